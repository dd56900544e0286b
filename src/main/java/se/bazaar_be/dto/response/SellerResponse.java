package se.bazaar_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SellerResponse {
    private Long sellerId;
    private Long userId;
    private String businessName;
    private String businessType;
    private String description;
    private String verificationStatus;
    private LocalDateTime verifiedAt;
    private Long verifiedBy;
    private String rejectionReason;
    private Boolean isActive;
    private Set<String> trustBadges;
    private BigDecimal ratingAverage;
    private Integer ratingCount;
    private BigDecimal totalSales;
    private Integer totalOrders;
    private List<DocumentInfo> documents;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DocumentInfo {
        private Long documentId;
        private String type;
        private String url;
        private String status;
        private LocalDateTime uploadedAt;
    }
}
