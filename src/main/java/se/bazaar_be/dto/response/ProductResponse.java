package se.bazaar_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    private Long productId;
    private Long sellerId;
    private String name;
    private String description;
    private String sku;
    private String imageUrl;
    private BigDecimal price;
    private Integer stock;
    private String currency;
    private String status;
}
