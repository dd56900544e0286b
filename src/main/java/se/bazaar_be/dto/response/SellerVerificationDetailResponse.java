package se.bazaar_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SellerVerificationDetailResponse {
    private SellerResponse seller;
    private VerificationChecklist verificationChecklist;
    private RiskAssessment riskAssessment;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VerificationChecklist {
        private boolean businessInfoComplete;
        private List<String> requiredDocuments;
        private int submittedDocuments;
        private int approvedDocuments;
        private List<String> missingDocuments;
        // Every required document type has an approved upload
        private boolean documentsComplete;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RiskAssessment {
        private int score;
        private String level;
        private List<String> factors;
        private List<String> recommendations;
    }
}
