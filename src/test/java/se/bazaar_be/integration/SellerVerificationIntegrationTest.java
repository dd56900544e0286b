package se.bazaar_be.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.DocumentRequest;
import se.bazaar_be.dto.request.DocumentReviewRequest;
import se.bazaar_be.dto.request.ProductCreateRequest;
import se.bazaar_be.dto.request.SellerApplicationRequest;
import se.bazaar_be.dto.request.VerificationUpdateRequest;
import se.bazaar_be.dto.response.ProductResponse;
import se.bazaar_be.dto.response.SellerResponse;
import se.bazaar_be.dto.response.SellerVerificationDetailResponse;
import se.bazaar_be.exception.AccessDeniedException;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.pojo.User;
import se.bazaar_be.pojo.enums.BusinessType;
import se.bazaar_be.pojo.enums.DocumentStatus;
import se.bazaar_be.pojo.enums.DocumentType;
import se.bazaar_be.pojo.enums.Role;
import se.bazaar_be.pojo.enums.TrustBadge;
import se.bazaar_be.pojo.enums.VerificationStatus;
import se.bazaar_be.service.ProductService;
import se.bazaar_be.service.SellerVerificationService;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Seller verification gate against the database")
class SellerVerificationIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private SellerVerificationService sellerVerificationService;

    @Autowired
    private ProductService productService;

    @Test
    @DisplayName("A seller can only list products after verification, which also raises the trust score")
    void verificationOpensTheGate() {
        // Given
        User user = newUser();
        Actor applicant = Actor.of(user.getUserId(), Role.CUSTOMER);
        SellerResponse applied = sellerVerificationService.apply(SellerApplicationRequest.builder()
                .businessName("Dhaka Crafts")
                .businessType(BusinessType.ESTABLISHED_BUSINESS)
                .build(), applicant);
        Actor seller = Actor.of(user.getUserId(), Role.SELLER);
        SellerResponse withDocument = sellerVerificationService.uploadDocument(DocumentRequest.builder()
                .type(DocumentType.TRADE_LICENSE)
                .url("https://cdn.example.com/license.pdf")
                .build(), seller);
        ProductCreateRequest listing = ProductCreateRequest.builder()
                .name("Nakshi kantha")
                .price(new BigDecimal("1500.00"))
                .stock(3)
                .build();

        assertThat(applied.getVerificationStatus()).isEqualTo("PENDING");
        assertThat(applied.getIsActive()).isFalse();
        assertThatThrownBy(() -> productService.createProduct(listing, seller))
                .isInstanceOf(AccessDeniedException.class);

        // When
        sellerVerificationService.reviewDocument(applied.getSellerId(), withDocument.getDocuments().get(0).getDocumentId(),
                DocumentReviewRequest.builder().status(DocumentStatus.APPROVED).build(), ADMIN);
        sellerVerificationService.updateVerification(applied.getSellerId(), VerificationUpdateRequest.builder()
                .status(VerificationStatus.UNDER_REVIEW)
                .build(), ADMIN);
        SellerResponse verified = sellerVerificationService.updateVerification(applied.getSellerId(),
                VerificationUpdateRequest.builder()
                        .status(VerificationStatus.VERIFIED)
                        .notes("Documents checked")
                        .trustBadges(List.of(TrustBadge.TOP_RATED))
                        .build(), ADMIN);

        // Then
        assertThat(verified.getVerificationStatus()).isEqualTo("VERIFIED");
        assertThat(verified.getIsActive()).isTrue();
        assertThat(verified.getVerifiedBy()).isEqualTo(ADMIN.getUserId());
        assertThat(verified.getTrustBadges()).containsExactly("TOP_RATED");
        assertThat(verified.getDocuments().get(0).getStatus()).isEqualTo("APPROVED");

        User reloaded = userRepository.findById(user.getUserId()).orElseThrow();
        assertThat(reloaded.getTrustScore()).isEqualTo(50);
        assertThat(reloaded.getIsVerified()).isTrue();

        ProductResponse product = productService.createProduct(listing, seller);
        assertThat(product.getStatus()).isEqualTo("ACTIVE");
        assertThat(product.getSellerId()).isEqualTo(applied.getSellerId());
    }

    @Test
    @DisplayName("A pending seller cannot be verified without review")
    void pendingCannotJumpToVerified() {
        User user = newUser();
        SellerResponse applied = sellerVerificationService.apply(SellerApplicationRequest.builder()
                .businessName("Shortcut Ltd")
                .businessType(BusinessType.BRAND)
                .build(), Actor.of(user.getUserId(), Role.CUSTOMER));

        assertThatThrownBy(() -> sellerVerificationService.updateVerification(applied.getSellerId(),
                VerificationUpdateRequest.builder().status(VerificationStatus.VERIFIED).build(), ADMIN))
                .isInstanceOf(InvalidStatusException.class);
        assertThat(userRepository.findById(user.getUserId()).orElseThrow().getTrustScore()).isZero();
    }

    @Test
    @DisplayName("Verification detail reflects uploaded and approved documents")
    void verificationDetailChecklist() {
        // Given
        User user = newUser();
        SellerResponse applied = sellerVerificationService.apply(SellerApplicationRequest.builder()
                .businessName("Sylhet Tea Traders")
                .businessType(BusinessType.VERIFIED_RETAILER)
                .description("Single-estate tea")
                .build(), Actor.of(user.getUserId(), Role.CUSTOMER));
        Actor seller = Actor.of(user.getUserId(), Role.SELLER);
        SellerResponse uploaded = sellerVerificationService.uploadDocument(DocumentRequest.builder()
                .type(DocumentType.TRADE_LICENSE)
                .url("https://cdn.example.com/tea-license.pdf")
                .build(), seller);
        sellerVerificationService.uploadDocument(DocumentRequest.builder()
                .type(DocumentType.TAX_CERTIFICATE)
                .url("https://cdn.example.com/tea-tax.pdf")
                .build(), seller);
        sellerVerificationService.reviewDocument(applied.getSellerId(), uploaded.getDocuments().get(0).getDocumentId(),
                DocumentReviewRequest.builder().status(DocumentStatus.APPROVED).build(), ADMIN);

        // When
        SellerVerificationDetailResponse detail = sellerVerificationService.getVerificationDetail(applied.getSellerId(), ADMIN);

        // Then
        SellerVerificationDetailResponse.VerificationChecklist checklist = detail.getVerificationChecklist();
        assertThat(checklist.getSubmittedDocuments()).isEqualTo(2);
        assertThat(checklist.getApprovedDocuments()).isEqualTo(1);
        assertThat(checklist.getMissingDocuments()).containsExactly("TAX_CERTIFICATE", "IDENTITY_PROOF");
        assertThat(checklist.isBusinessInfoComplete()).isTrue();
        assertThat(detail.getRiskAssessment().getFactors()).contains("MISSING_DOCUMENTS");
        assertThat(detail.getSeller().getVerificationStatus()).isEqualTo("PENDING");
    }
}
