package se.bazaar_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.SellerApplicationRequest;
import se.bazaar_be.dto.request.VerificationUpdateRequest;
import se.bazaar_be.dto.response.SellerResponse;
import se.bazaar_be.dto.response.SellerVerificationDetailResponse;
import se.bazaar_be.exception.AccessDeniedException;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.exception.ResourceNotFoundException;
import se.bazaar_be.exception.ValidationFailedException;
import se.bazaar_be.mapper.SellerMapper;
import se.bazaar_be.pojo.Seller;
import se.bazaar_be.pojo.SellerDocument;
import se.bazaar_be.pojo.enums.BusinessType;
import se.bazaar_be.pojo.enums.DocumentStatus;
import se.bazaar_be.pojo.enums.DocumentType;
import se.bazaar_be.pojo.enums.Role;
import se.bazaar_be.pojo.enums.TrustBadge;
import se.bazaar_be.pojo.enums.VerificationStatus;
import se.bazaar_be.repository.SellerRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SellerVerificationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-15T08:00:00Z"), ZoneOffset.UTC);
    private static final Actor ADMIN = Actor.of(1L, Role.ADMIN);

    @Mock
    private SellerRepository sellerRepository;

    @Mock
    private TrustScoreService trustScoreService;

    private SellerVerificationService verificationService;

    @BeforeEach
    void setUp() {
        verificationService = new SellerVerificationService(
                sellerRepository,
                new OrderAccessPolicy(sellerRepository),
                trustScoreService,
                new SellerMapper(),
                CLOCK);
    }

    private Seller seller(VerificationStatus status) {
        return Seller.builder()
                .sellerId(5L)
                .userId(105L)
                .businessName("Aarong Outlet")
                .businessType(BusinessType.ESTABLISHED_BUSINESS)
                .verificationStatus(status)
                .build();
    }

    private void saveReturnsArgument() {
        when(sellerRepository.save(any(Seller.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("A new application starts pending and cannot sell")
    void applyCreatesPendingProfile() {
        when(sellerRepository.existsByUserId(20L)).thenReturn(false);
        saveReturnsArgument();

        SellerResponse response = verificationService.apply(SellerApplicationRequest.builder()
                .businessName("Jamdani House")
                .businessType(BusinessType.BRAND)
                .build(), Actor.of(20L, Role.CUSTOMER));

        assertThat(response.getVerificationStatus()).isEqualTo("PENDING");
        assertThat(response.getIsActive()).isFalse();
        assertThat(response.getUserId()).isEqualTo(20L);
    }

    @Test
    @DisplayName("A user cannot hold two seller profiles")
    void applyTwice() {
        when(sellerRepository.existsByUserId(20L)).thenReturn(true);

        assertThatThrownBy(() -> verificationService.apply(SellerApplicationRequest.builder()
                .businessName("Again")
                .businessType(BusinessType.BRAND)
                .build(), Actor.of(20L, Role.CUSTOMER)))
                .isInstanceOf(InvalidStatusException.class);
    }

    @Test
    @DisplayName("Verifying a seller under review activates it, sets badges and awards the trust bonus")
    void verifyActivatesSellerAndAwardsBonus() {
        when(sellerRepository.findById(5L)).thenReturn(Optional.of(seller(VerificationStatus.UNDER_REVIEW)));
        saveReturnsArgument();

        SellerResponse response = verificationService.updateVerification(5L, VerificationUpdateRequest.builder()
                .status(VerificationStatus.VERIFIED)
                .trustBadges(List.of(TrustBadge.VERIFIED_BRAND, TrustBadge.AUTHENTIC_GUARANTEE))
                .notes("Trade licence checked")
                .build(), ADMIN);

        assertThat(response.getVerificationStatus()).isEqualTo("VERIFIED");
        assertThat(response.getIsActive()).isTrue();
        assertThat(response.getVerifiedBy()).isEqualTo(1L);
        assertThat(response.getVerifiedAt()).isEqualTo(LocalDateTime.now(CLOCK));
        assertThat(response.getTrustBadges()).containsExactlyInAnyOrder("VERIFIED_BRAND", "AUTHENTIC_GUARANTEE");
        verify(trustScoreService).awardVerificationBonus(105L);
    }

    @Test
    @DisplayName("A pending seller must be taken under review before it can be verified")
    void verifyFromPending() {
        when(sellerRepository.findById(5L)).thenReturn(Optional.of(seller(VerificationStatus.PENDING)));

        assertThatThrownBy(() -> verificationService.updateVerification(5L,
                VerificationUpdateRequest.builder().status(VerificationStatus.VERIFIED).build(), ADMIN))
                .isInstanceOf(InvalidStatusException.class);
        verify(trustScoreService, never()).awardVerificationBonus(anyLong());
    }

    @Test
    @DisplayName("Rejection requires a reason")
    void rejectWithoutReason() {
        when(sellerRepository.findById(5L)).thenReturn(Optional.of(seller(VerificationStatus.UNDER_REVIEW)));

        assertThatThrownBy(() -> verificationService.updateVerification(5L,
                VerificationUpdateRequest.builder().status(VerificationStatus.REJECTED).build(), ADMIN))
                .isInstanceOf(ValidationFailedException.class)
                .satisfies(e -> assertThat(((ValidationFailedException) e).getFieldErrors()).containsKey("rejectionReason"));
    }

    @Test
    @DisplayName("A rejected seller can be taken back into review")
    void rejectedBackToReview() {
        Seller rejected = seller(VerificationStatus.UNDER_REVIEW);
        rejected.reject("Blurry licence scan");
        when(sellerRepository.findById(5L)).thenReturn(Optional.of(rejected));
        saveReturnsArgument();

        SellerResponse response = verificationService.updateVerification(5L,
                VerificationUpdateRequest.builder().status(VerificationStatus.UNDER_REVIEW).build(), ADMIN);

        assertThat(response.getVerificationStatus()).isEqualTo("UNDER_REVIEW");
        assertThat(response.getRejectionReason()).isNull();
        verify(trustScoreService, never()).awardVerificationBonus(anyLong());
    }

    @Test
    @DisplayName("A verified seller cannot be moved anywhere")
    void verifiedIsFinal() {
        Seller verified = seller(VerificationStatus.UNDER_REVIEW);
        verified.verify(1L, null, LocalDateTime.now(CLOCK));
        when(sellerRepository.findById(5L)).thenReturn(Optional.of(verified));

        assertThatThrownBy(() -> verificationService.updateVerification(5L, VerificationUpdateRequest.builder()
                .status(VerificationStatus.REJECTED).rejectionReason("Changed mind").build(), ADMIN))
                .isInstanceOf(InvalidStatusException.class);
    }

    @Test
    @DisplayName("Only admins may change verification")
    void requiresAdmin() {
        assertThatThrownBy(() -> verificationService.updateVerification(5L,
                VerificationUpdateRequest.builder().status(VerificationStatus.VERIFIED).build(), Actor.of(105L, Role.SELLER)))
                .isInstanceOf(AccessDeniedException.class);
        verify(sellerRepository, never()).findById(anyLong());
    }

    private SellerDocument document(DocumentType type, DocumentStatus status) {
        return SellerDocument.builder()
                .type(type)
                .url("https://cdn.example.com/docs/" + type.name().toLowerCase() + ".pdf")
                .status(status)
                .uploadedAt(LocalDateTime.now(CLOCK).minusDays(1))
                .build();
    }

    @Test
    @DisplayName("Verification detail lists the documents a brand still has to get approved")
    void verificationDetailForIncompleteBrand() {
        Seller seller = Seller.builder()
                .sellerId(7L)
                .userId(107L)
                .businessName("Kumudini Brand")
                .businessType(BusinessType.BRAND)
                .build();
        seller.addDocument(document(DocumentType.TRADE_LICENSE, DocumentStatus.APPROVED));
        seller.addDocument(document(DocumentType.TAX_CERTIFICATE, DocumentStatus.PENDING));
        when(sellerRepository.findByIdWithDocuments(7L)).thenReturn(Optional.of(seller));

        SellerVerificationDetailResponse detail = verificationService.getVerificationDetail(7L, ADMIN);

        SellerVerificationDetailResponse.VerificationChecklist checklist = detail.getVerificationChecklist();
        assertThat(checklist.getRequiredDocuments())
                .containsExactly("TRADE_LICENSE", "TAX_CERTIFICATE", "IDENTITY_PROOF", "BRAND_AUTHORIZATION");
        assertThat(checklist.getSubmittedDocuments()).isEqualTo(2);
        assertThat(checklist.getApprovedDocuments()).isEqualTo(1);
        assertThat(checklist.getMissingDocuments())
                .containsExactly("TAX_CERTIFICATE", "IDENTITY_PROOF", "BRAND_AUTHORIZATION");
        assertThat(checklist.isDocumentsComplete()).isFalse();
        assertThat(checklist.isBusinessInfoComplete()).isFalse();

        SellerVerificationDetailResponse.RiskAssessment risk = detail.getRiskAssessment();
        assertThat(risk.getFactors()).containsExactly("NEW_SELLER", "INCOMPLETE_PROFILE", "MISSING_DOCUMENTS");
        assertThat(risk.getScore()).isEqualTo(3);
        assertThat(risk.getLevel()).isEqualTo("HIGH");
        assertThat(detail.getSeller().getDocuments()).hasSize(2);
    }

    @Test
    @DisplayName("A celebrity with every required document approved is low risk but flagged for identity checks")
    void verificationDetailForCompleteCelebrity() {
        Seller seller = Seller.builder()
                .sellerId(8L)
                .userId(108L)
                .businessName("Star Closet")
                .businessType(BusinessType.CELEBRITY)
                .description("Pre-loved outfits from film sets")
                .build();
        seller.addDocument(document(DocumentType.IDENTITY_PROOF, DocumentStatus.APPROVED));
        seller.addDocument(document(DocumentType.CELEBRITY_VERIFICATION, DocumentStatus.APPROVED));
        seller.addDocument(document(DocumentType.TAX_CERTIFICATE, DocumentStatus.APPROVED));
        when(sellerRepository.findByIdWithDocuments(8L)).thenReturn(Optional.of(seller));

        SellerVerificationDetailResponse detail = verificationService.getVerificationDetail(8L, ADMIN);

        assertThat(detail.getVerificationChecklist().isDocumentsComplete()).isTrue();
        assertThat(detail.getVerificationChecklist().isBusinessInfoComplete()).isTrue();
        assertThat(detail.getRiskAssessment().getFactors()).containsExactly("NEW_SELLER");
        assertThat(detail.getRiskAssessment().getLevel()).isEqualTo("LOW");
        assertThat(detail.getRiskAssessment().getRecommendations())
                .contains("Require additional identity verification for celebrity status");
    }

    @Test
    @DisplayName("Verification detail of an unknown seller is a not-found")
    void verificationDetailUnknownSeller() {
        when(sellerRepository.findByIdWithDocuments(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> verificationService.getVerificationDetail(404L, ADMIN))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Only admins see verification detail")
    void verificationDetailRequiresAdmin() {
        assertThatThrownBy(() -> verificationService.getVerificationDetail(7L, Actor.of(107L, Role.SELLER)))
                .isInstanceOf(AccessDeniedException.class);
        verify(sellerRepository, never()).findByIdWithDocuments(anyLong());
    }
}
