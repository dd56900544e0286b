package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.DocumentRequest;
import se.bazaar_be.dto.request.DocumentReviewRequest;
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
import se.bazaar_be.pojo.enums.VerificationStatus;
import se.bazaar_be.repository.SellerRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Seller onboarding and the admin verification workflow. Only a verified, active seller may list
 * products or receive orders.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class SellerVerificationService {

    private static final Duration NEW_SELLER_PERIOD = Duration.ofDays(30);

    private final SellerRepository sellerRepository;
    private final OrderAccessPolicy accessPolicy;
    private final TrustScoreService trustScoreService;
    private final SellerMapper sellerMapper;
    private final Clock clock;

    @Transactional
    public SellerResponse apply(SellerApplicationRequest request, Actor actor) {
        if (actor.getRole() != Role.CUSTOMER && actor.getRole() != Role.SELLER) {
            throw new AccessDeniedException("Only marketplace users can apply as sellers");
        }
        if (sellerRepository.existsByUserId(actor.getUserId())) {
            throw new InvalidStatusException("User " + actor.getUserId() + " already has a seller profile");
        }

        Seller seller = Seller.builder()
                .userId(actor.getUserId())
                .businessName(request.getBusinessName())
                .businessType(request.getBusinessType())
                .description(request.getDescription())
                .build();
        seller = sellerRepository.save(seller);

        log.info("Seller profile {} created for user {}", seller.getSellerId(), actor.getUserId());
        return sellerMapper.convertToResponse(seller);
    }

    @Transactional
    public SellerResponse uploadDocument(DocumentRequest request, Actor actor) {
        Seller seller = accessPolicy.requireSellerAccount(actor);
        seller.addDocument(SellerDocument.builder()
                .type(request.getType())
                .url(request.getUrl())
                .uploadedAt(LocalDateTime.now(clock))
                .build());
        seller = sellerRepository.saveAndFlush(seller);

        log.info("Seller {} uploaded a {} document", seller.getSellerId(), request.getType());
        return sellerMapper.convertToResponse(seller);
    }

    public SellerResponse getMySeller(Actor actor) {
        Seller seller = sellerRepository.findByUserId(actor.getUserId())
                .orElseThrow(() -> new ResourceNotFoundException("No seller profile for user " + actor.getUserId()));
        return sellerMapper.convertToResponse(seller);
    }

    public List<SellerResponse> getVerificationQueue(VerificationStatus status, Actor admin) {
        accessPolicy.requireAdmin(admin);
        VerificationStatus filter = status != null ? status : VerificationStatus.PENDING;
        return sellerRepository.findByVerificationStatusOrderByCreatedAtAsc(filter).stream()
                .map(sellerMapper::convertToResponse)
                .collect(Collectors.toList());
    }

    /**
     * Full picture an admin needs before deciding on a seller: the profile, a checklist of the
     * documents its business type requires, and a risk assessment.
     */
    public SellerVerificationDetailResponse getVerificationDetail(Long sellerId, Actor admin) {
        accessPolicy.requireAdmin(admin);
        Seller seller = sellerRepository.findByIdWithDocuments(sellerId)
                .orElseThrow(() -> new ResourceNotFoundException("Seller not found with ID: " + sellerId));

        SellerVerificationDetailResponse.VerificationChecklist checklist = buildChecklist(seller);
        return SellerVerificationDetailResponse.builder()
                .seller(sellerMapper.convertToResponse(seller))
                .verificationChecklist(checklist)
                .riskAssessment(assessRisk(seller, checklist))
                .build();
    }

    @Transactional
    public SellerResponse reviewDocument(Long sellerId, Long documentId, DocumentReviewRequest request, Actor admin) {
        accessPolicy.requireAdmin(admin);
        Seller seller = sellerRepository.findByIdWithDocuments(sellerId)
                .orElseThrow(() -> new ResourceNotFoundException("Seller not found with ID: " + sellerId));
        SellerDocument document = seller.getDocuments().stream()
                .filter(d -> d.getId().equals(documentId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Document " + documentId + " not found for seller " + sellerId));

        document.setStatus(request.getStatus());
        seller.addAdminNote("Document " + documentId + " marked " + request.getStatus(), admin.getUserId(), LocalDateTime.now(clock));
        seller = sellerRepository.save(seller);

        log.info("Admin {} marked document {} of seller {} as {}", admin.getUserId(), documentId, sellerId, request.getStatus());
        return sellerMapper.convertToResponse(seller);
    }

    /**
     * Moves a seller through {@code pending -> under_review -> verified | rejected}. A rejected seller
     * can be taken back into review; a verified one is final.
     */
    @Transactional
    public SellerResponse updateVerification(Long sellerId, VerificationUpdateRequest request, Actor admin) {
        accessPolicy.requireAdmin(admin);
        Seller seller = sellerRepository.findById(sellerId)
                .orElseThrow(() -> new ResourceNotFoundException("Seller not found with ID: " + sellerId));

        LocalDateTime now = LocalDateTime.now(clock);
        VerificationStatus previous = seller.getVerificationStatus();
        switch (request.getStatus()) {
            case UNDER_REVIEW -> seller.moveToReview();
            case VERIFIED -> seller.verify(admin.getUserId(), request.getTrustBadges(), now);
            case REJECTED -> {
                if (request.getRejectionReason() == null || request.getRejectionReason().isBlank()) {
                    throw new ValidationFailedException("rejectionReason", "Rejection reason is required");
                }
                seller.reject(request.getRejectionReason());
            }
            case PENDING -> throw new InvalidStatusException(
                    "Seller verification cannot move from " + previous + " to " + VerificationStatus.PENDING);
        }
        if (request.getNotes() != null && !request.getNotes().isBlank()) {
            seller.addAdminNote(request.getNotes(), admin.getUserId(), now);
        }
        seller = sellerRepository.save(seller);

        if (seller.getVerificationStatus() == VerificationStatus.VERIFIED) {
            trustScoreService.awardVerificationBonus(seller.getUserId());
        }

        log.info("Seller {} verification {} -> {} by admin {}", sellerId, previous, seller.getVerificationStatus(), admin.getUserId());
        return sellerMapper.convertToResponse(seller);
    }

    private SellerVerificationDetailResponse.VerificationChecklist buildChecklist(Seller seller) {
        Set<DocumentType> required = seller.getBusinessType().requiredDocuments();
        Set<DocumentType> approved = seller.getDocuments().stream()
                .filter(document -> document.getStatus() == DocumentStatus.APPROVED)
                .map(SellerDocument::getType)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DocumentType.class)));
        List<String> missing = required.stream()
                .filter(type -> !approved.contains(type))
                .map(Enum::name)
                .collect(Collectors.toList());

        return SellerVerificationDetailResponse.VerificationChecklist.builder()
                .businessInfoComplete(hasText(seller.getBusinessName()) && seller.getBusinessType() != null
                        && hasText(seller.getDescription()))
                .requiredDocuments(required.stream().map(Enum::name).collect(Collectors.toList()))
                .submittedDocuments(seller.getDocuments().size())
                .approvedDocuments((int) seller.getDocuments().stream()
                        .filter(document -> document.getStatus() == DocumentStatus.APPROVED)
                        .count())
                .missingDocuments(missing)
                .documentsComplete(missing.isEmpty())
                .build();
    }

    private SellerVerificationDetailResponse.RiskAssessment assessRisk(Seller seller,
                                                                     SellerVerificationDetailResponse.VerificationChecklist checklist) {
        List<String> factors = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        // A profile that was never persisted has no creation time yet and counts as new
        Instant createdAt = seller.getCreatedAt();
        if (createdAt == null || createdAt.isAfter(clock.instant().minus(NEW_SELLER_PERIOD))) {
            factors.add("NEW_SELLER");
            recommendations.add("Monitor closely for the first 3 months");
        }
        if (!checklist.isBusinessInfoComplete()) {
            factors.add("INCOMPLETE_PROFILE");
            recommendations.add("Request additional business information");
        }
        if (!checklist.isDocumentsComplete()) {
            factors.add("MISSING_DOCUMENTS");
            recommendations.add("Request approved copies of: " + String.join(", ", checklist.getMissingDocuments()));
        }
        if (seller.getRejectionReason() != null) {
            factors.add("PREVIOUSLY_REJECTED");
            recommendations.add("Check that the earlier rejection reason has been addressed");
        }
        if (seller.getBusinessType() == BusinessType.CELEBRITY) {
            recommendations.add("Require additional identity verification for celebrity status");
        }

        int score = factors.size();
        String level = score >= 3 ? "HIGH" : score >= 2 ? "MEDIUM" : "LOW";
        return SellerVerificationDetailResponse.RiskAssessment.builder()
                .score(score)
                .level(level)
                .factors(factors)
                .recommendations(recommendations)
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
