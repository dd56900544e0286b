package se.bazaar_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.bazaar_be.configuration.CurrentActor;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.DocumentReviewRequest;
import se.bazaar_be.dto.request.OrderActionRequest;
import se.bazaar_be.dto.request.ResolveDisputeRequest;
import se.bazaar_be.dto.request.VerificationUpdateRequest;
import se.bazaar_be.dto.response.ApiResponse;
import se.bazaar_be.dto.response.EscrowStatisticsResponse;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.dto.response.OrderListResponse;
import se.bazaar_be.dto.response.PagedResponse;
import se.bazaar_be.dto.response.SellerResponse;
import se.bazaar_be.dto.response.SellerVerificationDetailResponse;
import se.bazaar_be.pojo.enums.DisputeStatus;
import se.bazaar_be.pojo.enums.VerificationStatus;
import se.bazaar_be.service.DisputeService;
import se.bazaar_be.service.OrderService;
import se.bazaar_be.service.SellerVerificationService;
import se.bazaar_be.util.PaginationUtils;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin", description = "Dispute resolution, seller verification and escrow statistics")
@RequiredArgsConstructor
public class AdminController {

    private final DisputeService disputeService;
    private final SellerVerificationService sellerVerificationService;
    private final OrderService orderService;

    @Operation(summary = "List disputes", description = "Oldest first, with counts per dispute status")
    @GetMapping("/disputes")
    public ResponseEntity<ApiResponse<PagedResponse<OrderListResponse>>> getDisputes(
            @RequestParam(required = false) DisputeStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(
                disputeService.getDisputes(status, PaginationUtils.createPageable(page, size), actor)));
    }

    @Operation(summary = "Escrow statistics", description = "Held, released and refunded escrows with the refund rate")
    @GetMapping("/statistics/escrow")
    public ResponseEntity<ApiResponse<EscrowStatisticsResponse>> getEscrowStatistics(
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(orderService.getEscrowStatistics(actor)));
    }

    @Operation(summary = "Take a dispute under review")
    @PatchMapping("/disputes/{orderId}/review")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> startReview(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Dispute under review",
                disputeService.startReview(orderId, actor)));
    }

    @Operation(
            summary = "Resolve a dispute",
            description = "A positive refund amount refunds the buyer; otherwise escrow is released to the seller"
    )
    @PatchMapping("/disputes/{orderId}/resolve")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> resolveDispute(
            @PathVariable Long orderId,
            @Valid @RequestBody ResolveDisputeRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Dispute resolved",
                disputeService.resolveDispute(orderId, request, actor)));
    }

    @Operation(summary = "Close a dispute without moving funds")
    @PatchMapping("/disputes/{orderId}/close")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> closeDispute(
            @PathVariable Long orderId,
            @Valid @RequestBody(required = false) OrderActionRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        String note = request != null ? request.getNotes() : null;
        return ResponseEntity.ok(ApiResponse.success("Dispute closed",
                disputeService.closeDispute(orderId, note, actor)));
    }

    @Operation(summary = "List sellers by verification status", description = "Defaults to pending applications")
    @GetMapping("/seller-verifications")
    public ResponseEntity<ApiResponse<List<SellerResponse>>> getVerificationQueue(
            @RequestParam(required = false) VerificationStatus status,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(sellerVerificationService.getVerificationQueue(status, actor)));
    }

    @Operation(summary = "Seller verification detail", description = "Profile, document checklist and risk assessment")
    @GetMapping("/seller-verifications/{sellerId}")
    public ResponseEntity<ApiResponse<SellerVerificationDetailResponse>> getVerificationDetail(
            @PathVariable Long sellerId,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(sellerVerificationService.getVerificationDetail(sellerId, actor)));
    }

    @Operation(summary = "Update seller verification status")
    @PatchMapping("/seller-verifications/{sellerId}")
    public ResponseEntity<ApiResponse<SellerResponse>> updateVerification(
            @PathVariable Long sellerId,
            @Valid @RequestBody VerificationUpdateRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Seller verification updated",
                sellerVerificationService.updateVerification(sellerId, request, actor)));
    }

    @Operation(summary = "Approve or reject a seller document")
    @PatchMapping("/seller-verifications/{sellerId}/documents/{documentId}")
    public ResponseEntity<ApiResponse<SellerResponse>> reviewDocument(
            @PathVariable Long sellerId,
            @PathVariable Long documentId,
            @Valid @RequestBody DocumentReviewRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Document reviewed",
                sellerVerificationService.reviewDocument(sellerId, documentId, request, actor)));
    }
}
