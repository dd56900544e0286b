package se.bazaar_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.bazaar_be.configuration.CurrentActor;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.*;
import se.bazaar_be.dto.response.ApiResponse;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.dto.response.OrderListResponse;
import se.bazaar_be.dto.response.PagedResponse;
import se.bazaar_be.pojo.enums.OrderStatus;
import se.bazaar_be.service.DisputeService;
import se.bazaar_be.service.EscrowService;
import se.bazaar_be.service.OrderService;
import se.bazaar_be.service.RefundService;
import se.bazaar_be.util.PaginationUtils;

@RestController
@RequestMapping("/api/orders")
@Tag(name = "Order Management",
     description = "Escrow-protected order lifecycle: creation, fulfilment, delivery confirmation, " +
                   "buyer approval, refunds and disputes.")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;
    private final EscrowService escrowService;
    private final RefundService refundService;
    private final DisputeService disputeService;

    @Operation(
            summary = "Create a new order",
            description = "Creates an order with a single verified seller. Stock for every line is reserved atomically."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "201",
                    description = "Order created successfully",
                    content = @Content(schema = @Schema(implementation = OrderDetailResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "400",
                    description = "Invalid order data or product unavailable"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "409",
                    description = "Insufficient stock"
            )
    })
    @PostMapping
    public ResponseEntity<ApiResponse<OrderDetailResponse>> createOrder(
            @Valid @RequestBody OrderCreateRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        OrderDetailResponse order = orderService.createOrder(request, actor);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Order created successfully", order));
    }

    @Operation(summary = "Get order details", description = "Visible to the buyer, the seller and admins")
    @GetMapping("/{orderId}")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> getOrder(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(orderService.getOrder(orderId, actor)));
    }

    @Operation(summary = "Get order details by order number")
    @GetMapping("/number/{orderNumber}")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> getOrderByNumber(
            @PathVariable String orderNumber,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(orderService.getOrderByNumber(orderNumber, actor)));
    }

    @Operation(summary = "List the caller's purchases", description = "Newest first, optionally filtered by status")
    @GetMapping("/my-orders")
    public ResponseEntity<ApiResponse<PagedResponse<OrderListResponse>>> getMyOrders(
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(
                orderService.getBuyerOrders(actor, status, PaginationUtils.createPageable(page, size))));
    }

    @Operation(summary = "List orders placed with the calling seller")
    @GetMapping("/seller-orders")
    public ResponseEntity<ApiResponse<PagedResponse<OrderListResponse>>> getSellerOrders(
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(
                orderService.getSellerOrders(actor, status, PaginationUtils.createPageable(page, size))));
    }

    @Operation(summary = "Start processing a paid order")
    @PatchMapping("/{orderId}/process")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> startProcessing(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Order is being processed",
                orderService.startProcessing(orderId, actor)));
    }

    @Operation(summary = "Mark an order as shipped")
    @PatchMapping("/{orderId}/ship")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> markShipped(
            @PathVariable Long orderId,
            @Valid @RequestBody ShipOrderRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Order marked as shipped",
                orderService.markShipped(orderId, request, actor)));
    }

    @Operation(
            summary = "Confirm delivery",
            description = "Seller confirms the buyer received the order. Starts the escrow hold period, after which funds are released automatically."
    )
    @PatchMapping("/{orderId}/confirm-delivery")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> confirmDelivery(
            @PathVariable Long orderId,
            @Valid @RequestBody(required = false) OrderActionRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        String notes = request != null ? request.getNotes() : null;
        return ResponseEntity.ok(ApiResponse.success("Delivery confirmed",
                escrowService.confirmDelivery(orderId, notes, actor)));
    }

    @Operation(summary = "Approve delivery", description = "Buyer approves the delivery and releases escrow to the seller")
    @PatchMapping("/{orderId}/approve-delivery")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> approveDelivery(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Delivery approved, payment released to seller",
                escrowService.approveDelivery(orderId, actor)));
    }

    @Operation(summary = "Ask the buyer to approve and release escrow")
    @PatchMapping("/{orderId}/request-release")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> requestRelease(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Release requested",
                escrowService.requestRelease(orderId, actor)));
    }

    @Operation(summary = "Cancel an unpaid order", description = "Reserved stock is returned")
    @PatchMapping("/{orderId}/cancel")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> cancelOrder(
            @PathVariable Long orderId,
            @Valid @RequestBody(required = false) OrderActionRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        String reason = request != null ? request.getNotes() : null;
        return ResponseEntity.ok(ApiResponse.success("Order cancelled",
                orderService.cancelOrder(orderId, reason, actor)));
    }

    @Operation(summary = "Request a refund", description = "Allowed within 30 days of delivery while payment is held in escrow")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Refund requested"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Refund not allowed")
    })
    @PostMapping("/{orderId}/request-refund")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> requestRefund(
            @PathVariable Long orderId,
            @Valid @RequestBody RefundRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Refund requested successfully",
                refundService.requestRefund(orderId, request, actor)));
    }

    @Operation(summary = "Open a dispute", description = "Suspends auto-release until an admin resolves or closes the dispute")
    @PostMapping("/{orderId}/dispute")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> openDispute(
            @PathVariable Long orderId,
            @Valid @RequestBody OpenDisputeRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Dispute opened",
                disputeService.openDispute(orderId, request, actor)));
    }

    @Operation(summary = "Rate a delivered order")
    @PostMapping("/{orderId}/feedback")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> leaveFeedback(
            @PathVariable Long orderId,
            @Valid @RequestBody FeedbackRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Feedback submitted",
                orderService.leaveFeedback(orderId, request, actor)));
    }
}
