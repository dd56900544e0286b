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
import se.bazaar_be.dto.request.GatewayRefundRequest;
import se.bazaar_be.dto.request.PaymentConfirmationRequest;
import se.bazaar_be.dto.response.ApiResponse;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.service.PaymentService;

@RestController
@RequestMapping("/api/payments")
@Tag(name = "Payment Signals", description = "Callbacks forwarded by the payment gateway integration")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @Operation(summary = "Confirm payment", description = "Moves the order to payment_confirmed and holds the money in escrow")
    @PostMapping("/{orderId}/confirm")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> confirmPayment(
            @PathVariable Long orderId,
            @Valid @RequestBody PaymentConfirmationRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Payment confirmed",
                paymentService.confirmPayment(orderId, request, actor)));
    }

    @Operation(summary = "Record a failed payment attempt")
    @PostMapping("/{orderId}/fail")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> failPayment(
            @PathVariable Long orderId,
            @Valid @RequestBody PaymentConfirmationRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Payment failure recorded",
                paymentService.failPayment(orderId, request, actor)));
    }

    @Operation(summary = "Record a refund processed by the gateway")
    @PostMapping("/{orderId}/refund")
    public ResponseEntity<ApiResponse<OrderDetailResponse>> recordRefund(
            @PathVariable Long orderId,
            @Valid @RequestBody GatewayRefundRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Refund recorded",
                paymentService.recordGatewayRefund(orderId, request, actor)));
    }
}
