package se.bazaar_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.bazaar_be.configuration.CurrentActor;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.DocumentRequest;
import se.bazaar_be.dto.request.SellerApplicationRequest;
import se.bazaar_be.dto.response.ApiResponse;
import se.bazaar_be.dto.response.SellerResponse;
import se.bazaar_be.service.SellerVerificationService;

@RestController
@RequestMapping("/api/sellers")
@Tag(name = "Seller Onboarding", description = "Seller applications and verification documents")
@RequiredArgsConstructor
public class SellerController {

    private final SellerVerificationService sellerVerificationService;

    @Operation(summary = "Apply to become a seller", description = "Creates a pending seller profile awaiting admin verification")
    @PostMapping("/apply")
    public ResponseEntity<ApiResponse<SellerResponse>> apply(
            @Valid @RequestBody SellerApplicationRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Seller application submitted", sellerVerificationService.apply(request, actor)));
    }

    @Operation(summary = "Upload a verification document")
    @PostMapping("/me/documents")
    public ResponseEntity<ApiResponse<SellerResponse>> uploadDocument(
            @Valid @RequestBody DocumentRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Document uploaded",
                sellerVerificationService.uploadDocument(request, actor)));
    }

    @Operation(summary = "Get the caller's seller profile")
    @GetMapping("/me")
    public ResponseEntity<ApiResponse<SellerResponse>> getMySeller(
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success(sellerVerificationService.getMySeller(actor)));
    }
}
