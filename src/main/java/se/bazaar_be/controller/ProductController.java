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
import se.bazaar_be.dto.request.ProductCreateRequest;
import se.bazaar_be.dto.request.ProductStatusUpdateRequest;
import se.bazaar_be.dto.response.ApiResponse;
import se.bazaar_be.dto.response.ProductResponse;
import se.bazaar_be.service.ProductService;

@RestController
@RequestMapping("/api/products")
@Tag(name = "Products", description = "Listings by verified sellers")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @Operation(summary = "List a new product", description = "Only verified, active sellers may list products")
    @PostMapping
    public ResponseEntity<ApiResponse<ProductResponse>> createProduct(
            @Valid @RequestBody ProductCreateRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Product created", productService.createProduct(request, actor)));
    }

    @Operation(summary = "Get a product")
    @GetMapping("/{productId}")
    public ResponseEntity<ApiResponse<ProductResponse>> getProduct(@PathVariable Long productId) {
        return ResponseEntity.ok(ApiResponse.success(productService.getProduct(productId)));
    }

    @Operation(summary = "Change the status of one of the caller's products")
    @PatchMapping("/{productId}/status")
    public ResponseEntity<ApiResponse<ProductResponse>> updateStatus(
            @PathVariable Long productId,
            @Valid @RequestBody ProductStatusUpdateRequest request,
            @Parameter(hidden = true) @CurrentActor Actor actor) {
        return ResponseEntity.ok(ApiResponse.success("Product status updated",
                productService.updateStatus(productId, request, actor)));
    }
}
