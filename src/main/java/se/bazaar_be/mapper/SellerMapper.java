package se.bazaar_be.mapper;

import org.springframework.stereotype.Component;
import se.bazaar_be.dto.response.ProductResponse;
import se.bazaar_be.dto.response.SellerResponse;
import se.bazaar_be.pojo.Product;
import se.bazaar_be.pojo.Seller;
import se.bazaar_be.pojo.SellerDocument;

import java.util.stream.Collectors;

@Component
public class SellerMapper {

    public SellerResponse convertToResponse(Seller seller) {
        return SellerResponse.builder()
                .sellerId(seller.getSellerId())
                .userId(seller.getUserId())
                .businessName(seller.getBusinessName())
                .businessType(seller.getBusinessType().name())
                .description(seller.getDescription())
                .verificationStatus(seller.getVerificationStatus().name())
                .verifiedAt(seller.getVerifiedAt())
                .verifiedBy(seller.getVerifiedBy())
                .rejectionReason(seller.getRejectionReason())
                .isActive(seller.getIsActive())
                .trustBadges(seller.getTrustBadges().stream()
                        .map(Enum::name)
                        .collect(Collectors.toSet()))
                .ratingAverage(seller.getRatingAverage())
                .ratingCount(seller.getRatingCount())
                .totalSales(seller.getTotalSales())
                .totalOrders(seller.getTotalOrders())
                .documents(seller.getDocuments().stream()
                        .map(this::convertToDocumentInfo)
                        .collect(Collectors.toList()))
                .build();
    }

    public ProductResponse convertToProductResponse(Product product) {
        return ProductResponse.builder()
                .productId(product.getProductId())
                .sellerId(product.getSeller().getSellerId())
                .name(product.getName())
                .description(product.getDescription())
                .sku(product.getSku())
                .imageUrl(product.getImageUrl())
                .price(product.getPrice())
                .stock(product.getStock())
                .currency(product.getCurrency())
                .status(product.getStatus().name())
                .build();
    }

    private SellerResponse.DocumentInfo convertToDocumentInfo(SellerDocument document) {
        return SellerResponse.DocumentInfo.builder()
                .documentId(document.getId())
                .type(document.getType().name())
                .url(document.getUrl())
                .status(document.getStatus().name())
                .uploadedAt(document.getUploadedAt())
                .build();
    }
}
