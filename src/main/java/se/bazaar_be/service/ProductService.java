package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.configuration.MarketplaceSettings;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.ProductCreateRequest;
import se.bazaar_be.dto.request.ProductStatusUpdateRequest;
import se.bazaar_be.dto.response.ProductResponse;
import se.bazaar_be.exception.AccessDeniedException;
import se.bazaar_be.exception.ResourceNotFoundException;
import se.bazaar_be.exception.ValidationFailedException;
import se.bazaar_be.mapper.SellerMapper;
import se.bazaar_be.pojo.Product;
import se.bazaar_be.pojo.Seller;
import se.bazaar_be.repository.ProductRepository;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class ProductService {

    private final ProductRepository productRepository;
    private final OrderAccessPolicy accessPolicy;
    private final SellerMapper sellerMapper;
    private final MarketplaceSettings settings;

    @Transactional
    public ProductResponse createProduct(ProductCreateRequest request, Actor actor) {
        Seller seller = accessPolicy.requireSellerAccount(actor);
        if (!seller.isEligibleToSell()) {
            throw new AccessDeniedException("Seller must be verified before listing products");
        }
        if (request.getSku() != null && productRepository.existsBySku(request.getSku())) {
            throw new ValidationFailedException("sku", "SKU " + request.getSku() + " is already in use");
        }

        Product product = Product.builder()
                .seller(seller)
                .name(request.getName())
                .description(request.getDescription())
                .sku(request.getSku())
                .imageUrl(request.getImageUrl())
                .price(request.getPrice())
                .stock(request.getStock())
                .currency(settings.getCurrency())
                .build();
        product = productRepository.save(product);

        log.info("Seller {} listed product {} with stock {}", seller.getSellerId(), product.getProductId(), product.getStock());
        return sellerMapper.convertToProductResponse(product);
    }

    @Transactional
    public ProductResponse updateStatus(Long productId, ProductStatusUpdateRequest request, Actor actor) {
        Seller seller = accessPolicy.requireSellerAccount(actor);
        Product product = productRepository.findByIdWithSeller(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found with ID: " + productId));
        if (!product.getSeller().getSellerId().equals(seller.getSellerId())) {
            throw new AccessDeniedException("Product " + productId + " does not belong to this seller");
        }

        product.setStatus(request.getStatus());
        product = productRepository.save(product);

        log.info("Product {} status set to {}", productId, request.getStatus());
        return sellerMapper.convertToProductResponse(product);
    }

    public ProductResponse getProduct(Long productId) {
        Product product = productRepository.findByIdWithSeller(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found with ID: " + productId));
        return sellerMapper.convertToProductResponse(product);
    }
}
