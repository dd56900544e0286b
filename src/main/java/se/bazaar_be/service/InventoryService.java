package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.exception.InsufficientStockException;
import se.bazaar_be.exception.ResourceNotFoundException;
import se.bazaar_be.exception.ValidationFailedException;
import se.bazaar_be.repository.ProductRepository;

/**
 * Per-product stock ledger. Reservations join the caller's transaction, so a failure later in
 * order creation rolls every earlier reservation back.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class InventoryService {

    private final ProductRepository productRepository;

    @Transactional
    public void reserve(Long productId, int quantity) {
        requirePositive(quantity);
        int updated = productRepository.decrementStock(productId, quantity);
        if (updated == 0) {
            Integer available = productRepository.findStockById(productId)
                    .orElseThrow(() -> new ResourceNotFoundException("Product not found with ID: " + productId));
            throw new InsufficientStockException(productId,
                    "Insufficient stock for product " + productId + ": requested " + quantity + ", available " + available);
        }
        log.debug("Reserved {} unit(s) of product {}", quantity, productId);
    }

    @Transactional
    public void release(Long productId, int quantity) {
        requirePositive(quantity);
        int updated = productRepository.incrementStock(productId, quantity);
        if (updated == 0) {
            throw new ResourceNotFoundException("Product not found with ID: " + productId);
        }
        log.debug("Released {} unit(s) of product {}", quantity, productId);
    }

    public int availableStock(Long productId) {
        return productRepository.findStockById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found with ID: " + productId));
    }

    private void requirePositive(int quantity) {
        if (quantity < 1) {
            throw new ValidationFailedException("quantity", "Quantity must be at least 1");
        }
    }
}
