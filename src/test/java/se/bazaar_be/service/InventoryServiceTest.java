package se.bazaar_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.bazaar_be.exception.InsufficientStockException;
import se.bazaar_be.exception.ResourceNotFoundException;
import se.bazaar_be.exception.ValidationFailedException;
import se.bazaar_be.repository.ProductRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InventoryServiceTest {

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private InventoryService inventoryService;

    @Test
    @DisplayName("reserve succeeds when the conditional decrement updates a row")
    void reserveDecrements() {
        when(productRepository.decrementStock(7L, 3)).thenReturn(1);

        assertThatCode(() -> inventoryService.reserve(7L, 3)).doesNotThrowAnyException();
        verify(productRepository, never()).findStockById(anyLong());
    }

    @Test
    @DisplayName("reserve reports the available stock when the decrement is refused")
    void reserveInsufficient() {
        when(productRepository.decrementStock(7L, 3)).thenReturn(0);
        when(productRepository.findStockById(7L)).thenReturn(Optional.of(2));

        assertThatThrownBy(() -> inventoryService.reserve(7L, 3))
                .isInstanceOf(InsufficientStockException.class)
                .hasMessageContaining("available 2")
                .satisfies(e -> assertThat(((InsufficientStockException) e).getProductId()).isEqualTo(7L));
    }

    @Test
    @DisplayName("reserve on an unknown product fails with ResourceNotFound")
    void reserveUnknownProduct() {
        when(productRepository.decrementStock(8L, 1)).thenReturn(0);
        when(productRepository.findStockById(8L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> inventoryService.reserve(8L, 1))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Non-positive quantities are rejected before touching the database")
    void rejectsNonPositiveQuantity() {
        assertThatThrownBy(() -> inventoryService.reserve(7L, 0))
                .isInstanceOf(ValidationFailedException.class);
        assertThatThrownBy(() -> inventoryService.release(7L, -1))
                .isInstanceOf(ValidationFailedException.class);
        verify(productRepository, never()).decrementStock(anyLong(), anyInt());
        verify(productRepository, never()).incrementStock(anyLong(), anyInt());
    }

    @Test
    @DisplayName("release increments stock and fails for an unknown product")
    void release() {
        when(productRepository.incrementStock(7L, 2)).thenReturn(1);
        when(productRepository.incrementStock(9L, 2)).thenReturn(0);

        inventoryService.release(7L, 2);

        verify(productRepository).incrementStock(7L, 2);
        assertThatThrownBy(() -> inventoryService.release(9L, 2))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void availableStock() {
        when(productRepository.findStockById(7L)).thenReturn(Optional.of(12));

        assertThat(inventoryService.availableStock(7L)).isEqualTo(12);
    }
}
