package se.bazaar_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.bazaar_be.pojo.Product;

import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {

    @Query("SELECT p FROM Product p JOIN FETCH p.seller WHERE p.productId = :id")
    Optional<Product> findByIdWithSeller(@Param("id") Long id);

    boolean existsBySku(String sku);

    @Query("SELECT p.stock FROM Product p WHERE p.productId = :id")
    Optional<Integer> findStockById(@Param("id") Long id);

    /**
     * Conditional decrement: the stock check and the write happen in one statement, so two
     * concurrent reservations can never take the stock below zero.
     *
     * @return 1 when the reservation was applied, 0 when stock was insufficient or the product is absent
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock - :quantity WHERE p.productId = :productId AND p.stock >= :quantity")
    int decrementStock(@Param("productId") Long productId, @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock + :quantity WHERE p.productId = :productId")
    int incrementStock(@Param("productId") Long productId, @Param("quantity") int quantity);

    // Units count as sold once the escrow for them is released.
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.totalSales = p.totalSales + :quantity WHERE p.productId = :productId")
    int recordSale(@Param("productId") Long productId, @Param("quantity") int quantity);
}
