package se.bazaar_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.bazaar_be.pojo.Seller;
import se.bazaar_be.pojo.enums.VerificationStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface SellerRepository extends JpaRepository<Seller, Long> {

    Optional<Seller> findByUserId(Long userId);

    boolean existsByUserId(Long userId);

    List<Seller> findByVerificationStatusOrderByCreatedAtAsc(VerificationStatus status);

    @Query("SELECT s FROM Seller s LEFT JOIN FETCH s.documents WHERE s.sellerId = :id")
    Optional<Seller> findByIdWithDocuments(@Param("id") Long id);

    // Aggregates are updated in place so concurrent releases for the same seller never overwrite each other
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Seller s SET s.totalSales = s.totalSales + :amount, s.totalOrders = s.totalOrders + 1 " +
           "WHERE s.sellerId = :sellerId")
    int recordCompletedSale(@Param("sellerId") Long sellerId, @Param("amount") BigDecimal amount);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Seller s SET s.ratingAverage = (s.ratingAverage * s.ratingCount + :rating) / (s.ratingCount + 1), " +
           "s.ratingCount = s.ratingCount + 1 WHERE s.sellerId = :sellerId")
    int recordRating(@Param("sellerId") Long sellerId, @Param("rating") BigDecimal rating);
}
