package se.bazaar_be.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.bazaar_be.pojo.Order;
import se.bazaar_be.pojo.enums.DisputeStatus;
import se.bazaar_be.pojo.enums.EscrowStatus;
import se.bazaar_be.pojo.enums.OrderStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    Optional<Order> findByOrderNumber(String orderNumber);

    boolean existsByOrderNumber(String orderNumber);

    Page<Order> findByBuyerIdOrderByCreatedAtDesc(Long buyerId, Pageable pageable);

    Page<Order> findByBuyerIdAndStatusOrderByCreatedAtDesc(Long buyerId, OrderStatus status, Pageable pageable);

    Page<Order> findBySellerIdOrderByCreatedAtDesc(Long sellerId, Pageable pageable);

    Page<Order> findBySellerIdAndStatusOrderByCreatedAtDesc(Long sellerId, OrderStatus status, Pageable pageable);

    // Oldest disputes first so admins work the queue in order
    @Query("SELECT o FROM Order o WHERE o.dispute.isDisputed = true ORDER BY o.dispute.createdAt ASC")
    Page<Order> findDisputes(Pageable pageable);

    @Query("SELECT o FROM Order o WHERE o.dispute.isDisputed = true AND o.dispute.status = :status " +
           "ORDER BY o.dispute.createdAt ASC")
    Page<Order> findDisputesByStatus(@Param("status") DisputeStatus status, Pageable pageable);

    long countByDisputeStatus(DisputeStatus status);

    long countByStatus(OrderStatus status);

    long countByEscrowStatus(EscrowStatus status);

    @Query("SELECT COALESCE(SUM(o.pricing.total), 0) FROM Order o WHERE o.escrow.status = :status")
    BigDecimal sumTotalByEscrowStatus(@Param("status") EscrowStatus status);

    @Query("SELECT COUNT(o) FROM Order o WHERE o.refund.isRefunded = true")
    long countRefunded();

    @Query("SELECT o.orderId FROM Order o " +
           "WHERE o.escrow.status = :held " +
           "AND o.escrow.autoReleaseAt IS NOT NULL AND o.escrow.autoReleaseAt <= :now " +
           "AND (o.dispute.status IS NULL OR o.dispute.status NOT IN :activeDisputeStatuses) " +
           "ORDER BY o.escrow.autoReleaseAt ASC")
    List<Long> findIdsDueForAutoRelease(@Param("held") EscrowStatus held,
                                        @Param("now") LocalDateTime now,
                                        @Param("activeDisputeStatuses") Collection<DisputeStatus> activeDisputeStatuses);
}
