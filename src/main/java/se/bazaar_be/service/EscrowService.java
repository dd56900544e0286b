package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.configuration.MarketplaceSettings;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.mapper.OrderMapper;
import se.bazaar_be.pojo.Escrow;
import se.bazaar_be.pojo.Order;
import se.bazaar_be.pojo.OrderItem;
import se.bazaar_be.pojo.enums.EscrowStatus;
import se.bazaar_be.pojo.enums.NoteAuthorType;
import se.bazaar_be.pojo.enums.OrderStatus;
import se.bazaar_be.repository.ProductRepository;
import se.bazaar_be.repository.SellerRepository;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Drives the escrow of delivered orders: delivery confirmation arms the auto-release deadline, and
 * the money leaves escrow through buyer approval, the auto-release sweep or dispute resolution.
 * Whichever path commits first wins; the others fail on the version check.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class EscrowService {

    private final OrderPersistenceService orderPersistence;
    private final OrderAccessPolicy accessPolicy;
    private final SellerRepository sellerRepository;
    private final ProductRepository productRepository;
    private final OrderMapper orderMapper;
    private final MarketplaceSettings settings;
    private final Clock clock;

    @Transactional
    public OrderDetailResponse confirmDelivery(Long orderId, String deliveryNotes, Actor sellerActor) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireSeller(order, sellerActor);
        if (order.getStatus() != OrderStatus.SHIPPED) {
            throw new InvalidStatusException("Order " + order.getOrderNumber()
                    + " must be shipped before delivery can be confirmed, current status: " + order.getStatus());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.markDelivered(now, deliveryNotes);
        Escrow escrow = order.getEscrow();
        if (escrow.getStatus() == EscrowStatus.PENDING) {
            escrow.hold(now);
        }
        escrow.armAutoRelease(now, settings.getEscrowHoldDays());
        order.addNote(NoteAuthorType.SELLER,
                deliveryNotes != null && !deliveryNotes.isBlank() ? "Delivery confirmed: " + deliveryNotes : "Delivery confirmed",
                sellerActor.label(), now);
        order = orderPersistence.commitEscrowTransition(order);

        log.info("Order {} delivered, escrow auto-release scheduled for {}",
                order.getOrderNumber(), order.getEscrow().getAutoReleaseAt());
        return orderMapper.convertToDetailResponse(order);
    }

    @Transactional
    public OrderDetailResponse approveDelivery(Long orderId, Actor buyer) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireBuyer(order, buyer);
        requireDelivered(order);

        LocalDateTime now = LocalDateTime.now(clock);
        order.getEscrow().approveAndRelease(now, buyer.label());
        order.addNote(NoteAuthorType.CUSTOMER, "Customer approved delivery, escrow released to seller", buyer.label(), now);
        order = orderPersistence.commitEscrowTransition(order);
        creditSeller(order);

        log.info("Escrow for order {} released to seller {} on buyer approval", order.getOrderNumber(), order.getSellerId());
        return orderMapper.convertToDetailResponse(order);
    }

    /**
     * Lets the seller nudge the buyer for approval. Does not move any money.
     */
    @Transactional
    public OrderDetailResponse requestRelease(Long orderId, Actor sellerActor) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireSeller(order, sellerActor);
        requireDelivered(order);
        if (Boolean.TRUE.equals(order.getEscrow().getReleaseRequested())) {
            throw new InvalidStatusException("Release was already requested for order " + order.getOrderNumber());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.getEscrow().markReleaseRequested(now);
        order.addNote(NoteAuthorType.SELLER, "Seller requested escrow release", sellerActor.label(), now);
        order = orderPersistence.commitEscrowTransition(order);

        log.info("Seller requested escrow release for order {}", order.getOrderNumber());
        return orderMapper.convertToDetailResponse(order);
    }

    /**
     * Releases one order whose hold period has elapsed. Eligibility is re-checked against the freshly
     * loaded row, so running this twice for the same order, or after another path already released it,
     * does nothing.
     *
     * @return whether this call moved the escrow
     */
    @Transactional
    public boolean autoRelease(Long orderId) {
        Order order = orderPersistence.load(orderId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (!order.getEscrow().isAutoReleaseDue(now) || order.hasActiveDispute()) {
            log.debug("Order {} no longer eligible for auto-release", order.getOrderNumber());
            return false;
        }

        order.getEscrow().releaseToSeller(now, Actor.SYSTEM.label());
        order.addNote(NoteAuthorType.SYSTEM, "Escrow auto-released to seller after hold period", Actor.SYSTEM.label(), now);
        order = orderPersistence.commitEscrowTransition(order);
        creditSeller(order);

        log.info("Escrow for order {} auto-released to seller {}", order.getOrderNumber(), order.getSellerId());
        return true;
    }

    /**
     * Adds a released order to the seller's and its products' sales aggregates. Called once per order,
     * right after the release commit succeeded.
     */
    @Transactional
    public void creditSeller(Order order) {
        int updated = sellerRepository.recordCompletedSale(order.getSellerId(), order.getTotal());
        if (updated == 0) {
            log.warn("Seller {} for order {} not found, sales aggregates not updated", order.getSellerId(), order.getOrderNumber());
        }
        for (OrderItem item : order.getItems()) {
            if (productRepository.recordSale(item.getProductId(), item.getQuantity()) == 0) {
                log.warn("Product {} for order {} not found, sales count not updated", item.getProductId(), order.getOrderNumber());
            }
        }
    }

    private void requireDelivered(Order order) {
        if (order.getStatus() != OrderStatus.DELIVERED) {
            throw new InvalidStatusException("Order " + order.getOrderNumber()
                    + " has not been delivered, current status: " + order.getStatus());
        }
    }
}
