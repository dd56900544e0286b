package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.configuration.MarketplaceSettings;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.FeedbackRequest;
import se.bazaar_be.dto.request.OrderCreateRequest;
import se.bazaar_be.dto.request.ShipOrderRequest;
import se.bazaar_be.dto.response.EscrowStatisticsResponse;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.dto.response.OrderListResponse;
import se.bazaar_be.dto.response.PagedResponse;
import se.bazaar_be.exception.InsufficientStockException;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.exception.ProductUnavailableException;
import se.bazaar_be.exception.ValidationFailedException;
import se.bazaar_be.mapper.OrderMapper;
import se.bazaar_be.pojo.*;
import se.bazaar_be.pojo.enums.DisputeStatus;
import se.bazaar_be.pojo.enums.EscrowStatus;
import se.bazaar_be.pojo.enums.NoteAuthorType;
import se.bazaar_be.pojo.enums.OrderStatus;
import se.bazaar_be.pojo.enums.ProductStatus;
import se.bazaar_be.repository.OrderRepository;
import se.bazaar_be.repository.ProductRepository;
import se.bazaar_be.repository.SellerRepository;
import se.bazaar_be.util.OrderNumberGenerator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class OrderService {

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final SellerRepository sellerRepository;
    private final InventoryService inventoryService;
    private final TaxCalculator taxCalculator;
    private final OrderNumberGenerator orderNumberGenerator;
    private final OrderPersistenceService orderPersistence;
    private final OrderAccessPolicy accessPolicy;
    private final OrderMapper orderMapper;
    private final MarketplaceSettings settings;
    private final Clock clock;

    /**
     * Places an order with a single verified seller. Products are validated, priced and reserved in
     * one transaction: any failure leaves stock and orders exactly as they were.
     */
    @Transactional
    public OrderDetailResponse createOrder(OrderCreateRequest request, Actor buyer) {
        accessPolicy.requireCustomer(buyer);
        Map<Long, Integer> quantities = mergeLines(request.getItems());

        List<OrderItem> items = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        Long sellerId = null;

        for (Map.Entry<Long, Integer> line : quantities.entrySet()) {
            Long productId = line.getKey();
            int quantity = line.getValue();

            Product product = productRepository.findByIdWithSeller(productId)
                    .orElseThrow(() -> new ProductUnavailableException("Product " + productId + " does not exist"));
            Seller seller = product.getSeller();
            if (product.getStatus() != ProductStatus.ACTIVE || !seller.isEligibleToSell()) {
                throw new ProductUnavailableException("Product " + productId + " is not available from a verified seller");
            }
            if (sellerId != null && !sellerId.equals(seller.getSellerId())) {
                throw new ValidationFailedException("items", "All items in an order must come from the same seller");
            }
            sellerId = seller.getSellerId();

            if (product.getStock() < quantity) {
                throw new InsufficientStockException(productId,
                        "Insufficient stock for product " + productId + ": requested " + quantity
                                + ", available " + product.getStock());
            }

            items.add(OrderItem.builder()
                    .productId(productId)
                    .quantity(quantity)
                    .unitPrice(product.getPrice())
                    .productSnapshot(ProductSnapshot.builder()
                            .name(product.getName())
                            .image(product.getImageUrl())
                            .sku(product.getSku())
                            .build())
                    .build());
            subtotal = subtotal.add(product.getPrice().multiply(BigDecimal.valueOf(quantity)));
        }

        ShippingAddress shippingAddress = toShippingAddress(request.getShippingAddress());
        BigDecimal shippingCost = calculateShipping(subtotal);
        BigDecimal tax = taxCalculator.calculateTax(subtotal, shippingAddress);
        OrderPricing pricing = OrderPricing.of(subtotal, shippingCost, tax, BigDecimal.ZERO, settings.getCurrency());

        // The stock check above is advisory; the conditional decrement is what guards against overselling
        for (OrderItem item : items) {
            inventoryService.reserve(item.getProductId(), item.getQuantity());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Order order = Order.builder()
                .orderNumber(orderNumberGenerator.nextOrderNumber())
                .buyerId(buyer.getUserId())
                .sellerId(sellerId)
                .pricing(pricing)
                .shippingAddress(shippingAddress)
                .payment(PaymentInfo.builder().method(request.getPaymentMethod()).build())
                .build();
        items.forEach(order::addItem);
        if (request.getNotes() != null && !request.getNotes().isBlank()) {
            order.addNote(NoteAuthorType.CUSTOMER, request.getNotes(), buyer.label(), now);
        }

        order = orderRepository.save(order);
        log.info("Order {} created by buyer {} with seller {}: {} line(s), total {} {}",
                order.getOrderNumber(), buyer.getUserId(), sellerId, items.size(), pricing.getTotal(), pricing.getCurrency());
        return orderMapper.convertToDetailResponse(order);
    }

    public OrderDetailResponse getOrder(Long orderId, Actor actor) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireCanView(order, actor);
        return orderMapper.convertToDetailResponse(order);
    }

    public OrderDetailResponse getOrderByNumber(String orderNumber, Actor actor) {
        Order order = orderPersistence.loadByNumber(orderNumber);
        accessPolicy.requireCanView(order, actor);
        return orderMapper.convertToDetailResponse(order);
    }

    public PagedResponse<OrderListResponse> getBuyerOrders(Actor buyer, OrderStatus status, Pageable pageable) {
        accessPolicy.requireCustomer(buyer);
        Page<Order> orders = status == null
                ? orderRepository.findByBuyerIdOrderByCreatedAtDesc(buyer.getUserId(), pageable)
                : orderRepository.findByBuyerIdAndStatusOrderByCreatedAtDesc(buyer.getUserId(), status, pageable);
        return PagedResponse.of(orders.map(orderMapper::convertToListResponse));
    }

    public PagedResponse<OrderListResponse> getSellerOrders(Actor sellerActor, OrderStatus status, Pageable pageable) {
        Seller seller = accessPolicy.requireSellerAccount(sellerActor);
        Page<Order> orders = status == null
                ? orderRepository.findBySellerIdOrderByCreatedAtDesc(seller.getSellerId(), pageable)
                : orderRepository.findBySellerIdAndStatusOrderByCreatedAtDesc(seller.getSellerId(), status, pageable);
        return PagedResponse.of(orders.map(orderMapper::convertToListResponse));
    }

    @Transactional
    public OrderDetailResponse startProcessing(Long orderId, Actor sellerActor) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireSeller(order, sellerActor);
        requireStatus(order, OrderStatus.PAYMENT_CONFIRMED);

        order.changeStatus(OrderStatus.PROCESSING);
        order.addNote(NoteAuthorType.SELLER, "Seller started processing the order", sellerActor.label(), LocalDateTime.now(clock));
        order = orderPersistence.commitStatusChange(order);

        log.info("Order {} moved to PROCESSING by seller user {}", order.getOrderNumber(), sellerActor.getUserId());
        return orderMapper.convertToDetailResponse(order);
    }

    @Transactional
    public OrderDetailResponse markShipped(Long orderId, ShipOrderRequest request, Actor sellerActor) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireSeller(order, sellerActor);
        requireStatus(order, OrderStatus.PROCESSING);

        LocalDateTime now = LocalDateTime.now(clock);
        order.markShipped(request.getTrackingNumber(), request.getCarrier(), request.getEstimatedDelivery(), now);
        order.addNote(NoteAuthorType.SELLER,
                "Shipped with " + request.getCarrier() + ", tracking " + request.getTrackingNumber(),
                sellerActor.label(), now);
        order = orderPersistence.commitStatusChange(order);

        log.info("Order {} shipped via {} ({})", order.getOrderNumber(), request.getCarrier(), request.getTrackingNumber());
        return orderMapper.convertToDetailResponse(order);
    }

    /**
     * Buyer cancellation before payment. Every reserved unit goes back to stock; escrow stays pending
     * since no money was ever held.
     */
    @Transactional
    public OrderDetailResponse cancelOrder(Long orderId, String reason, Actor buyer) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireBuyer(order, buyer);
        if (order.getStatus() != OrderStatus.PENDING_PAYMENT) {
            throw new InvalidStatusException("Order " + order.getOrderNumber()
                    + " can only be cancelled before payment, current status: " + order.getStatus());
        }

        order.changeStatus(OrderStatus.CANCELLED);
        String message = reason == null || reason.isBlank() ? "Cancelled by customer" : "Cancelled by customer: " + reason;
        order.addNote(NoteAuthorType.CUSTOMER, message, buyer.label(), LocalDateTime.now(clock));
        order = orderPersistence.commitStatusChange(order);

        for (OrderItem item : order.getItems()) {
            inventoryService.release(item.getProductId(), item.getQuantity());
        }

        log.info("Order {} cancelled by buyer {}, {} line(s) returned to stock",
                order.getOrderNumber(), buyer.getUserId(), order.getItems().size());
        return orderMapper.convertToDetailResponse(order);
    }

    @Transactional
    public OrderDetailResponse leaveFeedback(Long orderId, FeedbackRequest request, Actor buyer) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireBuyer(order, buyer);
        requireStatus(order, OrderStatus.DELIVERED);
        if (order.getCustomerFeedback().isSubmitted()) {
            throw new InvalidStatusException("Feedback was already submitted for order " + order.getOrderNumber());
        }

        order.recordFeedback(request.getRating(), request.getReview(), LocalDateTime.now(clock));
        order = orderPersistence.commitStatusChange(order);
        sellerRepository.recordRating(order.getSellerId(), BigDecimal.valueOf(request.getRating()));

        log.info("Buyer {} rated order {} with {} star(s)", buyer.getUserId(), order.getOrderNumber(), request.getRating());
        return orderMapper.convertToDetailResponse(order);
    }

    /**
     * Escrow totals across all orders. The refund rate is refunded orders over all orders.
     */
    public EscrowStatisticsResponse getEscrowStatistics(Actor admin) {
        accessPolicy.requireAdmin(admin);
        long totalOrders = orderRepository.count();
        long refundedOrders = orderRepository.countRefunded();
        BigDecimal refundRate = totalOrders == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(refundedOrders * 100).divide(BigDecimal.valueOf(totalOrders), 2, RoundingMode.HALF_UP);

        return EscrowStatisticsResponse.builder()
                .totalOrders(totalOrders)
                .deliveredOrders(orderRepository.countByStatus(OrderStatus.DELIVERED))
                .escrowHeld(orderRepository.countByEscrowStatus(EscrowStatus.HELD))
                .heldAmount(orderRepository.sumTotalByEscrowStatus(EscrowStatus.HELD))
                .releasedToSeller(orderRepository.countByEscrowStatus(EscrowStatus.RELEASED_TO_SELLER))
                .refundedToCustomer(orderRepository.countByEscrowStatus(EscrowStatus.REFUNDED_TO_CUSTOMER))
                .refundedOrders(refundedOrders)
                .refundRate(refundRate)
                .activeDisputes(orderRepository.countByDisputeStatus(DisputeStatus.OPEN)
                        + orderRepository.countByDisputeStatus(DisputeStatus.UNDER_REVIEW))
                .currency(settings.getCurrency())
                .build();
    }

    private Map<Long, Integer> mergeLines(List<OrderCreateRequest.OrderItemRequest> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationFailedException("items", "Order must contain at least one item");
        }
        Map<Long, Integer> quantities = new LinkedHashMap<>();
        for (OrderCreateRequest.OrderItemRequest line : lines) {
            if (line.getProductId() == null) {
                throw new ValidationFailedException("items.productId", "Product ID is required");
            }
            if (line.getQuantity() == null || line.getQuantity() < 1) {
                throw new ValidationFailedException("items.quantity", "Quantity must be at least 1");
            }
            quantities.merge(line.getProductId(), line.getQuantity(), Integer::sum);
        }
        return quantities;
    }

    private BigDecimal calculateShipping(BigDecimal subtotal) {
        return subtotal.compareTo(settings.getFreeShippingThreshold()) > 0
                ? BigDecimal.ZERO
                : settings.getFlatShippingFee();
    }

    private ShippingAddress toShippingAddress(OrderCreateRequest.ShippingAddressRequest request) {
        if (request == null) {
            throw new ValidationFailedException("shippingAddress", "Shipping address is required");
        }
        ShippingAddress address = ShippingAddress.builder()
                .name(request.getName())
                .phone(request.getPhone())
                .street(request.getStreet())
                .city(request.getCity())
                .division(request.getDivision())
                .postalCode(request.getPostalCode())
                .build();
        if (request.getCountry() != null && !request.getCountry().isBlank()) {
            address.setCountry(request.getCountry());
        }
        return address;
    }

    private void requireStatus(Order order, OrderStatus expected) {
        if (order.getStatus() != expected) {
            throw new InvalidStatusException("Order " + order.getOrderNumber() + " must be " + expected
                    + ", current status: " + order.getStatus());
        }
    }
}
