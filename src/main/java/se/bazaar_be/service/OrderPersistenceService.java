package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import se.bazaar_be.exception.InvalidEscrowTransitionException;
import se.bazaar_be.exception.InvalidStatusException;
import se.bazaar_be.exception.RefundNotAllowedException;
import se.bazaar_be.exception.ResourceNotFoundException;
import se.bazaar_be.pojo.Order;
import se.bazaar_be.repository.OrderRepository;

/**
 * Loads orders and commits transitions. Writes are flushed inside the caller's transaction so a
 * version conflict with a concurrent writer surfaces here as a typed failure, never as a retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderPersistenceService {

    private final OrderRepository orderRepository;

    public Order load(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with ID: " + orderId));
    }

    public Order loadByNumber(String orderNumber) {
        return orderRepository.findByOrderNumber(orderNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with number: " + orderNumber));
    }

    public Order commitEscrowTransition(Order order) {
        try {
            return orderRepository.saveAndFlush(order);
        } catch (ConcurrencyFailureException e) {
            log.warn("Escrow transition on order {} lost a concurrent update", order.getOrderNumber());
            throw new InvalidEscrowTransitionException(
                    "Order " + order.getOrderNumber() + " escrow was changed concurrently", e);
        }
    }

    public Order commitStatusChange(Order order) {
        try {
            return orderRepository.saveAndFlush(order);
        } catch (ConcurrencyFailureException e) {
            log.warn("Status change on order {} lost a concurrent update", order.getOrderNumber());
            throw new InvalidStatusException(
                    "Order " + order.getOrderNumber() + " was changed concurrently", e);
        }
    }

    public Order commitRefundRequest(Order order) {
        try {
            return orderRepository.saveAndFlush(order);
        } catch (ConcurrencyFailureException e) {
            log.warn("Refund request on order {} lost a concurrent update", order.getOrderNumber());
            throw new RefundNotAllowedException(
                    "Order " + order.getOrderNumber() + " was changed concurrently", e);
        }
    }
}
