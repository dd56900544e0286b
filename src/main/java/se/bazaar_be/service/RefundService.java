package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.dto.request.RefundRequest;
import se.bazaar_be.dto.response.OrderDetailResponse;
import se.bazaar_be.exception.RefundNotAllowedException;
import se.bazaar_be.mapper.OrderMapper;
import se.bazaar_be.pojo.Order;
import se.bazaar_be.pojo.enums.NoteAuthorType;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class RefundService {

    private final OrderPersistenceService orderPersistence;
    private final OrderAccessPolicy accessPolicy;
    private final RefundPolicy refundPolicy;
    private final OrderMapper orderMapper;
    private final Clock clock;

    /**
     * Records a pending refund for the full order total. The money only moves when an admin resolves
     * a dispute or the gateway reports the refund.
     */
    @Transactional
    public OrderDetailResponse requestRefund(Long orderId, RefundRequest request, Actor buyer) {
        Order order = orderPersistence.load(orderId);
        accessPolicy.requireBuyer(order, buyer);

        if (!refundPolicy.canRequestRefund(order)) {
            throw new RefundNotAllowedException("Refund window has expired or order is not eligible for refund");
        }
        if (order.getRefund().isRequested()) {
            throw new RefundNotAllowedException("A refund was already requested for order " + order.getOrderNumber());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.requestRefund(request.getReason(), now);
        String message = "Refund requested: " + request.getReason();
        if (request.getDescription() != null && !request.getDescription().isBlank()) {
            message += ". " + request.getDescription();
        }
        order.addNote(NoteAuthorType.CUSTOMER, message, buyer.label(), now);
        order = orderPersistence.commitRefundRequest(order);

        log.info("Refund of {} requested on order {} by buyer {}", order.getTotal(), order.getOrderNumber(), buyer.getUserId());
        return orderMapper.convertToDetailResponse(order);
    }
}
