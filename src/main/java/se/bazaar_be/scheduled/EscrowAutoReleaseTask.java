package se.bazaar_be.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import se.bazaar_be.exception.BusinessLogicException;
import se.bazaar_be.pojo.enums.DisputeStatus;
import se.bazaar_be.pojo.enums.EscrowStatus;
import se.bazaar_be.repository.OrderRepository;
import se.bazaar_be.service.EscrowService;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Releases escrow to sellers once the post-delivery hold has passed without an active dispute.
 * Every order is released in its own transaction. A sweep can be interrupted at any point: whatever
 * it did not reach is picked up by the next one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowAutoReleaseTask {

    private final OrderRepository orderRepository;
    private final EscrowService escrowService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${escrow.auto-release.poll-interval-ms:300000}",
               initialDelayString = "${escrow.auto-release.initial-delay-ms:60000}")
    public void scheduledSweep() {
        releaseDueEscrows();
    }

    /**
     * @return number of orders released by this sweep
     */
    public int releaseDueEscrows() {
        List<Long> dueOrderIds = orderRepository.findIdsDueForAutoRelease(
                EscrowStatus.HELD, LocalDateTime.now(clock), EnumSet.of(DisputeStatus.OPEN, DisputeStatus.UNDER_REVIEW));
        if (dueOrderIds.isEmpty()) {
            log.debug("No escrows due for auto-release");
            return 0;
        }

        log.info("Found {} escrow(s) due for auto-release", dueOrderIds.size());
        int released = 0;
        for (Long orderId : dueOrderIds) {
            try {
                if (escrowService.autoRelease(orderId)) {
                    released++;
                }
            } catch (BusinessLogicException e) {
                // another release path won, or the dispute state changed since the query
                log.warn("Skipped auto-release of order {}: {}", orderId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Auto-release of order {} failed, will retry on next sweep", orderId, e);
            }
        }
        log.info("Auto-release sweep finished: {} of {} escrow(s) released", released, dueOrderIds.size());
        return released;
    }
}
