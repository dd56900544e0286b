package se.bazaar_be.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.pojo.Product;
import se.bazaar_be.pojo.Seller;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Concurrent access to stock and escrow")
class ConcurrencyIntegrationTest extends IntegrationTestSupport {

    @Test
    @DisplayName("Concurrent orders never take stock below zero")
    void concurrentOrdersNeverOversell() throws Exception {
        // Given
        int initialStock = 5;
        int buyers = 12;
        Seller seller = verifiedSeller();
        Product product = product(seller, "200.00", initialStock);

        ExecutorService executor = Executors.newFixedThreadPool(buyers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < buyers; i++) {
            Actor buyer = newBuyer();
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    placeOrder(buyer, product, 1);
                    successes.incrementAndGet();
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        int remaining = inventoryService.availableStock(product.getProductId());
        assertThat(successes.get()).isBetween(1, initialStock);
        assertThat(successes.get() + failures.get()).isEqualTo(buyers);
        assertThat(remaining).isGreaterThanOrEqualTo(0);
        assertThat(remaining).isEqualTo(initialStock - successes.get());
    }

    @Test
    @DisplayName("Buyer approval racing the auto-release sweep releases the escrow exactly once")
    void approvalAndSweepReleaseOnce() throws Exception {
        // Given
        Seller seller = verifiedSeller();
        Actor buyer = newBuyer();
        Long orderId = deliveredOrder(buyer, seller, product(seller, "700.00", 2), 1);
        advanceDays(8);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Callable<Boolean> approval = () -> {
            start.await();
            try {
                escrowService.approveDelivery(orderId, buyer);
                return true;
            } catch (RuntimeException e) {
                return false;
            }
        };
        Callable<Boolean> sweep = () -> {
            start.await();
            try {
                return escrowService.autoRelease(orderId);
            } catch (RuntimeException e) {
                return false;
            }
        };

        // When
        Future<Boolean> approved = executor.submit(approval);
        Future<Boolean> swept = executor.submit(sweep);
        start.countDown();
        int releases = (approved.get(30, TimeUnit.SECONDS) ? 1 : 0) + (swept.get(30, TimeUnit.SECONDS) ? 1 : 0);
        executor.shutdown();

        // Then
        assertThat(releases).isEqualTo(1);
        assertThat(orderService.getOrder(orderId, ADMIN).getEscrow().getStatus()).isEqualTo("RELEASED_TO_SELLER");
        assertThat(sellerRepository.findById(seller.getSellerId()).orElseThrow().getTotalOrders()).isEqualTo(1);
    }
}
