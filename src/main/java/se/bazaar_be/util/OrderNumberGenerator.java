package se.bazaar_be.util;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import se.bazaar_be.repository.OrderRepository;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Order numbers look like {@code BD123456789}: the last six digits of the epoch millis followed
 * by three random digits.
 */
@Component
@RequiredArgsConstructor
public class OrderNumberGenerator {

    private static final String PREFIX = "BD";
    private static final int MAX_ATTEMPTS = 10;

    private final OrderRepository orderRepository;
    private final Clock clock;

    public String nextOrderNumber() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = format(clock.millis(), ThreadLocalRandom.current().nextInt(1000));
            if (!orderRepository.existsByOrderNumber(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique order number after " + MAX_ATTEMPTS + " attempts");
    }

    static String format(long epochMillis, int random) {
        String millis = String.format("%06d", epochMillis % 1_000_000);
        return PREFIX + millis + String.format("%03d", random);
    }
}
