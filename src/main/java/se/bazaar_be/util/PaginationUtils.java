package se.bazaar_be.util;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

public class PaginationUtils {

    public static final int MAX_PAGE_SIZE = 100;

    private PaginationUtils() {
    }

    /**
     * Unsorted page request; listing queries fix their own order (newest first, or oldest dispute first).
     */
    public static Pageable createPageable(int page, int size) {
        // Bounds checking to prevent integer overflow
        int safePage = Math.max(0, Math.min(page, 10000));
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return PageRequest.of(safePage, safeSize);
    }
}
