package cloud.recordstore.sdk;

import java.util.Optional;

/**
 * Bounds for a List call. The filter is a query condition placed after {@code WHERE}; it is passed through as given.
 */
public record ListConstraints(int limit, String filter) {

    public static final int DEFAULT_LIMIT = 10;

    public ListConstraints {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (filter != null && filter.isBlank()) {
            filter = null;
        }
    }

    public static ListConstraints defaults() {
        return new ListConstraints(DEFAULT_LIMIT, null);
    }

    public static ListConstraints limit(int limit) {
        return new ListConstraints(limit, null);
    }

    public Optional<String> filterCondition() {
        return Optional.ofNullable(filter);
    }
}
