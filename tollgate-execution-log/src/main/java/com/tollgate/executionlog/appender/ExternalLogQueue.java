package com.tollgate.executionlog.appender;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * List-shaped external buffer shared across processes. New items go on the left; the oldest sit on the right.
 * Each push checks the capacity and applies its outcome in one atomic step, so concurrent producers never
 * remove each other's items. Implementations throw unchecked exceptions on transport failure.
 */
public interface ExternalLogQueue {

    /** Pushes unless the list already holds {@code capacity} items. @return the new length, or empty when full */
    OptionalLong pushIfRoom(String item, int capacity);

    /** Pushes, then trims the oldest items beyond {@code capacity}. @return how many items were evicted */
    long pushEvictingOldest(String item, int capacity);

    Optional<String> popOldest();
}
