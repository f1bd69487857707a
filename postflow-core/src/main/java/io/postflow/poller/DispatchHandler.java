package io.postflow.poller;

import io.postflow.Platform;
import io.postflow.model.Publication;

/**
 * Receives publications claimed by the {@link DispatchPoller}.
 *
 * @see io.postflow.dispatch.DispatcherPollerHandler
 */
@FunctionalInterface
public interface DispatchHandler {

    /**
     * Starts an attempt for a claimed publication.
     *
     * @param claimed publication in {@code publishing} under this poller's lease
     * @return {@code false} to refuse the claim; the poller then releases it without
     *     consuming an attempt
     */
    boolean handle(Publication claimed);

    /**
     * Number of attempts this handler can start right now. The poller claims no more than
     * this many rows and skips claiming entirely when it returns {@code 0}.
     *
     * <p>Default returns {@link Integer#MAX_VALUE} (no cap).
     */
    default int availableCapacity() {
        return Integer.MAX_VALUE;
    }

    /**
     * Whether another attempt against {@code platform} may start right now.
     */
    default boolean hasCapacity(Platform platform) {
        return true;
    }
}
