package io.postflow.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads behind the poller, the attempt workers and the event emitter,
 * named {@code <prefix>1}, {@code <prefix>2}, ...
 *
 * <p>Uncaught exceptions are logged rather than printed to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread worker = new Thread(task, prefix + sequence.incrementAndGet());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler((t, e) ->
            logger.log(Level.SEVERE, "Uncaught exception on " + t.getName(), e));
        return worker;
    }
}
