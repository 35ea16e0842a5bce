package im.arun.texmml.service;

import im.arun.texmml.error.LatexConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of daemon threads that run whole-document conversions under a deadline.
 *
 * <p>A single document is always converted on one worker. Independent documents may
 * run at the same time, each with its own tree and context. A conversion that misses
 * its deadline is cancelled and reported as an empty result.
 */
public final class ConversionWorkers implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConversionWorkers.class);

    private final ExecutorService executor;
    private final Duration timeout;

    public ConversionWorkers(int threads, Duration timeout) {
        AtomicInteger counter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "texmml-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timeout = timeout;
    }

    /** Worker count for CPU-bound conversions: one per processor, capped at 8. */
    public static int defaultThreads() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 8));
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Runs {@code conversion} for the named document and waits for it. The worker thread
     * carries the document name while it runs. Runtime and I/O failures of the conversion
     * are rethrown unchanged.
     */
    public Optional<ParsedDocument> convert(String docName, Callable<ParsedDocument> conversion) throws IOException {
        Future<ParsedDocument> future = executor.submit(() -> {
            Thread worker = Thread.currentThread();
            String poolName = worker.getName();
            worker.setName(poolName + " [" + docName + "]");
            try {
                return conversion.call();
            } finally {
                worker.setName(poolName);
            }
        });
        try {
            return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.error("Conversion of {} timed out after {} ms", docName, timeout.toMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LatexConversionException("Interrupted while converting " + docName, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new LatexConversionException("Conversion of " + docName + " failed", cause);
        }
    }

    /** Stops the workers, interrupting conversions still running. */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
