// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import sh.sift.core.error.SegmentStoreException;

/**
 * Runs store operations on a worker thread and abandons them after a deadline.
 *
 * <p>On expiry the worker is interrupted and a retryable {@link SegmentStoreException}
 * whose message reports the timeout is raised, so {@link SegmentStoreException#isTimeout()}
 * holds for it.
 */
final class StoreDeadline {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ExecutorService WORKERS = Executors.newCachedThreadPool(runnable -> {
        final Thread thread = new Thread(runnable, "sift-store-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private StoreDeadline() {
    }

    /**
     * @param operation description used in failure messages, e.g. {@code "Loading segment X"}
     * @param call      the store operation
     * @param timeout   how long to wait for {@code call}
     * @return the result of {@code call}
     * @throws SegmentStoreException if {@code call} fails, is interrupted or exceeds {@code timeout}
     */
    static <T> T call(final String operation, final Callable<T> call, final Duration timeout) {
        final Future<T> result = WORKERS.submit(call);
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            result.cancel(true);
            throw new SegmentStoreException(operation + " timed out after " + timeout.toMillis() + "ms", true, e);
        } catch (InterruptedException e) {
            result.cancel(true);
            Thread.currentThread().interrupt();
            throw new SegmentStoreException(operation + " was interrupted", true, e);
        } catch (CancellationException e) {
            throw new SegmentStoreException(operation + " was cancelled", true, e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new SegmentStoreException(operation + " failed", true, cause);
        }
    }
}
