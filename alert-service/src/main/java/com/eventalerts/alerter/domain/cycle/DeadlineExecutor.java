package com.eventalerts.alerter.domain.cycle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;

/**
 * Runs blocking calls (query, sends) on an I/O executor and waits for them no longer than
 * the cycle deadline. A call still running at the deadline is cancelled with an interrupt.
 */
@RequiredArgsConstructor
public class DeadlineExecutor {

    private final ExecutorService executor;
    private final Clock clock;

    /**
     * @throws TimeoutException if the deadline passed before or while the call ran
     * @throws RuntimeException the call's own unchecked failure, unwrapped
     */
    public <T> T call(Callable<T> task, Instant deadline) throws TimeoutException {
        var remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new TimeoutException("Deadline " + deadline + " already passed");
        }

        var future = executor.submit(task);
        try {
            return future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            var cancelled = new CancellationException("Interrupted while waiting for a blocking call");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }
}
