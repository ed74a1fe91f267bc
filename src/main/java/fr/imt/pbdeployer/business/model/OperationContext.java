package fr.imt.pbdeployer.business.model;

import fr.imt.pbdeployer.exception.OperationCancelledException;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deadline and cancellation state carried by every remote call of one operation.
 */
@Getter
public class OperationContext {

    private final CancellationToken token;
    private final Instant deadline;
    private final Clock clock;

    public OperationContext(CancellationToken token, Instant deadline, Clock clock) {
        this.token = token;
        this.deadline = deadline;
        this.clock = clock;
    }

    public static OperationContext unbounded(Clock clock) {
        return new OperationContext(new CancellationToken(), null, clock);
    }

    public static OperationContext withTimeout(Duration timeout, Clock clock) {
        return new OperationContext(new CancellationToken(), clock.instant().plus(timeout), clock);
    }

    /**
     * Throws if the operation was cancelled or its deadline passed.
     */
    public void checkActive() {
        if (token.isCancelled()) {
            throw new OperationCancelledException("Operation cancelled: " + token.reason());
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new OperationCancelledException("Operation deadline exceeded");
        }
    }

    /**
     * Clamps a per-call timeout to the time left before the deadline.
     */
    public Duration bound(Duration timeout) {
        if (deadline == null) {
            return timeout;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new OperationCancelledException("Operation deadline exceeded");
        }
        return remaining.compareTo(timeout) < 0 ? remaining : timeout;
    }

    /**
     * Sleeps in short slices so that a cancellation is observed promptly.
     */
    public void pause(Duration duration) {
        long end = System.nanoTime() + duration.toNanos();
        while (true) {
            checkActive();
            long left = end - System.nanoTime();
            if (left <= 0) {
                return;
            }
            try {
                Thread.sleep(Math.min(Duration.ofNanos(left).toMillis() + 1, 200));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Interrupted while waiting");
            }
        }
    }
}
