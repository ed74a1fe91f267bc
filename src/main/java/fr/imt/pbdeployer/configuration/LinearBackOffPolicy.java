package fr.imt.pbdeployer.configuration;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Waits {@code n * interval} before the n-th retry.
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final long intervalMillis;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(long intervalMillis) {
        this(intervalMillis, new ThreadWaitSleeper());
    }

    public LinearBackOffPolicy(long intervalMillis, Sleeper sleeper) {
        this.intervalMillis = intervalMillis;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptCounter();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        AttemptCounter counter = (AttemptCounter) backOffContext;
        counter.attempts++;
        long wait = intervalMillis * counter.attempts;
        if (wait <= 0) {
            return;
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted during linear back off", e);
        }
    }

    private static final class AttemptCounter implements BackOffContext {
        private int attempts;
    }
}
