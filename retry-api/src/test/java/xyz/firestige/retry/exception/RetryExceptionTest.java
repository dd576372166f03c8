package xyz.firestige.retry.exception;

import org.junit.jupiter.api.Test;
import xyz.firestige.retry.api.ResultPredicate;
import xyz.firestige.retry.api.StopReason;

import static org.assertj.core.api.Assertions.assertThat;

class RetryExceptionTest {

    @Test
    void exhaustionExceptionsCarryReason() {
        assertThat(new AttemptsExhaustedException("n", null, null).getReason()).isEqualTo(StopReason.MAX_ATTEMPTS);
        assertThat(new TimeExhaustedException("t", null, null).getReason()).isEqualTo(StopReason.TIMEOUT);
        assertThat(new AttemptsExhaustedException("n", null, null)).isInstanceOf(RetryException.class);
    }

    @Test
    void attemptCountWithoutContextIsZero() {
        assertThat(new WrappedFailureException("w", null, new IllegalStateException()).getAttemptCount()).isZero();
    }

    @Test
    void rejectedResultKeepsValue() {
        RejectedResultException e = new RejectedResultException(42);
        assertThat(e.getResult()).isEqualTo(42);
        assertThat(e.getMessage()).contains("42");
    }

    @Test
    void resultPredicates() {
        assertThat(ResultPredicate.isNull().shouldRetry(null, null)).isTrue();
        assertThat(ResultPredicate.isNull().shouldRetry("x", null)).isFalse();
        assertThat(ResultPredicate.never().shouldRetry(null, null)).isFalse();
    }
}
