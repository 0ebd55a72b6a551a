package dev.stepflow.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationSignalTest {

    @Test
    void signalWithoutDeadlineOnlyFiresOnCancel() throws Exception {
        var signal = CancellationSignal.create();

        assertThat(signal.hasDeadline()).isFalse();
        assertThat(signal.isCancelled()).isFalse();
        signal.throwIfCancelled();

        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThatThrownBy(signal::throwIfCancelled)
            .isInstanceOf(RunCancelledException.class)
            .hasMessage("Run cancelled");
    }

    @Test
    void expiredDeadlineCountsAsCancelled() {
        var signal = CancellationSignal.withTimeout(Duration.ZERO);

        assertThat(signal.hasDeadline()).isTrue();
        assertThat(signal.isCancelled()).isTrue();
        assertThatThrownBy(signal::throwIfCancelled).hasMessageContaining("deadline");
    }

    @Test
    void timeoutBeyondNanosecondRangeNeverExpires() throws Exception {
        var signal = CancellationSignal.withTimeout(Duration.ofSeconds(9_300_000_000L));

        assertThat(signal.hasDeadline()).isTrue();
        assertThat(signal.isCancelled()).isFalse();
        assertThat(signal.remainingNanos()).isPositive();
        signal.throwIfCancelled();
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThatThrownBy(() -> CancellationSignal.withTimeout(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listenersRunOnceAndCanUnsubscribe() {
        var signal = CancellationSignal.create();
        var kept = new AtomicInteger();
        var dropped = new AtomicInteger();

        signal.onCancel(kept::incrementAndGet);
        signal.onCancel(dropped::incrementAndGet).close();

        signal.cancel();
        signal.cancel();

        assertThat(kept).hasValue(1);
        assertThat(dropped).hasValue(0);
    }
}
