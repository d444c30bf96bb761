package com.deepknow.callbot.domain.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void cancelsOnceAndKeepsFirstReason() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger fired = new AtomicInteger();
        token.onCancel(fired::incrementAndGet);

        assertThat(token.cancel("client_closed")).isTrue();
        assertThat(token.cancel("timeout")).isFalse();

        assertThat(fired).hasValue(1);
        assertThat(token.getReason()).isEqualTo("client_closed");
        assertThat(token.isTimedOut()).isFalse();
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(ExchangeCancelledException.class);
    }

    @Test
    void listenerRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel(null);
        AtomicInteger fired = new AtomicInteger();

        token.onCancel(fired::incrementAndGet);

        assertThat(fired).hasValue(1);
        assertThat(token.getReason()).isEqualTo("cancelled");
    }

    @Test
    void removedListenerDoesNotFire() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger fired = new AtomicInteger();
        CancellationToken.Registration reg = token.onCancel(fired::incrementAndGet);

        reg.remove();
        token.cancel("x");

        assertThat(fired).hasValue(0);
    }

    @Test
    void linkedTokenFollowsParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = CancellationToken.linked(parent, 0, scheduler);

        parent.cancel(CancellationToken.REASON_CLIENT_CLOSED);

        assertThat(child.isCancelled()).isTrue();
        assertThat(child.getReason()).isEqualTo(CancellationToken.REASON_CLIENT_CLOSED);
    }

    @Test
    void linkedTokenTimesOut() throws InterruptedException {
        CancellationToken child = CancellationToken.linked(null, 50, scheduler);
        CountDownLatch fired = new CountDownLatch(1);
        child.onCancel(fired::countDown);

        assertThat(fired.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(child.isTimedOut()).isTrue();
    }

    @Test
    void closedLinkIsDetachedFromParentAndTimer() throws InterruptedException {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = CancellationToken.linked(parent, 50, scheduler);

        child.close();
        parent.cancel("late");
        Thread.sleep(150);

        assertThat(child.isCancelled()).isFalse();
    }

    @Test
    void cancellingChildLeavesParentUntouched() {
        CancellationToken parent = CancellationToken.create();
        try (CancellationToken child = CancellationToken.linked(parent, 0, null)) {
            child.cancel(CancellationToken.REASON_TIMEOUT);
        }

        assertThat(parent.isCancelled()).isFalse();
    }
}
