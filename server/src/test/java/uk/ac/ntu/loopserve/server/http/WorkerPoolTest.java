package uk.ac.ntu.loopserve.server.http;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

    @Test
    void runsTasksOnNamedDaemonThreads() throws Exception {
        Set<String> names = ConcurrentHashMap.newKeySet();
        Set<Boolean> daemon = ConcurrentHashMap.newKeySet();
        CountDownLatch done = new CountDownLatch(4);

        try (WorkerPool pool = new WorkerPool(2, 8)) {
            for (int i = 0; i < 4; i++) {
                pool.execute(() -> {
                    names.add(Thread.currentThread().getName());
                    daemon.add(Thread.currentThread().isDaemon());
                    done.countDown();
                });
            }
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(names).allMatch(n -> n.startsWith("loopserve-worker-"));
        assertThat(daemon).containsExactly(true);
    }

    @Test
    void fullQueueShedsToTheOverflowThread() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch overflowed = new CountDownLatch(1);
        String[] ranOn = new String[1];
        boolean[] flagged = new boolean[1];

        try (WorkerPool pool = new WorkerPool(1, 1)) {
            pool.execute(() -> {
                started.countDown();
                awaitQuietly(release);
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            pool.execute(() -> { });
            assertThat(pool.queued()).isEqualTo(1);

            pool.execute(() -> {
                ranOn[0] = Thread.currentThread().getName();
                flagged[0] = WorkerPool.shedding();
                overflowed.countDown();
            });

            assertThat(overflowed.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(ranOn[0]).startsWith("loopserve-overflow-");
            assertThat(flagged[0]).isTrue();
            assertThat(pool.shed()).isEqualTo(1);
            assertThat(pool.capacity()).isEqualTo(1);
            release.countDown();
        }
        assertThat(WorkerPool.shedding()).isFalse();
    }

    @Test
    void rejectsNonPositiveSizes() {
        assertThatThrownBy(() -> new WorkerPool(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkerPool(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
