package edchat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ActorThreadPoolTest {

    private final ActorThreadPool<Object> pool = new ActorThreadPool<>(4);

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void tasksOfOneActorRunInOrder() throws Exception {
        Object actor = new Object();
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            int n = i;
            pool.submit(actor, () -> {
                seen.add(n);
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(IntStream.range(0, 200).boxed().collect(Collectors.toList()), seen);
    }

    @Test
    void blockedActorDoesNotStallOthers() throws Exception {
        Object slow = new Object();
        Object fast = new Object();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch fastDone = new CountDownLatch(1);

        pool.submit(slow, () -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        pool.submit(fast, fastDone::countDown);

        assertTrue(fastDone.await(5, TimeUnit.SECONDS));
        release.countDown();
    }

    @Test
    void failingTaskDoesNotStopTheActor() throws Exception {
        Object actor = new Object();
        CountDownLatch next = new CountDownLatch(1);

        pool.submit(actor, () -> {
            throw new IllegalStateException("boom");
        });
        pool.submit(actor, next::countDown);

        assertTrue(next.await(5, TimeUnit.SECONDS));
    }
}
