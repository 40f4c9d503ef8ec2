package edchat;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ====================== ACTOR THREAD POOL ============================
 *
 * WHAT IS THIS?
 * A fixed worker pool in which every task belongs to an "actor" (for the
 * chat server: one client connection). Tasks of the SAME actor run one
 * at a time in submission order, tasks of DIFFERENT actors run in
 * parallel on the worker threads.
 *
 * For a chat user this means: the lines typed by alice are handled in
 * the order they were typed, and the disconnect is handled only after
 * every line sent before it.
 *
 * HOW DOES IT WORK?
 * 1. Each actor has a queue of pending tasks, created on first use.
 * 2. submit(actor, task):
 *    - actor idle  -> mark it running and hand the task to a worker
 *    - actor busy  -> append the task to the actor's queue
 * 3. When a task finishes, the worker polls the actor's queue:
 *    - more tasks -> run the next one
 *    - empty      -> the actor is idle again and its queue is dropped
 *
 * A task that throws is logged and does not stop its actor: the next
 * queued task still runs.
 * =====================================================================
 */
public class ActorThreadPool<T> {

    private static final Logger LOG = LoggerFactory.getLogger(ActorThreadPool.class);

    // Pending tasks per running actor. An idle actor has no entry.
    private final Map<T, Queue<Runnable>> actors = new ConcurrentHashMap<>();

    private final ExecutorService threads;

    /**
     * @param threads number of worker threads
     */
    public ActorThreadPool(int threads) {
        this.threads = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
    }

    /**
     * Queues {@code task} for {@code actor}. The task runs after every task
     * previously submitted for the same actor has finished.
     */
    public void submit(T actor, Runnable task) {
        synchronized (actor) {
            Queue<Runnable> pending = actors.get(actor);
            if (pending == null) {
                actors.put(actor, new ConcurrentLinkedQueue<>());
                execute(actor, task);
            } else {
                pending.add(task);
            }
        }
    }

    /**
     * Stops the workers, interrupting running tasks, and waits briefly for
     * them to exit.
     */
    public void shutdown() {
        threads.shutdownNow();
        try {
            if (!threads.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Worker threads did not terminate in time");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void execute(T actor, Runnable task) {
        threads.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                LOG.error("Task of {} failed", actor, ex);
            } finally {
                complete(actor);
            }
        });
    }

    private void complete(T actor) {
        synchronized (actor) {
            Queue<Runnable> pending = actors.get(actor);
            Runnable next = pending.poll();
            if (next == null) {
                actors.remove(actor);
            } else {
                execute(actor, next);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "edchat-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
