package com.lob.engine.worker;

import com.lob.common.LatencyStats;
import com.lob.common.LobConfig;
import com.lob.engine.book.BookInvariantException;
import com.lob.engine.book.MatchingEngine;
import com.lob.protocol.OrderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-threaded owner of one {@link MatchingEngine}.
 *
 * Any thread may {@link #submit} commands; they are queued in arrival order
 * and applied one at a time on the worker thread. Listener callbacks run on
 * that thread too. The engine must not be touched from elsewhere while the
 * worker runs; after {@link #awaitTermination} it is safe to query.
 *
 * Run loop: poll queue -> process -> record latency.
 * No locks around the book; the queue is the only point of contention.
 */
public final class EngineWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EngineWorker.class);

    private static final long POLL_TIMEOUT_MS = 100;

    private final MatchingEngine engine;
    private final BlockingQueue<OrderCommand> queue;
    private final LatencyStats stats = new LatencyStats("engine.command");
    private final long metricsIntervalNanos;
    private final int depthLevels;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong processed = new AtomicLong();
    private final CountDownLatch stopped = new CountDownLatch(1);

    public EngineWorker(LobConfig cfg, MatchingEngine engine) {
        this.engine = engine;
        this.queue = new ArrayBlockingQueue<>(cfg.commandQueueCapacity);
        this.metricsIntervalNanos = TimeUnit.SECONDS.toNanos(cfg.metricsIntervalSecs);
        this.depthLevels = cfg.depthLevels;
    }

    public void start() {
        Thread t = new Thread(this, "lob-engine");
        t.setDaemon(false);
        t.start();
        log.info("Engine worker started: queueCapacity={}", queue.remainingCapacity());
    }

    /**
     * Queues a command. Returns false if the worker is stopping or the queue is
     * full. A true return means the command will be applied unless the engine
     * halts first.
     */
    public boolean submit(OrderCommand command) {
        if (!running.get()) return false;
        if (!queue.offer(command)) {
            log.warn("Command queue full, refusing {} for order {}", command.type(), command.orderId());
            return false;
        }
        // stopped between the check and the offer: the loop may already have
        // exited, so take the command back unless the worker got to it first
        if (!running.get() && queue.remove(command)) return false;
        return true;
    }

    /** Stops accepting commands; those already queued are still applied. */
    public void stop() { running.set(false); }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    public long processedCount() { return processed.get(); }

    public LatencyStats latencyStats() { return stats; }

    @Override
    public void run() {
        long nextReport = System.nanoTime() + metricsIntervalNanos;
        try {
            while (running.get() || !queue.isEmpty()) {
                OrderCommand command = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (command != null) {
                    long start = System.nanoTime();
                    engine.process(command);
                    stats.record(System.nanoTime() - start);
                    processed.incrementAndGet();
                }
                long now = System.nanoTime();
                if (now >= nextReport) {
                    stats.logAndReset();
                    nextReport = now + metricsIntervalNanos;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Engine worker interrupted with {} commands queued", queue.size());
        } catch (BookInvariantException e) {
            log.error("Engine halted after {} commands; {} commands left unprocessed",
                    processed.get(), queue.size(), e);
        } finally {
            running.set(false);
            if (log.isDebugEnabled()) {
                log.debug("Book at shutdown:\n{}", engine.formatBook(depthLevels));
            }
            stopped.countDown();
            log.info("Engine worker stopped after {} commands", processed.get());
        }
    }
}
