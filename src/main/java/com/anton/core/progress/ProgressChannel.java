package com.anton.core.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, non-blocking progress channel.
 * <p>
 * Publishing never blocks the run: events are queued and delivered to listeners on a single
 * daemon thread. When the queue is full the event is dropped and counted. A listener that
 * throws is logged and does not affect other listeners or the run.
 */
public class ProgressChannel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);

    public static final int DEFAULT_CAPACITY = 256;
    private static final Duration CLOSE_GRACE = Duration.ofSeconds(2);

    private final BlockingQueue<ProgressEvent> queue;
    private final CopyOnWriteArrayList<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private final Thread worker;
    private volatile boolean closed;

    public ProgressChannel() {
        this(DEFAULT_CAPACITY);
    }

    public ProgressChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.worker = new Thread(this::drain, "anton-progress");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Queue an event for delivery.
     *
     * @return false if the event was dropped because the channel is full or closed
     */
    public boolean publish(ProgressEvent event) {
        if (closed) {
            return false;
        }
        if (!queue.offer(event)) {
            long count = dropped.incrementAndGet();
            log.debug("Progress queue full, dropped {} event ({} dropped so far)", event.type(), count);
            return false;
        }
        return true;
    }

    public Subscription subscribe(ProgressListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /**
     * Stops accepting events and gives the worker a short grace period to flush what is queued.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        worker.interrupt();
        try {
            worker.join(CLOSE_GRACE.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void drain() {
        while (!closed || !queue.isEmpty()) {
            ProgressEvent event;
            try {
                event = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                // closing: flush whatever is left without waiting
                event = queue.poll();
                if (event == null) {
                    return;
                }
            }
            if (event != null) {
                for (ProgressListener listener : listeners) {
                    deliverSafely(listener, event);
                }
            }
        }
    }

    private void deliverSafely(ProgressListener listener, ProgressEvent event) {
        try {
            listener.onProgress(event);
        } catch (Exception e) {
            log.warn("Progress listener threw exception processing event {}: {}",
                    event.type(), e.getMessage(), e);
        }
    }
}
