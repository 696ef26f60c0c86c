package com.anton.core.engine;

import com.anton.core.session.AgentReply;
import com.anton.core.session.AgentSession;
import com.anton.core.session.AgentSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs agent turns with a time budget and tracks the turn in flight so a stop request can
 * cancel it through the session's own cancellation path.
 */
class TurnRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TurnRunner.class);

    private final ExecutorService executor;
    private final AtomicReference<AgentSession> inFlight = new AtomicReference<>();

    TurnRunner() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "anton-turn-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Sends a prompt and waits at most {@code limit} for the reply.
     *
     * @throws TurnTimeoutException  if the budget ran out; the session has been cancelled
     * @throws AgentSessionException if the session failed or was cancelled
     */
    AgentReply ask(AgentSession session, String prompt, Duration limit, String label) {
        inFlight.set(session);
        Future<AgentReply> future = executor.submit(() -> session.ask(prompt));
        try {
            return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} exceeded {}s, cancelling session", label, limit.toSeconds());
            session.cancel();
            future.cancel(true);
            throw new TurnTimeoutException(label, limit);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new AgentSessionException(label + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.cancel();
            throw AgentSessionException.cancelled();
        } finally {
            inFlight.compareAndSet(session, null);
        }
    }

    /** Cancels the turn in flight, if any. Safe from any thread. */
    void cancelInFlight() {
        AgentSession session = inFlight.get();
        if (session != null) {
            log.info("Cancelling in-flight agent turn");
            session.cancel();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
