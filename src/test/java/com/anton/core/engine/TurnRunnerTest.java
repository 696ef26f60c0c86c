package com.anton.core.engine;

import com.anton.core.session.AgentReply;
import com.anton.core.session.AgentSession;
import com.anton.core.session.AgentSessionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TurnRunnerTest {

    private final TurnRunner turns = new TurnRunner();

    @AfterEach
    void tearDown() {
        turns.close();
    }

    /** Blocks in ask until cancelled. */
    private static class HangingSession implements AgentSession {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch cancelled = new CountDownLatch(1);

        @Override
        public AgentReply ask(String prompt) {
            started.countDown();
            try {
                cancelled.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw AgentSessionException.cancelled();
        }

        @Override
        public void cancel() {
            cancelled.countDown();
        }

        @Override
        public void close() {
        }
    }

    @Test
    @DisplayName("returns the reply of a turn that finishes in time")
    void inTime() {
        AgentSession session = new HangingSession() {
            @Override
            public AgentReply ask(String prompt) {
                return new AgentReply("done: " + prompt, 1, 0);
            }
        };

        assertEquals("done: go", turns.ask(session, "go", Duration.ofSeconds(5), "Task").text());
    }

    @Test
    @DisplayName("a turn over budget is cancelled through the session")
    void timeout() {
        HangingSession session = new HangingSession();

        TurnTimeoutException e = assertThrows(TurnTimeoutException.class,
                () -> turns.ask(session, "go", Duration.ofMillis(200), "Task"));

        assertEquals(0, session.cancelled.getCount());
        assertEquals(Duration.ofMillis(200), e.getLimit());
        assertEquals("Task timed out after 0s", e.getMessage());
    }

    @Test
    @DisplayName("session errors are rethrown unchanged")
    void sessionError() {
        AgentSession session = new HangingSession() {
            @Override
            public AgentReply ask(String prompt) {
                throw new AgentSessionException("provider overloaded");
            }
        };

        AgentSessionException e = assertThrows(AgentSessionException.class,
                () -> turns.ask(session, "go", Duration.ofSeconds(5), "Task"));
        assertEquals("provider overloaded", e.getMessage());
    }

    @Test
    @DisplayName("cancelInFlight stops the running turn")
    void cancelInFlight() throws InterruptedException {
        HangingSession session = new HangingSession();
        Thread stopper = new Thread(() -> {
            try {
                session.started.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            turns.cancelInFlight();
        });
        stopper.start();

        AgentSessionException e = assertThrows(AgentSessionException.class,
                () -> turns.ask(session, "go", Duration.ofSeconds(10), "Task"));

        stopper.join();
        assertTrue(e.isCancelled());
    }
}
