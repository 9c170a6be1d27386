package com.genserver;

import com.genserver.config.GenServerConfig;
import com.genserver.helper.CounterServer;
import com.genserver.mailbox.config.MailboxType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.genserver.helper.CounterServer.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the synchronous call protocol: timeouts, failure delivery, ordering and contention.
 */
@Timeout(20)
class CallProtocolTest {

    private final List<GenServer<?, ?, ?>> servers = new ArrayList<>();

    @AfterEach
    void tearDown() {
        for (GenServer<?, ?, ?> server : servers) {
            server.stop(Duration.ofSeconds(5));
        }
    }

    private <T extends GenServer<?, ?, ?>> T started(T server, Object... args) {
        servers.add(server);
        server.start(args);
        return server;
    }

    @Test
    void testCallTimesOutAndWorkerSurvives() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch slowCallEntered = new CountDownLatch(1);
        GenServer<String, String, Integer> server = started(new GenServer<String, String, Integer>() {
            @Override
            protected Integer init(Object... args) {
                return 0;
            }

            @Override
            protected CallResult<Integer> handleCall(String message, Integer state) throws Exception {
                if ("slow".equals(message)) {
                    slowCallEntered.countDown();
                    release.await();
                    return CallResult.reply("late", state + 100);
                }
                return CallResult.reply(state, state);
            }
        });

        Duration timeout = Duration.ofMillis(100);
        long start = System.nanoTime();
        GenServerTimeoutException error = assertThrows(GenServerTimeoutException.class,
                () -> server.call("slow", timeout));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(timeout, error.getTimeout());
        assertTrue(elapsedMs >= 100, "returned before the timeout: " + elapsedMs + "ms");
        assertTrue(elapsedMs < 1000, "timeout took too long: " + elapsedMs + "ms");
        assertTrue(slowCallEntered.await(1, TimeUnit.SECONDS));
        assertTrue(server.isRunning());

        release.countDown();
        // the late reply is dropped, but its state transition still applies
        Integer state = server.call("get", Duration.ofSeconds(5));
        assertEquals(100, state);
    }

    @Test
    void testCallbackFailureReachesCallerAndServerContinues() {
        GenServer<String, String, Integer> server = started(GenServer.of(new GenServerCallbacks<String, String, Integer>() {
            @Override
            public Integer init(Object... args) {
                return 1;
            }

            @Override
            public CallResult<Integer> handleCall(String message, Integer state) throws Exception {
                if ("explode".equals(message)) {
                    throw new java.io.IOException("disk on fire");
                }
                return CallResult.reply(state * 10, state + 1);
            }
        }));

        CallbackException error = assertThrows(CallbackException.class, () -> server.call("explode"));
        assertInstanceOf(java.io.IOException.class, error.getCause());
        assertEquals("disk on fire", error.getCause().getMessage());
        assertEquals(server.getName(), error.getServerName());

        Integer response = server.call("work");
        assertEquals(10, response);
        Integer next = server.call("work");
        assertEquals(20, next);
    }

    @Test
    void testFailedCastKeepsPreviousState() {
        GenServer<Integer, String, Integer> server = started(new GenServer<Integer, String, Integer>() {
            @Override
            protected Integer init(Object... args) {
                return 0;
            }

            @Override
            protected Integer handleCast(Integer amount, Integer state) {
                if (amount < 0) {
                    throw new IllegalArgumentException("negative amount " + amount);
                }
                return state + amount;
            }

            @Override
            protected CallResult<Integer> handleCall(String message, Integer state) {
                return CallResult.reply(state, state);
            }
        });

        server.cast(5);
        server.cast(-1);
        server.cast(3);

        Integer total = server.call("total");
        assertEquals(8, total);
        assertTrue(server.isRunning());
    }

    @Test
    void testHundredConcurrentCallers() throws Exception {
        CounterServer server = started(new CounterServer());
        int callers = 100;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);

        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    go.await();
                    return server.<Integer>call(INCREMENT_AND_GET, Duration.ofSeconds(10));
                }));
            }
            go.countDown();

            Set<Integer> responses = new HashSet<>();
            for (Future<Integer> future : futures) {
                responses.add(future.get(15, TimeUnit.SECONDS));
            }

            // every caller saw a distinct pre-call state
            assertEquals(callers, responses.size());
            for (int i = 1; i <= callers; i++) {
                assertTrue(responses.contains(i), "missing response " + i);
            }
            Integer count = server.call(GET_COUNT);
            assertEquals(callers, count);
        } finally {
            executor.shutdownNow();
        }
    }

    @ParameterizedTest
    @EnumSource(MailboxType.class)
    void testConcurrentCastsAndCallsWithEachMailbox(MailboxType mailboxType) throws Exception {
        CounterServer server = started(new CounterServer(new GenServerConfig().setMailboxType(mailboxType)));
        int producers = 8;
        int castsPerProducer = 500;
        ExecutorService executor = Executors.newFixedThreadPool(producers);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < castsPerProducer; i++) {
                        server.cast(INCREMENT);
                    }
                    server.call(GET_COUNT);
                }));
            }
            for (Future<?> future : futures) {
                future.get(15, TimeUnit.SECONDS);
            }

            Integer count = server.call(GET_COUNT);
            assertEquals(producers * castsPerProducer, count);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testCallsAnsweredInMailboxOrder() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch castEntered = new CountDownLatch(1);
        List<String> handled = new ArrayList<>();
        GenServer<String, String, Integer> server = started(new GenServer<String, String, Integer>() {
            @Override
            protected Integer init(Object... args) {
                return 0;
            }

            @Override
            protected Integer handleCast(String message, Integer state) throws Exception {
                castEntered.countDown();
                gate.await();
                return state;
            }

            @Override
            protected CallResult<Integer> handleCall(String message, Integer state) {
                handled.add(message);
                return CallResult.reply(state + 1, state + 1);
            }
        });

        // hold the worker so the three calls queue up behind the cast
        server.cast("block");
        assertTrue(castEntered.await(5, TimeUnit.SECONDS));
        CompletableFuture<Integer> first = server.callAsync("first");
        CompletableFuture<Integer> second = server.callAsync("second");
        CompletableFuture<Integer> third = server.callAsync("third");
        assertFalse(first.isDone());
        assertEquals(3, server.getPendingMessages());

        gate.countDown();

        assertEquals(1, first.get(5, TimeUnit.SECONDS));
        assertEquals(2, second.get(5, TimeUnit.SECONDS));
        assertEquals(3, third.get(5, TimeUnit.SECONDS));
        Integer count = server.call("check");
        assertEquals(4, count);
        assertEquals(List.of("first", "second", "third", "check"), handled);
    }

    @Test
    void testCallAsyncFailsWithCallbackException() {
        CounterServer server = started(new CounterServer());

        CompletableFuture<Object> future = server.callAsync(java.util.Map.of("action", "unknown"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CallbackException.class, error.getCause());
    }

    @Test
    void testDefaultCallTimeoutFromConfig() {
        CountDownLatch release = new CountDownLatch(1);
        GenServer<String, String, Integer> server = started(new GenServer<String, String, Integer>(
                new GenServerConfig().setDefaultCallTimeout(Duration.ofMillis(50))) {
            @Override
            protected Integer init(Object... args) {
                return 0;
            }

            @Override
            protected CallResult<Integer> handleCall(String message, Integer state) throws Exception {
                release.await();
                return CallResult.reply(state, state);
            }
        });

        try {
            assertThrows(GenServerTimeoutException.class, () -> server.call("anything"));
        } finally {
            release.countDown();
        }
    }

    @Test
    void testOverflowingTimeoutsWaitLikeForever() {
        CounterServer server = started(new CounterServer());
        Duration practicallyForever = Duration.ofSeconds(Long.MAX_VALUE);

        Integer count = server.call(INCREMENT_AND_GET, practicallyForever);
        assertEquals(1, count);
        assertEquals(0, server.getPendingMessages());

        server.stop(practicallyForever);
        assertEquals(GenServerStatus.STOPPED, server.getStatus());
        assertEquals(1, server.getTerminateCount());
    }

    @Test
    void testStopTimeoutLeavesWorkerRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);
        List<Integer> terminated = new ArrayList<>();
        GenServer<String, String, Integer> server = started(new GenServer<String, String, Integer>() {
            @Override
            protected Integer init(Object... args) {
                return 0;
            }

            @Override
            protected Integer handleCast(String message, Integer state) throws Exception {
                busy.countDown();
                release.await();
                return state + 1;
            }

            @Override
            protected void terminate(Integer state) {
                terminated.add(state);
            }
        });

        server.cast("work");
        assertTrue(busy.await(5, TimeUnit.SECONDS));

        GenServerTimeoutException error = assertThrows(GenServerTimeoutException.class,
                () -> server.stop(Duration.ofMillis(100)));
        assertEquals(Duration.ofMillis(100), error.getTimeout());
        assertEquals(GenServerStatus.STOPPING, server.getStatus());
        assertThrows(StoppedException.class, () -> server.cast("more"));

        release.countDown();
        server.stop(Duration.ofSeconds(5));

        assertEquals(GenServerStatus.STOPPED, server.getStatus());
        assertEquals(List.of(1), terminated);
    }

    @Test
    void testCallFromOwnCallbackIsRejected() {
        List<Throwable> errors = new ArrayList<>();
        GenServer<String, String, Integer> server = started(new GenServer<String, String, Integer>() {
            @Override
            protected Integer init(Object... args) {
                return 0;
            }

            @Override
            protected Integer handleCast(String message, Integer state) {
                try {
                    call("reentrant");
                } catch (GenServerException e) {
                    errors.add(e);
                }
                return state;
            }

            @Override
            protected CallResult<Integer> handleCall(String message, Integer state) {
                return CallResult.reply(errors.size(), state);
            }
        });

        server.cast("trigger");
        Integer seen = server.call("count");

        assertEquals(1, seen);
        assertEquals(GenServerException.class, errors.get(0).getClass());
    }

    @Test
    void testInterruptedCallerAbandonsCall() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        GenServer<String, String, Integer> server = started(new GenServer<String, String, Integer>() {
            @Override
            protected Integer init(Object... args) {
                return 0;
            }

            @Override
            protected CallResult<Integer> handleCall(String message, Integer state) throws Exception {
                if ("slow".equals(message)) {
                    release.await();
                }
                return CallResult.reply(state, state + 1);
            }
        });

        List<Throwable> outcome = new ArrayList<>();
        Thread caller = new Thread(() -> {
            try {
                server.call("slow");
            } catch (GenServerException e) {
                synchronized (outcome) {
                    outcome.add(e);
                    outcome.add(Thread.currentThread().isInterrupted() ? null : new AssertionError("interrupt flag lost"));
                }
            }
        });
        caller.start();
        Thread.sleep(100);
        caller.interrupt();
        caller.join(5000);

        synchronized (outcome) {
            assertEquals(2, outcome.size());
            assertInstanceOf(InterruptedException.class, outcome.get(0).getCause());
            assertNull(outcome.get(1));
        }

        release.countDown();
        Integer state = server.call("get", Duration.ofSeconds(5));
        assertEquals(1, state);
    }
}
