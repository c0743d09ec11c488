package com.adkstream.gateway.session;

import com.adkstream.gateway.approval.ApprovalRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private SessionStore storeWith(SessionBackend backend) {
        return new SessionStore(backend, "demo_app", () -> new ApprovalRegistry(scheduler));
    }

    /** Slow backend that counts creations. */
    static class CountingBackend extends InMemorySessionBackend {
        final AtomicInteger creates = new AtomicInteger();

        @Override
        public CreateOrFetch create(Session candidate) {
            creates.incrementAndGet();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return super.create(candidate);
        }
    }

    /** Backend whose first creation fails. */
    static class FailOnceBackend extends InMemorySessionBackend {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public CreateOrFetch create(Session candidate) {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("backend unavailable");
            }
            return super.create(candidate);
        }
    }

    @Nested
    class Identity {

        @Test
        void getOrCreate_firstCallCreates_secondFetchesSameSession() {
            SessionStore store = storeWith(new InMemorySessionBackend());

            CreateOrFetch first = store.getOrCreate("alice", "conn-1");
            CreateOrFetch second = store.getOrCreate("alice", "conn-1");

            assertTrue(first.created());
            assertFalse(second.created());
            assertSame(first.session(), second.session());
            assertEquals("session_alice_conn-1", first.session().getSessionId());
        }

        @Test
        void getOrCreate_withoutSignature_usesAppName() {
            SessionStore store = storeWith(new InMemorySessionBackend());

            Session session = store.getOrCreate("alice", null).session();

            assertEquals("session_alice_demo_app", session.getSessionId());
            assertSame(session, store.getOrCreate("alice", " ").session());
        }

        @Test
        void getOrCreate_distinctSignatures_distinctSessions() {
            SessionStore store = storeWith(new InMemorySessionBackend());

            Session a = store.getOrCreate("alice", "conn-1").session();
            Session b = store.getOrCreate("alice", "conn-2").session();

            assertNotSame(a, b);
            assertNotSame(a.getApprovals(), b.getApprovals());
            assertEquals(2, store.size());
        }

        @Test
        void get_unknownSession_isEmpty() {
            SessionStore store = storeWith(new InMemorySessionBackend());

            assertEquals(Optional.empty(), store.get("session_nobody_demo_app"));
            assertEquals(Optional.empty(), store.get(null));
        }

        @Test
        void clear_dropsAllSessions() {
            SessionStore store = storeWith(new InMemorySessionBackend());
            store.getOrCreate("alice", null);
            store.getOrCreate("bob", null);

            store.clear();

            assertEquals(0, store.size());
            assertTrue(store.getOrCreate("alice", null).created());
        }
    }

    @Nested
    class Concurrency {

        @Test
        void concurrentGetOrCreate_sameIdentity_createsOnce() throws Exception {
            CountingBackend backend = new CountingBackend();
            SessionStore store = storeWith(backend);
            int callers = 16;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch go = new CountDownLatch(1);
            try {
                List<Future<CreateOrFetch>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        go.await();
                        return store.getOrCreate("alice", "conn-1");
                    }));
                }
                go.countDown();

                Session expected = null;
                int created = 0;
                for (Future<CreateOrFetch> result : results) {
                    CreateOrFetch outcome = result.get(5, TimeUnit.SECONDS);
                    if (expected == null) {
                        expected = outcome.session();
                    }
                    assertSame(expected, outcome.session());
                    if (outcome.created()) {
                        created++;
                    }
                }
                assertEquals(1, created);
                assertEquals(1, backend.creates.get());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void getOrCreate_afterFailedCreation_canRetry() {
            FailOnceBackend backend = new FailOnceBackend();
            SessionStore store = storeWith(backend);

            IllegalStateException error = assertThrows(IllegalStateException.class,
                    () -> store.getOrCreate("alice", null));
            assertEquals("backend unavailable", error.getMessage());
            assertEquals(0, store.size());

            assertTrue(store.getOrCreate("alice", null).created());
        }
    }
}
