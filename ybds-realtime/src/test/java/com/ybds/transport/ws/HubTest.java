package com.ybds.transport.ws;

import com.ybds.auth.Identity;
import com.ybds.infrastructure.metrics.HubMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.ybds.transport.ws.TestClients.bytes;
import static com.ybds.transport.ws.TestClients.drain;
import static com.ybds.transport.ws.TestClients.registered;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for Hub.
 *
 * Tests:
 * - Registration, id uniqueness and idempotent unregistration
 * - Topic fan-out and membership symmetry
 * - User, role and broadcast publishing
 * - Slow consumer eviction
 * - Inactivity sweep
 * - Per-client ordering
 * - Shutdown and request queue saturation
 */
@ExtendWith(MockitoExtension.class)
class HubTest {

    private static final long WAIT_MS = 2_000;

    @Mock
    private HubMetrics metrics;

    private Hub hub;

    @AfterEach
    void tearDown() {
        if (hub != null) {
            hub.close();
        }
    }

    private static HubConfig.Builder config() {
        return HubConfig.builder()
            .heartbeatInterval(Duration.ofSeconds(5))
            .readTimeout(Duration.ofSeconds(10))
            .writeTimeout(Duration.ofSeconds(1));
    }

    private Hub startHub(HubConfig config) {
        return startHub(config, SubscriptionPolicy.permitAll(), FallbackHandler.noop());
    }

    private Hub startHub(HubConfig config, SubscriptionPolicy policy, FallbackHandler fallback) {
        hub = new Hub(config, policy, fallback, metrics);
        hub.start();
        return hub;
    }

    private static boolean await(CompletableFuture<Boolean> future) throws Exception {
        return future.get(WAIT_MS, TimeUnit.MILLISECONDS);
    }

    // ═══════════════════════════════════════════════════════════════
    // REGISTRATION
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testAttachRegistersClientsWithUniqueIds() throws Exception {
        startHub(config().build());

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            Client client = hub.attach(new Identity("user" + i, Set.of("customer")), new RecordingTransport());
            ids.add(client.getId());
            assertEquals(32, client.getId().length(), "Id should be 16 bytes of hex");
        }
        assertTrue(await(hub.sync()));

        assertEquals(100, ids.size(), "Client ids should be unique");
        assertEquals(100, hub.clientCount());
        ids.forEach(id -> assertTrue(hub.isRegistered(id)));
        verify(metrics, times(100)).recordConnected();
    }

    @Test
    void testRegisteringSameClientTwiceKeepsOneEntry() throws Exception {
        startHub(config().build());
        Client client = registered(hub, "u1");

        assertTrue(await(hub.register(client)));
        assertEquals(1, hub.clientCount());
    }

    @Test
    void testUnregisterIsIdempotent() throws Exception {
        startHub(config().build());
        Client client = registered(hub, "u1");

        assertTrue(await(hub.unregister(client)), "First unregister removes the client");
        assertFalse(await(hub.unregister(client)), "Second unregister is a no-op");

        assertEquals(0, hub.clientCount());
        assertEquals(ClientState.CLOSED, client.getState());
        assertEquals(CloseReason.SERVER_CLOSED, client.getCloseReason());
        verify(metrics, times(1)).recordDisconnected("SERVER_CLOSED");
    }

    // ═══════════════════════════════════════════════════════════════
    // TOPICS
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testTopicFanOutReachesOnlySubscribers() throws Exception {
        startHub(config().build());
        RecordingTransport t1 = new RecordingTransport();
        RecordingTransport t2 = new RecordingTransport();
        RecordingTransport t3 = new RecordingTransport();
        Client c1 = hub.attach(new Identity("u1", Set.of("staff")), t1);
        Client c2 = hub.attach(new Identity("u2", Set.of("staff")), t2);
        hub.attach(new Identity("u3", Set.of("staff")), t3);

        assertTrue(await(hub.subscribe(c1, "orders.updates")));
        assertTrue(await(hub.subscribe(c2, "orders.updates")));

        String event = "{\"type\":\"order_created\",\"payload\":{\"id\":\"o-1\"}}";
        assertEquals(2, hub.publishToTopic("orders.updates", bytes(event)));

        assertEquals(event, t1.nextText(WAIT_MS));
        assertEquals(event, t2.nextText(WAIT_MS));
        assertNull(t3.nextText(200), "Non-subscriber should receive nothing");
        verify(metrics).recordPublish("TOPIC", 2);
    }

    @Test
    void testPublishToTopicWithoutSubscribersDeliversNothing() {
        startHub(config().build());
        assertEquals(0, hub.publishToTopic("nobody.listens", bytes("{}")));
    }

    @Test
    void testSubscribeUpdatesBothSides() throws Exception {
        startHub(config().build());
        Client client = registered(hub, "u1");

        assertTrue(await(hub.subscribe(client, "orders.updates")));

        assertTrue(client.isSubscribed("orders.updates"));
        assertEquals(Set.of(client.getId()), hub.subscriberIds("orders.updates"));

        assertTrue(await(hub.unsubscribe(client, "orders.updates")));
        assertFalse(client.isSubscribed("orders.updates"));
        assertTrue(hub.subscriberIds("orders.updates").isEmpty());
        assertEquals(0, hub.topicCount(), "Empty topic entries are removed");
    }

    @Test
    void testSubscribeFromUnregisteredClientIsRejected() throws Exception {
        startHub(config().build());
        Client stranger = TestClients.detached(hub, "u1");

        assertFalse(await(hub.subscribe(stranger, "orders.updates")));
        assertTrue(stranger.getTopics().isEmpty());
        assertEquals(0, hub.topicCount());
    }

    @Test
    void testUnsubscribeFromTopicNeverJoinedIsNoOp() throws Exception {
        startHub(config().build());
        Client client = registered(hub, "u1");

        assertFalse(await(hub.unsubscribe(client, "never.joined")));
        assertEquals(0, hub.topicCount());
    }

    @Test
    void testUnregisterRemovesClientFromEveryTopic() throws Exception {
        startHub(config().build());
        RecordingTransport transport = new RecordingTransport();
        Client client = hub.attach(new Identity("u1", Set.of("customer")), transport);
        Client other = registered(hub, "u2");

        for (String topic : List.of("a", "b", "c")) {
            assertTrue(await(hub.subscribe(client, topic)));
        }
        assertTrue(await(hub.subscribe(other, "a")));

        assertTrue(await(hub.unregister(client)));

        assertTrue(client.getTopics().isEmpty());
        assertEquals(Set.of(other.getId()), hub.subscriberIds("a"));
        assertTrue(hub.subscriberIds("b").isEmpty());
        assertTrue(hub.subscriberIds("c").isEmpty());
        assertEquals(1, hub.topicCount());

        assertTrue(transport.awaitClosed(WAIT_MS), "Write loop should release the transport");
        assertEquals(1, transport.closeFrames(), "Closed queue should produce a close frame");
    }

    @Test
    void testMembershipSymmetryUnderConcurrentRequests() throws Exception {
        startHub(config().build());
        List<Client> clients = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            clients.add(registered(hub, "user" + i));
        }
        List<String> topics = List.of("t0", "t1", "t2", "t3", "t4");

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                long seed = worker;
                tasks.add(pool.submit(() -> {
                    Random random = new Random(seed);
                    for (int i = 0; i < 250; i++) {
                        Client client = clients.get(random.nextInt(clients.size()));
                        String topic = topics.get(random.nextInt(topics.size()));
                        if (random.nextBoolean()) {
                            hub.subscribe(client, topic);
                        } else {
                            hub.unsubscribe(client, topic);
                        }
                        hub.publishToTopic(topic, bytes("x"));
                        drainQuietly(client);
                    }
                }));
            }
            hub.unregister(clients.get(0));
            hub.unregister(clients.get(1));
            for (Future<?> task : tasks) {
                task.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertTrue(await(hub.sync()));

        for (String topic : topics) {
            Set<String> expected = new HashSet<>();
            for (Client client : clients) {
                if (client.getTopics().contains(topic)) {
                    expected.add(client.getId());
                }
            }
            assertEquals(expected, hub.subscriberIds(topic), "Index and client view disagree on " + topic);
        }
        assertTrue(clients.get(0).getTopics().isEmpty());
        assertTrue(clients.get(1).getTopics().isEmpty());
    }

    private static void drainQuietly(Client client) {
        try {
            drain(client, 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH SCOPES
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testPublishToUserReachesEveryDevice() throws Exception {
        startHub(config().build());
        Client phone = registered(hub, "u1");
        Client laptop = registered(hub, "u1");
        Client other = registered(hub, "u2");

        assertEquals(2, hub.publishToUser("u1", bytes("hello")));

        assertEquals(List.of("hello"), drain(phone, 0));
        assertEquals(List.of("hello"), drain(laptop, 0));
        assertTrue(drain(other, 0).isEmpty());
        assertEquals(2, hub.clientsForUser("u1").size());
    }

    @Test
    void testPublishToRoleAndAll() throws Exception {
        startHub(config().build());
        Client admin = registered(hub, "a1", "admin", "staff");
        Client customer = registered(hub, "c1", "customer");

        assertEquals(1, hub.publishToRole("admin", bytes("for-admins")));
        assertEquals(2, hub.publishToAll(bytes("for-everyone")));

        assertEquals(List.of("for-admins", "for-everyone"), drain(admin, 0));
        assertEquals(List.of("for-everyone"), drain(customer, 0));
        verify(metrics).recordPublish("ROLE", 1);
        verify(metrics).recordPublish("ALL", 2);
    }

    @Test
    void testPerClientOrderingIsPreserved() throws Exception {
        startHub(config().outboundCapacity(1024).build());
        RecordingTransport transport = new RecordingTransport();
        hub.attach(new Identity("u1", Set.of()), transport);
        assertTrue(await(hub.sync()));

        for (int i = 0; i < 500; i++) {
            assertEquals(1, hub.publishToUser("u1", bytes(Integer.toString(i))));
        }

        List<String> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (received.size() < 500 && System.currentTimeMillis() < deadline) {
            received.addAll(transport.drainMessages());
            Thread.sleep(10);
        }

        assertEquals(500, received.size());
        for (int i = 0; i < 500; i++) {
            assertEquals(Integer.toString(i), received.get(i), "Frames should arrive in publish order");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // BACKPRESSURE
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testSlowConsumerIsEvictedWithoutAffectingOthers() throws Exception {
        startHub(config().outboundCapacity(2).build());
        Client slow = registered(hub, "slow");
        Client healthy = registered(hub, "healthy");
        assertTrue(await(hub.subscribe(slow, "ticker")));
        assertTrue(await(hub.subscribe(healthy, "ticker")));

        int[] delivered = new int[5];
        List<String> healthyReceived = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            delivered[i] = hub.publishToTopic("ticker", bytes("m" + i));
            healthyReceived.addAll(drain(healthy, 0));
        }

        assertArrayEquals(new int[]{2, 2, 1, 1, 1}, delivered);
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), healthyReceived);

        assertTrue(await(hub.sync()));
        assertFalse(hub.isRegistered(slow.getId()));
        assertEquals(ClientState.CLOSED, slow.getState());
        assertEquals(CloseReason.SLOW_CONSUMER, slow.getCloseReason());
        assertTrue(slow.outbound().isClosed());
        assertEquals(Set.of(healthy.getId()), hub.subscriberIds("ticker"));
        verify(metrics, times(1)).recordSlowConsumer();
        verify(metrics).recordDisconnected("SLOW_CONSUMER");
    }

    @Test
    void testSweepRetriesEvictionDroppedByFullRequestQueue() throws Exception {
        CountDownLatch handlerEntered = new CountDownLatch(1);
        CountDownLatch releaseHandler = new CountDownLatch(1);
        startHub(config()
            .requestQueueCapacity(1)
            .outboundCapacity(1)
            .inactivityTimeout(Duration.ofMinutes(10))
            .build(), SubscriptionPolicy.permitAll(), (client, envelope) -> {
                handlerEntered.countDown();
                releaseHandler.await(WAIT_MS, TimeUnit.MILLISECONDS);
            });
        Client slow = registered(hub, "slow");

        // Park the loop inside the handler and take the only request slot
        hub.dispatch(slow, new Envelope("chat", null, null));
        assertTrue(handlerEntered.await(WAIT_MS, TimeUnit.MILLISECONDS));
        CompletableFuture<Boolean> slotTaken = hub.sync();

        assertEquals(1, hub.publishToAll(bytes("m0")));
        assertEquals(0, hub.publishToAll(bytes("m1")));
        assertEquals(CloseReason.SLOW_CONSUMER, slow.getCloseReason());
        verify(metrics).recordRequestRejected();

        releaseHandler.countDown();
        assertTrue(await(slotTaken));
        assertTrue(hub.isRegistered(slow.getId()), "Dropped unregistration leaves the client registered");

        // Pongs from a closing client must not keep it looking alive
        Instant before = slow.getLastActivity();
        Thread.sleep(20);
        slow.onPong();
        assertEquals(before, slow.getLastActivity());

        assertEquals(1, hub.sweepInactive());
        assertTrue(await(hub.sync()));

        assertFalse(hub.isRegistered(slow.getId()));
        assertEquals(ClientState.CLOSED, slow.getState());
        assertEquals(CloseReason.SLOW_CONSUMER, slow.getCloseReason());
        assertTrue(slow.outbound().isClosed());
        verify(metrics).recordDisconnected("SLOW_CONSUMER");
    }

    @Test
    void testFullRequestQueueRejectsWithoutBlocking() throws Exception {
        hub = new Hub(config().requestQueueCapacity(1).build(), SubscriptionPolicy.permitAll(),
            FallbackHandler.noop(), metrics);
        Client first = TestClients.detached(hub, "u1");
        Client second = TestClients.detached(hub, "u2");

        CompletableFuture<Boolean> accepted = hub.register(first);
        CompletableFuture<Boolean> rejected = hub.register(second);

        assertTrue(rejected.isDone(), "Rejected request completes immediately");
        assertFalse(rejected.get());
        verify(metrics).recordRequestRejected();

        hub.start();
        assertTrue(await(accepted));
        assertTrue(hub.isRegistered(first.getId()));
        assertFalse(hub.isRegistered(second.getId()));
    }

    // ═══════════════════════════════════════════════════════════════
    // LIVENESS
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testSweepEvictsOnlyInactiveClients() throws Exception {
        startHub(config().inactivityTimeout(Duration.ofMillis(100)).build());
        Client stale = registered(hub, "stale");
        Thread.sleep(250);
        Client fresh = registered(hub, "fresh");

        assertEquals(1, hub.sweepInactive());
        assertTrue(await(hub.sync()));

        assertFalse(hub.isRegistered(stale.getId()));
        assertEquals(CloseReason.INACTIVE, stale.getCloseReason());
        assertTrue(hub.isRegistered(fresh.getId()));
        verify(metrics).recordDisconnected("INACTIVE");
    }

    @Test
    void testScheduledSweepRuns() throws Exception {
        startHub(config()
            .cleanupInterval(Duration.ofMillis(50))
            .inactivityTimeout(Duration.ofMillis(100))
            .build());
        Client client = registered(hub, "idle");

        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (hub.clientCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(0, hub.clientCount(), "Idle client should be swept");
        assertEquals(CloseReason.INACTIVE, client.getCloseReason());
    }

    // ═══════════════════════════════════════════════════════════════
    // POLICY & FALLBACK
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testFailingPolicyDenies() throws Exception {
        startHub(config().build(), (client, topic) -> {
            throw new IllegalStateException("policy store unavailable");
        }, FallbackHandler.noop());
        Client client = registered(hub, "u1");

        assertFalse(hub.canSubscribe(client, "orders.updates"));
    }

    @Test
    void testFallbackHandlerReceivesEnvelope() throws Exception {
        AtomicReference<Envelope> seen = new AtomicReference<>();
        CountDownLatch handled = new CountDownLatch(1);
        startHub(config().build(), SubscriptionPolicy.permitAll(), (client, envelope) -> {
            seen.set(envelope);
            handled.countDown();
        });
        Client client = registered(hub, "u1");

        Envelope chat = new Envelope("chat", null, null);
        assertTrue(await(hub.dispatch(client, chat)));
        assertTrue(handled.await(WAIT_MS, TimeUnit.MILLISECONDS));
        assertEquals(chat, seen.get());
    }

    @Test
    void testFallbackHandlerFailureDoesNotStopLoop() throws Exception {
        startHub(config().build(), SubscriptionPolicy.permitAll(), (client, envelope) -> {
            throw new IllegalArgumentException("bad payload");
        });
        Client client = registered(hub, "u1");

        assertTrue(await(hub.dispatch(client, new Envelope("chat", null, null))));
        assertTrue(await(hub.subscribe(client, "still.works")));
        assertEquals(ClientState.ACTIVE, client.getState());
    }

    // ═══════════════════════════════════════════════════════════════
    // SHUTDOWN
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testCloseUnregistersEveryClient() throws Exception {
        startHub(config().build());
        List<RecordingTransport> transports = new ArrayList<>();
        List<Client> clients = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            RecordingTransport transport = new RecordingTransport();
            transports.add(transport);
            clients.add(hub.attach(new Identity("u" + i, Set.of()), transport));
        }
        assertTrue(await(hub.sync()));

        hub.close();

        assertEquals(0, hub.clientCount());
        for (Client client : clients) {
            assertEquals(ClientState.CLOSED, client.getState());
            assertEquals(CloseReason.SHUTDOWN, client.getCloseReason());
        }
        for (RecordingTransport transport : transports) {
            assertTrue(transport.awaitClosed(WAIT_MS));
        }
        verify(metrics, atLeastOnce()).recordDisconnected("SHUTDOWN");

        assertThrows(IllegalStateException.class,
            () -> hub.attach(new Identity("late", Set.of()), new RecordingTransport()));
        assertFalse(hub.sync().get(), "Requests after close complete false");
    }
}
