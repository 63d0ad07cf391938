package com.ybds.transport.ws;

import com.ybds.auth.Identity;
import com.ybds.infrastructure.metrics.HubMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Registry of live connections and their topic subscriptions, plus the fan-out
 * publish API.
 *
 * Threading:
 * - One loop thread ({@code ws-hub-loop}) applies every registry mutation, in
 *   submission order, under the write lock.
 * - Publishers and queries take the read lock and never block while holding it.
 * - Requests are submitted with a non-blocking offer, never from inside the lock.
 *   Slow consumers found during a publish are evicted after the read lock is released.
 * - One sweep thread ({@code ws-hub-sweep}) evicts clients that went silent.
 * - One pooled writer thread ({@code ws-writer-N}) per client runs its write loop.
 */
public final class Hub implements RealtimePublisher, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Hub.class);
    private static final long SHUTDOWN_WAIT_MS = 5_000;

    static final String SCOPE_TOPIC = "TOPIC";
    static final String SCOPE_ALL = "ALL";
    static final String SCOPE_USER = "USER";
    static final String SCOPE_ROLE = "ROLE";

    private final HubConfig config;
    private final SubscriptionPolicy subscriptionPolicy;
    private final FallbackHandler fallbackHandler;
    private final HubMetrics metrics;

    // Guarded by lock; written only by the loop thread
    private final Map<String, Client> clients = new HashMap<>();
    private final Map<String, Set<String>> topics = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final BlockingQueue<HubRequest> requests;
    private final Thread loopThread;
    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-hub-sweep");
        t.setDaemon(true);
        return t;
    });
    private final AtomicInteger writerSeq = new AtomicInteger();
    private final ExecutorService writers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ws-writer-" + writerSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Hub(HubConfig config) {
        this(config, SubscriptionPolicy.permitAll(), FallbackHandler.noop(), HubMetrics.NOOP);
    }

    public Hub(HubConfig config, SubscriptionPolicy subscriptionPolicy,
               FallbackHandler fallbackHandler, HubMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.subscriptionPolicy = subscriptionPolicy != null ? subscriptionPolicy : SubscriptionPolicy.permitAll();
        this.fallbackHandler = fallbackHandler != null ? fallbackHandler : FallbackHandler.noop();
        this.metrics = metrics != null ? metrics : HubMetrics.NOOP;
        this.requests = new ArrayBlockingQueue<>(config.requestQueueCapacity());
        this.loopThread = new Thread(this::runLoop, "ws-hub-loop");
        this.loopThread.setDaemon(true);
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        loopThread.start();
        long intervalMs = config.cleanupInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::runSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[WsHub] Started (cleanup every {}, inactivity timeout {}, outbound capacity {})",
            config.cleanupInterval(), config.inactivityTimeout(), config.outboundCapacity());
    }

    /**
     * Stop the sweep, unregister every client with {@link CloseReason#SHUTDOWN} and
     * stop the loop and writer threads.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        sweeper.shutdownNow();
        if (started.compareAndSet(false, true)) {
            loopThread.start();
        }

        List<Client> remaining;
        lock.readLock().lock();
        try {
            remaining = new ArrayList<>(clients.values());
        } finally {
            lock.readLock().unlock();
        }
        for (Client client : remaining) {
            client.beginClose(CloseReason.SHUTDOWN);
            enqueue(HubRequest.of(RequestType.UNREGISTER, client));
        }

        awaitQuietly(enqueue(HubRequest.of(RequestType.SYNC, null)));

        loopThread.interrupt();
        try {
            loopThread.join(SHUTDOWN_WAIT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        HubRequest pending;
        while ((pending = requests.poll()) != null) {
            pending.result().complete(false);
        }

        writers.shutdown();
        try {
            if (!writers.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                writers.shutdownNow();
            }
        } catch (InterruptedException e) {
            writers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[WsHub] Stopped ({} clients closed)", remaining.size());
    }

    private void awaitQuietly(CompletableFuture<Boolean> future) {
        try {
            future.get(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[WsHub] Shutdown drain incomplete: {}", e.toString());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECTIONS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Create a client for an authenticated transport, register it and start its write loop.
     */
    public Client attach(Identity identity, Transport transport) {
        if (closed.get()) {
            throw new IllegalStateException("Hub is closed");
        }
        Client client = new Client(identity, this, transport, config);
        register(client).whenComplete((registered, error) -> {
            if (error != null || !Boolean.TRUE.equals(registered)) {
                reject(client);
            }
        });
        writers.execute(client::pumpOutbound);
        return client;
    }

    private void reject(Client client) {
        if (client.beginClose(CloseReason.REJECTED)) {
            log.warn("[WsHub] Registration rejected for client {} (user={})", client.getId(), client.getUserId());
        }
        client.outbound().close();
        client.markClosed();
    }

    public CompletableFuture<Boolean> register(Client client) {
        return submit(HubRequest.of(RequestType.REGISTER, client));
    }

    /**
     * Remove the client from the registry and every topic, close its outbound queue
     * and mark it closed. Completes false when the client was not registered.
     */
    public CompletableFuture<Boolean> unregister(Client client) {
        return submit(HubRequest.of(RequestType.UNREGISTER, client));
    }

    /**
     * Ask the subscription policy. A failing policy denies.
     */
    public boolean canSubscribe(Client client, String topic) {
        try {
            return subscriptionPolicy.authorize(client, topic);
        } catch (RuntimeException e) {
            log.warn("[WsHub] Subscription policy failed for client {} topic {}", client.getId(), topic, e);
            return false;
        }
    }

    public CompletableFuture<Boolean> subscribe(Client client, String topic) {
        return submit(new HubRequest(RequestType.SUBSCRIBE, client, topic, null, new CompletableFuture<>()));
    }

    public CompletableFuture<Boolean> unsubscribe(Client client, String topic) {
        return submit(new HubRequest(RequestType.UNSUBSCRIBE, client, topic, null, new CompletableFuture<>()));
    }

    /**
     * Hand an envelope to the fallback handler on the loop thread. The handler must
     * not block: every registry change waits behind it.
     */
    public CompletableFuture<Boolean> dispatch(Client client, Envelope envelope) {
        return submit(new HubRequest(RequestType.MESSAGE, client, null, envelope, new CompletableFuture<>()));
    }

    /**
     * Completes once every request submitted before it has been applied.
     */
    public CompletableFuture<Boolean> sync() {
        return submit(HubRequest.of(RequestType.SYNC, null));
    }

    /**
     * Evict clients whose last inbound activity is older than the inactivity timeout,
     * and resubmit the unregistration of clients that started closing but are still
     * registered (their first request was dropped by a full request queue).
     *
     * @return number of clients submitted for unregistration
     */
    public int sweepInactive() {
        Instant cutoff = Instant.now().minus(config.inactivityTimeout());
        List<Client> stale = new ArrayList<>();
        List<Client> stuck = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Client client : clients.values()) {
                if (client.isClosing()) {
                    stuck.add(client);
                } else if (client.getLastActivity().isBefore(cutoff)) {
                    stale.add(client);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        for (Client client : stale) {
            if (client.beginClose(CloseReason.INACTIVE)) {
                log.info("[WsHub] Inactive client {} (user={}), last activity {}",
                    client.getId(), client.getUserId(), client.getLastActivity());
            }
            unregister(client);
        }
        for (Client client : stuck) {
            log.warn("[WsHub] Retrying unregistration of client {} (user={}, reason={})",
                client.getId(), client.getUserId(), client.getCloseReason());
            unregister(client);
        }
        int total = stale.size() + stuck.size();
        if (total > 0) {
            log.info("[WsHub] Sweep evicted {} inactive, retried {} closing clients", stale.size(), stuck.size());
        }
        return total;
    }

    private void runSweep() {
        try {
            sweepInactive();
        } catch (RuntimeException e) {
            log.error("[WsHub] Inactivity sweep failed", e);
        }
    }

    /**
     * Start unregistering a client whose outbound queue overflowed.
     */
    void evict(Client client) {
        if (!client.beginClose(CloseReason.SLOW_CONSUMER)) {
            return;
        }
        metrics.recordSlowConsumer();
        log.warn("[WsHub] Slow consumer evicted: client={} user={} queued={}",
            client.getId(), client.getUserId(), client.outbound().size());
        unregister(client);
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    @Override
    public int publishToTopic(String topic, byte[] message) {
        Objects.requireNonNull(message, "message");
        List<Client> slow = new ArrayList<>(0);
        int delivered = 0;
        lock.readLock().lock();
        try {
            Set<String> ids = topics.get(topic);
            if (ids != null) {
                for (String id : ids) {
                    Client client = clients.get(id);
                    if (client != null) {
                        delivered += offer(client, message, slow);
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return settle(SCOPE_TOPIC, delivered, slow);
    }

    @Override
    public int publishToAll(byte[] message) {
        return publishMatching(SCOPE_ALL, message, client -> true);
    }

    @Override
    public int publishToUser(String userId, byte[] message) {
        return publishMatching(SCOPE_USER, message, client -> client.getUserId().equals(userId));
    }

    @Override
    public int publishToRole(String role, byte[] message) {
        return publishMatching(SCOPE_ROLE, message, client -> client.hasRole(role));
    }

    private int publishMatching(String scope, byte[] message, Predicate<Client> target) {
        Objects.requireNonNull(message, "message");
        List<Client> slow = new ArrayList<>(0);
        int delivered = 0;
        lock.readLock().lock();
        try {
            for (Client client : clients.values()) {
                if (target.test(client)) {
                    delivered += offer(client, message, slow);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return settle(scope, delivered, slow);
    }

    private static int offer(Client client, byte[] message, List<Client> slow) {
        if (client.getState() != ClientState.ACTIVE) {
            return 0;
        }
        if (client.outbound().offer(message)) {
            return 1;
        }
        if (!client.outbound().isClosed()) {
            slow.add(client);
        }
        return 0;
    }

    private int settle(String scope, int delivered, List<Client> slow) {
        for (Client client : slow) {
            evict(client);
        }
        metrics.recordPublish(scope, delivered);
        return delivered;
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    public int clientCount() {
        lock.readLock().lock();
        try {
            return clients.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int topicCount() {
        lock.readLock().lock();
        try {
            return topics.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> subscriberIds(String topic) {
        lock.readLock().lock();
        try {
            Set<String> ids = topics.get(topic);
            return ids == null ? Set.of() : Set.copyOf(ids);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(String clientId) {
        lock.readLock().lock();
        try {
            return clients.containsKey(clientId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All live connections of one user.
     */
    public List<Client> clientsForUser(String userId) {
        List<Client> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Client client : clients.values()) {
                if (client.getUserId().equals(userId)) {
                    result.add(client);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    public HubConfig getConfig() {
        return config;
    }

    HubMetrics metrics() {
        return metrics;
    }

    // ═══════════════════════════════════════════════════════════════
    // LOOP
    // ═══════════════════════════════════════════════════════════════

    private CompletableFuture<Boolean> submit(HubRequest request) {
        if (closed.get()) {
            request.result().complete(false);
            return request.result();
        }
        return enqueue(request);
    }

    private CompletableFuture<Boolean> enqueue(HubRequest request) {
        if (!requests.offer(request)) {
            metrics.recordRequestRejected();
            log.warn("[WsHub] Request queue full, dropping {} for client {}",
                request.type(), request.client() != null ? request.client().getId() : "-");
            request.result().complete(false);
        }
        return request.result();
    }

    private void runLoop() {
        log.debug("[WsHub] Loop thread running");
        while (true) {
            HubRequest request;
            try {
                request = requests.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                request.result().complete(apply(request));
            } catch (RuntimeException e) {
                log.error("[WsHub] {} request failed", request.type(), e);
                request.result().completeExceptionally(e);
            }
        }
        log.debug("[WsHub] Loop thread exiting");
    }

    private boolean apply(HubRequest request) {
        return switch (request.type()) {
            case REGISTER -> applyRegister(request.client());
            case UNREGISTER -> applyUnregister(request.client());
            case SUBSCRIBE -> applySubscribe(request.client(), request.topic());
            case UNSUBSCRIBE -> applyUnsubscribe(request.client(), request.topic());
            case MESSAGE -> applyMessage(request.client(), request.envelope());
            case SYNC -> true;
        };
    }

    private boolean applyRegister(Client client) {
        if (client.getState() == ClientState.CLOSED) {
            return false;
        }
        Client previous;
        int total;
        lock.writeLock().lock();
        try {
            previous = clients.put(client.getId(), client);
            if (previous != null && previous != client) {
                detachLocked(previous);
            }
            total = clients.size();
        } finally {
            lock.writeLock().unlock();
        }

        if (previous == client) {
            return true;
        }
        if (previous != null) {
            log.warn("[WsHub] Duplicate client id {}, replacing registration of user {}",
                client.getId(), previous.getUserId());
            previous.beginClose(CloseReason.REJECTED);
            previous.outbound().close();
            previous.markClosed();
            metrics.recordDisconnected(CloseReason.REJECTED.name());
        }
        metrics.recordConnected();
        log.info("[WsHub] Client connected: {} (user={}, roles={}, remote={}, total={})",
            client.getId(), client.getUserId(), client.getRoles(), client.getRemoteAddress(), total);
        return true;
    }

    private boolean applyUnregister(Client client) {
        boolean removed;
        int total;
        lock.writeLock().lock();
        try {
            removed = clients.remove(client.getId(), client);
            if (removed) {
                detachLocked(client);
            }
            total = clients.size();
        } finally {
            lock.writeLock().unlock();
        }

        client.beginClose(CloseReason.SERVER_CLOSED);
        client.outbound().close();
        client.markClosed();

        if (removed) {
            CloseReason reason = client.getCloseReason();
            metrics.recordDisconnected(reason.name());
            log.info("[WsHub] Client disconnected: {} (user={}, reason={}, total={})",
                client.getId(), client.getUserId(), reason, total);
        }
        return removed;
    }

    private void detachLocked(Client client) {
        for (String topic : client.getTopics()) {
            Set<String> members = topics.get(topic);
            if (members != null) {
                members.remove(client.getId());
                if (members.isEmpty()) {
                    topics.remove(topic);
                }
            }
        }
        client.clearTopics();
    }

    private boolean applySubscribe(Client client, String topic) {
        lock.writeLock().lock();
        try {
            if (clients.get(client.getId()) != client) {
                log.debug("[WsHub] Subscribe from unregistered client {} ignored", client.getId());
                return false;
            }
            topics.computeIfAbsent(topic, k -> new HashSet<>()).add(client.getId());
            client.addTopic(topic);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[WsHub] Client {} subscribed to {}", client.getId(), topic);
        return true;
    }

    private boolean applyUnsubscribe(Client client, String topic) {
        boolean removed = false;
        lock.writeLock().lock();
        try {
            Set<String> members = topics.get(topic);
            if (members != null) {
                removed = members.remove(client.getId());
                if (members.isEmpty()) {
                    topics.remove(topic);
                }
            }
            client.removeTopic(topic);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            log.debug("[WsHub] Client {} unsubscribed from {}", client.getId(), topic);
        }
        return removed;
    }

    private boolean applyMessage(Client client, Envelope envelope) {
        if (client.getState() != ClientState.ACTIVE) {
            return false;
        }
        try {
            fallbackHandler.handle(client, envelope);
        } catch (Exception e) {
            log.warn("[WsHub] Message handler failed for client {} (type={})", client.getId(), envelope.type(), e);
        }
        return true;
    }

    enum RequestType {
        REGISTER,
        UNREGISTER,
        SUBSCRIBE,
        UNSUBSCRIBE,
        MESSAGE,
        SYNC
    }

    private record HubRequest(RequestType type, Client client, String topic, Envelope envelope,
                              CompletableFuture<Boolean> result) {
        static HubRequest of(RequestType type, Client client) {
            return new HubRequest(type, client, null, null, new CompletableFuture<>());
        }
    }
}
