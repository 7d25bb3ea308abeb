package fun.fengwk.smh.core.transport;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.spec.McpServerSession;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import io.modelcontextprotocol.spec.ProtocolVersions;
import io.modelcontextprotocol.util.Assert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session multiplexed HTTP + SSE transport provider for MCP server.
 *
 * <p>Each {@code GET} on the stream path opens one {@link SseSessionTransport} registered in the
 * {@link SessionRegistry}. Client messages are posted with the registry id and routed to that transport.
 *
 * @author fengwk
 */
@Slf4j
public class SseServerTransportProvider implements McpServerTransportProvider {

    private final McpJsonMapper jsonMapper;
    private final SseTransportProperties properties;
    private final SessionRegistry<SseSessionTransport> sessionRegistry;
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final ScheduledExecutorService keepAliveScheduler;

    private volatile McpServerSession.Factory sessionFactory;

    public SseServerTransportProvider(McpJsonMapper jsonMapper,
                                      SseTransportProperties properties,
                                      SessionRegistry<SseSessionTransport> sessionRegistry) {
        Assert.notNull(jsonMapper, "The JsonMapper can not be null");
        Assert.notNull(properties, "The SseTransportProperties can not be null");
        Assert.notNull(sessionRegistry, "The SessionRegistry can not be null");

        this.jsonMapper = jsonMapper;
        this.properties = properties;
        this.sessionRegistry = sessionRegistry;

        long interval = properties.getKeepAliveIntervalMs();
        if (interval > 0) {
            this.keepAliveScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "smh-sse-keepalive");
                thread.setDaemon(true);
                return thread;
            });
            this.keepAliveScheduler.scheduleAtFixedRate(this::sendKeepAlive, interval, interval, TimeUnit.MILLISECONDS);
        } else {
            this.keepAliveScheduler = null;
        }
    }

    @Override
    public List<String> protocolVersions() {
        return List.of(ProtocolVersions.MCP_2024_11_05);
    }

    @Override
    public void setSessionFactory(McpServerSession.Factory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    /**
     * Open a new session stream.
     *
     * @return emitter whose first event is the message endpoint
     * @throws IllegalStateException when the server is shutting down or not initialized
     */
    public SseEmitter openStream() {
        if (closing.get()) {
            throw new IllegalStateException("server is shutting down");
        }
        McpServerSession.Factory factory = sessionFactory;
        if (factory == null) {
            throw new IllegalStateException("session factory is not set");
        }

        SseEmitter emitter = new SseEmitter(properties.getStreamTimeoutMs());
        String sessionId = sessionRegistry.create(id -> new SseSessionTransport(id, emitter, jsonMapper, sessionRegistry::remove));
        SseSessionTransport transport = sessionRegistry.get(sessionId)
            .orElseThrow(() -> new IllegalStateException("session vanished during creation: " + sessionId));
        try {
            transport.bind(factory.create(transport));
        } catch (RuntimeException ex) {
            transport.terminate("session creation failure");
            throw ex;
        }
        transport.open(properties.getMessagePath() + "?session_id=" + sessionId);
        return emitter;
    }

    /**
     * Route a posted JSON-RPC message to its session.
     *
     * @return false when the session is unknown or no longer open
     * @throws IllegalArgumentException when the body is not a JSON-RPC message
     */
    public boolean deliverMessage(String sessionId, String body) {
        return sessionRegistry.get(sessionId)
            .map(transport -> transport.deliver(body))
            .orElse(false);
    }

    public int activeSessionCount() {
        return sessionRegistry.size();
    }

    public boolean isClosing() {
        return closing.get();
    }

    @Override
    public Mono<Void> notifyClients(String method, Object params) {
        return Flux.fromIterable(sessionRegistry.handles())
            .filter(transport -> transport.getSession() != null && transport.getState() == TransportState.OPEN)
            .flatMap(transport -> transport.getSession().sendNotification(method, params)
                .doOnError(ex -> log.warn("notification failed, sessionId={}, method={}, error={}",
                    transport.getSessionId(), method, ex.getMessage()))
                .onErrorComplete())
            .then();
    }

    @Override
    public Mono<Void> closeGracefully() {
        return Mono.fromRunnable(() -> {
            if (!closing.compareAndSet(false, true)) {
                return;
            }
            if (keepAliveScheduler != null) {
                keepAliveScheduler.shutdownNow();
            }
            List<SseSessionTransport> transports = sessionRegistry.handles();
            log.info("SSE transport shutting down, activeSessions={}", transports.size());
            for (SseSessionTransport transport : transports) {
                transport.terminate("server shutdown");
            }
            sessionRegistry.clear();
        });
    }

    void sendKeepAlive() {
        for (SseSessionTransport transport : sessionRegistry.handles()) {
            try {
                transport.ping();
            } catch (RuntimeException ex) {
                log.warn("keep-alive failed, sessionId={}, error={}", transport.getSessionId(), ex.getMessage());
            }
        }
    }

}
