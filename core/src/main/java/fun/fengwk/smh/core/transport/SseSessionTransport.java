package fun.fengwk.smh.core.transport;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCMessage;
import io.modelcontextprotocol.spec.McpServerSession;
import io.modelcontextprotocol.spec.McpServerTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One SSE stream plus the POSTs correlated to it, exposed to the MCP session as a single duplex channel.
 *
 * <p>Inbound messages are serialized through a unicast sink. Outbound events are written under a per
 * transport lock. Any fault moves the transport to {@link TransportState#CLOSED} exactly once.
 *
 * @author fengwk
 */
@Slf4j
public class SseSessionTransport implements McpServerTransport {

    static final String ENDPOINT_EVENT = "endpoint";
    static final String MESSAGE_EVENT = "message";

    private static final Duration EMIT_TIMEOUT = Duration.ofSeconds(1);

    private final String sessionId;
    private final SseEmitter emitter;
    private final McpJsonMapper jsonMapper;
    private final Consumer<String> onClosed;

    private final AtomicReference<TransportState> state = new AtomicReference<>(TransportState.CONNECTING);
    private final Sinks.Many<JSONRPCMessage> inboundSink = Sinks.many().unicast().onBackpressureBuffer();
    private final Object writeLock = new Object();

    private volatile McpServerSession session;
    private volatile Disposable inboundSubscription;

    /**
     * @param sessionId registry id of this transport
     * @param emitter   stream owned by this transport
     * @param jsonMapper json codec
     * @param onClosed  called with the session id once the transport has closed
     */
    public SseSessionTransport(String sessionId, SseEmitter emitter, McpJsonMapper jsonMapper, Consumer<String> onClosed) {
        this.sessionId = sessionId;
        this.emitter = emitter;
        this.jsonMapper = jsonMapper;
        this.onClosed = onClosed;

        emitter.onCompletion(() -> terminate("stream completed"));
        emitter.onTimeout(() -> terminate("stream timeout"));
        emitter.onError(ex -> terminate("stream error: " + ex.getMessage()));
    }

    public String getSessionId() {
        return sessionId;
    }

    public TransportState getState() {
        return state.get();
    }

    public McpServerSession getSession() {
        return session;
    }

    /**
     * Attach the protocol session and start draining inbound messages into it.
     */
    void bind(McpServerSession session) {
        this.session = session;
        this.inboundSubscription = inboundSink.asFlux()
            .flatMap(session::handle)
            .subscribe(
                ignored -> {
                },
                ex -> {
                    log.warn("inbound channel failed, sessionId={}, error={}", sessionId, ex.getMessage());
                    terminate("inbound fault");
                });
    }

    /**
     * Announce the message endpoint and move to {@link TransportState#OPEN}.
     *
     * @return false when the stream is already gone
     */
    boolean open(String messageEndpoint) {
        if (!state.compareAndSet(TransportState.CONNECTING, TransportState.OPEN)) {
            return false;
        }
        try {
            synchronized (writeLock) {
                emitter.send(SseEmitter.event().name(ENDPOINT_EVENT).data(messageEndpoint));
            }
            log.info("SSE connection opened, sessionId={}", sessionId);
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.debug("endpoint event write failed, sessionId={}, error={}", sessionId, ex.getMessage());
            terminate("endpoint write failure");
            return false;
        }
    }

    /**
     * Push one posted JSON-RPC message into the session.
     *
     * @return false when the transport is not open
     * @throws IllegalArgumentException when the body is not a JSON-RPC message
     */
    public boolean deliver(String body) {
        if (state.get() != TransportState.OPEN) {
            return false;
        }
        if (!StringUtils.hasText(body)) {
            throw new IllegalArgumentException("empty message body");
        }
        JSONRPCMessage message;
        try {
            message = McpSchema.deserializeJsonRpcMessage(jsonMapper, body);
        } catch (Exception ex) {
            throw new IllegalArgumentException("invalid message: " + ex.getMessage(), ex);
        }
        try {
            inboundSink.emitNext(message, Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT));
            return true;
        } catch (Sinks.EmissionException ex) {
            log.debug("inbound message dropped, sessionId={}, reason={}", sessionId, ex.getReason());
            return false;
        }
    }

    /**
     * Write a ping comment. A failed write closes the transport.
     */
    boolean ping() {
        if (state.get() != TransportState.OPEN) {
            return false;
        }
        try {
            synchronized (writeLock) {
                emitter.send(SseEmitter.event().comment("ping"));
            }
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.debug("keep-alive write failed, sessionId={}, error={}", sessionId, ex.getMessage());
            terminate("keep-alive failure");
            return false;
        }
    }

    @Override
    public Mono<Void> sendMessage(JSONRPCMessage message) {
        return Mono.fromRunnable(() -> write(message));
    }

    private void write(JSONRPCMessage message) {
        if (state.get() != TransportState.OPEN) {
            log.debug("outbound message dropped, sessionId={}, state={}", sessionId, state.get());
            return;
        }
        try {
            String json = jsonMapper.writeValueAsString(message);
            synchronized (writeLock) {
                emitter.send(SseEmitter.event().name(MESSAGE_EVENT).data(json));
            }
        } catch (IOException | IllegalStateException ex) {
            log.debug("outbound write failed, sessionId={}, error={}", sessionId, ex.getMessage());
            terminate("write failure");
        }
    }

    @Override
    public <T> T unmarshalFrom(Object data, TypeRef<T> typeRef) {
        return jsonMapper.convertValue(data, typeRef);
    }

    @Override
    public Mono<Void> closeGracefully() {
        return Mono.fromRunnable(() -> terminate("graceful close"));
    }

    @Override
    public void close() {
        terminate("closed");
    }

    /**
     * Move to {@link TransportState#CLOSED}. Only the first call has an effect.
     */
    void terminate(String reason) {
        TransportState current = state.get();
        while (current == TransportState.CONNECTING || current == TransportState.OPEN) {
            if (state.compareAndSet(current, TransportState.CLOSING)) {
                break;
            }
            current = state.get();
        }
        if (current == TransportState.CLOSING || current == TransportState.CLOSED) {
            return;
        }

        try {
            inboundSink.tryEmitComplete();
            McpServerSession currentSession = session;
            if (currentSession != null) {
                // re-enters close(), which returns early since the state is CLOSING
                currentSession.close();
            }
            Disposable subscription = inboundSubscription;
            if (subscription != null) {
                subscription.dispose();
            }
            try {
                synchronized (writeLock) {
                    emitter.complete();
                }
            } catch (RuntimeException ex) {
                log.debug("stream complete failed, sessionId={}, error={}", sessionId, ex.getMessage());
            }
        } finally {
            onClosed.accept(sessionId);
            state.set(TransportState.CLOSED);
            log.info("Closing SSE connection, sessionId={}, reason={}", sessionId, reason);
        }
    }

}
