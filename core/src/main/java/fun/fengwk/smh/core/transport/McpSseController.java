package fun.fengwk.smh.core.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP surface of the SSE transport.
 *
 * @author fengwk
 */
@Slf4j
@RestController
public class McpSseController {

    private final SseServerTransportProvider transportProvider;

    public McpSseController(SseServerTransportProvider transportProvider) {
        this.transportProvider = transportProvider;
    }

    @GetMapping(path = "${smh.transport.sse-path:/sse}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> openStream() {
        try {
            return ResponseEntity.ok(transportProvider.openStream());
        } catch (IllegalStateException ex) {
            log.warn("SSE connection rejected, error={}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @PostMapping(path = "${smh.transport.message-path:/messages}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> postMessage(
        @RequestParam(name = "session_id", required = false) String sessionId,
        @RequestBody(required = false) String body) {
        if (!StringUtils.hasText(sessionId)) {
            return ResponseEntity.badRequest().body(error("Missing session_id"));
        }
        boolean delivered;
        try {
            delivered = transportProvider.deliverMessage(sessionId, body);
        } catch (IllegalArgumentException ex) {
            log.debug("invalid message rejected, sessionId={}, error={}", sessionId, ex.getMessage());
            return ResponseEntity.badRequest().body(error("Invalid message format"));
        }
        if (!delivered) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("Session not found or expired"));
        }
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("status", "ok");
        return ResponseEntity.ok(ack);
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("active_sessions", transportProvider.activeSessionCount());
        return health;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        return error;
    }

}
