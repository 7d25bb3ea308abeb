package fun.fengwk.smh.core.transport;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * HTTP + SSE transport configuration.
 *
 * @author fengwk
 */
@Data
@ConfigurationProperties(prefix = "smh.transport")
public class SseTransportProperties {

    /**
     * Path of the server push stream.
     */
    private String ssePath = "/sse";

    /**
     * Path clients post JSON-RPC messages to.
     */
    private String messagePath = "/messages";

    /**
     * SSE stream timeout in milliseconds, 0 keeps the stream open until closed.
     */
    private long streamTimeoutMs = 0L;

    /**
     * Interval of ping comments on open streams, 0 disables them.
     */
    private long keepAliveIntervalMs = 15000L;

}
