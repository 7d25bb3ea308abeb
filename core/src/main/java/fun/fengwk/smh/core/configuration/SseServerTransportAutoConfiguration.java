package fun.fengwk.smh.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.smh.core.transport.SessionRegistry;
import fun.fengwk.smh.core.transport.SseServerTransportProvider;
import fun.fengwk.smh.core.transport.SseSessionTransport;
import fun.fengwk.smh.core.transport.SseTransportProperties;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.spec.McpServerTransportProviderBase;
import org.springframework.ai.mcp.server.common.autoconfigure.McpServerAutoConfiguration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Replaces the stdio transport with the session multiplexed HTTP + SSE transport.
 *
 * @author fengwk
 */
@AutoConfiguration(before = McpServerAutoConfiguration.class)
@EnableConfigurationProperties(SseTransportProperties.class)
public class SseServerTransportAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SessionRegistry<SseSessionTransport> sseSessionRegistry() {
        return new SessionRegistry<>();
    }

    @Bean
    @ConditionalOnMissingBean(McpServerTransportProviderBase.class)
    public SseServerTransportProvider sseServerTransportProvider(
        @Qualifier("mcpServerObjectMapper") ObjectMapper mcpServerObjectMapper,
        SseTransportProperties sseTransportProperties,
        SessionRegistry<SseSessionTransport> sseSessionRegistry) {
        return new SseServerTransportProvider(
            new JacksonMcpJsonMapper(mcpServerObjectMapper), sseTransportProperties, sseSessionRegistry);
    }

}
