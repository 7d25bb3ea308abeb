package fun.fengwk.smh.core.configuration;

import fun.fengwk.smh.core.service.SearchMcpService;
import fun.fengwk.smh.core.service.catalog.SearchToolCatalog;
import fun.fengwk.smh.core.service.model.SearchToolResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Registers the search tools of the configured catalog variant.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SearchToolSpecificationConfiguration {

    @Bean
    public List<McpServerFeatures.SyncToolSpecification> searchToolSpecifications(SearchToolCatalog searchToolCatalog,
                                                                                 SearchMcpService searchMcpService) {
        List<McpServerFeatures.SyncToolSpecification> specifications = new ArrayList<>();
        for (McpSchema.Tool tool : searchToolCatalog.definitions()) {
            specifications.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(tool)
                .callHandler((exchange, request) -> handleCall(request, searchMcpService))
                .build());
        }
        log.info("search tools registered, variant={}, tools={}", searchToolCatalog.getVariant(),
            specifications.stream().map(spec -> spec.tool().name()).toList());
        return specifications;
    }

    static McpSchema.CallToolResult handleCall(McpSchema.CallToolRequest request, SearchMcpService searchMcpService) {
        SearchToolResult result;
        try {
            Map<String, Object> arguments = request.arguments() == null ? Map.of() : request.arguments();
            result = searchMcpService.invoke(request.name(), arguments);
        } catch (Exception ex) {
            log.warn("search tool call failed, tool={}, error={}", request.name(), ex.getMessage(), ex);
            result = SearchToolResult.failure("Error performing search: " + ex.getMessage());
        }
        if (result == null) {
            result = SearchToolResult.failure("Error performing search: empty result");
        }
        return McpSchema.CallToolResult.builder()
            .addTextContent(result.getText())
            .isError(result.isError())
            .build();
    }

}
