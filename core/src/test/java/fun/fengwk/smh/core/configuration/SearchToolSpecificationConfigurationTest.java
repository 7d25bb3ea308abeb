package fun.fengwk.smh.core.configuration;

import fun.fengwk.smh.core.service.SearchMcpService;
import fun.fengwk.smh.core.service.catalog.SearchToolCatalog;
import fun.fengwk.smh.core.service.catalog.SearchToolProperties;
import fun.fengwk.smh.core.service.model.SearchToolResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class SearchToolSpecificationConfigurationTest {

    @Mock
    private SearchMcpService searchMcpService;

    @Test
    public void testRegistersOneSpecificationPerTool() {
        List<McpServerFeatures.SyncToolSpecification> specifications = buildSpecifications();

        assertThat(specifications).extracting(specification -> specification.tool().name())
            .containsExactly("search_text", "search_news", "search_images", "search_videos", "search_books");
    }

    @Test
    public void testReturnsTextContentForSuccess() {
        when(searchMcpService.invoke(eq("search_text"), anyMap())).thenReturn(SearchToolResult.success("[ ]"));

        McpSchema.CallToolResult result = buildSpecifications().get(0).callHandler().apply(
            null,
            new McpSchema.CallToolRequest("search_text", Map.of("query", "java"))
        );

        assertThat(result.isError()).isFalse();
        assertThat(result.content()).hasSize(1);
        assertThat(((McpSchema.TextContent) result.content().get(0)).text()).isEqualTo("[ ]");
    }

    @Test
    public void testMarksErrorResults() {
        when(searchMcpService.invoke(eq("search_news"), anyMap()))
            .thenReturn(SearchToolResult.failure("Error performing search: timeout"));

        McpSchema.CallToolResult result = buildSpecifications().get(1).callHandler().apply(
            null,
            new McpSchema.CallToolRequest("search_news", Map.of("query", "java"))
        );

        assertThat(result.isError()).isTrue();
        assertThat(((McpSchema.TextContent) result.content().get(0)).text()).isEqualTo("Error performing search: timeout");
    }

    @Test
    public void testContainsUnexpectedFailures() {
        when(searchMcpService.invoke(eq("search_text"), anyMap())).thenThrow(new IllegalStateException("boom"));

        McpSchema.CallToolResult result = SearchToolSpecificationConfiguration.handleCall(
            new McpSchema.CallToolRequest("search_text", (Map<String, Object>) null), searchMcpService);

        assertThat(result.isError()).isTrue();
        assertThat(((McpSchema.TextContent) result.content().get(0)).text()).isEqualTo("Error performing search: boom");
    }

    private List<McpServerFeatures.SyncToolSpecification> buildSpecifications() {
        SearchToolCatalog catalog = new SearchToolCatalog(new SearchToolProperties());
        return new SearchToolSpecificationConfiguration().searchToolSpecifications(catalog, searchMcpService);
    }

}
