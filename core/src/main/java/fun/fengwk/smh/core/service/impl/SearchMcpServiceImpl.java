package fun.fengwk.smh.core.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.smh.core.facade.search.SearchFacade;
import fun.fengwk.smh.core.facade.search.model.SearchCategory;
import fun.fengwk.smh.core.facade.search.model.SearchRequest;
import fun.fengwk.smh.core.service.SearchMcpService;
import fun.fengwk.smh.core.service.catalog.SearchTool;
import fun.fengwk.smh.core.service.catalog.SearchToolCatalog;
import fun.fengwk.smh.core.service.catalog.SearchToolProperties;
import fun.fengwk.smh.core.service.enrich.ContentEnrichmentService;
import fun.fengwk.smh.core.service.enrich.EnrichmentProperties;
import fun.fengwk.smh.core.service.model.SearchToolResult;
import fun.fengwk.smh.core.utils.ArgumentUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * @author fengwk
 */
@Slf4j
@Service
public class SearchMcpServiceImpl implements SearchMcpService {

    static final String BOOKS_UNAVAILABLE = "Error: 'books' search backend not available in this deployment.";

    private final SearchToolCatalog searchToolCatalog;
    private final SearchToolProperties searchToolProperties;
    private final SearchFacade searchFacade;
    private final ContentEnrichmentService contentEnrichmentService;
    private final EnrichmentProperties enrichmentProperties;
    private final ObjectMapper objectMapper;

    public SearchMcpServiceImpl(SearchToolCatalog searchToolCatalog,
                                SearchToolProperties searchToolProperties,
                                SearchFacade searchFacade,
                                ContentEnrichmentService contentEnrichmentService,
                                EnrichmentProperties enrichmentProperties,
                                ObjectMapper objectMapper) {
        this.searchToolCatalog = searchToolCatalog;
        this.searchToolProperties = searchToolProperties;
        this.searchFacade = searchFacade;
        this.contentEnrichmentService = contentEnrichmentService;
        this.enrichmentProperties = enrichmentProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public SearchToolResult invoke(String toolName, Map<String, Object> arguments) {
        Optional<SearchTool> toolOptional = searchToolCatalog.find(toolName);
        if (toolOptional.isEmpty()) {
            log.warn("unknown tool called, tool={}", toolName);
            return SearchToolResult.failure("Unknown tool: " + toolName);
        }
        SearchTool tool = toolOptional.get();
        Map<String, Object> args = arguments == null ? Map.of() : arguments;

        ToolCall call;
        try {
            call = parse(tool, args);
        } catch (IllegalArgumentException ex) {
            return SearchToolResult.failure("Error: " + ex.getMessage());
        }

        if (tool.getCategory() == SearchCategory.BOOKS && !searchFacade.supports(SearchCategory.BOOKS)) {
            return SearchToolResult.failure(BOOKS_UNAVAILABLE);
        }

        long start = System.currentTimeMillis();
        try {
            List<Map<String, Object>> results = searchFacade.search(call.request());
            if (tool == SearchTool.SEARCH_TEXT && call.fetchFullContent() && !results.isEmpty()) {
                results = contentEnrichmentService.enrich(
                    results, enrichmentProperties.getConcurrencyLimit(), call.maxContentLength());
            }
            String payload = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(results);
            log.info("tool call finished, tool={}, results={}, elapsedMs={}",
                tool.getToolName(), results.size(), System.currentTimeMillis() - start);
            return SearchToolResult.success(payload);
        } catch (Exception ex) {
            log.error("tool call failed, tool={}, error={}", tool.getToolName(), ex.getMessage(), ex);
            return SearchToolResult.failure("Error performing search: " + ex.getMessage());
        }
    }

    private ToolCall parse(SearchTool tool, Map<String, Object> args) {
        String query = ArgumentUtils.toString(args.get("query"));
        if (!StringUtils.hasText(query)) {
            throw new IllegalArgumentException("query is required");
        }

        String region = ArgumentUtils.toString(args.get("region"));
        if (!StringUtils.hasText(region)) {
            region = searchToolProperties.getDefaultRegion();
        }

        String safesearch = ArgumentUtils.toString(args.get("safesearch"));
        if (!StringUtils.hasText(safesearch)) {
            safesearch = searchToolProperties.getDefaultSafesearch();
        }
        safesearch = safesearch.trim().toLowerCase(Locale.ROOT);
        if (!SearchToolCatalog.SAFESEARCH_VALUES.contains(safesearch)) {
            throw new IllegalArgumentException("safesearch must be one of " + SearchToolCatalog.SAFESEARCH_VALUES);
        }

        String timelimit = ArgumentUtils.toString(args.get("timelimit"));
        if (StringUtils.hasText(timelimit)) {
            timelimit = timelimit.trim().toLowerCase(Locale.ROOT);
            if (!SearchToolCatalog.TIMELIMIT_VALUES.contains(timelimit)) {
                throw new IllegalArgumentException("timelimit must be one of " + SearchToolCatalog.TIMELIMIT_VALUES);
            }
        } else {
            timelimit = null;
        }

        int maxResults = positive("max_results", ArgumentUtils.toInteger("max_results", args.get("max_results")),
            searchToolProperties.getDefaultMaxResults());

        String backend = null;
        if (tool == SearchTool.SEARCH_TEXT && searchToolCatalog.hasBackendSelector()) {
            backend = ArgumentUtils.toString(args.get("backend"));
            if (StringUtils.hasText(backend)) {
                backend = backend.trim().toLowerCase(Locale.ROOT);
                if (!SearchToolCatalog.BACKEND_VALUES.contains(backend)) {
                    throw new IllegalArgumentException("backend must be one of " + SearchToolCatalog.BACKEND_VALUES);
                }
            } else {
                backend = "auto";
            }
        }

        boolean fetchFullContent = false;
        int maxContentLength = searchToolProperties.getDefaultMaxContentLength();
        if (tool == SearchTool.SEARCH_TEXT) {
            Boolean fetch = ArgumentUtils.toBoolean("fetch_full_content", args.get("fetch_full_content"));
            fetchFullContent = Boolean.TRUE.equals(fetch);
            maxContentLength = positive("max_content_length",
                ArgumentUtils.toInteger("max_content_length", args.get("max_content_length")), maxContentLength);
        }

        SearchRequest request = SearchRequest.builder()
            .query(query.trim())
            .category(tool.getCategory())
            .region(region)
            .safesearch(safesearch)
            .timelimit(timelimit)
            .maxResults(maxResults)
            .backend(backend)
            .build();
        return new ToolCall(request, fetchFullContent, maxContentLength);
    }

    private static int positive(String name, Integer value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private record ToolCall(SearchRequest request, boolean fetchFullContent, int maxContentLength) {
    }

}
