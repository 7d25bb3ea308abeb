package fun.fengwk.smh.core.service.catalog;

import io.modelcontextprotocol.spec.McpSchema;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tool definitions published through {@code tools/list} for the configured variant.
 *
 * @author fengwk
 */
@Component
public class SearchToolCatalog {

    public static final List<String> SAFESEARCH_VALUES = List.of("on", "moderate", "off");

    public static final List<String> TIMELIMIT_VALUES = List.of("d", "w", "m", "y");

    public static final List<String> BACKEND_VALUES = List.of(
        "auto", "html", "lite", "bing", "brave", "duckduckgo", "google",
        "grokipedia", "mojeek", "yandex", "yahoo", "wikipedia"
    );

    private static final List<SearchTool> STANDARD_TOOLS = List.of(
        SearchTool.SEARCH_TEXT,
        SearchTool.SEARCH_NEWS,
        SearchTool.SEARCH_IMAGES,
        SearchTool.SEARCH_VIDEOS,
        SearchTool.SEARCH_BOOKS
    );

    private static final List<SearchTool> METASEARCH_TOOLS = List.of(
        SearchTool.SEARCH_TEXT,
        SearchTool.SEARCH_NEWS
    );

    private final SearchToolProperties properties;

    public SearchToolCatalog(SearchToolProperties properties) {
        this.properties = properties;
    }

    public CatalogVariant getVariant() {
        return properties.getVariant() == null ? CatalogVariant.STANDARD : properties.getVariant();
    }

    public List<SearchTool> tools() {
        return getVariant() == CatalogVariant.METASEARCH ? METASEARCH_TOOLS : STANDARD_TOOLS;
    }

    /**
     * Resolve a published tool by name.
     */
    public Optional<SearchTool> find(String toolName) {
        return SearchTool.fromToolName(toolName).filter(tools()::contains);
    }

    /**
     * Whether {@code search_text} publishes the backend selector.
     */
    public boolean hasBackendSelector() {
        return getVariant() == CatalogVariant.METASEARCH;
    }

    public List<McpSchema.Tool> definitions() {
        List<McpSchema.Tool> definitions = new ArrayList<>();
        for (SearchTool tool : tools()) {
            definitions.add(definition(tool));
        }
        return definitions;
    }

    public McpSchema.Tool definition(SearchTool tool) {
        Map<String, Object> schemaProperties = new LinkedHashMap<>();
        schemaProperties.put("query", stringProperty("Search query", null, null));
        if (tool == SearchTool.SEARCH_TEXT && hasBackendSelector()) {
            schemaProperties.put("backend", stringProperty("Search engine backend to use.", BACKEND_VALUES, "auto"));
        }
        schemaProperties.put("region", stringProperty("Region code, e.g. us-en, uk-en", null, properties.getDefaultRegion()));
        schemaProperties.put("safesearch", stringProperty("Safe search level", SAFESEARCH_VALUES, properties.getDefaultSafesearch()));
        schemaProperties.put("timelimit", stringProperty("Time limit: d (day), w (week), m (month), y (year)", TIMELIMIT_VALUES, null));
        schemaProperties.put("max_results", integerProperty("Maximum number of results", properties.getDefaultMaxResults()));
        if (tool == SearchTool.SEARCH_TEXT) {
            schemaProperties.put("fetch_full_content", booleanProperty(
                "If true, fetches and returns the full text content of each result page. "
                    + "This provides complete context but adds latency.", false));
            schemaProperties.put("max_content_length", integerProperty(
                "Maximum characters of content to fetch per page (only used if fetch_full_content is true).",
                properties.getDefaultMaxContentLength()));
        }

        McpSchema.JsonSchema inputSchema = new McpSchema.JsonSchema(
            "object",
            schemaProperties,
            List.of("query"),
            false,
            null,
            null
        );

        return McpSchema.Tool.builder()
            .name(tool.getToolName())
            .description(describe(tool))
            .inputSchema(inputSchema)
            .build();
    }

    private String describe(SearchTool tool) {
        return switch (tool) {
            case SEARCH_TEXT -> hasBackendSelector()
                ? "Perform a metasearch using various backends (DuckDuckGo, Google, Bing, etc.). "
                    + "Use this to find APIs, libraries, developer tools, and general information. "
                    + "Optionally fetch full page content for complete context."
                : "Perform a web search to find APIs, libraries, developer tools, and general information. "
                    + "Optionally fetch full page content for complete context.";
            case SEARCH_NEWS -> "Perform a news search to find the latest updates, releases, or security alerts.";
            case SEARCH_IMAGES -> "Perform an image search to find diagrams, screenshots, logos and other visuals.";
            case SEARCH_VIDEOS -> "Perform a video search to find tutorials, talks and demos.";
            case SEARCH_BOOKS -> "Perform a book search to find technical books, references and publications.";
        };
    }

    private static Map<String, Object> stringProperty(String description, List<String> enumValues, String defaultValue) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "string");
        if (enumValues != null) {
            property.put("enum", enumValues);
        }
        if (defaultValue != null) {
            property.put("default", defaultValue);
        }
        property.put("description", description);
        return property;
    }

    private static Map<String, Object> integerProperty(String description, int defaultValue) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "integer");
        property.put("default", defaultValue);
        property.put("description", description);
        return property;
    }

    private static Map<String, Object> booleanProperty(String description, boolean defaultValue) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "boolean");
        property.put("default", defaultValue);
        property.put("description", description);
        return property;
    }

}
