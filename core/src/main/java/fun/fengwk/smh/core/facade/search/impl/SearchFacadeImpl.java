package fun.fengwk.smh.core.facade.search.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.smh.core.facade.search.SearchBackendException;
import fun.fengwk.smh.core.facade.search.SearchFacade;
import fun.fengwk.smh.core.facade.search.model.SearchCategory;
import fun.fengwk.smh.core.facade.search.model.SearchRequest;
import fun.fengwk.smh.core.facade.search.searxng.SearxngClient;
import fun.fengwk.smh.core.facade.search.searxng.SearxngClientResponse;
import fun.fengwk.smh.core.facade.search.searxng.SearxngProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SearXNG backed search facade producing per-category result mappings.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SearchFacadeImpl implements SearchFacade {

    /**
     * Default max number of results to return.
     */
    private static final int DEFAULT_LIMIT = 10;

    /**
     * Categories assumed present when the config probe fails.
     */
    private static final Set<String> DEFAULT_CATEGORIES = Set.of("general", "news", "images", "videos");

    private static final Set<String> DEFAULT_BACKENDS = Set.of("auto", "html", "lite");

    private final SearxngClient searxngClient;
    private final SearxngProperties searxngProperties;
    private final ObjectMapper objectMapper;

    private volatile Set<String> availableCategories;

    public SearchFacadeImpl(SearxngClient searxngClient, SearxngProperties searxngProperties, ObjectMapper objectMapper) {
        this.searxngClient = searxngClient;
        this.searxngProperties = searxngProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Map<String, Object>> search(SearchRequest request) {
        if (request == null || !StringUtils.hasText(request.getQuery())) {
            throw new IllegalArgumentException("query is blank");
        }
        SearchCategory category = request.getCategory() == null ? SearchCategory.TEXT : request.getCategory();
        int limit = request.getMaxResults() <= 0 ? DEFAULT_LIMIT : request.getMaxResults();
        int maxPages = Math.max(1, searxngProperties.getMaxPages());
        Map<String, String> baseParams = buildParams(request, category);

        List<Map<String, Object>> results = new ArrayList<>();
        Set<String> seenLinks = new HashSet<>();
        for (int page = 1; page <= maxPages && results.size() < limit; page++) {
            Map<String, String> params = new LinkedHashMap<>(baseParams);
            params.put("pageno", String.valueOf(page));

            JsonNode items = execute(params).get("results");
            if (items == null || !items.isArray() || items.isEmpty()) {
                break;
            }
            int before = results.size();
            for (JsonNode itemNode : items) {
                Map<String, Object> item = mapResult(category, itemNode);
                String link = textOrNull(itemNode.get("url"));
                if (item.isEmpty() || (link != null && !seenLinks.add(link))) {
                    continue;
                }
                results.add(item);
                if (results.size() >= limit) {
                    break;
                }
            }
            if (results.size() == before) {
                break;
            }
        }
        return results;
    }

    @Override
    public boolean supports(SearchCategory category) {
        return availableCategories().contains(resolveCategoryName(category));
    }

    private Set<String> availableCategories() {
        Set<String> categories = availableCategories;
        if (categories == null) {
            synchronized (this) {
                categories = availableCategories;
                if (categories == null) {
                    categories = probeCategories();
                    availableCategories = categories;
                }
            }
        }
        return categories;
    }

    private Set<String> probeCategories() {
        SearxngClientResponse response = searxngClient.fetchConfig();
        if (!response.isSuccessful() || !StringUtils.hasText(response.getBody())) {
            log.warn("searxng config probe failed, statusCode={}, error={}",
                response.getStatusCode(), response.hasError() ? response.getError().getMessage() : "");
            return DEFAULT_CATEGORIES;
        }
        try {
            JsonNode categoriesNode = objectMapper.readTree(response.getBody()).get("categories");
            if (categoriesNode == null || !categoriesNode.isArray()) {
                return DEFAULT_CATEGORIES;
            }
            Set<String> categories = new LinkedHashSet<>();
            for (JsonNode node : categoriesNode) {
                categories.add(node.asText().toLowerCase(Locale.ROOT));
            }
            log.info("searxng categories probed: {}", categories);
            return Set.copyOf(categories);
        } catch (JsonProcessingException ex) {
            log.warn("searxng config unparsable, error={}", ex.getMessage());
            return DEFAULT_CATEGORIES;
        }
    }

    private Map<String, String> buildParams(SearchRequest request, SearchCategory category) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", request.getQuery());
        params.put("categories", resolveCategoryName(category));
        params.put("language", toLanguage(request.getRegion()));
        params.put("safesearch", toSafesearchLevel(request.getSafesearch()));
        String timeRange = toTimeRange(request.getTimelimit());
        if (timeRange != null) {
            params.put("time_range", timeRange);
        }
        String backend = request.getBackend();
        if (StringUtils.hasText(backend) && !DEFAULT_BACKENDS.contains(backend.trim().toLowerCase(Locale.ROOT))) {
            params.put("engines", backend.trim());
        }
        return params;
    }

    private JsonNode execute(Map<String, String> params) {
        SearxngClientResponse response = searxngClient.search(params);
        if (response.hasError()) {
            throw new SearchBackendException("search request failed: " + response.getError().getMessage(), response.getError());
        }
        if (!response.isSuccessful()) {
            throw new SearchBackendException("search backend returned status " + response.getStatusCode());
        }
        if (!StringUtils.hasText(response.getBody())) {
            throw new SearchBackendException("empty response body");
        }
        try {
            return objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException ex) {
            throw new SearchBackendException("invalid response body: " + ex.getOriginalMessage(), ex);
        }
    }

    private String resolveCategoryName(SearchCategory category) {
        if (category == SearchCategory.BOOKS && StringUtils.hasText(searxngProperties.getBooksCategory())) {
            return searxngProperties.getBooksCategory().trim().toLowerCase(Locale.ROOT);
        }
        return category.getSearxngCategory();
    }

    private Map<String, Object> mapResult(SearchCategory category, JsonNode node) {
        Map<String, Object> item = new LinkedHashMap<>();
        switch (category) {
            case NEWS -> {
                putIfPresent(item, "date", textOrNull(node.get("publishedDate")));
                putIfPresent(item, "title", textOrNull(node.get("title")));
                putIfPresent(item, "body", textOrNull(node.get("content")));
                putIfPresent(item, "url", textOrNull(node.get("url")));
                putIfPresent(item, "image", firstText(node, "img_src", "thumbnail"));
                putIfPresent(item, "source", firstText(node, "source", "engine"));
            }
            case IMAGES -> {
                putIfPresent(item, "title", textOrNull(node.get("title")));
                putIfPresent(item, "image", textOrNull(node.get("img_src")));
                putIfPresent(item, "thumbnail", firstText(node, "thumbnail_src", "thumbnail"));
                putIfPresent(item, "url", textOrNull(node.get("url")));
                int[] resolution = parseResolution(textOrNull(node.get("resolution")));
                if (resolution != null) {
                    item.put("height", resolution[1]);
                    item.put("width", resolution[0]);
                }
                putIfPresent(item, "source", firstText(node, "source", "engine"));
            }
            case VIDEOS -> {
                putIfPresent(item, "title", textOrNull(node.get("title")));
                putIfPresent(item, "content", textOrNull(node.get("url")));
                putIfPresent(item, "description", textOrNull(node.get("content")));
                putIfPresent(item, "duration", textOrNull(node.get("length")));
                putIfPresent(item, "embed_url", textOrNull(node.get("iframe_src")));
                putIfPresent(item, "images", firstText(node, "thumbnail", "img_src"));
                putIfPresent(item, "publisher", textOrNull(node.get("author")));
                putIfPresent(item, "published", textOrNull(node.get("publishedDate")));
                putIfPresent(item, "provider", textOrNull(node.get("engine")));
            }
            case BOOKS -> {
                putIfPresent(item, "title", textOrNull(node.get("title")));
                putIfPresent(item, "author", joinText(node.get("authors")));
                putIfPresent(item, "publisher", textOrNull(node.get("publisher")));
                putIfPresent(item, "info", textOrNull(node.get("content")));
                putIfPresent(item, "url", textOrNull(node.get("url")));
                putIfPresent(item, "thumbnail", firstText(node, "thumbnail", "img_src"));
            }
            default -> {
                putIfPresent(item, "title", textOrNull(node.get("title")));
                putIfPresent(item, "href", textOrNull(node.get("url")));
                putIfPresent(item, "body", textOrNull(node.get("content")));
            }
        }
        return item;
    }

    static String toLanguage(String region) {
        if (!StringUtils.hasText(region)) {
            return "all";
        }
        String normalized = region.trim().toLowerCase(Locale.ROOT);
        if ("wt-wt".equals(normalized)) {
            return "all";
        }
        int dash = normalized.indexOf('-');
        if (dash <= 0 || dash == normalized.length() - 1) {
            return normalized;
        }
        String country = normalized.substring(0, dash);
        String language = normalized.substring(dash + 1);
        if ("uk".equals(country)) {
            country = "gb";
        }
        return language + "-" + country.toUpperCase(Locale.ROOT);
    }

    static String toSafesearchLevel(String safesearch) {
        if (safesearch == null) {
            return "1";
        }
        return switch (safesearch.trim().toLowerCase(Locale.ROOT)) {
            case "off" -> "0";
            case "on" -> "2";
            default -> "1";
        };
    }

    static String toTimeRange(String timelimit) {
        if (!StringUtils.hasText(timelimit)) {
            return null;
        }
        return switch (timelimit.trim().toLowerCase(Locale.ROOT)) {
            case "d" -> "day";
            case "w" -> "week";
            case "m" -> "month";
            case "y" -> "year";
            default -> null;
        };
    }

    private static int[] parseResolution(String resolution) {
        if (!StringUtils.hasText(resolution)) {
            return null;
        }
        String[] parts = resolution.toLowerCase(Locale.ROOT).replace(" ", "").split("[x×]");
        if (parts.length != 2) {
            return null;
        }
        try {
            return new int[] {Integer.parseInt(parts[0]), Integer.parseInt(parts[1])};
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static void putIfPresent(Map<String, Object> item, String key, String value) {
        if (StringUtils.hasText(value)) {
            item.put(key, value);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = textOrNull(node.get(field));
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private static String joinText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            return node.asText();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (StringUtils.hasText(element.asText())) {
                values.add(element.asText());
            }
        }
        return values.isEmpty() ? null : String.join(", ", values);
    }

    /**
     * Extract string value from JSON node.
     */
    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

}
