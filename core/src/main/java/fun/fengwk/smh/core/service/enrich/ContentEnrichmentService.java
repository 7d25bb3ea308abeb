package fun.fengwk.smh.core.service.enrich;

import java.util.List;
import java.util.Map;

/**
 * Attaches the full page text to search results.
 *
 * @author fengwk
 */
public interface ContentEnrichmentService {

    String FULL_CONTENT_KEY = "full_content";

    String EXTRACTION_FAILED = "[Content extraction failed or blocked]";

    /**
     * Fetch every result page under a concurrency ceiling.
     *
     * <p>The returned list has the same size and order as {@code results}. Each item is a copy of the
     * input item plus {@link #FULL_CONTENT_KEY}, holding the page text or {@link #EXTRACTION_FAILED}.
     * The input list and its maps are left untouched.
     *
     * @param results          search results
     * @param concurrencyLimit max fetches in flight, non-positive falls back to the configured limit
     * @param maxLength        max characters kept per page, non-positive falls back to the configured length
     * @return enriched copies in input order
     */
    List<Map<String, Object>> enrich(List<Map<String, Object>> results, int concurrencyLimit, int maxLength);

}
