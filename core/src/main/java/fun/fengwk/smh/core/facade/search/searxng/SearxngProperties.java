package fun.fengwk.smh.core.facade.search.searxng;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SearXNG configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "smh.search.searxng")
public class SearxngProperties {

    /**
     * SearXNG base url.
     */
    private String baseUrl = "";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 10000;

    /**
     * Request method: GET/POST.
     */
    private String method = "POST";

    /**
     * Max result pages fetched to fill max_results.
     */
    private int maxPages = 3;

    /**
     * Category name that serves book searches, probed through /config.
     */
    private String booksCategory = "books";

}
