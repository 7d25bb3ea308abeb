package fun.fengwk.smh.core.service.enrich;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Full content enrichment configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "smh.enrich")
public class EnrichmentProperties {

    /**
     * Max simultaneous page fetches within one enrichment call.
     */
    private int concurrencyLimit = 5;

    /**
     * Per page request timeout in milliseconds.
     */
    private int fetchTimeoutMs = 10000;

    /**
     * Connect timeout for the shared page fetch client.
     */
    private int connectTimeoutMs = 10000;

    /**
     * Default max characters kept per page.
     */
    private int maxContentLength = 50000;

    /**
     * Max response bytes read per page, the rest of the body is dropped.
     */
    private int maxBodyBytes = 2 * 1024 * 1024;

    /**
     * Max wait for a free fetch slot before the item is given up.
     */
    private long acquireTimeoutMs = 60000;

    /**
     * Extracted text shorter than this is treated as no main content.
     */
    private int minTextLength = 25;

    /**
     * User agent sent with page requests.
     */
    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /**
     * Accept header sent with page requests.
     */
    private String accept = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    /**
     * Accept-Language header sent with page requests.
     */
    private String acceptLanguage = "en-US,en;q=0.5";

}
