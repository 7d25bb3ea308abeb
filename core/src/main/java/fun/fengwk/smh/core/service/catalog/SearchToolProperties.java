package fun.fengwk.smh.core.service.catalog;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tool catalog configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "smh.tools")
public class SearchToolProperties {

    /**
     * Published tool set.
     */
    private CatalogVariant variant = CatalogVariant.STANDARD;

    private String defaultRegion = "us-en";

    private String defaultSafesearch = "moderate";

    private int defaultMaxResults = 10;

    private int defaultMaxContentLength = 50000;

}
