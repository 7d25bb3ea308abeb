package fun.fengwk.smh.core.facade.search.model;

import lombok.Builder;
import lombok.Data;

/**
 * Search request input.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchRequest {

    /**
     * Search keywords with optional engine operators.
     */
    private String query;

    /**
     * Search kind.
     */
    @Builder.Default
    private SearchCategory category = SearchCategory.TEXT;

    /**
     * Region code in country-language form, e.g. us-en, uk-en, wt-wt.
     */
    private String region;

    /**
     * Safesearch level: on/moderate/off.
     */
    private String safesearch;

    /**
     * Time limit code d/w/m/y (empty means no filter).
     */
    private String timelimit;

    /**
     * Max number of results to return.
     */
    private int maxResults;

    /**
     * Engine selector, auto means backend default engines.
     */
    private String backend;

}
