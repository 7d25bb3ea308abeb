package fun.fengwk.smh.core.facade.search;

import fun.fengwk.smh.core.facade.search.model.SearchCategory;
import fun.fengwk.smh.core.facade.search.model.SearchRequest;

import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
public interface SearchFacade {

    /**
     * Execute search and return ordered result mappings whose fields depend on the category.
     *
     * @throws SearchBackendException when the backend fails
     */
    List<Map<String, Object>> search(SearchRequest request);

    /**
     * Whether the backend serves the given category. Probed once per process.
     */
    boolean supports(SearchCategory category);

}
