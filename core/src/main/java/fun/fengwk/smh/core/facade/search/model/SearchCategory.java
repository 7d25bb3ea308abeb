package fun.fengwk.smh.core.facade.search.model;

/**
 * Search kinds supported by the facade.
 *
 * @author fengwk
 */
public enum SearchCategory {

    TEXT("general"),
    NEWS("news"),
    IMAGES("images"),
    VIDEOS("videos"),
    BOOKS("books");

    private final String searxngCategory;

    SearchCategory(String searxngCategory) {
        this.searxngCategory = searxngCategory;
    }

    /**
     * Category name understood by SearXNG.
     */
    public String getSearxngCategory() {
        return searxngCategory;
    }

}
