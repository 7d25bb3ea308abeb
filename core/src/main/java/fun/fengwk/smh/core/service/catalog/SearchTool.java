package fun.fengwk.smh.core.service.catalog;

import fun.fengwk.smh.core.facade.search.model.SearchCategory;
import lombok.Getter;

import java.util.Optional;

/**
 * @author fengwk
 */
@Getter
public enum SearchTool {

    SEARCH_TEXT("search_text", SearchCategory.TEXT),
    SEARCH_NEWS("search_news", SearchCategory.NEWS),
    SEARCH_IMAGES("search_images", SearchCategory.IMAGES),
    SEARCH_VIDEOS("search_videos", SearchCategory.VIDEOS),
    SEARCH_BOOKS("search_books", SearchCategory.BOOKS),
    ;

    private final String toolName;
    private final SearchCategory category;

    SearchTool(String toolName, SearchCategory category) {
        this.toolName = toolName;
        this.category = category;
    }

    public static Optional<SearchTool> fromToolName(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        for (SearchTool tool : values()) {
            if (tool.toolName.equals(toolName)) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }

}
