package fun.fengwk.smh.core.service.model;

import lombok.Builder;
import lombok.Data;

/**
 * Text payload of a tool call.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchToolResult {

    private String text;

    private boolean error;

    public static SearchToolResult success(String text) {
        return SearchToolResult.builder().text(text).error(false).build();
    }

    public static SearchToolResult failure(String text) {
        return SearchToolResult.builder().text(text).error(true).build();
    }

}
