package fun.fengwk.smh.core.service;

import fun.fengwk.smh.core.service.model.SearchToolResult;

import java.util.Map;

/**
 * @author fengwk
 */
public interface SearchMcpService {

    /**
     * Run a catalog tool. Never throws, failures come back as error results.
     *
     * @param toolName  tool name
     * @param arguments raw tool arguments, may be null
     * @return pretty printed json results or an error text
     */
    SearchToolResult invoke(String toolName, Map<String, Object> arguments);

}
