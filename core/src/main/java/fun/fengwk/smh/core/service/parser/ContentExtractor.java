package fun.fengwk.smh.core.service.parser;

/**
 * Extracts the primary readable text of an html document.
 *
 * @author fengwk
 */
public interface ContentExtractor {

    /**
     * @param html full html document
     * @param url  document url used for relative links and domain rules, may be null
     * @return main text, or null when no main content is found
     */
    String extract(String html, String url);

    default String extract(String html) {
        return extract(html, null);
    }

}
