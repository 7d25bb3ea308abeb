package fun.fengwk.smh.core.service.fetch;

import java.time.Duration;

/**
 * Fetches a page and returns its main text.
 *
 * @author fengwk
 */
public interface PageFetcher {

    /**
     * Fetch a page and extract its main text.
     *
     * @param url       target url
     * @param timeout   request timeout
     * @param maxLength max characters of text to keep
     * @return extracted text, or null when the page could not be fetched or holds no main content
     */
    String fetch(String url, Duration timeout, int maxLength);

}
