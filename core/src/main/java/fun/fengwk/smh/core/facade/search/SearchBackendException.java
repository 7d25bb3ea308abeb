package fun.fengwk.smh.core.facade.search;

/**
 * Raised when the search backend cannot serve a request.
 *
 * @author fengwk
 */
public class SearchBackendException extends RuntimeException {

    public SearchBackendException(String message) {
        super(message);
    }

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
    }

}
