package aforo.pricing.exception;

/**
 * Fetching a URL-backed pricing failed (network error or non-2xx status).
 */
public class RemoteFetchException extends PricingEngineException {

    private final String url;

    public RemoteFetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public RemoteFetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
