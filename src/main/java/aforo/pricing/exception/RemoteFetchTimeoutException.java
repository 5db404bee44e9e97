package aforo.pricing.exception;

import java.time.Duration;

public class RemoteFetchTimeoutException extends RemoteFetchException {

    public RemoteFetchTimeoutException(String url, Duration timeout, Throwable cause) {
        super(url, "Timeout fetching pricing from URL " + url + " after " + timeout.toMillis() + " ms", cause);
    }
}
