package aforo.pricing.client;

import aforo.pricing.exception.RemoteFetchException;
import aforo.pricing.exception.RemoteFetchTimeoutException;
import aforo.pricing.util.JwtTokenGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Downloads pricing documents hosted at customer URLs.
 */
@Component
@Slf4j
public class RemotePricingClient {

    private final WebClient pricingWebClient;
    private final JwtTokenGenerator jwtTokenGenerator;
    private final Duration timeout;

    public RemotePricingClient(
            @Qualifier("pricingWebClient") WebClient pricingWebClient,
            JwtTokenGenerator jwtTokenGenerator,
            @Value("${aforo.pricing.remote.timeout-ms:5000}") long timeoutMs) {
        this.pricingWebClient = pricingWebClient;
        this.jwtTokenGenerator = jwtTokenGenerator;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    /**
     * Fetches the raw YAML of a pricing. Errors are mapped to {@link RemoteFetchException};
     * the whole exchange is bounded by the configured timeout.
     */
    public Mono<String> fetchPricingYaml(String url, Long organizationId) {
        return Mono.defer(() -> pricingWebClient.get()
                        .uri(url)
                        .accept(MediaType.ALL)
                        .header("X-Organization-Id", String.valueOf(organizationId))
                        .header("Authorization", "Bearer " + jwtTokenGenerator.generateServiceToken(organizationId))
                        .retrieve()
                        .bodyToMono(String.class))
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new RemoteFetchException(url, "Empty pricing document at " + url)))
                .onErrorMap(e -> !(e instanceof RemoteFetchException), e -> translate(url, e))
                .doOnError(e -> log.error("❌ Failed to fetch pricing from {}: {}", url, e.getMessage()));
    }

    private RemoteFetchException translate(String url, Throwable e) {
        if (e instanceof TimeoutException) {
            return new RemoteFetchTimeoutException(url, timeout, e);
        }
        if (e instanceof WebClientResponseException responseException) {
            return new RemoteFetchException(url, "Failed to fetch pricing from URL " + url + ": "
                    + responseException.getStatusCode().value() + " " + responseException.getStatusText(), e);
        }
        return new RemoteFetchException(url, "Failed to fetch pricing from URL " + url + ": " + e.getMessage(), e);
    }
}
