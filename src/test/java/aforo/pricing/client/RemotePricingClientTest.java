package aforo.pricing.client;

import aforo.pricing.exception.RemoteFetchException;
import aforo.pricing.exception.RemoteFetchTimeoutException;
import aforo.pricing.util.JwtTokenGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RemotePricingClientTest {

    private static final String URL = "https://pricings.example.com/zoom.yml";

    private JwtTokenGenerator jwtTokenGenerator;

    @BeforeEach
    void setUp() {
        jwtTokenGenerator = new JwtTokenGenerator("0123456789abcdef0123456789abcdef", "aforo-pricing",
                Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldSendOrganizationAndServiceToken() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, "text/yaml")
                            .body("saasName: Zoom")
                            .build());
                })
                .build();
        RemotePricingClient client = new RemotePricingClient(webClient, jwtTokenGenerator, 5000);

        StepVerifier.create(client.fetchPricingYaml(URL, 7L))
                .expectNext("saasName: Zoom")
                .verifyComplete();

        assertEquals("7", captured.get().headers().getFirst("X-Organization-Id"));
        assertTrue(captured.get().headers().getFirst(HttpHeaders.AUTHORIZATION).startsWith("Bearer "));
    }

    @Test
    void shouldFailWithTimeoutWhenHostDoesNotAnswer() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.never())
                .build();
        RemotePricingClient client = new RemotePricingClient(webClient, jwtTokenGenerator, 50);

        StepVerifier.create(client.fetchPricingYaml(URL, 7L))
                .expectError(RemoteFetchTimeoutException.class)
                .verify();
    }

    @Test
    void shouldMapErrorStatus() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build()))
                .build();
        RemotePricingClient client = new RemotePricingClient(webClient, jwtTokenGenerator, 5000);

        StepVerifier.create(client.fetchPricingYaml(URL, 7L))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(RemoteFetchException.class, e);
                    assertTrue(e.getMessage().contains("404"));
                    assertEquals(URL, ((RemoteFetchException) e).getUrl());
                })
                .verify();
    }

    @Test
    void shouldRejectEmptyDocument() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()))
                .build();
        RemotePricingClient client = new RemotePricingClient(webClient, jwtTokenGenerator, 5000);

        StepVerifier.create(client.fetchPricingYaml(URL, 7L))
                .expectError(RemoteFetchException.class)
                .verify();
    }
}
