package aforo.pricing.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(
            @Value("${aforo.pricing.remote.timeout-ms:5000}") int timeoutMs,
            @Value("${aforo.pricing.remote.max-in-memory-size:5242880}") int maxInMemorySize) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer
                                .defaultCodecs()
                                .maxInMemorySize(maxInMemorySize))
                        .build());
    }

    /**
     * Client for pricing documents hosted by customers. Those hosts frequently use
     * self-signed certificates, so certificate validation can be turned off.
     */
    @Bean(name = "pricingWebClient")
    public WebClient pricingWebClient(
            @Value("${aforo.pricing.remote.timeout-ms:5000}") int timeoutMs,
            @Value("${aforo.pricing.remote.max-in-memory-size:5242880}") int maxInMemorySize,
            @Value("${aforo.pricing.remote.trust-all-certificates:true}") boolean trustAllCertificates) throws SSLException {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
                .followRedirect(true);
        if (trustAllCertificates) {
            SslContext sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
            httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
        }

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer
                                .defaultCodecs()
                                .maxInMemorySize(maxInMemorySize))
                        .build())
                .build();
    }

    @Bean(name = "eventWebhookWebClient")
    public WebClient eventWebhookWebClient(
            WebClient.Builder builder,
            @Value("${aforo.events.webhook.base-url:http://localhost:8096}") String baseUrl) {
        return builder.baseUrl(baseUrl).build();
    }
}
