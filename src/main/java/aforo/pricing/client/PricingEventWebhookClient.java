package aforo.pricing.client;

import aforo.pricing.event.PricingLifecycleEvent;
import aforo.pricing.util.JwtTokenGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Forwards pricing lifecycle events to the notification webhook. Best effort, fire and forget.
 */
@Component
@Slf4j
public class PricingEventWebhookClient {

    private final WebClient webClient;
    private final JwtTokenGenerator jwtTokenGenerator;
    private final boolean enabled;

    public PricingEventWebhookClient(
            @Qualifier("eventWebhookWebClient") WebClient webClient,
            JwtTokenGenerator jwtTokenGenerator,
            @Value("${aforo.events.webhook.enabled:false}") boolean enabled) {
        this.webClient = webClient;
        this.jwtTokenGenerator = jwtTokenGenerator;
        this.enabled = enabled;
        log.info("🔗 Pricing event webhook {}", enabled ? "enabled" : "disabled");
    }

    @Async
    @EventListener
    public void onPricingEvent(PricingLifecycleEvent event) {
        if (!enabled) {
            return;
        }
        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("code", event.getType().getCode());
            payload.put("organizationId", event.getOrganizationId());
            payload.put("serviceName", event.getServiceName());
            payload.put("pricingVersion", event.getPricingVersion());
            payload.put("occurredAt", event.getOccurredAt().toString());

            webClient.post()
                    .uri("/api/events/pricing")
                    .header("Authorization", "Bearer " + jwtTokenGenerator.generateServiceToken(event.getOrganizationId()))
                    .bodyValue(payload)
                    .retrieve()
                    .toBodilessEntity()
                    .doOnSuccess(response ->
                            log.info("✅ Event {} delivered for service {}", event.getType().getCode(), event.getServiceName()))
                    .doOnError(error ->
                            log.warn("⚠️ Failed to deliver event {}: {}", event.getType().getCode(), error.getMessage()))
                    .onErrorResume(error -> Mono.empty())
                    .subscribe();

        } catch (RuntimeException e) {
            log.warn("⚠️ Error sending event {} for service {}: {}", event.getType().getCode(), event.getServiceName(), e.getMessage());
        }
    }
}
