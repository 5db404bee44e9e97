package aforo.pricing.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
@Slf4j
public class PricingEventPublisher {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void publish(PricingLifecycleEvent.Type type, Long organizationId, String serviceName, String pricingVersion) {
        PricingLifecycleEvent event = PricingLifecycleEvent.builder()
                .type(type)
                .organizationId(organizationId)
                .serviceName(serviceName)
                .pricingVersion(pricingVersion)
                .occurredAt(clock.instant())
                .build();
        try {
            eventPublisher.publishEvent(event);
            log.info("📣 {} published for service {} {}", type.getCode(), serviceName,
                    pricingVersion != null ? pricingVersion : "");
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to publish {} for service {}: {}", type.getCode(), serviceName, e.getMessage());
        }
    }
}
