package aforo.pricing.service;

import aforo.pricing.client.dto.PricingDocument;
import aforo.pricing.entity.AddOn;
import aforo.pricing.entity.FeatureDefinition;
import aforo.pricing.entity.Plan;
import aforo.pricing.entity.Pricing;
import aforo.pricing.entity.RenewalPeriod;
import aforo.pricing.entity.UsageLimitDefinition;
import aforo.pricing.exception.ValidationException;
import aforo.pricing.model.FeatureValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a YAML pricing document into a {@link Pricing}, rejecting documents whose plans or
 * add-ons reference features or usage limits missing from the catalog.
 */
@Component
@Slf4j
public class PricingDocumentParser {

    private final YAMLMapper yamlMapper;
    private final Validator validator;

    public PricingDocumentParser(Validator validator) {
        this.validator = validator;
        this.yamlMapper = new YAMLMapper();
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Pricing parse(String yaml, Long organizationId) {
        PricingDocument document;
        try {
            document = yamlMapper.readValue(yaml, PricingDocument.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Pricing document is not valid YAML: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new ValidationException("Pricing document is empty");
        }
        return toPricing(document, organizationId);
    }

    public Pricing toPricing(PricingDocument document, Long organizationId) {
        Set<ConstraintViolation<PricingDocument>> violations = validator.validate(document);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new ValidationException("Invalid pricing document: " + details);
        }

        Map<String, FeatureDefinition> features = new LinkedHashMap<>();
        document.getFeatures().forEach((name, doc) -> features.put(name, toFeature(name, doc)));

        Map<String, UsageLimitDefinition> usageLimits = new LinkedHashMap<>();
        if (document.getUsageLimits() != null) {
            document.getUsageLimits().forEach((name, doc) -> usageLimits.put(name, toUsageLimit(name, doc, features)));
        }

        Map<String, Plan> plans = null;
        if (document.getPlans() != null && !document.getPlans().isEmpty()) {
            plans = new LinkedHashMap<>();
            for (Map.Entry<String, PricingDocument.PlanDoc> e : document.getPlans().entrySet()) {
                plans.put(e.getKey(), toPlan(e.getKey(), e.getValue(), features, usageLimits));
            }
        }

        Map<String, AddOn> addOns = null;
        if (document.getAddOns() != null && !document.getAddOns().isEmpty()) {
            addOns = new LinkedHashMap<>();
            for (Map.Entry<String, PricingDocument.AddOnDoc> e : document.getAddOns().entrySet()) {
                addOns.put(e.getKey(), toAddOn(e.getKey(), e.getValue(), features, usageLimits, plans));
            }
        }

        if (plans == null && addOns == null) {
            throw new ValidationException("Pricing " + document.getSaasName() + " " + document.getVersion()
                    + " must define at least one plan or add-on");
        }

        return Pricing.builder()
                .organizationId(organizationId)
                .serviceName(document.getSaasName().trim())
                .version(document.getVersion().trim())
                .currency(document.getCurrency())
                .createdAt(parseCreatedAt(document.getCreatedAt()))
                .features(features)
                .usageLimits(usageLimits)
                .plans(plans)
                .addOns(addOns)
                .build();
    }

    private FeatureDefinition toFeature(String name, PricingDocument.FeatureDoc doc) {
        FeatureValue.Type type = parseType(doc.getValueType(), "feature " + name);
        return FeatureDefinition.builder()
                .name(name)
                .description(doc.getDescription())
                .valueType(type)
                .defaultValue(typedValue(doc.getDefaultValue(), type, "default value of feature " + name))
                .expression(doc.getExpression())
                .serverExpression(doc.getServerExpression())
                .type(doc.getType())
                .build();
    }

    private UsageLimitDefinition toUsageLimit(String name, PricingDocument.UsageLimitDoc doc,
                                              Map<String, FeatureDefinition> features) {
        FeatureValue.Type type = parseType(doc.getValueType(), "usage limit " + name);
        List<String> linked = doc.getLinkedFeatures() != null ? new ArrayList<>(doc.getLinkedFeatures()) : new ArrayList<>();
        for (String feature : linked) {
            if (!features.containsKey(feature)) {
                throw new ValidationException("Usage limit " + name + " is linked to unknown feature " + feature);
            }
        }
        RenewalPeriod period = null;
        if (doc.getPeriod() != null) {
            if (doc.getPeriod().getValue() <= 0) {
                throw new ValidationException("Usage limit " + name + " must have a positive renewal period");
            }
            period = RenewalPeriod.builder()
                    .value(doc.getPeriod().getValue())
                    .unit(parseUnit(doc.getPeriod().getUnit(), name))
                    .build();
        }
        boolean trackable = doc.getTrackable() != null ? doc.getTrackable() : type == FeatureValue.Type.NUMERIC;
        return UsageLimitDefinition.builder()
                .name(name)
                .description(doc.getDescription())
                .valueType(type)
                .defaultValue(typedValue(doc.getDefaultValue(), type, "default value of usage limit " + name))
                .linkedFeatures(linked)
                .trackable(trackable)
                .period(period)
                .build();
    }

    private Plan toPlan(String name, PricingDocument.PlanDoc doc,
                        Map<String, FeatureDefinition> features,
                        Map<String, UsageLimitDefinition> usageLimits) {
        return Plan.builder()
                .name(name)
                .description(doc.getDescription())
                .price(parsePrice(doc.getPrice()))
                .features(featureValues(doc.getFeatures(), features, "plan " + name))
                .usageLimits(usageLimitValues(doc.getUsageLimits(), usageLimits, "plan " + name))
                .build();
    }

    private AddOn toAddOn(String name, PricingDocument.AddOnDoc doc,
                          Map<String, FeatureDefinition> features,
                          Map<String, UsageLimitDefinition> usageLimits,
                          Map<String, Plan> plans) {
        List<String> availableFor = doc.getAvailableFor() != null ? new ArrayList<>(doc.getAvailableFor()) : new ArrayList<>();
        for (String plan : availableFor) {
            if (plans == null || !plans.containsKey(plan)) {
                throw new ValidationException("Add-on " + name + " is available for unknown plan " + plan);
            }
        }
        Map<String, FeatureValue> limitValues = usageLimitValues(doc.getUsageLimits(), usageLimits, "add-on " + name);
        usageLimitValues(doc.getUsageLimitsExtensions(), usageLimits, "add-on " + name)
                .forEach((limit, extension) -> limitValues.merge(limit, extension,
                        (a, b) -> FeatureValue.of(a.asNumber() + b.asNumber())));
        return AddOn.builder()
                .name(name)
                .description(doc.getDescription())
                .price(parsePrice(doc.getPrice()))
                .availableFor(availableFor)
                .features(featureValues(doc.getFeatures(), features, "add-on " + name))
                .usageLimits(limitValues)
                .build();
    }

    private Map<String, FeatureValue> featureValues(Map<String, Object> raw,
                                                    Map<String, FeatureDefinition> features,
                                                    String owner) {
        Map<String, FeatureValue> values = new LinkedHashMap<>();
        if (raw == null) {
            return values;
        }
        raw.forEach((name, value) -> {
            FeatureDefinition definition = features.get(name);
            if (definition == null) {
                throw new ValidationException("The " + owner + " references unknown feature " + name);
            }
            FeatureValue typed = typedValue(unwrap(value), definition.getValueType(), "feature " + name + " of " + owner);
            if (typed != null) {
                values.put(name, typed);
            }
        });
        return values;
    }

    private Map<String, FeatureValue> usageLimitValues(Map<String, Object> raw,
                                                       Map<String, UsageLimitDefinition> usageLimits,
                                                       String owner) {
        Map<String, FeatureValue> values = new LinkedHashMap<>();
        if (raw == null) {
            return values;
        }
        raw.forEach((name, value) -> {
            UsageLimitDefinition definition = usageLimits.get(name);
            if (definition == null) {
                throw new ValidationException("The " + owner + " references unknown usage limit " + name);
            }
            FeatureValue typed = typedValue(unwrap(value), definition.getValueType(), "usage limit " + name + " of " + owner);
            if (typed != null) {
                values.put(name, typed);
            }
        });
        return values;
    }

    @SuppressWarnings("unchecked")
    private static Object unwrap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return ((Map<String, Object>) map).get("value");
        }
        return value;
    }

    private static FeatureValue typedValue(Object raw, FeatureValue.Type type, String what) {
        if (raw == null) {
            return null;
        }
        FeatureValue value;
        try {
            value = FeatureValue.fromRaw(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported " + what + ": " + raw, e);
        }
        if (value.getType() != type) {
            throw new ValidationException("The " + what + " must be " + type + " but was " + value.getType());
        }
        return value;
    }

    private static FeatureValue.Type parseType(String raw, String what) {
        try {
            return FeatureValue.Type.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown valueType '" + raw + "' of " + what, e);
        }
    }

    private static RenewalPeriod.Unit parseUnit(String raw, String usageLimit) {
        try {
            return RenewalPeriod.Unit.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown period unit '" + raw + "' of usage limit " + usageLimit, e);
        }
    }

    private static BigDecimal parsePrice(Object raw) {
        if (raw instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        if (raw instanceof String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                // price given as an expression or label
                return null;
            }
        }
        return null;
    }

    private static Instant parseCreatedAt(String raw) {
        if (raw == null || raw.isBlank()) {
            return Instant.now();
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(raw.trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException e2) {
                throw new ValidationException("Invalid createdAt '" + raw + "' in pricing document", e2);
            }
        }
    }
}
