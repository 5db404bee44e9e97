package aforo.pricing.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VersionCodecTest {

    @Test
    void shouldEscapeAndUnescapeDots() {
        assertEquals("1_0_2", VersionCodec.escape("1.0.2"));
        assertEquals("1.0.2", VersionCodec.unescape("1_0_2"));
        assertNull(VersionCodec.escape(null));
        assertNull(VersionCodec.unescape(null));
    }

    @Test
    void shouldMapUnderscoredVersionToSameKeyAsDottedTwin() {
        assertEquals(VersionCodec.escape("1.0"), VersionCodec.escape("1_0"));
    }

    @Test
    void shouldLowerCaseServicesAndKeepOrder() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("Zoom", "2.0");
        services.put("Teams", "1.1");

        Map<String, String> escaped = VersionCodec.escapeContractedServices(services);

        assertEquals(List.of("zoom", "teams"), List.copyOf(escaped.keySet()));
        assertEquals("2_0", escaped.get("zoom"));
        assertEquals("1_1", escaped.get("teams"));
        assertTrue(VersionCodec.escapeContractedServices(null).isEmpty());
    }

    @Test
    void shouldLowerCaseServicesIndependentlyOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Map<String, String> escaped = VersionCodec.escapeContractedServices(Map.of("INVOICING", "1.0"));

            assertEquals(Map.of("invoicing", "1_0"), escaped);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
