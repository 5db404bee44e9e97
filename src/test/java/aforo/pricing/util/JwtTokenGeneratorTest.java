package aforo.pricing.util;

import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenGeneratorTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Test
    void shouldSignShortLivedServiceToken() throws Exception {
        JwtTokenGenerator generator = new JwtTokenGenerator(SECRET, "aforo-pricing", Clock.fixed(NOW, ZoneOffset.UTC));

        SignedJWT jwt = SignedJWT.parse(generator.generateServiceToken(7L));

        assertTrue(jwt.verify(new MACVerifier(SECRET)));
        assertEquals("pricing-service", jwt.getJWTClaimsSet().getSubject());
        assertEquals("aforo-pricing", jwt.getJWTClaimsSet().getIssuer());
        assertEquals(7L, jwt.getJWTClaimsSet().getLongClaim("organizationId"));
        assertEquals(NOW.plusSeconds(600), jwt.getJWTClaimsSet().getExpirationTime().toInstant());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSignPricingTokenWithUserClaims() throws Exception {
        JwtTokenGenerator generator = new JwtTokenGenerator(SECRET, "aforo-pricing", Clock.fixed(NOW, ZoneOffset.UTC));

        String token = generator.generatePricingToken("user-1", 7L, Map.of(
                "features", Map.of("zoom-meetings", Map.of("eval", true, "used", 3L)),
                "pricingContext", Map.of("zoom.features.videoQuality", "HD")), 3600);
        SignedJWT jwt = SignedJWT.parse(token);

        assertTrue(jwt.verify(new MACVerifier(SECRET)));
        assertEquals("user-1", jwt.getJWTClaimsSet().getSubject());
        assertEquals("pricing", jwt.getJWTClaimsSet().getStringClaim("type"));
        assertEquals(NOW.plusSeconds(3600), jwt.getJWTClaimsSet().getExpirationTime().toInstant());
        Map<String, Object> features = jwt.getJWTClaimsSet().getJSONObjectClaim("features");
        assertEquals(true, ((Map<String, Object>) features.get("zoom-meetings")).get("eval"));
        assertEquals("HD", jwt.getJWTClaimsSet().getJSONObjectClaim("pricingContext").get("zoom.features.videoQuality"));
        assertTrue(jwt.getJWTClaimsSet().getClaims().keySet().containsAll(List.of("features", "pricingContext", "iat")));
    }

    @Test
    void shouldRejectShortSecret() {
        assertThrows(IllegalStateException.class,
                () -> new JwtTokenGenerator("short", "aforo-pricing", Clock.systemUTC()));
    }
}
