package aforo.pricing.util;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.KeyLengthException;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

/**
 * Signs the short-lived service tokens sent with outbound pricing fetches and event webhooks,
 * so hosts that sit behind the organization's gateway can authenticate the engine, and the
 * pricing tokens that carry a user's feature evaluation.
 */
@Component
@Slf4j
public class JwtTokenGenerator {

    private static final long TOKEN_TTL_SECONDS = 600;

    private final String jwtIssuer;
    private final JWSSigner signer;
    private final Clock clock;

    public JwtTokenGenerator(
            @Value("${aforo.jwt.secret:change-me-please-change-me-32-bytes-min}") String jwtSecret,
            @Value("${aforo.jwt.issuer:aforo-pricing}") String jwtIssuer,
            Clock clock) {
        this.jwtIssuer = jwtIssuer;
        this.clock = clock;
        try {
            this.signer = new MACSigner(jwtSecret.getBytes(StandardCharsets.UTF_8));
        } catch (KeyLengthException e) {
            throw new IllegalStateException("aforo.jwt.secret must be at least 32 bytes long", e);
        }
    }

    /**
     * @param organizationId organization the call is made for
     * @return compact HS256 token valid for ten minutes
     */
    public String generateServiceToken(Long organizationId) {
        Instant now = clock.instant();
        JWTClaimsSet claimsSet = new JWTClaimsSet.Builder()
                .subject("pricing-service")
                .issuer(jwtIssuer)
                .claim("organizationId", organizationId)
                .claim("type", "service")
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plusSeconds(TOKEN_TTL_SECONDS)))
                .build();

        String token = sign(claimsSet, "service token for organization " + organizationId);
        log.debug("Generated service JWT token for organization {}", organizationId);
        return token;
    }

    /**
     * Signs a user's evaluation snapshot so clients can gate features without calling back.
     *
     * @param claims extra claims; values must be JSON scalars, lists or maps
     * @return compact HS256 token with the user as subject
     */
    public String generatePricingToken(String userId, Long organizationId, Map<String, Object> claims,
                                       long ttlSeconds) {
        Instant now = clock.instant();
        JWTClaimsSet.Builder builder = new JWTClaimsSet.Builder()
                .subject(userId)
                .issuer(jwtIssuer)
                .claim("organizationId", organizationId)
                .claim("type", "pricing")
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plusSeconds(ttlSeconds)));
        claims.forEach(builder::claim);

        String token = sign(builder.build(), "pricing token for user " + userId);
        log.debug("Generated pricing JWT token for user {}", userId);
        return token;
    }

    private String sign(JWTClaimsSet claimsSet, String description) {
        SignedJWT signedJWT = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claimsSet);
        try {
            signedJWT.sign(signer);
        } catch (JOSEException e) {
            log.error("Failed to sign {}: {}", description, e.getMessage());
            throw new IllegalStateException("Failed to generate JWT " + description, e);
        }
        return signedJWT.serialize();
    }
}
