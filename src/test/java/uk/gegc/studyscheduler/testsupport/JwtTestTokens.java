package uk.gegc.studyscheduler.testsupport;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Signs tokens the way the identity service does, for tests that go through the JWT filter.
 */
public final class JwtTestTokens {

    /**
     * Same value as {@code jwt.secret} in the test profile.
     */
    public static final String SECRET = "c3R1ZHktc2NoZWR1bGVyLXRlc3Qtc2lnbmluZy1rZXktMDEyMzQ1Njc4OWFiY2RlZg==";
    public static final String OTHER_SECRET = "b3RoZXItc2lnbmluZy1rZXktdGhhdC1pcy1sb25nLWVub3VnaC0wMTIzNDU2Nzg5";

    private JwtTestTokens() {
    }

    public static String token(String secret, String subject, Instant expiresAt) {
        SecretKey key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(secret));
        return Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(expiresAt.minus(1, ChronoUnit.HOURS)))
                .expiration(Date.from(expiresAt))
                .signWith(key)
                .compact();
    }

    public static String bearer(String subject) {
        return "Bearer " + token(SECRET, subject, Instant.now().plus(1, ChronoUnit.HOURS));
    }
}
