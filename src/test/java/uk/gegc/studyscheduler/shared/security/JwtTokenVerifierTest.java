package uk.gegc.studyscheduler.shared.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.studyscheduler.testsupport.JwtTestTokens.OTHER_SECRET;
import static uk.gegc.studyscheduler.testsupport.JwtTestTokens.SECRET;
import static uk.gegc.studyscheduler.testsupport.JwtTestTokens.token;

@DisplayName("JwtTokenVerifier Tests")
class JwtTokenVerifierTest {

    private JwtTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new JwtTokenVerifier();
        ReflectionTestUtils.setField(verifier, "base64secret", SECRET);
        verifier.init();
    }

    @Test
    @DisplayName("Valid token authenticates the user id in the subject")
    void authenticate_validToken() {
        UUID userId = UUID.randomUUID();

        Optional<Authentication> result =
                verifier.authenticate(token(SECRET, userId.toString(), Instant.now().plus(1, ChronoUnit.HOURS)));

        assertThat(result).isPresent();
        assertThat(result.get().getName()).isEqualTo(userId.toString());
        assertThat(result.get().isAuthenticated()).isTrue();
        assertThat(result.get().getAuthorities()).extracting(GrantedAuthority::getAuthority).containsExactly("ROLE_USER");
    }

    @Test
    @DisplayName("Expired token is rejected")
    void authenticate_expired() {
        String expired = token(SECRET, UUID.randomUUID().toString(), Instant.now().minus(1, ChronoUnit.HOURS));

        assertThat(verifier.authenticate(expired)).isEmpty();
    }

    @Test
    @DisplayName("Token signed with another key is rejected")
    void authenticate_wrongSignature() {
        String forged = token(OTHER_SECRET, UUID.randomUUID().toString(), Instant.now().plus(1, ChronoUnit.HOURS));

        assertThat(verifier.authenticate(forged)).isEmpty();
    }

    @Test
    @DisplayName("Subject that is not a user id is rejected")
    void authenticate_nonUuidSubject() {
        String token = token(SECRET, "alice", Instant.now().plus(1, ChronoUnit.HOURS));

        assertThat(verifier.authenticate(token)).isEmpty();
    }

    @Test
    @DisplayName("Garbage and empty tokens are rejected")
    void authenticate_garbage() {
        assertThat(verifier.authenticate("not.a.jwt")).isEmpty();
        assertThat(verifier.authenticate("")).isEmpty();
    }
}
