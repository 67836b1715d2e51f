package com.example.auth.service;

import com.example.auth.config.TokenProperties;
import com.example.common.RandomTokens;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 bearer tokens.
 *
 * <p>Verification is stateless apart from the {@link RevocationStore} lookup. Expiry is checked
 * here against the injected {@link Clock} rather than by the decoder, so that an expired token is
 * reported as {@link AuthException.Reason#EXPIRED} and never as malformed.
 */
@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "RevocationStore is a shared collaborator managed by Spring")
public class TokenService {

  private static final Logger logger = LoggerFactory.getLogger(TokenService.class);
  private static final String HMAC_SHA256 = "HmacSHA256";
  private static final int TOKEN_ID_BYTES = 16;

  private final JwtEncoder encoder;
  private final JwtDecoder decoder;
  private final RevocationStore revocationStore;
  private final Duration ttl;
  private final Clock clock;

  public TokenService(TokenProperties properties, RevocationStore revocationStore, Clock clock) {
    final SecretKey key =
        new SecretKeySpec(properties.signingKey().getBytes(StandardCharsets.UTF_8), HMAC_SHA256);
    this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
    final NimbusJwtDecoder nimbusDecoder =
        NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    nimbusDecoder.setJwtValidator(jwt -> OAuth2TokenValidatorResult.success());
    this.decoder = nimbusDecoder;
    this.revocationStore = revocationStore;
    this.ttl = properties.ttl();
    this.clock = clock;
  }

  public String issue(long identityId) {
    final Instant issuedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
    final JwtClaimsSet claims =
        JwtClaimsSet.builder()
            .subject(Long.toString(identityId))
            .issuedAt(issuedAt)
            .expiresAt(issuedAt.plus(ttl))
            .id(RandomTokens.urlSafe(TOKEN_ID_BYTES))
            .build();
    final JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    return encoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
  }

  public long verify(String token) {
    if (token == null || token.isBlank()) {
      throw new AuthException(AuthException.Reason.MALFORMED, "token is required");
    }
    if (revocationStore.isRevoked(token)) {
      throw new AuthException(AuthException.Reason.REVOKED, "token has been revoked");
    }
    final Jwt jwt = decode(token);
    final long identityId = parseSubject(jwt.getSubject());
    final Instant expiresAt = jwt.getExpiresAt();
    if (expiresAt == null) {
      throw new AuthException(AuthException.Reason.MALFORMED, "token has no expiry");
    }
    if (!Instant.now(clock).isBefore(expiresAt)) {
      throw new AuthException(AuthException.Reason.EXPIRED, "token has expired");
    }
    return identityId;
  }

  public void revoke(String token) {
    if (token == null || token.isBlank()) {
      return;
    }
    revocationStore.revoke(token, resolvePurgeAfter(token));
  }

  public String refresh(String token) {
    return issue(verify(token));
  }

  public Duration ttl() {
    return ttl;
  }

  private Jwt decode(String token) {
    try {
      return decoder.decode(token);
    } catch (JwtException ex) {
      logger.debug("token rejected by decoder: {}", ex.getMessage());
      throw new AuthException(AuthException.Reason.MALFORMED, "token is invalid", ex);
    }
  }

  private long parseSubject(String subject) {
    if (subject == null || subject.isBlank()) {
      throw new AuthException(AuthException.Reason.MALFORMED, "token has no subject");
    }
    try {
      return Long.parseLong(subject);
    } catch (NumberFormatException ex) {
      throw new AuthException(AuthException.Reason.MALFORMED, "token subject is not numeric", ex);
    }
  }

  private Instant resolvePurgeAfter(String token) {
    final Instant fallback = Instant.now(clock).plus(ttl);
    try {
      final Instant expiresAt = decoder.decode(token).getExpiresAt();
      return expiresAt == null ? fallback : expiresAt;
    } catch (JwtException ex) {
      // 署名不正のトークンは検証で必ず弾かれるため TTL 経過後に掃除してよい
      return fallback;
    }
  }
}
