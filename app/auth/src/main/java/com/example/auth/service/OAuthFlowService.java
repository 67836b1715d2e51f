package com.example.auth.service;

import com.example.auth.model.OAuthCallback;
import com.example.auth.model.OAuthLoginStart;
import com.example.auth.model.OAuthPendingLogin;
import com.example.auth.model.OAuthProfile;
import com.example.auth.model.OAuthProviderConfig;
import com.example.auth.model.OAuthProviderTokens;
import com.example.auth.repository.IdentityRepository;
import com.example.common.RandomTokens;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Authorization-code flow: {@link #initiate} hands out the provider URL and a one-time state,
 * {@link #callback} checks that state against the copy the caller kept in its session and turns
 * the code into a bearer token.
 *
 * <p>Nothing here keeps per-flow state. The caller stores the {@link OAuthPendingLogin} and must
 * drop it from the session before calling {@link #callback}, whatever the outcome.
 */
@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class OAuthFlowService {

  private static final Logger logger = LoggerFactory.getLogger(OAuthFlowService.class);
  private static final int STATE_BYTES = 32;

  private final OAuthProviderRegistry providerRegistry;
  private final OAuthProviderClient providerClient;
  private final IdentityResolveService identityResolveService;
  private final IdentityRepository identityRepository;
  private final TokenService tokenService;
  private final Clock clock;

  public OAuthLoginStart initiate(String providerName) {
    final OAuthProviderConfig config = providerRegistry.require(providerName);
    final String state = RandomTokens.urlSafe(STATE_BYTES);
    final String authorizeUrl = config.definition().authorizeUrl();
    final String url =
        authorizeUrl
            + (authorizeUrl.indexOf('?') >= 0 ? "&" : "?")
            + "client_id="
            + encode(config.clientId())
            + "&redirect_uri="
            + encode(config.redirectUri())
            + "&response_type=code"
            + "&scope="
            + encode(config.definition().scope())
            + "&state="
            + encode(state);
    logger.info("oauth login initiated provider={}", config.name());
    return new OAuthLoginStart(url, new OAuthPendingLogin(state, config.name()));
  }

  public String callback(
      String providerName, @NonNull OAuthCallback callback, OAuthPendingLogin expected) {
    if (!stateMatches(providerName, callback.state(), expected)) {
      logger.warn("oauth callback rejected: state mismatch provider={}", providerName);
      throw new AuthException(
          AuthException.Reason.CSRF_MISMATCH, "Invalid or missing CSRF state parameter");
    }
    if (callback.hasError()) {
      final String description =
          callback.errorDescription() == null || callback.errorDescription().isBlank()
              ? callback.error()
              : callback.errorDescription();
      logger.info(
          "oauth provider denied authorization provider={} error={}",
          providerName,
          callback.error());
      throw new AuthException(AuthException.Reason.PROVIDER_DENIED, "OAuth error: " + description);
    }
    if (callback.code() == null || callback.code().isBlank()) {
      throw new AuthException(AuthException.Reason.MISSING_CODE, "Missing authorization code");
    }

    final OAuthProviderConfig config = providerRegistry.require(providerName);
    final OAuthProviderTokens providerTokens =
        providerClient.exchangeCode(config, callback.code());
    final OAuthProfile profile = providerClient.fetchProfile(config, providerTokens.accessToken());
    if (profile.subjectId() == null || profile.subjectId().isBlank()) {
      throw new AuthException(
          AuthException.Reason.MISSING_SUBJECT_ID, "Provider profile has no subject id");
    }

    final long identityId =
        identityResolveService.resolve(config.name(), profile.subjectId(), profile.email());
    storeProviderTokens(identityId, config.name(), providerTokens);
    logger.info("oauth login completed provider={} id={}", config.name(), identityId);
    return tokenService.issue(identityId);
  }

  private boolean stateMatches(
      String providerName, String receivedState, OAuthPendingLogin expected) {
    if (receivedState == null || receivedState.isEmpty() || expected == null) {
      return false;
    }
    if (expected.state() == null
        || providerName == null
        || !providerName.equals(expected.providerName())) {
      return false;
    }
    return MessageDigest.isEqual(
        receivedState.getBytes(StandardCharsets.UTF_8),
        expected.state().getBytes(StandardCharsets.UTF_8));
  }

  private void storeProviderTokens(long identityId, String provider, OAuthProviderTokens tokens) {
    try {
      identityRepository.updateProviderTokens(
          identityId, tokens.accessToken(), tokens.refreshToken(), Instant.now(clock));
    } catch (DataAccessException ex) {
      logger.warn("failed to store provider tokens provider={} id={}", provider, identityId, ex);
    }
  }

  private String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
