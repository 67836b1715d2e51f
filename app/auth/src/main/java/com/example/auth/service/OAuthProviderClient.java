package com.example.auth.service;

import com.example.auth.model.OAuthProfile;
import com.example.auth.model.OAuthProviderConfig;
import com.example.auth.model.OAuthProviderDefinition;
import com.example.auth.model.OAuthProviderTokens;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/** Talks to a provider's token and profile endpoints. Every failure maps to one reason. */
@Service
@RequiredArgsConstructor
public class OAuthProviderClient {

  private static final Logger logger = LoggerFactory.getLogger(OAuthProviderClient.class);
  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  private final RestClient oauthRestClient;

  public OAuthProviderTokens exchangeCode(@NonNull OAuthProviderConfig config, String code) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("client_id", config.clientId());
    form.add("client_secret", config.clientSecret());
    form.add("code", code);
    form.add("redirect_uri", config.redirectUri());
    form.add("grant_type", "authorization_code");

    final Map<String, Object> body =
        call(
            config.name(),
            "token exchange",
            AuthException.Reason.TOKEN_EXCHANGE_FAILED,
            () ->
                oauthRestClient
                    .post()
                    .uri(config.definition().tokenUrl())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(JSON_OBJECT));

    final String accessToken = text(body, "access_token");
    if (accessToken == null) {
      logger.warn(
          "oauth token exchange returned no access token provider={} error={}",
          config.name(),
          text(body, "error"));
      throw new AuthException(
          AuthException.Reason.TOKEN_EXCHANGE_FAILED, "No access token in provider response");
    }
    return new OAuthProviderTokens(accessToken, text(body, "refresh_token"));
  }

  public OAuthProfile fetchProfile(@NonNull OAuthProviderConfig config, String accessToken) {
    final Map<String, Object> body =
        call(
            config.name(),
            "profile fetch",
            AuthException.Reason.PROFILE_FETCH_FAILED,
            () ->
                oauthRestClient
                    .get()
                    .uri(config.definition().profileUrl())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JSON_OBJECT));
    if (body == null) {
      logger.warn("oauth profile fetch returned empty body provider={}", config.name());
      throw new AuthException(
          AuthException.Reason.PROFILE_FETCH_FAILED, "Provider profile response is empty");
    }
    final OAuthProviderDefinition definition = config.definition();
    return new OAuthProfile(
        text(body, definition.subjectAttribute()),
        text(body, definition.emailAttribute()),
        text(body, definition.displayNameAttribute()));
  }

  private Map<String, Object> call(
      String provider,
      String operation,
      AuthException.Reason failure,
      Supplier<Map<String, Object>> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "oauth {} failed with http status={} provider={}",
          operation,
          ex.getStatusCode().value(),
          provider);
      throw new AuthException(failure, "Provider " + operation + " failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("oauth {} timed out provider={}", operation, provider);
        throw new AuthException(failure, "Provider " + operation + " timed out", ex);
      }
      logger.warn("oauth {} connection failed provider={}", operation, provider, ex);
      throw new AuthException(failure, "Provider " + operation + " connection failed", ex);
    } catch (RuntimeException ex) {
      logger.warn("oauth {} response parse failed provider={}", operation, provider, ex);
      throw new AuthException(failure, "Provider " + operation + " response is invalid", ex);
    }
  }

  private String text(Map<String, Object> body, String attribute) {
    if (body == null || attribute == null) {
      return null;
    }
    final Object value = body.get(attribute);
    if (value == null) {
      return null;
    }
    final String text = String.valueOf(value);
    return text.isBlank() ? null : text;
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
