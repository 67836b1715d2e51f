package com.example.auth.service;

import com.example.auth.config.OAuthProperties;
import com.example.auth.model.OAuthProviderConfig;
import com.example.auth.model.OAuthProviderDefinition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Known providers and the ones that have client credentials.
 *
 * <p>Built-in definitions can be overridden and new providers added through {@code
 * auth.oauth.providers.<name>}. Startup fails on half-filled credentials or on a required provider
 * that is not configured.
 */
@Component
public class OAuthProviderRegistry {

  private static final Logger logger = LoggerFactory.getLogger(OAuthProviderRegistry.class);

  static final Map<String, OAuthProviderDefinition> BUILT_IN =
      Map.of(
          "google",
          new OAuthProviderDefinition(
              "google",
              "https://accounts.google.com/o/oauth2/v2/auth",
              "https://oauth2.googleapis.com/token",
              "https://www.googleapis.com/oauth2/v2/userinfo",
              "openid email profile",
              "id",
              "email",
              "name"),
          "github",
          new OAuthProviderDefinition(
              "github",
              "https://github.com/login/oauth/authorize",
              "https://github.com/login/oauth/access_token",
              "https://api.github.com/user",
              "user:email",
              "id",
              "email",
              "name"));

  private final Map<String, OAuthProviderDefinition> definitions;
  private final Map<String, OAuthProviderConfig> configured;

  public OAuthProviderRegistry(OAuthProperties properties) {
    final Map<String, OAuthProviderDefinition> known = new LinkedHashMap<>(BUILT_IN);
    final Map<String, OAuthProviderConfig> withCredentials = new LinkedHashMap<>();

    properties
        .providers()
        .forEach(
            (name, settings) -> {
              final OAuthProviderDefinition definition =
                  mergeDefinition(name, known.get(name), settings);
              if (definition == null) {
                logger.warn(
                    "ignoring oauth provider {}: not built in and endpoints are incomplete", name);
                return;
              }
              known.put(name, definition);
              final OAuthProviderConfig config = toConfig(definition, settings);
              if (config != null) {
                withCredentials.put(name, config);
              }
            });

    final List<String> missingRequired = new ArrayList<>();
    for (String required : properties.requiredProviders()) {
      if (!withCredentials.containsKey(required)) {
        missingRequired.add(required);
      }
    }
    if (!missingRequired.isEmpty()) {
      throw new IllegalStateException(
          "Required OAuth provider(s) not configured: " + String.join(", ", missingRequired));
    }

    this.definitions = Collections.unmodifiableMap(known);
    this.configured = Collections.unmodifiableMap(withCredentials);
    logger.info(
        "oauth providers known={} configured={}", definitions.keySet(), configured.keySet());
  }

  /** Resolves a provider that can be used right now, or fails with the reason it cannot. */
  public OAuthProviderConfig require(String providerName) {
    if (providerName == null || !definitions.containsKey(providerName)) {
      throw new AuthException(
          AuthException.Reason.UNKNOWN_PROVIDER, "Unsupported OAuth provider: " + providerName);
    }
    final OAuthProviderConfig config = configured.get(providerName);
    if (config == null) {
      throw new AuthException(
          AuthException.Reason.PROVIDER_NOT_CONFIGURED,
          "OAuth provider not configured: " + providerName);
    }
    return config;
  }

  public Set<String> configuredProviders() {
    return new TreeSet<>(configured.keySet());
  }

  private OAuthProviderDefinition mergeDefinition(
      String name, OAuthProviderDefinition base, OAuthProperties.Provider settings) {
    if (base == null) {
      base = new OAuthProviderDefinition(name, null, null, null, null, "id", "email", "name");
    }
    final String authorizeUrl = pick(settings.authorizeUrl(), base.authorizeUrl());
    final String tokenUrl = pick(settings.tokenUrl(), base.tokenUrl());
    final String profileUrl = pick(settings.profileUrl(), base.profileUrl());
    final String scope = pick(settings.scope(), base.scope());
    if (authorizeUrl == null || tokenUrl == null || profileUrl == null || scope == null) {
      return null;
    }
    return new OAuthProviderDefinition(
        name,
        authorizeUrl,
        tokenUrl,
        profileUrl,
        scope,
        base.subjectAttribute(),
        base.emailAttribute(),
        base.displayNameAttribute());
  }

  private OAuthProviderConfig toConfig(
      OAuthProviderDefinition definition, OAuthProperties.Provider settings) {
    final Map<String, String> credentials = new LinkedHashMap<>();
    credentials.put("client-id", settings.clientId());
    credentials.put("client-secret", settings.clientSecret());
    credentials.put("redirect-uri", settings.redirectUri());

    final List<String> missing = new ArrayList<>();
    credentials.forEach(
        (key, value) -> {
          if (value == null || value.isBlank()) {
            missing.add("auth.oauth.providers." + definition.name() + "." + key);
          }
        });
    if (missing.size() == credentials.size()) {
      return null;
    }
    if (!missing.isEmpty()) {
      throw new IllegalStateException(
          "Incomplete "
              + definition.name()
              + " OAuth configuration. Missing: "
              + String.join(", ", missing));
    }
    return new OAuthProviderConfig(
        definition, settings.clientId(), settings.clientSecret(), settings.redirectUri());
  }

  private String pick(String override, String fallback) {
    return override == null || override.isBlank() ? fallback : override;
  }
}
