package com.example.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.auth.config.OAuthProperties;
import com.example.auth.model.OAuthProviderConfig;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OAuthProviderRegistryTest {

  @Test
  void builtInProviderWithCredentialsIsConfigured() {
    final OAuthProviderRegistry registry =
        registry(List.of(), Map.of("google", credentials("id", "secret", "http://cb")));

    final OAuthProviderConfig config = registry.require("google");

    assertThat(config.definition().tokenUrl()).isEqualTo("https://oauth2.googleapis.com/token");
    assertThat(config.definition().scope()).isEqualTo("openid email profile");
    assertThat(registry.configuredProviders()).containsExactly("google");
  }

  @Test
  void blankCredentialsLeaveProviderKnownButNotConfigured() {
    final OAuthProviderRegistry registry =
        registry(List.of(), Map.of("github", credentials("", " ", null)));

    assertThatThrownBy(() -> registry.require("github"))
        .isInstanceOf(AuthException.class)
        .hasMessage("OAuth provider not configured: github")
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.PROVIDER_NOT_CONFIGURED);
    assertThatThrownBy(() -> registry.require("myspace"))
        .isInstanceOf(AuthException.class)
        .hasMessage("Unsupported OAuth provider: myspace")
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.UNKNOWN_PROVIDER);
  }

  @Test
  void partialCredentialsFailStartupNamingMissingKeys() {
    assertThatThrownBy(
            () -> registry(List.of(), Map.of("github", credentials("id", null, null))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage(
            "Incomplete github OAuth configuration. Missing: "
                + "auth.oauth.providers.github.client-secret, "
                + "auth.oauth.providers.github.redirect-uri");
  }

  @Test
  void missingRequiredProviderFailsStartup() {
    assertThatThrownBy(
            () ->
                registry(
                    List.of("google", "github"),
                    Map.of("google", credentials("id", "secret", "http://cb"))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Required OAuth provider(s) not configured: github");
  }

  @Test
  void customProviderNeedsAllEndpoints() {
    final OAuthProviderRegistry registry =
        registry(
            List.of(),
            Map.of(
                "gitlab",
                new OAuthProperties.Provider(
                    "id",
                    "secret",
                    "http://cb",
                    "https://gitlab.test/oauth/authorize",
                    "https://gitlab.test/oauth/token",
                    "https://gitlab.test/api/v4/user",
                    "read_user"),
                "broken",
                new OAuthProperties.Provider(
                    "id", "secret", "http://cb", "https://x.test/a", null, null, null)));

    assertThat(registry.require("gitlab").definition().profileUrl())
        .isEqualTo("https://gitlab.test/api/v4/user");
    assertThat(registry.configuredProviders()).containsExactly("gitlab");
    assertThatThrownBy(() -> registry.require("broken"))
        .isInstanceOf(AuthException.class)
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.UNKNOWN_PROVIDER);
  }

  @Test
  void endpointOverrideReplacesBuiltInUrl() {
    final OAuthProviderRegistry registry =
        registry(
            List.of(),
            Map.of(
                "github",
                new OAuthProperties.Provider(
                    "id",
                    "secret",
                    "http://cb",
                    null,
                    "http://stub.test/token",
                    null,
                    null)));

    final OAuthProviderConfig config = registry.require("github");
    assertThat(config.definition().tokenUrl()).isEqualTo("http://stub.test/token");
    assertThat(config.definition().profileUrl()).isEqualTo("https://api.github.com/user");
  }

  private static OAuthProviderRegistry registry(
      List<String> required, Map<String, OAuthProperties.Provider> providers) {
    return new OAuthProviderRegistry(new OAuthProperties(null, null, null, required, providers));
  }

  private static OAuthProperties.Provider credentials(
      String clientId, String clientSecret, String redirectUri) {
    return new OAuthProperties.Provider(
        clientId, clientSecret, redirectUri, null, null, null, null);
  }
}
