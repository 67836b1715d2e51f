package com.example.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.auth.model.OAuthProfile;
import com.example.auth.model.OAuthProviderConfig;
import com.example.auth.model.OAuthProviderDefinition;
import com.example.auth.model.OAuthProviderTokens;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class OAuthProviderClientTest {

  private static final OAuthProviderConfig CONFIG =
      new OAuthProviderConfig(
          new OAuthProviderDefinition(
              "github",
              "http://provider.test/authorize",
              "http://provider.test/token",
              "http://provider.test/user",
              "user:email",
              "id",
              "email",
              "name"),
          "client-1",
          "secret-1",
          "http://app.test/auth/oauth/github/callback");

  @Test
  void exchangeCodePostsFormAndReadsTokens() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://provider.test/token"))
        .andExpect(method(POST))
        .andExpect(header("Accept", MediaType.APPLICATION_JSON_VALUE))
        .andExpect(
            content()
                .formDataContains(
                    Map.of(
                        "client_id", "client-1",
                        "client_secret", "secret-1",
                        "code", "code-1",
                        "grant_type", "authorization_code")))
        .andRespond(
            withSuccess(
                """
                {"access_token":"at-1","refresh_token":"rt-1","token_type":"bearer"}
                """,
                MediaType.APPLICATION_JSON));

    final OAuthProviderTokens tokens = fixture.client.exchangeCode(CONFIG, "code-1");

    assertThat(tokens.accessToken()).isEqualTo("at-1");
    assertThat(tokens.refreshToken()).isEqualTo("rt-1");
    fixture.server.verify();
  }

  @Test
  void exchangeCodeWithoutAccessTokenFails() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://provider.test/token"))
        .andRespond(
            withSuccess("{\"error\":\"bad_verification_code\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.exchangeCode(CONFIG, "code-1"))
        .isInstanceOf(AuthException.class)
        .hasMessage("No access token in provider response")
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.TOKEN_EXCHANGE_FAILED);
  }

  @Test
  void exchangeCodeMapsNon2xxToExchangeFailure() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://provider.test/token"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> fixture.client.exchangeCode(CONFIG, "code-1"))
        .isInstanceOf(AuthException.class)
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.TOKEN_EXCHANGE_FAILED);
  }

  @Test
  void exchangeCodeMapsTimeoutToExchangeFailure() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://provider.test/token"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.exchangeCode(CONFIG, "code-1"))
        .isInstanceOf(AuthException.class)
        .hasMessage("Provider token exchange timed out")
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.TOKEN_EXCHANGE_FAILED);
  }

  @Test
  void fetchProfileSendsBearerAndStringifiesNumericId() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://provider.test/user"))
        .andExpect(method(GET))
        .andExpect(header("Authorization", "Bearer at-1"))
        .andRespond(
            withSuccess(
                """
                {"id":12345,"email":"a@x.com","name":"Alice","login":"alice"}
                """,
                MediaType.APPLICATION_JSON));

    final OAuthProfile profile = fixture.client.fetchProfile(CONFIG, "at-1");

    assertThat(profile.subjectId()).isEqualTo("12345");
    assertThat(profile.email()).isEqualTo("a@x.com");
    assertThat(profile.displayName()).isEqualTo("Alice");
  }

  @Test
  void fetchProfileTreatsNullEmailAsMissing() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://provider.test/user"))
        .andRespond(withSuccess("{\"id\":1,\"email\":null}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.fetchProfile(CONFIG, "at-1").email()).isNull();
  }

  @Test
  void fetchProfileMapsServerErrorToProfileFailure() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo("http://provider.test/user")).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.fetchProfile(CONFIG, "at-1"))
        .isInstanceOf(AuthException.class)
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.PROFILE_FETCH_FAILED);
  }

  @Test
  void fetchProfileMapsConnectionFailureToProfileFailure() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://provider.test/user"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(() -> fixture.client.fetchProfile(CONFIG, "at-1"))
        .isInstanceOf(AuthException.class)
        .hasMessage("Provider profile fetch connection failed")
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.PROFILE_FETCH_FAILED);
  }

  @Test
  void fetchProfileMapsUnreadableBodyToProfileFailure() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://provider.test/user"))
        .andRespond(withSuccess("<html>oops</html>", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.fetchProfile(CONFIG, "at-1"))
        .isInstanceOf(AuthException.class)
        .extracting(ex -> ((AuthException) ex).reason())
        .isEqualTo(AuthException.Reason.PROFILE_FETCH_FAILED);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    return new ClientFixture(new OAuthProviderClient(builder.build()), server);
  }

  private record ClientFixture(OAuthProviderClient client, MockRestServiceServer server) {}
}
