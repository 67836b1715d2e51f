/*
 * どこで: Auth API 層
 * 何を: OAuth 認可コードフローの開始/コールバック API を提供する
 * なぜ: CSRF state をセッションへ一時保存し、コールバックで一度だけ照合するため
 *       auth.oauth.success-redirect-uri 設定時は成功後にフロントへ 302 し、token を fragment で渡す
 */
package com.example.auth.api;

import com.example.auth.api.response.TokenResponse;
import com.example.auth.model.OAuthCallback;
import com.example.auth.model.OAuthLoginStart;
import com.example.auth.model.OAuthPendingLogin;
import com.example.auth.service.AuthException;
import com.example.auth.service.AuthMetrics;
import com.example.auth.service.OAuthFlowService;
import com.example.auth.service.TokenService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/oauth")
public class AuthOAuthController {

  static final String SESSION_STATE = "oauth_state";
  static final String SESSION_PROVIDER = "oauth_provider";
  private static final String METHOD_OAUTH = "oauth";

  private final OAuthFlowService oauthFlowService;
  private final TokenService tokenService;
  private final AuthMetrics authMetrics;
  private final String successRedirectUri;

  public AuthOAuthController(
      OAuthFlowService oauthFlowService,
      TokenService tokenService,
      AuthMetrics authMetrics,
      @Value("${auth.oauth.success-redirect-uri:}") String successRedirectUri) {
    this.oauthFlowService = oauthFlowService;
    this.tokenService = tokenService;
    this.authMetrics = authMetrics;
    this.successRedirectUri = successRedirectUri == null ? "" : successRedirectUri.trim();
  }

  @GetMapping("/{provider}")
  public ResponseEntity<Void> initiate(
      @PathVariable("provider") String provider, HttpServletRequest request) {
    final OAuthLoginStart start = oauthFlowService.initiate(provider);
    final HttpSession session = request.getSession(true);
    session.setAttribute(SESSION_STATE, start.state());
    session.setAttribute(SESSION_PROVIDER, start.pendingLogin().providerName());
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(URI.create(start.authorizationUrl()))
        .build();
  }

  @GetMapping("/{provider}/callback")
  public ResponseEntity<?> callback(
      @PathVariable("provider") String provider,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "code", required = false) String code,
      @RequestParam(name = "error", required = false) String error,
      @RequestParam(name = "error_description", required = false) String errorDescription,
      HttpServletRequest request) {
    // 成否にかかわらず先に消す。同じ state の再送は必ず CSRF_MISMATCH になる。
    final OAuthPendingLogin expected = takePendingLogin(request);
    final String token;
    try {
      token =
          oauthFlowService.callback(
              provider, new OAuthCallback(state, code, error, errorDescription), expected);
    } catch (AuthException ex) {
      authMetrics.recordLoginResult(METHOD_OAUTH, "failure");
      throw ex;
    }
    authMetrics.recordLoginResult(METHOD_OAUTH, "success");
    final TokenResponse body = TokenResponse.bearer(token, tokenService.ttl());
    if (successRedirectUri.isEmpty()) {
      return ResponseEntity.ok(body);
    }
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(URI.create(successRedirectUri + "#" + toFragment(body)))
        .build();
  }

  private String toFragment(TokenResponse body) {
    return "access_token="
        + URLEncoder.encode(body.accessToken(), StandardCharsets.UTF_8)
        + "&token_type="
        + body.tokenType()
        + "&expires_in="
        + body.expiresIn();
  }

  private OAuthPendingLogin takePendingLogin(HttpServletRequest request) {
    final HttpSession session = request.getSession(false);
    if (session == null) {
      return null;
    }
    final Object state = session.getAttribute(SESSION_STATE);
    final Object provider = session.getAttribute(SESSION_PROVIDER);
    session.removeAttribute(SESSION_STATE);
    session.removeAttribute(SESSION_PROVIDER);
    if (!(state instanceof String expectedState)) {
      return null;
    }
    return new OAuthPendingLogin(
        expectedState, provider instanceof String providerName ? providerName : null);
  }
}
