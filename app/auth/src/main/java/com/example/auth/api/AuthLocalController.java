/*
 * どこで: Auth API 層
 * 何を: メール/パスワードでの登録・ログイン・ログアウト、トークン更新、自分情報 API を提供する
 * なぜ: Bearer トークンの発行と失効の入口を 1 か所に集約するため
 */
package com.example.auth.api;

import com.example.auth.api.request.CredentialsRequest;
import com.example.auth.api.response.MeResponse;
import com.example.auth.api.response.MessageResponse;
import com.example.auth.api.response.TokenResponse;
import com.example.auth.config.BearerTokenAuthenticationFilter;
import com.example.auth.model.AuthenticatedUser;
import com.example.auth.model.IdentityRecord;
import com.example.auth.service.AuthException;
import com.example.auth.service.AuthMetrics;
import com.example.auth.service.LocalCredentialService;
import com.example.auth.service.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthLocalController {

  private static final String METHOD_LOCAL = "local";
  private static final String METHOD_REFRESH = "refresh";

  private final LocalCredentialService localCredentialService;
  private final TokenService tokenService;
  private final AuthMetrics authMetrics;

  @PostMapping("/register")
  public ResponseEntity<TokenResponse> register(@RequestBody CredentialsRequest request) {
    final String token = localCredentialService.register(request.email(), request.password());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(TokenResponse.bearer(token, tokenService.ttl()));
  }

  @PostMapping("/login")
  public ResponseEntity<TokenResponse> login(@RequestBody CredentialsRequest request) {
    final String token;
    try {
      token = localCredentialService.login(request.email(), request.password());
    } catch (AuthException ex) {
      authMetrics.recordLoginResult(METHOD_LOCAL, "failure");
      throw ex;
    }
    authMetrics.recordLoginResult(METHOD_LOCAL, "success");
    return ResponseEntity.ok(TokenResponse.bearer(token, tokenService.ttl()));
  }

  /**
   * 役割:
   * - 提示された Bearer トークンを失効させる。
   *
   * 期待動作:
   * - ヘッダ欠落/Bearer 以外/検証失敗はすべて 401 を返す。
   * - 失効済みトークンでの再ログアウトも 401 (REVOKED 起因) になる。
   */
  @PostMapping("/logout")
  public ResponseEntity<MessageResponse> logout(
      @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    localCredentialService.logout(requireBearer(authorization));
    return ResponseEntity.ok(new MessageResponse("Logged out successfully"));
  }

  @PostMapping("/refresh")
  public ResponseEntity<TokenResponse> refresh(
      @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    final String token;
    try {
      token = tokenService.refresh(requireBearer(authorization));
    } catch (AuthException ex) {
      authMetrics.recordLoginResult(METHOD_REFRESH, "failure");
      throw ex;
    }
    authMetrics.recordLoginResult(METHOD_REFRESH, "success");
    return ResponseEntity.ok(TokenResponse.bearer(token, tokenService.ttl()));
  }

  @GetMapping("/me")
  public ResponseEntity<MeResponse> me(@AuthenticationPrincipal AuthenticatedUser user) {
    if (user == null) {
      throw new AuthException(AuthException.Reason.UNAUTHENTICATED, "Not authenticated");
    }
    final IdentityRecord identity = localCredentialService.currentIdentity(user.identityId());
    return ResponseEntity.ok(
        new MeResponse(
            identity.id(), identity.email(), identity.providerName(), identity.hasCredential()));
  }

  private String requireBearer(String authorization) {
    final String token = BearerTokenAuthenticationFilter.extractToken(authorization);
    if (token == null) {
      throw new AuthException(AuthException.Reason.UNAUTHENTICATED, "Not authenticated");
    }
    return token;
  }
}
