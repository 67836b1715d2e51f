/*
 * どこで: Auth API 層
 * 何を: 認証系の例外を標準エラー形式と HTTP ステータスへ変換する
 * なぜ: 失敗理由ごとの契約を一定に保ち、エラー種別をメトリクスで追えるようにするため
 */
package com.example.auth.api;

import com.example.auth.service.AuthException;
import com.example.auth.service.AuthMetrics;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class AuthApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(AuthApiExceptionHandler.class);
  private static final String INVALID_INPUT = AuthException.Reason.INVALID_INPUT.name();

  private final AuthMetrics authMetrics;

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<ApiErrorResponse> handleAuth(AuthException ex) {
    final String code = ex.reason().name();
    final HttpStatus status = statusOf(ex.reason().category());
    authMetrics.recordAuthError(code);
    if (status.is5xxServerError()) {
      logger.warn("auth request failed code={} message={}", code, ex.getMessage());
    }
    final ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
    if (status == HttpStatus.UNAUTHORIZED) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    }
    return builder.body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    HttpMediaTypeNotSupportedException.class
  })
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(Exception ex) {
    authMetrics.recordAuthError(INVALID_INPUT);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(INVALID_INPUT, "request body must be a JSON object"));
  }

  static HttpStatus statusOf(AuthException.Category category) {
    return switch (category) {
      case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
      case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case CONFLICT -> HttpStatus.CONFLICT;
      case UNPROCESSABLE -> HttpStatus.UNPROCESSABLE_ENTITY;
      case UPSTREAM -> HttpStatus.BAD_GATEWAY;
    };
  }
}
