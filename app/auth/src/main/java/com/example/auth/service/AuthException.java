package com.example.auth.service;

public class AuthException extends RuntimeException {

  public enum Category {
    INVALID_REQUEST,
    AUTHENTICATION,
    NOT_FOUND,
    CONFLICT,
    UNPROCESSABLE,
    UPSTREAM
  }

  public enum Reason {
    INVALID_INPUT(Category.INVALID_REQUEST),
    CONFLICT(Category.CONFLICT),
    INVALID_CREDENTIALS(Category.AUTHENTICATION),
    UNAUTHENTICATED(Category.AUTHENTICATION),
    EXPIRED(Category.AUTHENTICATION),
    REVOKED(Category.AUTHENTICATION),
    MALFORMED(Category.AUTHENTICATION),
    UNKNOWN_PROVIDER(Category.NOT_FOUND),
    PROVIDER_NOT_CONFIGURED(Category.NOT_FOUND),
    CSRF_MISMATCH(Category.INVALID_REQUEST),
    PROVIDER_DENIED(Category.UPSTREAM),
    MISSING_CODE(Category.INVALID_REQUEST),
    TOKEN_EXCHANGE_FAILED(Category.UPSTREAM),
    PROFILE_FETCH_FAILED(Category.UPSTREAM),
    MISSING_SUBJECT_ID(Category.UNPROCESSABLE),
    MISSING_EMAIL(Category.UNPROCESSABLE);

    private final Category category;

    Reason(Category category) {
      this.category = category;
    }

    public Category category() {
      return category;
    }
  }

  private final Reason reason;

  public AuthException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AuthException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
