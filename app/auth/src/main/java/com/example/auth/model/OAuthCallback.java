package com.example.auth.model;

/** Query parameters the provider appends when redirecting back. */
public record OAuthCallback(String state, String code, String error, String errorDescription) {

  public boolean hasError() {
    return error != null && !error.isBlank();
  }
}
