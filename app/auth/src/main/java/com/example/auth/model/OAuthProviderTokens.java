package com.example.auth.model;

public record OAuthProviderTokens(String accessToken, String refreshToken) {

  @Override
  public String toString() {
    return "OAuthProviderTokens[accessToken=***, refreshToken="
        + (refreshToken == null ? "null" : "***")
        + "]";
  }
}
