package com.example.auth.model;

public record OAuthLoginStart(String authorizationUrl, OAuthPendingLogin pendingLogin) {

  public String state() {
    return pendingLogin.state();
  }
}
