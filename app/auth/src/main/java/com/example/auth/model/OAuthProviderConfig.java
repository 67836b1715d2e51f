package com.example.auth.model;

/** A provider definition joined with the client credentials registered for it. */
public record OAuthProviderConfig(
    OAuthProviderDefinition definition, String clientId, String clientSecret, String redirectUri) {

  public String name() {
    return definition.name();
  }

  @Override
  public String toString() {
    return "OAuthProviderConfig[name=" + name() + ", clientId=" + clientId + "]";
  }
}
