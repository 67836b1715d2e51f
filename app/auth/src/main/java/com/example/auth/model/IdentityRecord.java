/*
 * どこで: app/auth/src/main/java/com/example/auth/model/IdentityRecord.java
 * 何を: identities テーブル相当のドメインレコード
 * なぜ: ローカル認証と OAuth 連携の両方を 1 つのアカウントとして扱うため
 */
package com.example.auth.model;

import java.time.Instant;

public record IdentityRecord(
    Long id,
    String email,
    String credentialDigest,
    String providerName,
    String providerSubjectId,
    String providerAccessToken,
    String providerRefreshToken,
    Instant createdAt,
    Instant updatedAt) {

  public static IdentityRecord newLocal(String email, String credentialDigest, Instant now) {
    return new IdentityRecord(null, email, credentialDigest, null, null, null, null, now, now);
  }

  public static IdentityRecord newFromProvider(
      String email, String providerName, String providerSubjectId, Instant now) {
    return new IdentityRecord(
        null, email, null, providerName, providerSubjectId, null, null, now, now);
  }

  public boolean hasCredential() {
    return credentialDigest != null && !credentialDigest.isBlank();
  }

  public boolean hasProviderIdentity() {
    return providerName != null && providerSubjectId != null;
  }

  public boolean hasAuthenticationMeans() {
    return hasCredential() || hasProviderIdentity();
  }

  /** Binds a provider identity. Stored provider tokens belong to the previous binding and go. */
  public IdentityRecord withProviderIdentity(
      String providerName, String providerSubjectId, Instant now) {
    return new IdentityRecord(
        id, email, credentialDigest, providerName, providerSubjectId, null, null, createdAt, now);
  }
}
