package com.example.auth.service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Single-process revocation store. Swap for a shared store when running more than one node. */
public class InMemoryRevocationStore implements RevocationStore {

  private final Map<String, Instant> revoked = new ConcurrentHashMap<>();

  @Override
  public void revoke(String token, Instant expiresAt) {
    // 既に登録済みなら遅い方の期限を残す
    revoked.merge(token, expiresAt, (current, next) -> next.isAfter(current) ? next : current);
  }

  @Override
  public boolean isRevoked(String token) {
    return revoked.containsKey(token);
  }

  @Override
  public int purgeExpired(Instant now) {
    final int before = revoked.size();
    revoked.entrySet().removeIf(entry -> !entry.getValue().isAfter(now));
    return Math.max(0, before - revoked.size());
  }

  int size() {
    return revoked.size();
  }
}
