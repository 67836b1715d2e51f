package com.example.auth.service;

import java.time.Instant;

/**
 * Tokens that must be rejected even though their signature and expiry are still good.
 *
 * <p>Implementations must tolerate concurrent {@link #revoke} and {@link #isRevoked} calls without
 * losing inserts. Entries may be dropped once {@code expiresAt} has passed since the token can no
 * longer verify anyway.
 */
public interface RevocationStore {

  void revoke(String token, Instant expiresAt);

  boolean isRevoked(String token);

  int purgeExpired(Instant now);
}
