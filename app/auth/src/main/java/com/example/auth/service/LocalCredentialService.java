package com.example.auth.service;

import com.example.auth.model.IdentityRecord;
import com.example.auth.repository.IdentityRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/** Email/password registration, login and logout. */
@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class LocalCredentialService {

  private static final Logger logger = LoggerFactory.getLogger(LocalCredentialService.class);
  // 未登録/パスワード不一致/OAuth 専用アカウントを呼び出し側から区別させない
  static final String INVALID_CREDENTIALS_MESSAGE = "invalid email or password";

  private final IdentityRepository identityRepository;
  private final CredentialHasher credentialHasher;
  private final TokenService tokenService;
  private final Clock clock;

  public String register(String email, String secret) {
    final String normalized = requireEmail(email);
    requireSecret(secret);
    if (identityRepository.findByEmail(normalized).isPresent()) {
      throw new AuthException(AuthException.Reason.CONFLICT, "email is already registered");
    }

    final Instant now = Instant.now(clock);
    final IdentityRecord created;
    try {
      created =
          identityRepository.create(
              IdentityRecord.newLocal(normalized, credentialHasher.hash(secret), now));
    } catch (DuplicateKeyException ex) {
      throw new AuthException(AuthException.Reason.CONFLICT, "email is already registered", ex);
    }
    logger.info("local identity registered id={}", created.id());
    return tokenService.issue(created.id());
  }

  public String login(String email, String secret) {
    final String normalized = requireEmail(email);
    requireSecret(secret);

    final Optional<IdentityRecord> identity = identityRepository.findByEmail(normalized);
    if (identity.isEmpty()
        || !identity.get().hasCredential()
        || !credentialHasher.verify(secret, identity.get().credentialDigest())) {
      logger.info("local login rejected");
      throw new AuthException(
          AuthException.Reason.INVALID_CREDENTIALS, INVALID_CREDENTIALS_MESSAGE);
    }
    return tokenService.issue(identity.get().id());
  }

  public void logout(String token) {
    try {
      tokenService.verify(token);
    } catch (AuthException ex) {
      throw new AuthException(
          AuthException.Reason.UNAUTHENTICATED, "token is not valid: " + ex.getMessage(), ex);
    }
    tokenService.revoke(token);
  }

  public IdentityRecord currentIdentity(long identityId) {
    return identityRepository
        .findById(identityId)
        .orElseThrow(
            () ->
                new AuthException(
                    AuthException.Reason.UNAUTHENTICATED, "identity no longer exists"));
  }

  private String requireEmail(String email) {
    final String normalized = EmailAddresses.normalize(email);
    if (normalized == null) {
      throw new AuthException(AuthException.Reason.INVALID_INPUT, "email is required");
    }
    return normalized;
  }

  private void requireSecret(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new AuthException(AuthException.Reason.INVALID_INPUT, "password is required");
    }
  }
}
