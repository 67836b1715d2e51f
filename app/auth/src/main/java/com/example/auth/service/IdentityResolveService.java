package com.example.auth.service;

import com.example.auth.config.OAuthProperties;
import com.example.auth.model.IdentityRecord;
import com.example.auth.repository.IdentityRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Maps a provider identity onto an identity record: existing login, link by email, or create.
 *
 * <p>Linking trusts the email asserted by the provider. With {@code auth.oauth.link-by-email=false}
 * an email match is refused instead, so the owner has to sign in locally first.
 *
 * <p>Each store write is a single statement. A uniqueness violation means a concurrent callback
 * won the race, so the whole decision is taken again from fresh reads. Other integrity violations
 * are not retried.
 */
@Service
@SuppressWarnings("EI_EXPOSE_REP2")
public class IdentityResolveService {

  private static final Logger logger = LoggerFactory.getLogger(IdentityResolveService.class);
  static final int MAX_ATTEMPTS = 3;

  private final IdentityRepository identityRepository;
  private final Clock clock;
  private final boolean linkByEmail;

  public IdentityResolveService(
      IdentityRepository identityRepository, OAuthProperties properties, Clock clock) {
    this.identityRepository = identityRepository;
    this.clock = clock;
    this.linkByEmail = properties.linkByEmail();
  }

  public long resolve(String providerName, String providerSubjectId, String profileEmail) {
    if (isBlank(providerName)) {
      throw new IllegalArgumentException("provider is required");
    }
    if (isBlank(providerSubjectId)) {
      throw new AuthException(
          AuthException.Reason.MISSING_SUBJECT_ID, "provider profile has no subject id");
    }
    final String email = EmailAddresses.normalize(profileEmail);

    DuplicateKeyException lastConflict = null;
    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      try {
        return resolveOnce(providerName, providerSubjectId, email);
      } catch (DuplicateKeyException ex) {
        logger.info(
            "identity resolve hit a uniqueness conflict provider={} attempt={}",
            providerName,
            attempt);
        lastConflict = ex;
      }
    }
    logger.warn(
        "identity resolve gave up after {} conflicts provider={}", MAX_ATTEMPTS, providerName);
    throw new AuthException(
        AuthException.Reason.CONFLICT,
        "identity was modified concurrently; retry the login",
        lastConflict);
  }

  private long resolveOnce(String providerName, String providerSubjectId, String email) {
    final Optional<IdentityRecord> existing =
        identityRepository.findByProvider(providerName, providerSubjectId);
    if (existing.isPresent()) {
      return existing.get().id();
    }

    final Instant now = Instant.now(clock);
    if (email != null) {
      final Optional<IdentityRecord> byEmail = identityRepository.findByEmail(email);
      if (byEmail.isPresent()) {
        return link(byEmail.get(), providerName, providerSubjectId, now);
      }
    }

    if (email == null) {
      throw new AuthException(
          AuthException.Reason.MISSING_EMAIL, "provider profile has no email to create an account");
    }
    final IdentityRecord created =
        identityRepository.create(
            IdentityRecord.newFromProvider(email, providerName, providerSubjectId, now));
    logger.info("identity created from provider={} id={}", providerName, created.id());
    return created.id();
  }

  private long link(
      IdentityRecord target, String providerName, String providerSubjectId, Instant now) {
    if (!linkByEmail) {
      throw new AuthException(
          AuthException.Reason.CONFLICT,
          "an account with this email already exists; sign in to it before linking");
    }
    if (target.hasProviderIdentity()) {
      logger.warn(
          "replacing provider identity on id={} previousProvider={} provider={}",
          target.id(),
          target.providerName(),
          providerName);
    }
    final IdentityRecord linked =
        identityRepository.update(
            target.withProviderIdentity(providerName, providerSubjectId, now));
    logger.info("provider identity linked provider={} id={}", providerName, linked.id());
    return linked.id();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
