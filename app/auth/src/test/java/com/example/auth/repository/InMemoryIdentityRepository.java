package com.example.auth.repository;

import com.example.auth.model.IdentityRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.dao.DuplicateKeyException;

/** Stateful stand-in for the identities table with the same uniqueness rules as the schema. */
public class InMemoryIdentityRepository extends IdentityRepository {

  private final List<IdentityRecord> rows = new ArrayList<>();
  private final AtomicInteger createCalls = new AtomicInteger();
  private long nextId = 1;

  public InMemoryIdentityRepository() {
    super(null);
  }

  public int createCalls() {
    return createCalls.get();
  }

  @Override
  public synchronized IdentityRecord create(IdentityRecord identity) {
    createCalls.incrementAndGet();
    checkUnique(identity, null);
    final IdentityRecord stored =
        new IdentityRecord(
            nextId++,
            identity.email(),
            identity.credentialDigest(),
            identity.providerName(),
            identity.providerSubjectId(),
            identity.providerAccessToken(),
            identity.providerRefreshToken(),
            identity.createdAt(),
            identity.updatedAt());
    rows.add(stored);
    return stored;
  }

  @Override
  public synchronized Optional<IdentityRecord> findById(long id) {
    return rows.stream().filter(row -> row.id() == id).findFirst();
  }

  @Override
  public synchronized Optional<IdentityRecord> findByEmail(String email) {
    return rows.stream().filter(row -> Objects.equals(row.email(), email)).findFirst();
  }

  @Override
  public synchronized Optional<IdentityRecord> findByProvider(
      String providerName, String providerSubjectId) {
    return rows.stream()
        .filter(
            row ->
                Objects.equals(row.providerName(), providerName)
                    && Objects.equals(row.providerSubjectId(), providerSubjectId))
        .findFirst();
  }

  @Override
  public synchronized IdentityRecord update(IdentityRecord identity) {
    checkUnique(identity, identity.id());
    rows.replaceAll(row -> row.id().equals(identity.id()) ? identity : row);
    return identity;
  }

  @Override
  public synchronized int updateProviderTokens(
      long id, String accessToken, String refreshToken, Instant updatedAt) {
    final Optional<IdentityRecord> current = findById(id);
    if (current.isEmpty()) {
      return 0;
    }
    final IdentityRecord row = current.get();
    update(
        new IdentityRecord(
            row.id(),
            row.email(),
            row.credentialDigest(),
            row.providerName(),
            row.providerSubjectId(),
            accessToken,
            refreshToken == null ? row.providerRefreshToken() : refreshToken,
            row.createdAt(),
            updatedAt));
    return 1;
  }

  private void checkUnique(IdentityRecord identity, Long ownId) {
    for (IdentityRecord row : rows) {
      if (row.id().equals(ownId)) {
        continue;
      }
      if (identity.email() != null && identity.email().equals(row.email())) {
        throw new DuplicateKeyException("uq_identities_email");
      }
      if (identity.hasProviderIdentity()
          && identity.providerName().equals(row.providerName())
          && identity.providerSubjectId().equals(row.providerSubjectId())) {
        throw new DuplicateKeyException("uq_identities_provider");
      }
    }
  }
}
