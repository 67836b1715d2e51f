package com.example.auth.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.auth.model.IdentityRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Identity records keyed by id, email and provider identity.
 *
 * <p>Uniqueness of {@code email} and of {@code (provider_name, provider_subject_id)} is enforced by
 * the schema; violations surface as {@link org.springframework.dao.DuplicateKeyException}.
 */
@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class IdentityRepository {

  private static final String COLUMNS =
      """
      id, email, credential_digest, provider_name, provider_subject_id,
      provider_access_token, provider_refresh_token, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public IdentityRecord create(IdentityRecord identity) {
    if (!identity.hasAuthenticationMeans()) {
      throw new IllegalArgumentException("identity needs a credential or a provider identity");
    }
    final String sql =
        """
        INSERT INTO identities (email, credential_digest, provider_name, provider_subject_id,
                                provider_access_token, provider_refresh_token, created_at, updated_at)
        VALUES (:email, :credentialDigest, :providerName, :providerSubjectId,
                :providerAccessToken, :providerRefreshToken, :createdAt, :updatedAt)
        RETURNING
        """
            + COLUMNS;
    return jdbcTemplate.queryForObject(sql, toParams(identity), this::mapRow);
  }

  public Optional<IdentityRecord> findById(long id) {
    final String sql = "SELECT " + COLUMNS + " FROM identities WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<IdentityRecord> findByEmail(String email) {
    final String sql = "SELECT " + COLUMNS + " FROM identities WHERE email = :email";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("email", email);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<IdentityRecord> findByProvider(String providerName, String providerSubjectId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM identities
            WHERE provider_name = :providerName AND provider_subject_id = :providerSubjectId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("providerName", providerName)
            .addValue("providerSubjectId", providerSubjectId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public IdentityRecord update(IdentityRecord identity) {
    if (identity.id() == null) {
      throw new IllegalArgumentException("id is required");
    }
    if (!identity.hasAuthenticationMeans()) {
      throw new IllegalArgumentException("identity needs a credential or a provider identity");
    }
    final String sql =
        """
        UPDATE identities
        SET email = :email,
            credential_digest = :credentialDigest,
            provider_name = :providerName,
            provider_subject_id = :providerSubjectId,
            provider_access_token = :providerAccessToken,
            provider_refresh_token = :providerRefreshToken,
            updated_at = :updatedAt
        WHERE id = :id
        RETURNING
        """
            + COLUMNS;
    return jdbcTemplate.queryForObject(sql, toParams(identity), this::mapRow);
  }

  public int updateProviderTokens(
      long id, String accessToken, String refreshToken, Instant updatedAt) {
    final String sql =
        """
        UPDATE identities
        SET provider_access_token = :accessToken,
            provider_refresh_token = COALESCE(:refreshToken, provider_refresh_token),
            updated_at = :updatedAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("accessToken", accessToken)
            .addValue("refreshToken", refreshToken, Types.VARCHAR)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource toParams(IdentityRecord identity) {
    return new MapSqlParameterSource()
        .addValue("id", identity.id())
        .addValue("email", identity.email())
        .addValue("credentialDigest", identity.credentialDigest())
        .addValue("providerName", identity.providerName())
        .addValue("providerSubjectId", identity.providerSubjectId())
        .addValue("providerAccessToken", identity.providerAccessToken())
        .addValue("providerRefreshToken", identity.providerRefreshToken())
        .addValue("createdAt", toTimestamp(identity.createdAt()))
        .addValue("updatedAt", toTimestamp(identity.updatedAt()));
  }

  private IdentityRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new IdentityRecord(
        rs.getLong("id"),
        rs.getString("email"),
        rs.getString("credential_digest"),
        rs.getString("provider_name"),
        rs.getString("provider_subject_id"),
        rs.getString("provider_access_token"),
        rs.getString("provider_refresh_token"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
