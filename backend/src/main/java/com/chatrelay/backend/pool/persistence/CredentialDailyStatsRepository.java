package com.chatrelay.backend.pool.persistence;

import com.chatrelay.backend.pool.domain.CredentialDailyStats;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CredentialDailyStatsRepository extends JpaRepository<CredentialDailyStats, Long> {

  Optional<CredentialDailyStats> findByCredentialIdAndStatDate(
      Long credentialId, LocalDate statDate);

  List<CredentialDailyStats> findByStatDateOrderByCredentialIdAsc(LocalDate statDate);

  @Modifying
  @Query(
      value =
          """
          INSERT INTO credential_daily_stats
              (credential_id, stat_date, tokens_in, tokens_out, cache_creation_tokens,
               cache_read_tokens, request_count, error_count, cost_units)
          VALUES (:credentialId, :statDate, :tokensIn, :tokensOut, :cacheCreation, :cacheRead,
                  1, 0, 0)
          ON CONFLICT (credential_id, stat_date) DO UPDATE SET
              tokens_in = credential_daily_stats.tokens_in + EXCLUDED.tokens_in,
              tokens_out = credential_daily_stats.tokens_out + EXCLUDED.tokens_out,
              cache_creation_tokens =
                  credential_daily_stats.cache_creation_tokens + EXCLUDED.cache_creation_tokens,
              cache_read_tokens =
                  credential_daily_stats.cache_read_tokens + EXCLUDED.cache_read_tokens,
              request_count = credential_daily_stats.request_count + 1
          """,
      nativeQuery = true)
  int upsertSuccess(
      @Param("credentialId") Long credentialId,
      @Param("statDate") LocalDate statDate,
      @Param("tokensIn") long tokensIn,
      @Param("tokensOut") long tokensOut,
      @Param("cacheCreation") long cacheCreation,
      @Param("cacheRead") long cacheRead);

  @Modifying
  @Query(
      value =
          """
          INSERT INTO credential_daily_stats
              (credential_id, stat_date, tokens_in, tokens_out, cache_creation_tokens,
               cache_read_tokens, request_count, error_count, cost_units)
          VALUES (:credentialId, :statDate, 0, 0, 0, 0, 0, 1, 0)
          ON CONFLICT (credential_id, stat_date) DO UPDATE SET
              error_count = credential_daily_stats.error_count + 1
          """,
      nativeQuery = true)
  int upsertError(@Param("credentialId") Long credentialId, @Param("statDate") LocalDate statDate);

  @Modifying
  @Query(
      value =
          """
          INSERT INTO credential_daily_stats
              (credential_id, stat_date, tokens_in, tokens_out, cache_creation_tokens,
               cache_read_tokens, request_count, error_count, cost_units)
          VALUES (:credentialId, :statDate, 0, 0, 0, 0, 0, 0, :costUnits)
          ON CONFLICT (credential_id, stat_date) DO UPDATE SET
              cost_units = credential_daily_stats.cost_units + EXCLUDED.cost_units
          """,
      nativeQuery = true)
  int upsertCost(
      @Param("credentialId") Long credentialId,
      @Param("statDate") LocalDate statDate,
      @Param("costUnits") long costUnits);
}
