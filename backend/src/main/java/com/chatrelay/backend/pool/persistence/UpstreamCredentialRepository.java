package com.chatrelay.backend.pool.persistence;

import com.chatrelay.backend.pool.domain.CredentialHealth;
import com.chatrelay.backend.pool.domain.UpstreamCredential;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface UpstreamCredentialRepository extends JpaRepository<UpstreamCredential, Long> {

  List<UpstreamCredential> findAllByOrderByPriorityDescIdAsc();

  @Modifying
  @Query(
      """
      update UpstreamCredential c
         set c.health = :health,
             c.consecutiveErrors = :consecutiveErrors,
             c.lastError = :lastError,
             c.lastErrorAt = :lastErrorAt,
             c.updatedAt = :updatedAt
       where c.id = :id
      """)
  int updateHealth(
      @Param("id") Long id,
      @Param("health") CredentialHealth health,
      @Param("consecutiveErrors") int consecutiveErrors,
      @Param("lastError") String lastError,
      @Param("lastErrorAt") Instant lastErrorAt,
      @Param("updatedAt") Instant updatedAt);

  @Modifying
  @Query(
      """
      update UpstreamCredential c
         set c.health = :health,
             c.consecutiveErrors = 0,
             c.updatedAt = :updatedAt
       where c.id = :id
      """)
  int markHealthy(
      @Param("id") Long id,
      @Param("health") CredentialHealth health,
      @Param("updatedAt") Instant updatedAt);
}
