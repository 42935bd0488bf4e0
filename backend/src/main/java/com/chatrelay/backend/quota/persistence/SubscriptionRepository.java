package com.chatrelay.backend.quota.persistence;

import com.chatrelay.backend.quota.domain.Subscription;
import com.chatrelay.backend.quota.domain.SubscriptionStatus;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

  /** Ids only, so the row is first materialised by the locking read. */
  @Query(
      """
      select s.id from Subscription s
       where s.tenantId = :tenantId
         and s.status = :status
         and s.startsAt <= :now
         and s.expiresAt > :now
       order by s.createdAt asc, s.id asc
      """)
  List<Long> findActiveIds(
      @Param("tenantId") UUID tenantId,
      @Param("status") SubscriptionStatus status,
      @Param("now") Instant now);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select s from Subscription s join fetch s.plan where s.id = :id")
  Optional<Subscription> findByIdForUpdate(@Param("id") Long id);

  @Query(
      """
      select s from Subscription s
       where s.plan.id = :planId
         and s.status = com.chatrelay.backend.quota.domain.SubscriptionStatus.ACTIVE
         and s.expiresAt > :now
      """)
  List<Subscription> findActiveByPlan(@Param("planId") Long planId, @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      update Subscription s
         set s.status = com.chatrelay.backend.quota.domain.SubscriptionStatus.EXPIRED
       where s.tenantId = :tenantId
         and s.status = com.chatrelay.backend.quota.domain.SubscriptionStatus.ACTIVE
         and s.expiresAt <= :now
      """)
  int expireEnded(@Param("tenantId") UUID tenantId, @Param("now") Instant now);
}
