package com.chatrelay.backend.quota.persistence;

import com.chatrelay.backend.quota.domain.TenantAccount;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TenantAccountRepository extends JpaRepository<TenantAccount, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select t from TenantAccount t where t.id = :id")
  Optional<TenantAccount> findByIdForUpdate(@Param("id") UUID id);
}
