package com.chatrelay.backend.quota.persistence;

import com.chatrelay.backend.quota.domain.SubscriptionPlan;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, Long> {

  Optional<SubscriptionPlan> findByCode(String code);
}
