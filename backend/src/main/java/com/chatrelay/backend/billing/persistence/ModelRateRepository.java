package com.chatrelay.backend.billing.persistence;

import com.chatrelay.backend.billing.domain.ModelRate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ModelRateRepository extends JpaRepository<ModelRate, String> {

  Optional<ModelRate> findByModelIdAndEnabledTrue(String modelId);
}
