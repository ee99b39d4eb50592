package com.chicu.forecastguard.record.persistence;

import com.chicu.forecastguard.retrain.RetrainDecision;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RetrainRunRepository extends JpaRepository<RetrainRunEntity, Long> {

    List<RetrainRunEntity> findTop50ByParameterOrderByCreatedAtDesc(String parameter);

    Optional<RetrainRunEntity> findTopByParameterOrderByCreatedAtDesc(String parameter);

    long countByParameterAndDecision(String parameter, RetrainDecision decision);
}
