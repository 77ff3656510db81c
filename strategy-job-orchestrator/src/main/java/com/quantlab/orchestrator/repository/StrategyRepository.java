package com.quantlab.orchestrator.repository;

import com.quantlab.orchestrator.domain.Strategy;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for strategies that own jobs.
 */
@Repository
public interface StrategyRepository extends JpaRepository<Strategy, Long> {

    /**
     * Lock the strategy row so that job creation for the same strategy is serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Strategy s WHERE s.id = :id")
    Optional<Strategy> findByIdForUpdate(@Param("id") Long id);
}
