package com.setupbrain.repository.jpa;

import com.setupbrain.entity.DecisionLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the brain_logs table.
 *
 * <p>Used by DecisionArchiveService for batch persistence, by the REST API for per-cycle
 * history and by BrainCycleRunner to resume cycle numbering.
 */
@Repository
public interface DecisionLogJpaRepository extends JpaRepository<DecisionLogEntity, Long> {

    List<DecisionLogEntity> findByCycleNumberOrderByTimestampAsc(Long cycleNumber);

    @Query("SELECT MAX(d.cycleNumber) FROM DecisionLogEntity d")
    Long findMaxCycleNumber();
}
