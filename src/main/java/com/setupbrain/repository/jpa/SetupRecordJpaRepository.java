package com.setupbrain.repository.jpa;

import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.entity.SetupRecordEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the setups_forming table.
 */
@Repository
public interface SetupRecordJpaRepository extends JpaRepository<SetupRecordEntity, Long> {

    Optional<SetupRecordEntity> findBySymbolAndTimeframeAndSetupType(
            String symbol, String timeframe, SetupType setupType);

    List<SetupRecordEntity> findAllByOrderByUpdatedAtDesc();

    List<SetupRecordEntity> findBySymbolOrderByUpdatedAtDesc(String symbol);
}
