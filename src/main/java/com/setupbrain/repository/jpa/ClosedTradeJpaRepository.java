package com.setupbrain.repository.jpa;

import com.setupbrain.entity.ClosedTradeEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the paper_closed_trades history.
 */
@Repository
public interface ClosedTradeJpaRepository extends JpaRepository<ClosedTradeEntity, Long> {

    List<ClosedTradeEntity> findAllByOrderByClosedAtDesc(Pageable pageable);

    List<ClosedTradeEntity> findBySymbolOrderByClosedAtDesc(String symbol, Pageable pageable);
}
