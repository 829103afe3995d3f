package com.setupbrain.repository.jpa;

import com.setupbrain.entity.OpenTradeEntity;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the paper_open_trades slot.
 *
 * <p>Updates and deletes return the affected row count so the ledger can tell when the
 * position it is writing has already been closed.
 */
@Repository
public interface OpenTradeJpaRepository extends JpaRepository<OpenTradeEntity, String> {

    List<OpenTradeEntity> findAllByOrderByOpenedAtDesc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE OpenTradeEntity o SET o.highWaterMark = :high, o.lowWaterMark = :low WHERE o.id = :id")
    int updateWaterMarks(@Param("id") String id, @Param("high") BigDecimal high, @Param("low") BigDecimal low);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM OpenTradeEntity o WHERE o.id = :id")
    int deleteOpenTrade(@Param("id") String id);
}
