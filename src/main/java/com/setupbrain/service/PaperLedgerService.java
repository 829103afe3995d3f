package com.setupbrain.service;

import com.setupbrain.domain.enums.PaperCycleAction;
import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.OpenPosition;
import com.setupbrain.domain.model.PaperAccount;
import com.setupbrain.domain.model.PaperCycleResult;
import com.setupbrain.domain.model.PaperTradingState;
import com.setupbrain.entity.OpenTradeEntity;
import com.setupbrain.entity.PaperAccountEntity;
import com.setupbrain.exception.LedgerConflictException;
import com.setupbrain.exception.PersistenceException;
import com.setupbrain.mapper.PaperTradeMapper;
import com.setupbrain.repository.jpa.ClosedTradeJpaRepository;
import com.setupbrain.repository.jpa.OpenTradeJpaRepository;
import com.setupbrain.repository.jpa.PaperAccountJpaRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable storage of the paper trading ledger.
 *
 * <p>Loads the account and the open position slot into a {@link PaperTradingState} and
 * writes back the result of a cycle in one transaction: a close removes the open trade,
 * appends the closed trade and updates the account together.
 */
@Service
public class PaperLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PaperLedgerService.class);

    private final PaperAccountJpaRepository paperAccountJpaRepository;
    private final OpenTradeJpaRepository openTradeJpaRepository;
    private final ClosedTradeJpaRepository closedTradeJpaRepository;
    private final PaperTradeMapper paperTradeMapper;

    public PaperLedgerService(
            PaperAccountJpaRepository paperAccountJpaRepository,
            OpenTradeJpaRepository openTradeJpaRepository,
            ClosedTradeJpaRepository closedTradeJpaRepository,
            PaperTradeMapper paperTradeMapper) {
        this.paperAccountJpaRepository = paperAccountJpaRepository;
        this.openTradeJpaRepository = openTradeJpaRepository;
        this.closedTradeJpaRepository = closedTradeJpaRepository;
        this.paperTradeMapper = paperTradeMapper;
    }

    /**
     * Loads the ledger, creating the account with {@code initialCapital} on first use.
     */
    @Transactional
    public PaperTradingState loadState(BigDecimal initialCapital) {
        PaperAccount account = paperAccountJpaRepository
                .findById(PaperAccountEntity.SINGLETON_ID)
                .map(paperTradeMapper::toDomain)
                .orElseGet(() -> createAccount(initialCapital));

        List<OpenTradeEntity> openTrades = openTradeJpaRepository.findAllByOrderByOpenedAtDesc();
        if (openTrades.size() > 1) {
            log.error(
                    "Found {} open paper trades, expected at most one. Using the most recent: {}",
                    openTrades.size(),
                    openTrades.get(0).getId());
        }
        OpenPosition position = openTrades.isEmpty() ? null : paperTradeMapper.toDomain(openTrades.get(0));
        return new PaperTradingState(account, position);
    }

    /**
     * Persists whatever the cycle changed. HELD only refreshes the water marks;
     * NONE and PRICE_UNAVAILABLE write nothing.
     *
     * <p>Every write is checked against the stored slot: opening into an occupied slot,
     * or holding or closing a position that is no longer stored, raises
     * {@link LedgerConflictException} and nothing is written.
     */
    @Transactional
    public void saveResult(PaperCycleResult result) {
        try {
            PaperCycleAction action = result.getAction();
            if (action == PaperCycleAction.OPENED) {
                if (openTradeJpaRepository.count() > 0) {
                    throw conflict("Open slot already taken", result.getOpened());
                }
                openTradeJpaRepository.save(paperTradeMapper.toEntity(result.getOpened()));
            } else if (action == PaperCycleAction.HELD) {
                OpenPosition position = result.getState().getPosition();
                int updated = openTradeJpaRepository.updateWaterMarks(
                        position.getId(), position.getHighWaterMark(), position.getLowWaterMark());
                if (updated == 0) {
                    throw conflict("Position is no longer open", position);
                }
            } else if (action == PaperCycleAction.CLOSED) {
                ClosedTrade closedTrade = result.getClosed();
                if (openTradeJpaRepository.deleteOpenTrade(closedTrade.getPositionId()) == 0) {
                    throw new LedgerConflictException(
                            "Position " + closedTrade.getPositionId() + " was already closed",
                            Map.of("positionId", closedTrade.getPositionId()));
                }
                closedTradeJpaRepository.save(paperTradeMapper.toEntity(closedTrade));
                saveAccount(result.getState().getAccount());
            }
        } catch (LedgerConflictException e) {
            log.warn("Paper ledger write rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException(
                    "Failed to persist paper trading result: " + e.getMessage(),
                    Map.of("action", String.valueOf(result.getAction())),
                    e);
        }
    }

    public List<ClosedTrade> findClosedTrades(int limit) {
        return paperTradeMapper.toClosedTradeList(
                closedTradeJpaRepository.findAllByOrderByClosedAtDesc(PageRequest.of(0, limit)));
    }

    public List<ClosedTrade> findClosedTrades(String symbol, int limit) {
        return paperTradeMapper.toClosedTradeList(
                closedTradeJpaRepository.findBySymbolOrderByClosedAtDesc(symbol, PageRequest.of(0, limit)));
    }

    private static LedgerConflictException conflict(String reason, OpenPosition position) {
        return new LedgerConflictException(
                reason + ": " + position.getId(),
                Map.of("positionId", position.getId(), "symbol", position.getSymbol()));
    }

    private PaperAccount createAccount(BigDecimal initialCapital) {
        PaperAccount account = PaperAccount.initial(initialCapital, Instant.now());
        saveAccount(account);
        log.info("Paper account initialised with capital {}", initialCapital.toPlainString());
        return account;
    }

    private void saveAccount(PaperAccount account) {
        PaperAccountEntity entity = paperTradeMapper.toEntity(account);
        entity.setId(PaperAccountEntity.SINGLETON_ID);
        paperAccountJpaRepository.save(entity);
    }
}
