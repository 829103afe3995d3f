package com.setupbrain.service;

import com.setupbrain.domain.model.SetupRecord;
import com.setupbrain.entity.SetupRecordEntity;
import com.setupbrain.exception.PersistenceException;
import com.setupbrain.mapper.SetupRecordMapper;
import com.setupbrain.repository.jpa.SetupRecordJpaRepository;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and writes rows of the setups_forming table.
 *
 * <p>Writes are upserts keyed by (symbol, timeframe, setup_type). Any storage failure
 * is rethrown as {@link PersistenceException} carrying the setup identity.
 */
@Service
public class SetupRecordService {

    private static final Logger log = LoggerFactory.getLogger(SetupRecordService.class);

    private final SetupRecordJpaRepository setupRecordJpaRepository;
    private final SetupRecordMapper setupRecordMapper;

    public SetupRecordService(
            SetupRecordJpaRepository setupRecordJpaRepository, SetupRecordMapper setupRecordMapper) {
        this.setupRecordJpaRepository = setupRecordJpaRepository;
        this.setupRecordMapper = setupRecordMapper;
    }

    /**
     * Inserts the record, or updates the existing row with the same identity.
     */
    @Transactional
    public SetupRecord upsert(SetupRecord setupRecord) {
        try {
            SetupRecordEntity entity = setupRecordJpaRepository
                    .findBySymbolAndTimeframeAndSetupType(
                            setupRecord.getSymbol(), setupRecord.getTimeframe(), setupRecord.getSetupType())
                    .map(existing -> {
                        setupRecordMapper.updateEntity(setupRecord, existing);
                        return existing;
                    })
                    .orElseGet(() -> setupRecordMapper.toEntity(setupRecord));
            entity.setUpdatedAt(Instant.now());

            SetupRecordEntity saved = setupRecordJpaRepository.save(entity);
            log.debug(
                    "Setup record saved: id={} {} {} {} confidence={}",
                    saved.getId(),
                    saved.getSymbol(),
                    saved.getTimeframe(),
                    saved.getSetupType(),
                    saved.getConfidence());
            return setupRecordMapper.toDomain(saved);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to save setup record: " + e.getMessage(), identity(setupRecord), e);
        }
    }

    public List<SetupRecord> findAll() {
        try {
            return setupRecordMapper.toDomainList(setupRecordJpaRepository.findAllByOrderByUpdatedAtDesc());
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to load setup records: " + e.getMessage(), Map.of(), e);
        }
    }

    public List<SetupRecord> findBySymbol(String symbol) {
        return setupRecordMapper.toDomainList(setupRecordJpaRepository.findBySymbolOrderByUpdatedAtDesc(symbol));
    }

    private static Map<String, Object> identity(SetupRecord setupRecord) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", setupRecord.getSymbol());
        details.put("timeframe", setupRecord.getTimeframe());
        details.put("setupType", String.valueOf(setupRecord.getSetupType()));
        details.put("confidence", String.valueOf(setupRecord.getConfidence()));
        return details;
    }
}
