package com.setupbrain.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.model.SetupRecord;
import com.setupbrain.entity.SetupRecordEntity;
import com.setupbrain.exception.PersistenceException;
import com.setupbrain.mapper.SetupRecordMapper;
import com.setupbrain.repository.jpa.SetupRecordJpaRepository;
import com.setupbrain.service.SetupRecordService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for SetupRecordService.
 */
class SetupRecordServiceTest {

    private SetupRecordJpaRepository setupRecordJpaRepository;
    private SetupRecordService setupRecordService;

    @BeforeEach
    void setUp() {
        setupRecordJpaRepository = mock(SetupRecordJpaRepository.class);
        setupRecordService =
                new SetupRecordService(setupRecordJpaRepository, Mappers.getMapper(SetupRecordMapper.class));
        when(setupRecordJpaRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    private static SetupRecord record(ConfidenceTier confidence) {
        return SetupRecord.builder()
                .symbol("BTCUSDT")
                .timeframe("4h")
                .setupType(SetupType.TREND_ACCELERATION)
                .status("FORMING")
                .confidence(confidence)
                .detectedAt(Instant.parse("2024-03-01T00:00:00Z"))
                .context("Fast MA stretch")
                .marketContext("NORMAL")
                .build();
    }

    @Test
    void upsert_newIdentity_insertsRow() {
        when(setupRecordJpaRepository.findBySymbolAndTimeframeAndSetupType(
                        "BTCUSDT", "4h", SetupType.TREND_ACCELERATION))
                .thenReturn(Optional.empty());

        SetupRecord saved = setupRecordService.upsert(record(ConfidenceTier.LOW));

        ArgumentCaptor<SetupRecordEntity> captor = ArgumentCaptor.forClass(SetupRecordEntity.class);
        verify(setupRecordJpaRepository).save(captor.capture());
        assertThat(captor.getValue().getId()).isNull();
        assertThat(captor.getValue().getUpdatedAt()).isNotNull();
        assertThat(saved.getConfidence()).isEqualTo(ConfidenceTier.LOW);
    }

    @Test
    void upsert_existingIdentity_updatesSameRow() {
        SetupRecordEntity existing = Mappers.getMapper(SetupRecordMapper.class).toEntity(record(ConfidenceTier.LOW));
        existing.setId(17L);
        when(setupRecordJpaRepository.findBySymbolAndTimeframeAndSetupType(
                        "BTCUSDT", "4h", SetupType.TREND_ACCELERATION))
                .thenReturn(Optional.of(existing));

        SetupRecord saved = setupRecordService.upsert(record(ConfidenceTier.HIGH));

        assertThat(saved.getId()).isEqualTo(17L);
        assertThat(saved.getConfidence()).isEqualTo(ConfidenceTier.HIGH);
    }

    @Test
    void upsert_storageFailure_carriesIdentity() {
        when(setupRecordJpaRepository.findBySymbolAndTimeframeAndSetupType(any(), any(), any()))
                .thenThrow(new IllegalStateException("table locked"));

        assertThatThrownBy(() -> setupRecordService.upsert(record(ConfidenceTier.MEDIUM)))
                .isInstanceOfSatisfying(PersistenceException.class, e -> {
                    assertThat(e.getDetails()).containsEntry("symbol", "BTCUSDT");
                    assertThat(e.getDetails()).containsEntry("timeframe", "4h");
                    assertThat(e.getDetails()).containsEntry("setupType", "TREND_ACCELERATION");
                });
    }

    @Test
    void findAll_storageFailure_wrapped() {
        when(setupRecordJpaRepository.findAllByOrderByUpdatedAtDesc()).thenThrow(new IllegalStateException("down"));

        assertThatThrownBy(() -> setupRecordService.findAll()).isInstanceOf(PersistenceException.class);
    }

    @Test
    void findBySymbol_mapsRows() {
        when(setupRecordJpaRepository.findBySymbolOrderByUpdatedAtDesc("BTCUSDT"))
                .thenReturn(List.of(Mappers.getMapper(SetupRecordMapper.class).toEntity(record(ConfidenceTier.MEDIUM))));

        assertThat(setupRecordService.findBySymbol("BTCUSDT"))
                .extracting(SetupRecord::getSetupType)
                .containsExactly(SetupType.TREND_ACCELERATION);
    }
}
