package com.setupbrain.unit.recorder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.RecordAction;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.model.SetupRecord;
import com.setupbrain.domain.vo.RecordingStats;
import com.setupbrain.domain.vo.SetupCandidate;
import com.setupbrain.domain.vo.SetupKey;
import com.setupbrain.exception.PersistenceException;
import com.setupbrain.recorder.SetupRecorder;
import com.setupbrain.service.SetupRecordService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for SetupRecorder: create/update/skip classification against the
 * last-known cache, cache seeding and retry of failed writes.
 */
class SetupRecorderTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private SetupRecordService setupRecordService;
    private SetupRecorder setupRecorder;

    @BeforeEach
    void setUp() {
        setupRecordService = mock(SetupRecordService.class);
        when(setupRecordService.findAll()).thenReturn(List.of());
        when(setupRecordService.upsert(any())).thenAnswer(inv -> inv.getArgument(0));
        setupRecorder = new SetupRecorder(setupRecordService);
    }

    private static SetupCandidate candidate(String symbol, SetupType setupType, ConfidenceTier confidence) {
        return SetupCandidate.builder()
                .symbol(symbol)
                .timeframe(CandleInterval.FOUR_HOURS)
                .setupType(setupType)
                .confidence(confidence)
                .direction(TradeDirection.LONG)
                .context("test context")
                .detectedAt(T0)
                .build();
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("First sighting of each identity creates a record")
        void firstSightingCreates() {
            RecordingStats stats = setupRecorder.record(List.of(
                    candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM),
                    candidate("ETHUSDT", SetupType.VOLATILITY_EXPANSION, ConfidenceTier.LOW)));

            assertThat(stats.getCreated()).isEqualTo(2);
            assertThat(stats.getUpdated()).isZero();
            assertThat(stats.getSkipped()).isZero();
            assertThat(stats.getFailed()).isZero();
            verify(setupRecordService, times(2)).upsert(any());
        }

        @Test
        @DisplayName("Written record carries the setup identity, FORMING status and NORMAL market context")
        void writtenRecordContents() {
            setupRecorder.record(List.of(candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.HIGH)));

            ArgumentCaptor<SetupRecord> captor = ArgumentCaptor.forClass(SetupRecord.class);
            verify(setupRecordService).upsert(captor.capture());
            SetupRecord written = captor.getValue();
            assertThat(written.getSymbol()).isEqualTo("BTCUSDT");
            assertThat(written.getTimeframe()).isEqualTo("4h");
            assertThat(written.getSetupType()).isEqualTo(SetupType.RANGE_BREAK_ATTEMPT);
            assertThat(written.getStatus()).isEqualTo("FORMING");
            assertThat(written.getConfidence()).isEqualTo(ConfidenceTier.HIGH);
            assertThat(written.getDetectedAt()).isEqualTo(T0);
            assertThat(written.getContext()).isEqualTo("test context");
            assertThat(written.getMarketContext()).isEqualTo("NORMAL");
        }

        @Test
        @DisplayName("Repeating identical candidates writes nothing")
        void repeatSkips() {
            List<SetupCandidate> candidates =
                    List.of(candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM));
            setupRecorder.record(candidates);

            RecordingStats second = setupRecorder.record(candidates);

            assertThat(second.getSkipped()).isEqualTo(1);
            assertThat(second.getWrites()).isZero();
            verify(setupRecordService, times(1)).upsert(any());
        }

        @Test
        @DisplayName("Confidence change on a known identity is an update")
        void confidenceChangeUpdates() {
            setupRecorder.record(List.of(candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM)));

            RecordingStats stats = setupRecorder.record(
                    List.of(candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.HIGH)));

            assertThat(stats.getUpdated()).isEqualTo(1);
            assertThat(stats.getCreated()).isZero();
            assertThat(setupRecorder.snapshot())
                    .containsEntry(
                            SetupKey.of("BTCUSDT", CandleInterval.FOUR_HOURS, SetupType.RANGE_BREAK_ATTEMPT),
                            ConfidenceTier.HIGH);
        }

        @Test
        @DisplayName("Same symbol with a different setup type is a separate identity")
        void differentSetupTypeIsNewIdentity() {
            setupRecorder.record(List.of(candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM)));

            assertThat(setupRecorder.classify(
                            candidate("BTCUSDT", SetupType.TREND_ACCELERATION, ConfidenceTier.MEDIUM)))
                    .isEqualTo(RecordAction.CREATE);
        }

        @Test
        @DisplayName("Empty candidate list records nothing")
        void emptyList() {
            RecordingStats stats = setupRecorder.record(List.of());

            assertThat(stats).isEqualTo(RecordingStats.empty());
            verify(setupRecordService, never()).upsert(any());
        }
    }

    @Nested
    @DisplayName("Write failures")
    class WriteFailures {

        @Test
        @DisplayName("Failed write is counted and leaves the cache unchanged")
        void failedWriteCounted() {
            when(setupRecordService.upsert(any()))
                    .thenThrow(new PersistenceException("db down", Map.of(), new RuntimeException("db down")));

            RecordingStats stats = setupRecorder.record(
                    List.of(candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM)));

            assertThat(stats.getFailed()).isEqualTo(1);
            assertThat(stats.getCreated()).isZero();
            assertThat(setupRecorder.snapshot()).isEmpty();
        }

        @Test
        @DisplayName("Failed write is retried on the next cycle")
        void failedWriteRetried() {
            SetupCandidate btc = candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM);
            when(setupRecordService.upsert(any()))
                    .thenThrow(new PersistenceException("db down", Map.of(), new RuntimeException("db down")))
                    .thenAnswer(inv -> inv.getArgument(0));

            setupRecorder.record(List.of(btc));
            RecordingStats retry = setupRecorder.record(List.of(btc));

            assertThat(retry.getCreated()).isEqualTo(1);
            assertThat(retry.getFailed()).isZero();
            verify(setupRecordService, times(2)).upsert(any());
        }

        @Test
        @DisplayName("One failure does not stop the remaining candidates")
        void failureIsolated() {
            when(setupRecordService.upsert(any()))
                    .thenThrow(new PersistenceException("db down", Map.of(), new RuntimeException("db down")))
                    .thenAnswer(inv -> inv.getArgument(0));

            RecordingStats stats = setupRecorder.record(List.of(
                    candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM),
                    candidate("ETHUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM)));

            assertThat(stats.getFailed()).isEqualTo(1);
            assertThat(stats.getCreated()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Cache seeding")
    class CacheSeeding {

        @Test
        @DisplayName("Existing records seed the cache so unchanged setups are skipped")
        void seedsFromStore() {
            when(setupRecordService.findAll()).thenReturn(List.of(SetupRecord.builder()
                    .symbol("BTCUSDT")
                    .timeframe("4h")
                    .setupType(SetupType.RANGE_BREAK_ATTEMPT)
                    .status("FORMING")
                    .confidence(ConfidenceTier.MEDIUM)
                    .build()));

            assertThat(setupRecorder.loadExisting()).isEqualTo(1);

            RecordingStats stats = setupRecorder.record(
                    List.of(candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM)));
            assertThat(stats.getSkipped()).isEqualTo(1);
            verify(setupRecordService, never()).upsert(any());
        }

        @Test
        @DisplayName("Stored row with an unknown timeframe is skipped and the rest still load")
        void unknownTimeframeSkipped() {
            when(setupRecordService.findAll()).thenReturn(List.of(
                    SetupRecord.builder()
                            .id(3L)
                            .symbol("SOLUSDT")
                            .timeframe("7m")
                            .setupType(SetupType.TREND_ACCELERATION)
                            .status("FORMING")
                            .confidence(ConfidenceTier.LOW)
                            .build(),
                    SetupRecord.builder()
                            .id(4L)
                            .symbol("BTCUSDT")
                            .timeframe("4h")
                            .setupType(SetupType.RANGE_BREAK_ATTEMPT)
                            .status("FORMING")
                            .confidence(ConfidenceTier.MEDIUM)
                            .build()));

            assertThat(setupRecorder.loadExisting()).isEqualTo(1);

            RecordingStats stats = setupRecorder.record(List.of(
                    candidate("BTCUSDT", SetupType.RANGE_BREAK_ATTEMPT, ConfidenceTier.MEDIUM),
                    candidate("ETHUSDT", SetupType.VOLATILITY_EXPANSION, ConfidenceTier.LOW)));
            assertThat(stats.getSkipped()).isEqualTo(1);
            assertThat(stats.getCreated()).isEqualTo(1);
            verify(setupRecordService, times(1)).findAll();
        }

        @Test
        @DisplayName("Record call loads the cache lazily when startup loading did not happen")
        void lazyLoad() {
            setupRecorder.record(List.of());

            verify(setupRecordService).findAll();
        }

        @Test
        @DisplayName("Failed load returns zero and is retried by the next record call")
        void failedLoadRetried() {
            when(setupRecordService.findAll())
                    .thenThrow(new PersistenceException("db down", Map.of(), new RuntimeException("db down")))
                    .thenReturn(List.of());

            assertThat(setupRecorder.loadExisting()).isZero();
            setupRecorder.record(List.of());

            verify(setupRecordService, times(2)).findAll();
        }
    }
}
