package com.setupbrain.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.DecisionOutcome;
import com.setupbrain.domain.enums.DecisionSeverity;
import com.setupbrain.domain.enums.DecisionSource;
import com.setupbrain.domain.enums.DecisionStatus;
import com.setupbrain.domain.enums.DecisionType;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.model.CycleSummary;
import com.setupbrain.domain.model.DecisionRecord;
import com.setupbrain.domain.vo.Decision;
import com.setupbrain.domain.vo.SetupCandidate;
import com.setupbrain.entity.DecisionLogEntity;
import com.setupbrain.mapper.DecisionLogMapper;
import com.setupbrain.observability.DecisionArchiveService;
import com.setupbrain.observability.DecisionLogger;
import com.setupbrain.repository.jpa.DecisionLogJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for DecisionArchiveService: what a brain cycle leaves in brain_logs,
 * write ordering, the pause after repeated failures and the shutdown drain.
 */
class DecisionArchiveServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    private DecisionLogJpaRepository decisionLogJpaRepository;
    private Clock clock;
    private DecisionArchiveService decisionArchiveService;

    @BeforeEach
    void setUp() {
        decisionLogJpaRepository = mock(DecisionLogJpaRepository.class);
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0);
        decisionArchiveService = new DecisionArchiveService(
                decisionLogJpaRepository, Mappers.getMapper(DecisionLogMapper.class), clock);
    }

    private static DecisionRecord cycleEntry(long cycleNumber, String reasoning) {
        return DecisionRecord.builder()
                .timestamp(LocalDateTime.of(2024, 3, 1, 8, 0))
                .source(DecisionSource.BRAIN_CYCLE)
                .sourceId("cycle-" + cycleNumber)
                .decisionType(DecisionType.CYCLE_COMPLETED)
                .outcome(DecisionOutcome.INFO)
                .reasoning(reasoning)
                .dataContext(Map.of("pairsEvaluated", 4))
                .severity(DecisionSeverity.INFO)
                .sessionDate(LocalDate.of(2024, 3, 1))
                .cycleNumber(cycleNumber)
                .build();
    }

    private static Decision rejectedDecision() {
        SetupCandidate candidate = SetupCandidate.builder()
                .symbol("ETHUSDT")
                .timeframe(CandleInterval.ONE_DAY)
                .setupType(SetupType.TREND_ACCELERATION)
                .confidence(ConfidenceTier.MEDIUM)
                .direction(TradeDirection.SHORT)
                .detectedAt(T0)
                .build();
        return Decision.builder()
                .decisionId("ETHUSDT:1d:trend_acceleration:1709251200000")
                .candidate(candidate)
                .score(25)
                .status(DecisionStatus.REJECT)
                .tier(ConfidenceTier.LOW)
                .justification("Setup rejected: score 25 below threshold 50; buckets: trend_alignment")
                .firedBuckets(List.of("trend_alignment"))
                .direction(TradeDirection.SHORT)
                .entryPrice(new BigDecimal("3000"))
                .stopPrice(new BigDecimal("3100"))
                .build();
    }

    @SuppressWarnings("unchecked")
    private List<DecisionLogEntity> lastWrite() {
        ArgumentCaptor<List<DecisionLogEntity>> captor = ArgumentCaptor.forClass(List.class);
        verify(decisionLogJpaRepository).saveAll(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("What a cycle archives")
    class CycleContents {

        @Test
        @DisplayName("rejected setup decisions reach brain_logs alongside the cycle summary")
        void rejectedDecisionArchived() {
            DecisionLogger decisionLogger =
                    new DecisionLogger(mock(ApplicationEventPublisher.class), decisionArchiveService);

            decisionLogger.logSetupDecision(rejectedDecision(), 12L);
            decisionLogger.logCycleSummary(CycleSummary.builder()
                    .cycleNumber(12)
                    .startedAt(T0)
                    .finishedAt(T0)
                    .pairsEvaluated(1)
                    .candidates(1)
                    .rejected(1)
                    .build());
            decisionArchiveService.flush();

            List<DecisionLogEntity> written = lastWrite();
            assertThat(written).hasSize(2);
            assertThat(written.get(0).getOutcome()).isEqualTo(DecisionOutcome.REJECTED);
            assertThat(written.get(0).getSeverity()).isEqualTo(DecisionSeverity.DEBUG);
            assertThat(written.get(0).getSourceId()).isEqualTo("ETHUSDT:1d:trend_acceleration:1709251200000");
            assertThat(written.get(0).getDataContext()).contains("\"score\":25");
            assertThat(written.get(1).getDecisionType()).isEqualTo(DecisionType.CYCLE_COMPLETED);
            assertThat(written).allSatisfy(entity -> assertThat(entity.getCycleNumber()).isEqualTo(12L));
        }

        @Test
        @DisplayName("the highest written cycle number is tracked")
        void lastArchivedCycle() {
            decisionArchiveService.queue(cycleEntry(7, "Cycle 7"));
            decisionArchiveService.queue(cycleEntry(8, "Cycle 8"));

            assertThat(decisionArchiveService.getLastArchivedCycle()).isZero();
            decisionArchiveService.flush();

            assertThat(decisionArchiveService.getLastArchivedCycle()).isEqualTo(8L);
        }

        @Test
        @DisplayName("empty queue writes nothing")
        void emptyQueue() {
            decisionArchiveService.flush();

            verify(decisionLogJpaRepository, never()).saveAll(anyList());
        }

        @Test
        @DisplayName("one flush writes at most one batch of 200")
        void batchLimit() {
            for (int i = 0; i < 230; i++) {
                decisionArchiveService.queue(cycleEntry(1, "entry " + i));
            }

            decisionArchiveService.flush();

            assertThat(lastWrite()).hasSize(200);
            assertThat(decisionArchiveService.getPendingCount()).isEqualTo(30);
        }
    }

    @Nested
    @DisplayName("Write failures")
    class WriteFailures {

        @Test
        @DisplayName("a failed batch goes back ahead of newer records")
        void failedBatchKeepsOrder() {
            doThrow(new IllegalStateException("db down"))
                    .doReturn(List.of())
                    .when(decisionLogJpaRepository)
                    .saveAll(anyList());
            decisionArchiveService.queue(cycleEntry(3, "first"));
            decisionArchiveService.flush();
            decisionArchiveService.queue(cycleEntry(4, "second"));

            decisionArchiveService.flush();

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<DecisionLogEntity>> captor = ArgumentCaptor.forClass(List.class);
            verify(decisionLogJpaRepository, times(2)).saveAll(captor.capture());
            assertThat(captor.getAllValues().get(1))
                    .extracting(DecisionLogEntity::getReasoning)
                    .containsExactly("first", "second");
            assertThat(decisionArchiveService.getFailuresInRow()).isZero();
        }

        @Test
        @DisplayName("three failures in a row pause writes for the recovery window")
        void pausesAfterThreeFailures() {
            doThrow(new IllegalStateException("db down")).when(decisionLogJpaRepository).saveAll(anyList());
            decisionArchiveService.queue(cycleEntry(5, "Cycle 5"));

            for (int i = 0; i < 3; i++) {
                decisionArchiveService.flush();
            }
            decisionArchiveService.flush();

            assertThat(decisionArchiveService.isPaused()).isTrue();
            assertThat(decisionArchiveService.getPendingCount()).isOne();
            verify(decisionLogJpaRepository, times(3)).saveAll(anyList());
        }

        @Test
        @DisplayName("writes resume once the recovery window has passed")
        void resumesAfterWindow() {
            doThrow(new IllegalStateException("db down"))
                    .doThrow(new IllegalStateException("db down"))
                    .doThrow(new IllegalStateException("db down"))
                    .doReturn(List.of())
                    .when(decisionLogJpaRepository)
                    .saveAll(anyList());
            decisionArchiveService.queue(cycleEntry(5, "Cycle 5"));
            for (int i = 0; i < 3; i++) {
                decisionArchiveService.flush();
            }

            when(clock.instant()).thenReturn(T0.plusSeconds(61));
            decisionArchiveService.flush();

            assertThat(decisionArchiveService.isPaused()).isFalse();
            assertThat(decisionArchiveService.getFailuresInRow()).isZero();
            assertThat(decisionArchiveService.getPendingCount()).isZero();
            assertThat(decisionArchiveService.getLastArchivedCycle()).isEqualTo(5L);
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("drain writes every batch even while paused")
        void drainIgnoresPause() {
            doThrow(new IllegalStateException("db down"))
                    .doThrow(new IllegalStateException("db down"))
                    .doThrow(new IllegalStateException("db down"))
                    .doReturn(List.of())
                    .when(decisionLogJpaRepository)
                    .saveAll(anyList());
            decisionArchiveService.queue(cycleEntry(1, "seed"));
            for (int i = 0; i < 3; i++) {
                decisionArchiveService.flush();
            }
            for (int i = 0; i < 449; i++) {
                decisionArchiveService.queue(cycleEntry(2, "entry " + i));
            }

            decisionArchiveService.drainOnShutdown();

            verify(decisionLogJpaRepository, times(6)).saveAll(anyList());
            assertThat(decisionArchiveService.getPendingCount()).isZero();
        }

        @Test
        @DisplayName("drain stops at the first failed batch")
        void drainStopsOnFailure() {
            doThrow(new IllegalStateException("db down")).when(decisionLogJpaRepository).saveAll(anyList());
            for (int i = 0; i < 250; i++) {
                decisionArchiveService.queue(cycleEntry(1, "entry " + i));
            }

            decisionArchiveService.drainOnShutdown();

            verify(decisionLogJpaRepository, times(1)).saveAll(anyList());
            assertThat(decisionArchiveService.getPendingCount()).isEqualTo(250);
        }
    }
}
