package com.openforge.devgauge.plan;

import com.openforge.devgauge.domain.UsageRecord;
import com.openforge.devgauge.repository.UsageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UsageServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final PlanCatalog catalog = new PlanCatalog();

    private UsageRepository repository;
    private UsageService service;

    @BeforeEach
    void setUp() {
        repository = mock(UsageRepository.class);
        service = new UsageService(repository, catalog, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private UsageRecord record(String plan, int messages, Instant periodStart) {
        UsageRecord record = UsageRecord.builder()
                .userId("alice").planId(plan).messages(messages).periodStart(periodStart).build();
        when(repository.findByUserId("alice")).thenReturn(Optional.of(record));
        return record;
    }

    @Test
    void shouldAllowUnderLimitOnPrimaryModel() {
        record(PlanCatalog.STUDENT, 10, NOW.minusSeconds(3600));

        UsageDecision decision = service.checkLimit("alice", UsageType.MESSAGES);

        assertTrue(decision.allowed());
        assertFalse(decision.usingFallback());
        assertEquals(catalog.get(PlanCatalog.STUDENT).primaryModel(), decision.model());
        assertEquals(50, decision.limit());
    }

    @Test
    void shouldServeFallbackModelToFreePlanOverLimit() {
        record(PlanCatalog.FREE, 20, NOW.minusSeconds(3600));

        UsageDecision decision = service.checkLimit("alice", UsageType.MESSAGES);

        assertTrue(decision.allowed());
        assertTrue(decision.usingFallback());
        assertEquals(catalog.get(PlanCatalog.FREE).fallbackModel(), decision.model());
    }

    @Test
    void shouldBlockPaidPlanOverLimit() {
        record(PlanCatalog.STUDENT, 50, NOW.minusSeconds(3600));

        UsageDecision decision = service.checkLimit("alice", UsageType.MESSAGES);

        assertFalse(decision.allowed());
        assertNull(decision.model());
    }

    @Test
    void shouldTreatMissingLimitAsUnlimited() {
        record(PlanCatalog.PRO, 0, NOW.minusSeconds(3600));

        UsageDecision decision = service.checkLimit("alice", UsageType.PROJECT_CHATS);

        assertTrue(decision.allowed());
        assertNull(decision.limit());
    }

    @Test
    void shouldResetCountersWhenPeriodExpired() {
        UsageRecord stale = record(PlanCatalog.STUDENT, 50, NOW.minus(UsageService.PERIOD).minusSeconds(1));

        UsageDecision decision = service.checkLimit("alice", UsageType.MESSAGES);

        assertTrue(decision.allowed());
        assertEquals(0, decision.current());
        assertEquals(NOW, stale.getPeriodStart());
        verify(repository).save(stale);
    }

    @Test
    void shouldAllowOnFreePrimaryWhenStoreFails() {
        when(repository.findByUserId("alice")).thenThrow(new IllegalStateException("db down"));

        UsageDecision decision = service.checkLimit("alice", UsageType.REANALYZES);

        assertTrue(decision.allowed());
        assertEquals(catalog.get(PlanCatalog.FREE).primaryModel(), decision.model());
        assertEquals(PlanCatalog.FREE, service.planFor("alice").id());
    }

    @Test
    void shouldIncrementOnlyTheRequestedCounter() {
        UsageRecord current = record(PlanCatalog.PRO, 4, NOW.minusSeconds(60));

        service.increment("alice", UsageType.MESSAGES);

        assertEquals(5, current.getMessages());
        assertEquals(0, current.getReanalyzes());
        verify(repository).save(current);
    }

    @Test
    void shouldResolveUnknownPlanToFree() {
        record("enterprise", 0, NOW);

        assertEquals(PlanCatalog.FREE, service.planFor("alice").id());
        verify(repository, never()).save(any());
    }
}
