package com.openforge.devgauge.memory;

import com.openforge.devgauge.auth.CurrentUser;
import com.openforge.devgauge.config.AppConfig;
import com.openforge.devgauge.domain.AgentStateRecord;
import com.openforge.devgauge.plan.PlanCapability;
import com.openforge.devgauge.plan.PlanCatalog;
import com.openforge.devgauge.repository.AgentStateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MemoryStoreTest {

    private static final String USER = "user-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final PlanCatalog catalog = new PlanCatalog();
    private final PlanCapability free = catalog.get(PlanCatalog.FREE);
    private final PlanCapability student = catalog.get(PlanCatalog.STUDENT);
    private final PlanCapability pro = catalog.get(PlanCatalog.PRO);

    private AgentStateRepository repository;
    private CurrentUser currentUser;
    private MemoryStore store;
    private final AtomicReference<AgentStateRecord> row = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        repository = mock(AgentStateRepository.class);
        currentUser = mock(CurrentUser.class);
        when(currentUser.is(USER)).thenReturn(true);
        when(repository.findByUserId(USER)).thenAnswer(inv -> Optional.ofNullable(row.get()));
        when(repository.save(any(AgentStateRecord.class))).thenAnswer(inv -> {
            row.set(inv.getArgument(0));
            return inv.getArgument(0);
        });

        store = new MemoryStore(repository, new AppConfig().objectMapper(), catalog, currentUser, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldIgnoreWritesForPlanWithoutMemory() {
        List<MemoryItem> result = store.addMemoryItem(USER, free, MemoryItem.of(MemoryType.GOAL, "ship it", null));

        assertTrue(result.isEmpty());
        verifyNoInteractions(repository);
        assertTrue(store.load(USER, free).isEmpty());
    }

    @Test
    void shouldRefuseOtherUsersState() {
        when(currentUser.is("someone-else")).thenReturn(false);

        store.addMemoryItem("someone-else", student, MemoryItem.of(MemoryType.GOAL, "ship it", null));
        store.deleteState("someone-else");

        verify(repository, never()).save(any());
        verify(repository, never()).delete(any());
    }

    @Test
    void shouldAppendAndStampItems() {
        store.addMemoryItem(USER, student, MemoryItem.of(MemoryType.GOAL, "  Land a backend role  ", null));
        List<MemoryItem> stored = store.addMemoryItems(USER, student, List.of(
                MemoryItem.of(MemoryType.INSIGHT, "Strong in Go", null),
                MemoryItem.of(MemoryType.INSIGHT, "   ", null),
                new MemoryItem(null, "untyped", null, null)));

        assertEquals(2, stored.size());
        assertEquals("Land a backend role", stored.get(0).content());
        assertEquals(NOW, stored.get(1).createdAt());
        assertEquals(2, store.load(USER, student).orElseThrow().memory().size());
    }

    @Test
    void shouldCapMemoryKeepingNewest() {
        List<MemoryItem> items = IntStream.range(0, 80)
                .mapToObj(i -> MemoryItem.of(MemoryType.INSIGHT, "item " + i, null))
                .toList();

        List<MemoryItem> stored = store.addMemoryItems(USER, student, items);

        assertEquals(75, stored.size());
        assertEquals("item 5", stored.get(0).content());
        assertEquals("item 79", stored.get(74).content());
    }

    @Test
    void shouldDeleteByIndexAndIgnoreOutOfRange() {
        store.addMemoryItems(USER, student, List.of(
                MemoryItem.of(MemoryType.GOAL, "a", null),
                MemoryItem.of(MemoryType.GOAL, "b", null)));

        assertEquals(2, store.deleteMemoryItem(USER, student, 7).size());
        List<MemoryItem> left = store.deleteMemoryItem(USER, student, 0);

        assertEquals(1, left.size());
        assertEquals("b", left.get(0).content());
    }

    @Test
    void shouldKeepIdentityAndSwitchWhenClearing() {
        store.saveIdentity(USER, pro, new AgentIdentity("Nova", "coach", null, null));
        store.setMemoryEnabled(USER, pro, false);
        store.addMemoryItem(USER, pro, MemoryItem.of(MemoryType.GOAL, "a", null));

        store.clearMemory(USER, pro);

        AgentState state = store.load(USER, pro).orElseThrow();
        assertTrue(state.memory().isEmpty());
        assertFalse(state.memoryEnabled());
        assertEquals("Nova", state.identity().name());
    }

    @Test
    void shouldNotStoreOrReturnIdentityWithoutCustomIdentityPlan() {
        store.save(USER, student, new AgentState(List.of(), true, new AgentIdentity("Nova", null, null, null)));
        store.saveIdentity(USER, student, new AgentIdentity("Nova", null, null, null));

        assertNull(row.get().getIdentityJson());
        assertNull(store.load(USER, student).orElseThrow().identity());
    }

    @Test
    void shouldKeepStoredIdentityWhenSavingWithoutOne() {
        store.saveIdentity(USER, pro, new AgentIdentity("Nova", null, null, null));

        store.save(USER, pro, new AgentState(List.of(MemoryItem.of(MemoryType.GOAL, "a", NOW)), true, null));

        assertEquals("Nova", store.load(USER, pro).orElseThrow().identity().name());
    }

    @Test
    void shouldSwallowRepositoryFailuresAndReturnPriorList() {
        store.addMemoryItem(USER, student, MemoryItem.of(MemoryType.GOAL, "a", null));
        doThrow(new IllegalStateException("db down")).when(repository).save(any(AgentStateRecord.class));

        List<MemoryItem> result = store.addMemoryItem(USER, student, MemoryItem.of(MemoryType.GOAL, "b", null));

        assertEquals(1, result.size());
        assertEquals("a", result.get(0).content());
    }

    @Test
    void shouldTreatUnreadableStoredJsonAsEmpty() {
        row.set(AgentStateRecord.builder().userId(USER).memoryJson("{not json").build());

        assertTrue(store.load(USER, student).orElseThrow().memory().isEmpty());
    }

    @Test
    void shouldDeleteWholeState() {
        store.addMemoryItem(USER, student, MemoryItem.of(MemoryType.GOAL, "a", null));
        AgentStateRecord saved = row.get();

        store.deleteState(USER);

        verify(repository).delete(saved);
    }
}
