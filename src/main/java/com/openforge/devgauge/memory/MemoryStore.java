package com.openforge.devgauge.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.devgauge.auth.CurrentUser;
import com.openforge.devgauge.domain.AgentStateRecord;
import com.openforge.devgauge.plan.PlanCapability;
import com.openforge.devgauge.plan.PlanCatalog;
import com.openforge.devgauge.repository.AgentStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable owner of each user's {@link AgentState} (one {@link AgentStateRecord} row).
 *
 * Every operation first checks that the authenticated caller is the owner and
 * that the plan includes memory; otherwise reads return empty and writes do
 * nothing. Writes merge into the stored row, cap the item list for the plan
 * (oldest dropped first) and keep the stored identity unless the plan allows a
 * custom one. Persistence failures are logged and swallowed.
 */
@Slf4j
@Service
public class MemoryStore {

    private static final TypeReference<List<MemoryItem>> ITEM_LIST = new TypeReference<>() {};

    private final AgentStateRepository repository;
    private final ObjectMapper         objectMapper;
    private final PlanCatalog          catalog;
    private final CurrentUser          currentUser;
    private final Clock                clock;

    public MemoryStore(AgentStateRepository repository,
                       ObjectMapper objectMapper,
                       PlanCatalog catalog,
                       CurrentUser currentUser,
                       Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.catalog      = catalog;
        this.currentUser  = currentUser;
        this.clock        = clock;
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    /**
     * The persisted state, or empty when the plan has no memory, the caller is
     * not the owner, nothing was saved yet or the read failed. The identity is
     * only returned for plans with a custom identity.
     */
    public Optional<AgentState> load(String userId, PlanCapability plan) {
        if (!allowed(userId, plan)) return Optional.empty();
        try {
            return repository.findByUserId(userId).map(record -> toState(record, plan));
        } catch (Exception e) {
            log.warn("[Memory:{}] Failed to load agent state: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Write ────────────────────────────────────────────────────────────────

    /**
     * Merge-writes {@code state}. A null identity in the argument keeps the
     * stored one.
     */
    public void save(String userId, PlanCapability plan, AgentState state) {
        if (!allowed(userId, plan) || state == null) return;
        write(userId, plan, record -> {
            record.setMemoryJson(toJson(cap(state.memory(), plan)));
            record.setMemoryEnabled(state.memoryEnabled());
            if (plan.customIdentity() && state.identity() != null) {
                record.setIdentityJson(toJson(state.identity()));
            }
            return record;
        });
    }

    /** Appends one item and returns the capped list; the prior (empty) list for ineligible plans. */
    public List<MemoryItem> addMemoryItem(String userId, PlanCapability plan, MemoryItem item) {
        return addMemoryItems(userId, plan, item == null ? List.of() : List.of(item));
    }

    /**
     * Appends items in order, stamping each with the current time. Items with
     * no type or blank content are skipped. Returns the list as persisted.
     */
    public List<MemoryItem> addMemoryItems(String userId, PlanCapability plan, List<MemoryItem> items) {
        if (!allowed(userId, plan)) return List.of();
        Instant now = clock.instant();
        List<MemoryItem> fresh = items.stream()
                .filter(i -> i != null && i.type() != null && !i.content().isEmpty())
                .map(i -> i.stampedAt(now))
                .toList();
        return editMemory(userId, plan, current -> {
            current.addAll(fresh);
            return current;
        });
    }

    /** Removes the item at {@code index}; an out-of-range index changes nothing. */
    public List<MemoryItem> deleteMemoryItem(String userId, PlanCapability plan, int index) {
        if (!allowed(userId, plan)) return List.of();
        return editMemory(userId, plan, current -> {
            if (index >= 0 && index < current.size()) current.remove(index);
            return current;
        });
    }

    /** Drops every item and keeps the identity and the memory switch. */
    public void clearMemory(String userId, PlanCapability plan) {
        if (!allowed(userId, plan)) return;
        editMemory(userId, plan, current -> new ArrayList<>());
    }

    public void setMemoryEnabled(String userId, PlanCapability plan, boolean enabled) {
        if (!allowed(userId, plan)) return;
        write(userId, plan, record -> {
            record.setMemoryEnabled(enabled);
            return record;
        });
    }

    /** Writes only the identity. Needs a plan with custom identity. */
    public void saveIdentity(String userId, PlanCapability plan, AgentIdentity identity) {
        if (!plan.customIdentity() || !allowed(userId, plan) || identity == null) return;
        write(userId, plan, record -> {
            record.setIdentityJson(toJson(identity));
            return record;
        });
    }

    /** Account wipe: removes the whole row whatever the plan. */
    public void deleteState(String userId) {
        if (!currentUser.is(userId)) {
            log.debug("[Memory:{}] delete skipped, caller is not the owner", userId);
            return;
        }
        try {
            repository.findByUserId(userId).ifPresent(repository::delete);
            log.info("[Memory:{}] Agent state deleted", userId);
        } catch (Exception e) {
            log.warn("[Memory:{}] Failed to delete agent state: {}", userId, e.getMessage());
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private boolean allowed(String userId, PlanCapability plan) {
        if (plan == null || !plan.memoryEligible()) return false;
        if (!currentUser.is(userId)) {
            log.debug("[Memory:{}] skipped, caller is not the owner", userId);
            return false;
        }
        return true;
    }

    /** Load, edit and persist the item list; returns the capped result, or the prior list on failure. */
    private List<MemoryItem> editMemory(String userId, PlanCapability plan,
                                        UnaryOperator<List<MemoryItem>> edit) {
        List<MemoryItem> prior = List.of();
        try {
            AgentStateRecord record = repository.findByUserId(userId).orElseGet(() -> newRecord(userId));
            prior = readItems(record.getMemoryJson());
            List<MemoryItem> updated = cap(edit.apply(new ArrayList<>(prior)), plan);
            record.setMemoryJson(toJson(updated));
            repository.save(record);
            return updated;
        } catch (Exception e) {
            log.warn("[Memory:{}] Failed to update memory: {}", userId, e.getMessage());
            return prior;
        }
    }

    private void write(String userId, PlanCapability plan, UnaryOperator<AgentStateRecord> change) {
        try {
            AgentStateRecord record = repository.findByUserId(userId).orElseGet(() -> newRecord(userId));
            repository.save(change.apply(record));
        } catch (Exception e) {
            log.warn("[Memory:{}] Failed to save agent state (plan={}): {}", userId, plan.id(), e.getMessage());
        }
    }

    private List<MemoryItem> cap(List<MemoryItem> items, PlanCapability plan) {
        int cap = catalog.memoryCap(plan.id());
        if (cap <= 0 || items == null) return List.of();
        if (items.size() <= cap) return List.copyOf(items);
        return List.copyOf(items.subList(items.size() - cap, items.size()));
    }

    private AgentState toState(AgentStateRecord record, PlanCapability plan) {
        List<MemoryItem> items = cap(readItems(record.getMemoryJson()), plan);
        AgentIdentity identity = plan.customIdentity() ? readIdentity(record.getIdentityJson()) : null;
        boolean enabled = record.getMemoryEnabled() == null || record.getMemoryEnabled();
        return new AgentState(items, enabled, identity);
    }

    private static AgentStateRecord newRecord(String userId) {
        return AgentStateRecord.builder().userId(userId).build();
    }

    private List<MemoryItem> readItems(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            List<MemoryItem> items = objectMapper.readValue(json, ITEM_LIST);
            return items == null ? List.of() : items;
        } catch (JsonProcessingException e) {
            log.warn("[Memory] Stored memory is not readable, treating as empty: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private AgentIdentity readIdentity(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, AgentIdentity.class);
        } catch (JsonProcessingException e) {
            log.warn("[Memory] Stored identity is not readable, ignoring: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize agent state", e);
        }
    }
}
