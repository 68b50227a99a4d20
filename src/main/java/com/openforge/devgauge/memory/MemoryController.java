package com.openforge.devgauge.memory;

import com.openforge.devgauge.auth.CurrentUser;
import com.openforge.devgauge.plan.PlanCapability;
import com.openforge.devgauge.plan.UsageService;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for the caller's persisted agent state.
 *
 * ┌─────────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                 Description                   │
 * ├─────────────────────────────────────────────────────────────────────────┤
 * │  GET    /api/agent/memory                 stored items, switch, identity│
 * │  DELETE /api/agent/memory/items           forget every item             │
 * │  DELETE /api/agent/memory/items/{index}   forget one item               │
 * │  PUT    /api/agent/memory/enabled         turn memory on or off         │
 * │  PUT    /api/agent/memory/identity        set name, personality, icon   │
 * │  DELETE /api/agent/memory                 wipe the whole state          │
 * └─────────────────────────────────────────────────────────────────────────┘
 *
 * Plans without memory see an empty state and their writes change nothing.
 * Identity changes need a plan with custom identity (403 otherwise).
 */
@RestController
@RequestMapping("/api/agent/memory")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryStore  store;
    private final UsageService usage;
    private final CurrentUser  currentUser;

    @GetMapping
    public ResponseEntity<AgentState> getState() {
        String userId = requireUser();
        return ResponseEntity.ok(store.load(userId, usage.planFor(userId)).orElse(AgentState.empty()));
    }

    @DeleteMapping("/items")
    public ResponseEntity<Void> clearItems() {
        String userId = requireUser();
        store.clearMemory(userId, usage.planFor(userId));
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/items/{index}")
    public ResponseEntity<List<MemoryItem>> deleteItem(@PathVariable int index) {
        String userId = requireUser();
        return ResponseEntity.ok(store.deleteMemoryItem(userId, usage.planFor(userId), index));
    }

    @PutMapping("/enabled")
    public ResponseEntity<Void> setEnabled(@RequestBody EnabledRequest request) {
        String userId = requireUser();
        store.setMemoryEnabled(userId, usage.planFor(userId), request.enabled());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/identity")
    public ResponseEntity<AgentIdentity> setIdentity(@RequestBody @NotNull AgentIdentity identity) {
        String userId = requireUser();
        PlanCapability plan = usage.planFor(userId);
        if (!plan.customIdentity()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN,
                    "Plan '" + plan.id() + "' does not include a custom agent identity");
        }
        store.saveIdentity(userId, plan, identity);
        return ResponseEntity.ok(identity);
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteState() {
        store.deleteState(requireUser());
        return ResponseEntity.noContent().build();
    }

    private String requireUser() {
        return currentUser.id().orElseThrow(
                () -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Not authenticated"));
    }

    public record EnabledRequest(boolean enabled) {}
}
