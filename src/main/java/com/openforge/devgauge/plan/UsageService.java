package com.openforge.devgauge.plan;

import com.openforge.devgauge.domain.UsageRecord;
import com.openforge.devgauge.repository.UsageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalInt;

/**
 * Rolling usage metering per user.
 *
 * Counters live in one {@link UsageRecord} per user and reset once the period
 * is older than {@link #PERIOD}. When a limit is reached the free plan is served
 * its fallback model; paid plans are blocked. A failing store never blocks a
 * call: the check degrades to "allowed on the free primary model".
 * Not transactional; each save commits on its own.
 */
@Slf4j
@Service
public class UsageService {

    public static final Duration PERIOD = Duration.ofDays(30);

    private final UsageRepository repository;
    private final PlanCatalog     catalog;
    private final Clock           clock;

    public UsageService(UsageRepository repository, PlanCatalog catalog, Clock clock) {
        this.repository = repository;
        this.catalog    = catalog;
        this.clock      = clock;
    }

    /** The caller's plan as recorded server-side; free when none is stored. */
    public PlanCapability planFor(String userId) {
        try {
            return repository.findByUserId(userId)
                    .map(r -> catalog.get(r.getPlanId()))
                    .orElseGet(() -> catalog.get(PlanCatalog.FREE));
        } catch (Exception e) {
            log.warn("[Usage] Plan lookup failed for user={}: {}", userId, e.getMessage());
            return catalog.get(PlanCatalog.FREE);
        }
    }

    public UsageDecision checkLimit(String userId, UsageType type) {
        try {
            UsageRecord record = resolve(userId);
            PlanCapability plan = catalog.get(record.getPlanId());
            int current = counter(record, type);
            OptionalInt limit = plan.limit(type);

            if (limit.isEmpty()) {
                return new UsageDecision(true, plan.primaryModel(), false, current, null, plan);
            }
            if (current < limit.getAsInt()) {
                return new UsageDecision(true, plan.primaryModel(), false, current, limit.getAsInt(), plan);
            }
            if (plan.hasFallback()) {
                log.info("[Usage] user={} reached {} limit {}, serving fallback model",
                        userId, type, limit.getAsInt());
                return new UsageDecision(true, plan.fallbackModel(), true, current, limit.getAsInt(), plan);
            }
            return new UsageDecision(false, null, false, current, limit.getAsInt(), plan);
        } catch (Exception e) {
            log.warn("[Usage] checkLimit failed for user={}, allowing call: {}", userId, e.getMessage());
            PlanCapability free = catalog.get(PlanCatalog.FREE);
            return new UsageDecision(true, free.primaryModel(), false, 0, null, free);
        }
    }

    /** Counts one successful call. Failures are logged and dropped. */
    public void increment(String userId, UsageType type) {
        try {
            UsageRecord record = resolve(userId);
            switch (type) {
                case MESSAGES      -> record.setMessages(record.getMessages() + 1);
                case REANALYZES    -> record.setReanalyzes(record.getReanalyzes() + 1);
                case PROJECT_CHATS -> record.setProjectChats(record.getProjectChats() + 1);
            }
            repository.save(record);
        } catch (Exception e) {
            log.warn("[Usage] increment {} failed for user={}: {}", type, userId, e.getMessage());
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Loads the user's record, starting a new period when the current one has
     * expired. A user without a record gets an unsaved free-plan record.
     */
    private UsageRecord resolve(String userId) {
        Instant now = clock.instant();
        UsageRecord record = repository.findByUserId(userId).orElse(null);
        if (record == null) {
            return UsageRecord.builder().userId(userId).periodStart(now).build();
        }
        Instant start = record.getPeriodStart();
        if (start == null || Duration.between(start, now).compareTo(PERIOD) > 0) {
            record.setMessages(0);
            record.setReanalyzes(0);
            record.setProjectChats(0);
            record.setPeriodStart(now);
            repository.save(record);
            log.debug("[Usage] user={} started a new usage period", userId);
        }
        return record;
    }

    private static int counter(UsageRecord record, UsageType type) {
        Integer value = switch (type) {
            case MESSAGES      -> record.getMessages();
            case REANALYZES    -> record.getReanalyzes();
            case PROJECT_CHATS -> record.getProjectChats();
        };
        return value == null ? 0 : value;
    }
}
