package com.openforge.devgauge.skill;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of skills, keyed by name. Built once from the Skill beans and
 * never modified afterwards.
 */
@Slf4j
@Component
public class SkillRegistry {

    private final Map<String, Skill> skills;

    public SkillRegistry(List<Skill> skills) {
        Map<String, Skill> byName = new LinkedHashMap<>();
        for (Skill skill : skills) {
            if (byName.putIfAbsent(skill.name(), skill) != null) {
                throw new IllegalStateException("Duplicate skill name: " + skill.name());
            }
        }
        this.skills = Collections.unmodifiableMap(byName);
        log.info("[SkillRegistry] {} skills registered: {}", byName.size(), byName.keySet());
    }

    /**
     * Runs the named skill. An unknown name yields {@link SkillResult#notFound}
     * instead of an exception.
     */
    public SkillResult execute(String name, SkillContext context) {
        Skill skill = name == null ? null : skills.get(name);
        if (skill == null) {
            log.warn("[SkillRegistry] Skill '{}' not found", name);
            return SkillResult.notFound(name);
        }
        log.debug("[SkillRegistry] Executing '{}'", name);
        return skill.execute(context);
    }

    public Optional<Skill> find(String name) {
        return Optional.ofNullable(skills.get(name));
    }

    /** name to description, in registration order. */
    public Map<String, String> describe() {
        Map<String, String> out = new LinkedHashMap<>();
        skills.forEach((name, skill) -> out.put(name, skill.description()));
        return out;
    }
}
