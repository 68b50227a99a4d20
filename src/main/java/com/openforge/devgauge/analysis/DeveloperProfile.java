package com.openforge.devgauge.analysis;

import java.util.Map;

/**
 * Self-reported developer context rendered into every prompt.
 * {@code education} and {@code experienceYears} hold form values such as
 * "undergrad_junior" or "1_3_years".
 */
public record DeveloperProfile(
        String age,
        String education,
        String experienceYears,
        String currentRole,
        String careerGoal,
        String technicalSkills,
        String technicalInterests,
        String hobbies
) {

    private static final Map<String, String> EDUCATION_LABELS = Map.of(
            "high_school", "High School",
            "undergrad_freshman", "Undergrad - Freshman",
            "undergrad_sophomore", "Undergrad - Sophomore",
            "undergrad_junior", "Undergrad - Junior",
            "undergrad_senior", "Undergrad - Senior",
            "graduate", "Graduate Student",
            "bootcamp", "Bootcamp Graduate",
            "self_taught", "Self-Taught",
            "full_time", "Full-Time Professional"
    );

    public static DeveloperProfile empty() {
        return new DeveloperProfile(null, null, null, null, null, null, null, null);
    }

    public String educationLabel() {
        if (education == null || education.isBlank()) return "";
        return EDUCATION_LABELS.getOrDefault(education, education.replace('_', ' '));
    }

    public String experienceLabel() {
        return experienceYears == null || experienceYears.isBlank()
                ? "Unknown"
                : experienceYears.replace('_', ' ');
    }
}
