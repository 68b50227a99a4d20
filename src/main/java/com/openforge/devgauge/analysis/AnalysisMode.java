package com.openforge.devgauge.analysis;

/**
 * Mode addendum appended to a system prompt as "# MODE: focus".
 */
public enum AnalysisMode {

    INITIAL_ASSESSMENT("First-time profile analysis",
            "First analysis. Be thorough. Set baseline expectations. Focus on quick wins and refer to "
                    + "the user's timeframe for improvement (students have more time to grow than experienced devs)."),

    SYNTHESIS("Summary and recommendations from pre-computed scores", """
            The four category scores and the level have already been computed and are provided in the prompt. DO NOT re-score.
            Using those scores and the metrics, generate:
            - A concise honest summary (1-2 sentences)
            - 3 specific actionable recommendations targeting the weakest categories
            - Three one-sentence insights (projects, language, activity)

            Return ONLY this JSON, no extra text:
            {
              "summary": "<1-2 sentence honest assessment>",
              "recommendations": ["<specific task with tech + timeline>", "<task 2>", "<task 3>"],
              "projectsInsight": "<1 sentence on how recommended projects help>",
              "languageInsight": "<1 sentence on their language stack>",
              "activityInsight": "<1 sentence on contribution patterns>"
            }"""),

    PROGRESS_COMPARISON("Progress comparison",
            "Compare current metrics to the previous analysis. Celebrate improvements. Be constructive about "
                    + "regressions. Check whether previous recommendations were followed. Give updated next steps."),

    QUICK_CHAT("Conversational follow-up",
            "The user's level and scores are pre-computed in context. Do NOT re-score. Reference their actual "
                    + "numbers. Be concise, direct and actionable."),

    PROJECT_CHAT("Project implementation help",
            "Help with a specific recommended project. Be concise, practical and encouraging. Give specific "
                    + "implementation guidance. Reference their skill level from context."),

    PROJECT_RECOMMENDATION("Project suggestions", """
            Suggest 3-4 projects targeting skill gaps. Each project:
            - 70% familiar tech, 30% new
            - Completable in 2-8 weeks
            - Clear learning outcomes
            - Every project's suggestedStack has AT LEAST 1 and AT MOST 6 entries.

            Return a JSON array:
            [{
              "name": "<project name>",
              "skill1": "<skill>", "skill2": "<skill>", "skill3": "<skill>",
              "overview": "<2-3 sentence overview>",
              "alignment": "<1-2 sentence fit explanation>",
              "suggestedStack": [{ "name": "<tech>", "description": "<role in project>" }]
            }]"""),

    LEARNING_PATH("Learning roadmap", """
            Create a 3-phase learning roadmap (3-6 months):
            - Phase 1 (Month 1-2): Foundations and immediate gaps
            - Phase 2 (Month 3-4): Intermediate depth and projects
            - Phase 3 (Month 5-6): Advanced skills and portfolio polish

            Each phase: 2-3 milestones with clear success criteria.""");

    private final String focus;
    private final String additionalContext;

    AnalysisMode(String focus, String additionalContext) {
        this.focus             = focus;
        this.additionalContext = additionalContext;
    }

    public String focus() {
        return focus;
    }

    public String instructions() {
        return "\n\n# MODE: " + focus + "\n" + additionalContext;
    }
}
