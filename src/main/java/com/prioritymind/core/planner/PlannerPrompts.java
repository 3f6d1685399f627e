package com.prioritymind.core.planner;

import java.util.stream.Collectors;

/**
 * System and user prompts for the generator and evaluator roles.
 */
final class PlannerPrompts {

    static final String GENERATOR_SYSTEM_PROMPT = """
            You are a prioritization agent. Given a desired outcome, the user's current \
            reflections and a list of tasks, decide which tasks move the outcome forward \
            and order them by impact.

            Rules:
            1. Include a task only if it clearly advances the outcome; exclude the rest with a short reason.
            2. Order included tasks so prerequisites come first and leverage work comes early.
            3. Give every included task a confidence between 0 and 1 in confidence_scores.
            4. Treat baseline tasks as already prioritized; integrate new tasks around them.
            5. Use corrections_made to note what you changed from the previous plan; keep it brief.
            6. confidence is your overall confidence in the ordering, between 0 and 1.
            """;

    static final String EVALUATOR_SYSTEM_PROMPT = """
            You are a prioritization reviewer. Judge a draft ordering against the outcome \
            and reflections. Check outcome alignment, strategic coherence, reflection \
            integration and continuity with the baseline.

            Return PASS when the draft is sound, NEEDS_IMPROVEMENT with concrete, actionable \
            feedback when it can be fixed, and FAIL when it misreads the outcome entirely.
            """;

    private PlannerPrompts() {}

    static String generatorPrompt(PlannerInput input) {
        var sb = new StringBuilder();
        sb.append("OUTCOME:\n").append(input.outcome()).append("\n\n");
        sb.append("ACTIVE REFLECTIONS:\n").append(reflectionsText(input)).append("\n\n");
        sb.append(input.context().baselineSummary()).append("\n\n");
        sb.append("NEW TASKS (").append(input.context().newTaskCount()).append(" of ")
                .append(input.context().taskCount()).append("):\n");
        sb.append(input.context().newTasksText()).append("\n\n");
        sb.append("Iteration ").append(input.iteration()).append(" of ").append(input.maxIterations()).append('.');
        if (input.evaluatorFeedback() != null && !input.evaluatorFeedback().isBlank()) {
            sb.append("\n\nREVIEWER FEEDBACK ON YOUR PREVIOUS DRAFT:\n").append(input.evaluatorFeedback())
                    .append("\nAddress every point above in this revision.");
        }
        return sb.toString();
    }

    static String evaluatorPrompt(String draftJson, PlannerInput input) {
        return "OUTCOME:\n" + input.outcome() + "\n\n"
                + "ACTIVE REFLECTIONS:\n" + reflectionsText(input) + "\n\n"
                + input.context().baselineSummary() + "\n\n"
                + "DRAFT PRIORITIZATION:\n" + draftJson;
    }

    private static String reflectionsText(PlannerInput input) {
        if (input.reflections().isEmpty()) {
            return "No active reflections.";
        }
        return input.reflections().stream().map(r -> "- " + r).collect(Collectors.joining("\n"));
    }
}
