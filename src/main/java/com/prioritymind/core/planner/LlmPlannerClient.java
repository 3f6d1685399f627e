package com.prioritymind.core.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prioritymind.core.llm.LlmEmptyResponseException;
import com.prioritymind.core.llm.LlmParseException;
import com.prioritymind.core.llm.LlmService;
import com.prioritymind.core.model.EvaluationResult;
import com.prioritymind.core.model.PrioritizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link PlannerClient} backed by the chat model through {@link LlmService}.
 */
@Component
public class LlmPlannerClient implements PlannerClient {

    private static final Logger log = LoggerFactory.getLogger(LlmPlannerClient.class);

    private final LlmService llmService;
    private final ObjectMapper objectMapper;

    public LlmPlannerClient(LlmService llmService, ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.objectMapper = objectMapper;
    }

    @Override
    public PrioritizationResult generate(PlannerInput input) {
        log.info("Requesting draft {} of {} ({} new task(s))",
                input.iteration(), input.maxIterations(), input.context().newTaskCount());
        try {
            return llmService.structuredCall(PlannerPrompts.GENERATOR_SYSTEM_PROMPT,
                    PlannerPrompts.generatorPrompt(input), PrioritizationResult.class);
        } catch (LlmEmptyResponseException | LlmParseException e) {
            throw new PlannerException("Planner draft failed: " + e.getMessage(), e);
        }
    }

    @Override
    public EvaluationResult evaluate(PrioritizationResult draft, PlannerInput input) {
        String draftJson;
        try {
            draftJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(draft);
        } catch (JsonProcessingException e) {
            throw new PlannerException("Could not serialize draft for evaluation", e);
        }
        try {
            var result = llmService.structuredCall(PlannerPrompts.EVALUATOR_SYSTEM_PROMPT,
                    PlannerPrompts.evaluatorPrompt(draftJson, input), EvaluationResult.class);
            if (result.status() == null) {
                throw new PlannerException("Evaluator returned no status");
            }
            return result;
        } catch (LlmEmptyResponseException | LlmParseException e) {
            throw new PlannerException("Planner evaluation failed: " + e.getMessage(), e);
        }
    }
}
