package com.vidnyan.swivel.adapter.out.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.swivel.application.port.in.DescribeFrameworkUseCase.FrameworkInfo;
import com.vidnyan.swivel.application.port.in.FixSourceUseCase.FixReport;
import com.vidnyan.swivel.domain.exception.SwivelException;
import com.vidnyan.swivel.domain.healing.HealingIteration;
import com.vidnyan.swivel.domain.healing.HealingSession;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationMetadata;
import com.vidnyan.swivel.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of validation results and healing sessions: snake_case fields, lower-case enum
 * values, absent optional fields omitted.
 */
@Component
@RequiredArgsConstructor
public class ValidationResultJson {

    private final ObjectMapper objectMapper;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResultDocument(
        @JsonProperty("status") String status,
        @JsonProperty("errors") List<ErrorDocument> errors,
        @JsonProperty("summary") SummaryDocument summary,
        @JsonProperty("metadata") MetadataDocument metadata
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorDocument(
        @JsonProperty("code") String code,
        @JsonProperty("level") int level,
        @JsonProperty("severity") String severity,
        @JsonProperty("message") String message,
        @JsonProperty("line") Integer line,
        @JsonProperty("column") Integer column,
        @JsonProperty("fix_suggestion") String fixSuggestion,
        @JsonProperty("llm_action") String llmAction,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        @JsonProperty("context") Map<String, String> context
    ) {}

    public record SummaryDocument(
        @JsonProperty("total") int total,
        @JsonProperty("errors") int errors,
        @JsonProperty("warnings") int warnings
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetadataDocument(
        @JsonProperty("tool_version") String toolVersion,
        @JsonProperty("java_version") String javaVersion,
        @JsonProperty("framework_version") String frameworkVersion,
        @JsonProperty("platform") String platform,
        @JsonProperty("depth") String depth,
        @JsonProperty("tiers") Map<String, String> tiers,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("fault") String fault
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SessionDocument(
        @JsonProperty("outcome") String outcome,
        @JsonProperty("converged") boolean converged,
        @JsonProperty("iteration_count") int iterationCount,
        @JsonProperty("max_iterations") int maxIterations,
        @JsonProperty("fault") String fault,
        @JsonProperty("initial_result") ResultDocument initialResult,
        @JsonProperty("iterations") List<IterationDocument> iterations,
        @JsonProperty("final_result") ResultDocument finalResult,
        @JsonProperty("final_source") String finalSource
    ) {}

    public record IterationDocument(
        @JsonProperty("number") int number,
        @JsonProperty("applied_rules") List<String> appliedRules,
        @JsonProperty("deferred_rules") List<String> deferredRules,
        @JsonProperty("diff") String diff,
        @JsonProperty("result") ResultDocument result
    ) {}

    public record FixDocument(
        @JsonProperty("changed") boolean changed,
        @JsonProperty("rule_counts") Map<String, Integer> ruleCounts,
        @JsonProperty("remaining") List<String> remaining,
        @JsonProperty("source") String source
    ) {}

    public record FrameworkDocument(
        @JsonProperty("available") boolean available,
        @JsonProperty("java_version") String javaVersion,
        @JsonProperty("framework_version") String frameworkVersion,
        @JsonProperty("platform") String platform,
        @JsonProperty("components") List<String> components,
        @JsonProperty("containers") List<String> containers,
        @JsonProperty("layouts") List<String> layouts,
        @JsonProperty("unresolved") List<String> unresolved
    ) {}

    public String write(ValidationResult result) {
        return serialize(toDocument(result));
    }

    public String write(HealingSession session) {
        return serialize(toDocument(session));
    }

    public String write(FixReport report) {
        return serialize(new FixDocument(report.changed(), report.ruleCounts(), report.remaining(), report.source()));
    }

    public String write(FrameworkInfo info) {
        return serialize(new FrameworkDocument(info.available(), info.javaVersion(), info.frameworkVersion(),
                info.platform(), info.components(), info.containers(), info.layouts(), info.unresolved()));
    }

    public ResultDocument readResult(String json) {
        try {
            return objectMapper.readValue(json, ResultDocument.class);
        } catch (JsonProcessingException e) {
            throw new SwivelException("Malformed validation result JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ResultDocument toDocument(ValidationResult result) {
        return new ResultDocument(
                result.status().jsonValue(),
                result.errors().stream().map(ValidationResultJson::toDocument).toList(),
                new SummaryDocument(result.summary().total(), result.summary().errors(), result.summary().warnings()),
                toDocument(result.metadata()));
    }

    public SessionDocument toDocument(HealingSession session) {
        return new SessionDocument(
                session.outcome().name().toLowerCase(),
                session.converged(),
                session.iterationCount(),
                session.maxIterations(),
                session.fault(),
                toDocument(session.initialResult()),
                session.iterations().stream().map(this::toDocument).toList(),
                toDocument(session.finalResult()),
                session.finalSource());
    }

    private IterationDocument toDocument(HealingIteration iteration) {
        return new IterationDocument(iteration.number(), iteration.appliedRuleIds(), iteration.deferredRuleIds(),
                iteration.diff(), toDocument(iteration.result()));
    }

    private static ErrorDocument toDocument(ValidationError error) {
        return new ErrorDocument(error.code(), error.level().number(), error.severity().jsonValue(),
                error.message(), error.line(), error.column(), error.fixSuggestion(), error.llmAction(),
                error.context());
    }

    private static MetadataDocument toDocument(ValidationMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        Map<String, String> tiers = new LinkedHashMap<>();
        metadata.tiers().forEach((level, status) -> tiers.put(level.label(), status.jsonValue()));
        return new MetadataDocument(metadata.toolVersion(), metadata.javaVersion(), metadata.frameworkVersion(),
                metadata.platform(), metadata.depth() == null ? null : metadata.depth().jsonValue(),
                tiers, metadata.warnings(), metadata.fault());
    }

    private String serialize(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new SwivelException("Could not serialize to JSON: " + e.getOriginalMessage(), e);
        }
    }
}
