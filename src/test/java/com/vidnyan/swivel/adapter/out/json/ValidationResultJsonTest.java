package com.vidnyan.swivel.adapter.out.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.swivel.application.port.in.FixSourceUseCase.FixReport;
import com.vidnyan.swivel.domain.exception.SwivelException;
import com.vidnyan.swivel.domain.model.Severity;
import com.vidnyan.swivel.domain.model.ValidationDepth;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationLevel;
import com.vidnyan.swivel.domain.model.ValidationMetadata;
import com.vidnyan.swivel.domain.model.ValidationResult;
import com.vidnyan.swivel.domain.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ValidationResultJson json = new ValidationResultJson(mapper);

    private static ValidationResult failedResult() {
        ValidationError forbidden = ValidationError.builder()
                .code("E201")
                .message("Forbidden import java.nio.file.Files")
                .line(5)
                .column(1)
                .fixSuggestion("Remove the import")
                .llmAction("Delete line 5")
                .context(Map.of("import", "java.nio.file.Files"))
                .build();
        ValidationError unused = ValidationError.builder()
                .code("W205")
                .severity(Severity.WARNING)
                .message("Unused import")
                .build();
        ValidationMetadata metadata = new ValidationMetadata("0.1.0", "17.0.9", "17.0.9", "Linux amd64",
                ValidationDepth.FAST,
                Map.of(ValidationLevel.SYNTAX, ValidationStatus.PASS, ValidationLevel.STATIC, ValidationStatus.FAIL),
                List.of(), null);
        return ValidationResult.of(List.of(forbidden, unused), metadata);
    }

    @Test
    void write_ShouldUseSnakeCaseAndLowerCaseValues() throws Exception {
        JsonNode root = mapper.readTree(json.write(failedResult()));

        assertEquals("fail", root.get("status").asText());
        JsonNode first = root.get("errors").get(0);
        assertEquals("E201", first.get("code").asText());
        assertEquals(2, first.get("level").asInt());
        assertEquals("error", first.get("severity").asText());
        assertEquals("Remove the import", first.get("fix_suggestion").asText());
        assertEquals("Delete line 5", first.get("llm_action").asText());
        assertEquals("java.nio.file.Files", first.get("context").get("import").asText());
        assertEquals(2, root.get("summary").get("total").asInt());
        assertEquals(1, root.get("summary").get("warnings").asInt());
        assertEquals("0.1.0", root.get("metadata").get("tool_version").asText());
        assertEquals("fast", root.get("metadata").get("depth").asText());
        assertEquals("pass", root.get("metadata").get("tiers").get("L1").asText());
        assertEquals("fail", root.get("metadata").get("tiers").get("L2").asText());
    }

    @Test
    void write_ShouldOmitAbsentOptionalFields() throws Exception {
        JsonNode warning = mapper.readTree(json.write(failedResult())).get("errors").get(1);

        assertEquals("warning", warning.get("severity").asText());
        assertFalse(warning.has("line"));
        assertFalse(warning.has("column"));
        assertFalse(warning.has("fix_suggestion"));
        assertFalse(warning.has("context"));
    }

    @Test
    void readResult_ShouldAcceptItsOwnOutputAndIgnoreUnknownFields() throws Exception {
        ObjectNode written = (ObjectNode) mapper.readTree(json.write(failedResult()));
        written.put("generated_at", "2024-01-01T00:00:00Z");

        ValidationResultJson.ResultDocument document = json.readResult(mapper.writeValueAsString(written));

        assertEquals("fail", document.status());
        assertEquals(2, document.errors().size());
        assertEquals(5, document.errors().get(0).line());
        assertEquals("fail", document.metadata().tiers().get("L2"));
    }

    @Test
    void readResult_ShouldWrapMalformedInput() {
        assertThrows(SwivelException.class, () -> json.readResult("{\"status\": "));
    }

    @Test
    void writeFix_ShouldReportRuleCounts() throws Exception {
        JsonNode root = mapper.readTree(json.write(
                new FixReport("class A {}", Map.of("remove-unused-import", 2), List.of("D303"))));

        assertTrue(root.get("changed").asBoolean());
        assertEquals(2, root.get("rule_counts").get("remove-unused-import").asInt());
        assertEquals("D303", root.get("remaining").get(0).asText());
    }
}
