package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityValidatorTest {

    private static Map<String, Object> context(Object hierarchy) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("type", "task");
        raw.put("hierarchy", hierarchy);
        return raw;
    }

    // ==================== contexts ====================

    @Test
    void shouldAcceptMinimalContext() {
        assertTrue(EntityValidator.validateContext(context(List.of("golem"))).isEmpty());
    }

    @Test
    void shouldRejectNullContext() {
        assertEquals(List.of("context data is required"), EntityValidator.validateContext(null));
    }

    @Test
    void shouldRequireHierarchy() {
        Map<String, Object> raw = context(null);

        assertEquals(List.of("hierarchy is required and must be an array"), EntityValidator.validateContext(raw));
    }

    @Test
    void shouldRejectEmptyHierarchy() {
        assertEquals(List.of("hierarchy cannot be empty"), EntityValidator.validateContext(context(List.of())));
    }

    @Test
    void shouldRejectBlankHierarchySegment() {
        List<String> errors = EntityValidator.validateContext(context(List.of("golem", " ")));

        assertEquals(List.of("all hierarchy levels must be non-empty strings"), errors);
    }

    @Test
    void shouldLimitHierarchyDepth() {
        List<String> fiveLevels = List.of("a", "b", "c", "d", "e");
        List<String> sixLevels = List.of("a", "b", "c", "d", "e", "f");

        assertTrue(EntityValidator.validateContext(context(fiveLevels)).isEmpty());
        assertEquals(List.of("hierarchy cannot exceed 5 levels"), EntityValidator.validateContext(context(sixLevels)));
    }

    @Test
    void shouldRejectUnknownContextType() {
        Map<String, Object> raw = context(List.of("golem"));
        raw.put("type", "milestone");

        List<String> errors = EntityValidator.validateContext(raw);

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("type must be one of: project, epic, task, session, agent"));
    }

    @Test
    void shouldValidateImportanceRange() {
        Map<String, Object> raw = context(List.of("golem"));
        raw.put("importance", 100);
        assertTrue(EntityValidator.validateContext(raw).isEmpty());

        raw.put("importance", 101);
        assertEquals(1, EntityValidator.validateContext(raw).size());

        raw.put("importance", -1);
        assertEquals(1, EntityValidator.validateContext(raw).size());

        raw.put("importance", "50");
        assertEquals(List.of("importance must be a number between 0 and 100"), EntityValidator.validateContext(raw));
    }

    @Test
    void shouldRequireStringListsInMetadataAndRelationships() {
        Map<String, Object> raw = context(List.of("golem"));
        raw.put("metadata", Map.of("tags", List.of("ok", 7)));
        raw.put("relationships", Map.of("references", "ctx-1"));

        List<String> errors = EntityValidator.validateContext(raw);

        assertEquals(List.of(
                "metadata.tags must be an array of strings if provided",
                "relationships.references must be an array of strings if provided"), errors);
    }

    @Test
    void shouldRejectParentListedAsChild() {
        Map<String, Object> raw = context(List.of("golem"));
        raw.put("relationships", Map.of("parent", "ctx-1", "children", List.of("ctx-1", "ctx-2")));

        assertEquals(List.of("relationships.parent cannot also be a child"), EntityValidator.validateContext(raw));
    }

    @Test
    void shouldThrowWithEveryViolation() {
        Map<String, Object> raw = context(List.of());
        raw.put("importance", 500);

        ValidationException exception = assertThrows(ValidationException.class,
                () -> EntityValidator.requireValidContext(raw));

        assertEquals(2, exception.getErrors().size());
    }

    // ==================== agent states ====================

    @Test
    void shouldAcceptEmptyAgentState() {
        assertDoesNotThrow(() -> EntityValidator.requireValidAgentState(Map.of()));
    }

    @Test
    void shouldRejectUnknownAgentTypeAndStatus() {
        List<String> errors = EntityValidator.validateAgentState(Map.of("type", "designer", "status", "sleeping"));

        assertEquals(List.of("Invalid agent type: designer", "Invalid agent status: sleeping"), errors);
    }

    @Test
    void shouldValidatePerformanceMetrics() {
        List<String> errors = EntityValidator.validateAgentState(Map.of(
                "performanceMetrics", Map.of("successRate", 1.2, "avgCompletionTime", -5)));

        assertEquals(List.of(
                "successRate must be a number between 0 and 1",
                "avgCompletionTime must be a non-negative number"), errors);
    }

    @Test
    void shouldValidateMemoryUsage() {
        List<String> errors = EntityValidator.validateAgentState(Map.of(
                "memoryUsage", Map.of("memorySizeMB", -0.5, "contextsActive", "many")));

        assertEquals(List.of(
                "memorySizeMB must be a non-negative number",
                "contextsActive must be a non-negative number"), errors);
    }

    @Test
    void shouldRequireCapabilitiesList() {
        assertEquals(List.of("capabilities must be an array of strings if provided"),
                EntityValidator.validateAgentState(Map.of("capabilities", "debugging")));
    }

    // ==================== agent memories ====================

    @Test
    void shouldRequireAgentId() {
        assertEquals(List.of("agentId is required and must be a string"),
                EntityValidator.validateAgentMemory(Map.of("agentId", "  ")));
    }

    @Test
    void shouldValidateAdaptationScoreRange() {
        List<String> lowScore = EntityValidator.validateAgentMemory(Map.of(
                "agentId", "test-runner",
                "learning", Map.of("adaptationScore", 0.05)));
        List<String> validScore = EntityValidator.validateAgentMemory(Map.of(
                "agentId", "test-runner",
                "learning", Map.of("adaptationScore", 0.95)));

        assertEquals(List.of("learning.adaptationScore must be a number between 0.1 and 0.95"), lowScore);
        assertTrue(validScore.isEmpty());
    }

    @Test
    void shouldRequireInteractionObjects() {
        List<String> errors = EntityValidator.validateAgentMemory(Map.of(
                "agentId", "test-runner",
                "interactions", List.of("not-an-object")));

        assertEquals(List.of("interactions must contain objects"), errors);
    }

    @Test
    void shouldRequireTextPromptAndResponse() {
        Map<String, Object> interaction = new LinkedHashMap<>();
        interaction.put("prompt", null);
        interaction.put("response", 7);

        List<String> errors = EntityValidator.validateAgentMemory(Map.of(
                "agentId", "test-runner",
                "interactions", List.of(interaction)));

        assertEquals(List.of("interactions.response must be a string if provided"), errors);
    }
}
