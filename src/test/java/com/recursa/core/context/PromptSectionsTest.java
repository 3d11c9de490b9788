package com.recursa.core.context;

import com.recursa.core.model.Action;
import com.recursa.core.model.ActionRecord;
import com.recursa.core.model.ConsolidationSnapshot;
import com.recursa.core.model.FailureReason;
import com.recursa.core.model.TodoItem;
import com.recursa.core.model.TodoStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptSectionsTest {

    @Test
    @DisplayName("failed record renders its reason as an error line")
    void failedRecord() {
        var record = ActionRecord.failure(4, new Action("web_search", Map.of("query", "q")),
                FailureReason.TOOL_ERROR, "rate limited");

        String rendered = PromptSections.record(record, 100);

        assertEquals("<action seq=\"4\" name=\"web_search\">\narguments: {query=q}\n"
                + "error: [TOOL_ERROR] rate limited\n</action>", rendered);
    }

    @Test
    @DisplayName("long results are truncated with a marker")
    void truncates() {
        assertEquals("abc... [truncated 3 chars]", PromptSections.truncate("abcdef", 3));
        assertEquals("abc", PromptSections.truncate("abc", 3));
        assertEquals("", PromptSections.truncate(null, 3));
        assertEquals("abcdef", PromptSections.truncate("abcdef", 0));
    }

    @Test
    @DisplayName("snapshot renders todo list, facts, plan and carried-over text")
    void snapshot() {
        var snapshot = new ConsolidationSnapshot(
                List.of(new TodoItem("summarise X1", TodoStatus.DONE), new TodoItem("summarise X2", TodoStatus.WAITING)),
                "rules: english only", "1. file_read X2.pdf", "<action seq=\"9\"/>", true, 9, Instant.EPOCH);

        String rendered = PromptSections.snapshot(snapshot);

        assertTrue(rendered.contains("1. summarise X1:[done]\n2. summarise X2:[waiting]"));
        assertTrue(rendered.contains("<durable_facts>\nrules: english only\n</durable_facts>"));
        assertTrue(rendered.contains("<next_steps>\n1. file_read X2.pdf\n</next_steps>"));
        assertTrue(rendered.contains("<carried_over>"));
    }

    @Test
    @DisplayName("arguments keep insertion order")
    void argumentOrder() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("b", 1);
        args.put("a", "x");
        assertEquals("{b=1, a=x}", PromptSections.arguments(args));
    }
}
