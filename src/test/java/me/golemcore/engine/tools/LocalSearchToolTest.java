package me.golemcore.engine.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.RetrievedDocument;
import me.golemcore.engine.domain.model.ToolExecutionResult;
import me.golemcore.engine.port.outbound.RetrievalPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LocalSearchToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RetrievalPort retrievalPort;
    private LocalSearchTool tool;

    @BeforeEach
    void setUp() {
        retrievalPort = mock(RetrievalPort.class);
        tool = new LocalSearchTool(retrievalPort, objectMapper);
    }

    @Test
    void shouldRequireQueryInDefinition() {
        Map<String, Object> schema = tool.getDefinition().getInputSchema();

        assertEquals("localSearch", tool.getToolName());
        assertEquals(List.of("query"), schema.get("required"));
    }

    @Test
    void shouldReturnDocumentsAsJsonArray() throws Exception {
        when(retrievalPort.search("cats", List.of("feline"))).thenReturn(List.of(RetrievedDocument.builder()
                .title("Cats")
                .path("notes/cats.md")
                .content("Cats purr.")
                .score(0.9)
                .build()));

        ToolExecutionResult result = tool.execute(Map.of("query", "cats", "salientTerms", List.of("feline", " ")))
                .get();

        assertTrue(result.isSuccess());
        JsonNode json = objectMapper.readTree(result.getResult());
        assertTrue(json.isArray());
        assertEquals("Cats", json.get(0).get("title").asText());
        assertEquals("notes/cats.md", json.get(0).get("path").asText());
    }

    @Test
    void shouldReturnEmptyArrayWhenNothingFound() throws Exception {
        when(retrievalPort.search("nothing", List.of())).thenReturn(null);

        ToolExecutionResult result = tool.execute(Map.of("query", "nothing")).get();

        assertEquals("[]", result.getResult());
    }

    @Test
    void shouldFailWithoutQuery() throws Exception {
        ToolExecutionResult result = tool.execute(Map.of("salientTerms", List.of("x"))).get();

        assertFalse(result.isSuccess());
        assertEquals("Missing required parameter: query", result.getResult());
        verify(retrievalPort, never()).search(any(), anyList());
    }
}
