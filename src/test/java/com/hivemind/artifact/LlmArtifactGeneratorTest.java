package com.hivemind.artifact;

import com.hivemind.core.error.ArtifactGenerationException;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.TaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Mocks the {@link ChatClient} chain so no model is called.
 */
class LlmArtifactGeneratorTest {

    private ChatClientRequestSpec requestSpec;
    private CallResponseSpec callResponse;
    private LlmArtifactGenerator generator;

    private static final ArtifactRequest WIDGET_REQUEST = new ArtifactRequest(
            "OBJ-1", "OBJ-1-T02", "create a widget to show open incidents with a chart",
            "Create the widget record", TaskType.INTERACTIVE_COMPONENT, AgentRole.WIDGET_CREATOR);

    @BeforeEach
    void setUp() {
        ChatClient chatClient = mock(ChatClient.class);
        requestSpec = mock(ChatClientRequestSpec.class);
        callResponse = mock(CallResponseSpec.class);

        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.system(anyString())).thenReturn(requestSpec);
        when(requestSpec.user(anyString())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callResponse);

        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(chatClient);

        generator = new LlmArtifactGenerator(builder);
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("returns the parsed artifact for the task type's table")
        void parsesArtifact() {
            when(callResponse.content()).thenReturn("""
                    {"name":"open-incidents-chart","fields":{"template":"<div></div>"},"summary":"Charts open incidents"}
                    """);

            GeneratedArtifact artifact = generator.generate(WIDGET_REQUEST);

            assertEquals("sp_widget", artifact.table());
            assertEquals("open-incidents-chart", artifact.name());
            assertEquals("<div></div>", artifact.fields().get("template"));
            assertEquals("Charts open incidents", artifact.summary());
        }

        @Test
        @DisplayName("sends the system prompt and task details")
        void sendsPrompts() {
            when(callResponse.content()).thenReturn("{\"name\":\"w\",\"fields\":{},\"summary\":\"s\"}");

            generator.generate(WIDGET_REQUEST);

            verify(requestSpec).system(LlmArtifactGenerator.SYSTEM_PROMPT);
            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(requestSpec).user(user.capture());
            assertTrue(user.getValue().contains("Task: Create the widget record"));
            assertTrue(user.getValue().contains("sp_widget"));
        }

        @Test
        @DisplayName("accepts answers wrapped in markdown fences")
        void fencedAnswer() {
            when(callResponse.content()).thenReturn("""
                    ```json
                    {"name":"fenced","fields":{},"summary":"s"}
                    ```
                    """);

            assertEquals("fenced", generator.generate(WIDGET_REQUEST).name());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("unparseable content is a CONTENT_PARSE failure")
        void unparseable() {
            when(callResponse.content()).thenReturn("I cannot help with that");

            var ex = assertThrows(ArtifactGenerationException.class, () -> generator.generate(WIDGET_REQUEST));
            assertEquals(ArtifactGenerationException.Kind.CONTENT_PARSE, ex.getKind());
            assertEquals("I cannot help with that", ex.getRawResponse());
        }

        @Test
        @DisplayName("an artifact without a name is rejected")
        void missingName() {
            when(callResponse.content()).thenReturn("{\"fields\":{},\"summary\":\"s\"}");

            var ex = assertThrows(ArtifactGenerationException.class, () -> generator.generate(WIDGET_REQUEST));
            assertEquals(ArtifactGenerationException.Kind.CONTENT_PARSE, ex.getKind());
        }

        @Test
        @DisplayName("a failing backend is BACKEND_UNAVAILABLE")
        void backendDown() {
            when(requestSpec.call()).thenThrow(new RuntimeException("Connection refused"));

            var ex = assertThrows(ArtifactGenerationException.class, () -> generator.generate(WIDGET_REQUEST));
            assertEquals(ArtifactGenerationException.Kind.BACKEND_UNAVAILABLE, ex.getKind());
            assertTrue(ex.getMessage().contains("Connection refused"));
        }

        @Test
        @DisplayName("empty content is BACKEND_UNAVAILABLE")
        void emptyContent() {
            when(callResponse.content()).thenReturn("  ");

            var ex = assertThrows(ArtifactGenerationException.class, () -> generator.generate(WIDGET_REQUEST));
            assertEquals(ArtifactGenerationException.Kind.BACKEND_UNAVAILABLE, ex.getKind());
        }
    }

    @Test
    @DisplayName("stripFences removes json and plain fences")
    void stripFences() {
        assertEquals("{}", LlmArtifactGenerator.stripFences("```json\n{}\n```"));
        assertEquals("{}", LlmArtifactGenerator.stripFences("```{}```"));
        assertEquals("{}", LlmArtifactGenerator.stripFences("  {}  "));
    }

    @Test
    @DisplayName("target tables follow the task type")
    void targetTables() {
        assertEquals("sys_script", request(TaskType.SCRIPT).targetTable());
        assertEquals("sys_security_acl", request(TaskType.ACCESS_CONTROL).targetTable());
        assertEquals("sys_script_include", request(TaskType.GENERIC).targetTable());
        assertEquals("sys_script_include", request(null).targetTable());
    }

    private static ArtifactRequest request(TaskType type) {
        return new ArtifactRequest("OBJ-1", "OBJ-1-T01", "objective", "task", type, AgentRole.RESEARCHER);
    }
}
