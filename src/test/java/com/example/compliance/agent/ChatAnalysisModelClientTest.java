package com.example.compliance.agent;

import com.example.compliance.exception.ModelCallException;
import com.example.compliance.exception.ModelOutputParseException;
import com.example.compliance.model.Analysis;
import com.example.compliance.model.ContextPassage;
import com.example.compliance.model.JudgeVerdict;
import com.example.compliance.service.ResilientCaller;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatAnalysisModelClientTest {

    private static final List<ContextPassage> CONTEXT = List.of(
            new ContextPassage("Article 5: Prohibited AI Practices - biometric identification systems", 0.1, Map.of()),
            new ContextPassage("Article 6: High-risk AI systems in border control", 0.2, Map.of()));

    private final ChatClient analysisChatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final ChatClient judgeChatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final ChatAnalysisModelClient client = new ChatAnalysisModelClient(analysisChatClient, judgeChatClient,
            new ResilientCaller(3, Duration.ZERO, d -> { }), new ObjectMapper());

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    private static void replies(ChatClient chatClient, ChatResponse first, ChatResponse... rest) {
        when(chatClient.prompt().system(anyString()).user(anyString()).options(any(ChatOptions.class))
                .call().chatResponse()).thenReturn(first, rest);
    }

    @Test
    @DisplayName("Fenced JSON with trailing commas is decoded into an analysis")
    void analyzesFencedLenientJson() {
        // Given
        replies(analysisChatClient, response("""
                ```json
                {
                  "project_name": "AI Border Control",
                  "description": "Automated border control using facial recognition",
                  "contains_ai": true,
                  "ai_confidence": 0.95,
                  "high_risks": [
                    {"description": "Biometric identification system", "category": "Prohibited AI",
                     "eu_act_reference": "Article 5", "confidence_score": 0.9},
                  ],
                  "low_risks": [],
                }
                ```
                """));

        // When
        Analysis analysis = client.analyze("Facial recognition at the border", CONTEXT);

        // Then
        assertEquals("AI Border Control", analysis.projectName());
        assertTrue(analysis.containsAi());
        assertEquals(1, analysis.highRisks().size());
        assertEquals("Article 5", analysis.highRisks().get(0).euActReference());
    }

    @Test
    @DisplayName("Prompt numbers the context passages and embeds the document")
    void promptContainsContext() {
        replies(analysisChatClient, response("{\"project_name\": \"Web App\"}"));
        ChatClient.ChatClientRequestSpec spec = analysisChatClient.prompt().system("system");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);

        client.analyze("Simple web application", CONTEXT);

        verify(spec).user(prompt.capture());
        assertThat(prompt.getValue())
                .contains("[Context 1]\nArticle 5: Prohibited AI Practices")
                .contains("[Context 2]\nArticle 6: High-risk AI systems")
                .contains("Simple web application");
    }

    @Test
    @DisplayName("Transport failures are retried, malformed output is not")
    void retriesTransportButNotParsing() {
        // Given: first call fails at the transport, second returns garbage
        when(analysisChatClient.prompt().system(anyString()).user(anyString()).options(any(ChatOptions.class))
                .call().chatResponse())
                .thenThrow(new IllegalStateException("503 Service Unavailable"))
                .thenReturn(response("this is not json at all"))
                .thenReturn(response("{\"project_name\": \"Never reached\"}"));

        // When / Then
        assertThrows(ModelOutputParseException.class, () -> client.analyze("doc", CONTEXT));
    }

    @Test
    @DisplayName("Empty responses on every attempt become ModelCallException")
    void emptyResponsesFail() {
        replies(analysisChatClient, response(""));

        ModelCallException error = assertThrows(ModelCallException.class, () -> client.analyze("doc", CONTEXT));
        assertThat(error.getMessage()).contains("AnalysisModel");
    }

    @Test
    @DisplayName("Judge verdict is decoded from the judge client")
    void judgeUsesJudgeClient() {
        replies(judgeChatClient, response("""
                {"accuracy_score": 0.8, "completeness_score": 0.7, "consistency_score": 0.9,
                 "overall_score": 0.8, "reasoning": "Risks match Article 5"}
                """));
        Analysis analysis = Analysis.of("Web App", "Basic website", false, 0.1, List.of(), List.of());

        JudgeVerdict verdict = client.judge("Simple web application", analysis, CONTEXT);

        assertEquals(0.8, verdict.overall());
        assertEquals("Risks match Article 5", verdict.reasoning());
    }

    @Test
    @DisplayName("Code fences are stripped and lenient syntax accepted")
    void parsesLenientJson() {
        assertEquals("{\"a\": 1}", ChatAnalysisModelClient.stripCodeFences("```json\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", ChatAnalysisModelClient.stripCodeFences("  {\"a\": 1}  "));

        JsonNode node = ChatAnalysisModelClient.parseJson("{'project_name': 'X', /* note */ contains_ai: true,}");
        assertEquals("X", node.get("project_name").asText());
        assertTrue(node.get("contains_ai").asBoolean());

        assertThrows(ModelOutputParseException.class, () -> ChatAnalysisModelClient.parseJson("{\"a\": "));
    }
}
