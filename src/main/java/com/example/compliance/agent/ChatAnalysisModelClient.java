package com.example.compliance.agent;

import com.example.compliance.exception.ModelCallException;
import com.example.compliance.exception.ModelOutputParseException;
import com.example.compliance.model.Analysis;
import com.example.compliance.model.ContextPassage;
import com.example.compliance.model.JudgeVerdict;
import com.example.compliance.model.ModelOutputDecoder;
import com.example.compliance.model.Risk;
import com.example.compliance.service.ResilientCaller;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * {@link AnalysisModelClient} on top of Spring AI {@link ChatClient}s.
 * <p>
 * The chat call itself is retried by {@link ResilientCaller}; parsing happens after the
 * call returns and is never retried. Markdown code fences are stripped, the JSON is read
 * leniently and then decoded by {@link ModelOutputDecoder}.
 */
@Service
public class ChatAnalysisModelClient implements AnalysisModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatAnalysisModelClient.class);

    static final int ANALYSIS_DOCUMENT_CHARS = 8000;
    static final int JUDGE_DOCUMENT_CHARS = 4000;
    static final int JUDGE_CONTEXT_PASSAGES = 3;

    /** Accepts the JSON dialect models tend to emit: trailing commas, comments, unquoted names. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final String ANALYSIS_SYSTEM_PROMPT =
            "You are an expert AI compliance analyst. Respond only with valid JSON.";

    private static final String ANALYSIS_PROMPT = """
            You are an AI compliance expert analyzing technical documents against the EU AI Act.

            **EU AI Act Context:**
            %s

            **Technical Document to Analyze:**
            %s

            **Task:**
            Analyze the technical document and provide a structured JSON response with the following:

            1. **project_name**: Extract or infer the project name
            2. **description**: A brief 2-3 sentence description of the project
            3. **contains_ai**: Boolean indicating if the project contains AI/ML components
            4. **ai_confidence**: Confidence score (0.0-1.0) for AI detection
            5. **high_risks**: Array of high-risk items based on EU AI Act
            6. **low_risks**: Array of low-risk items based on EU AI Act

            For each risk, provide:
            - description: What the risk is
            - category: EU AI Act category (e.g., "Prohibited AI", "High-Risk AI")
            - eu_act_reference: Relevant article/section from EU AI Act
            - confidence_score: How confident you are (0.0-1.0)

            **Output Format (JSON):**
            ```json
            {
              "project_name": "...",
              "description": "...",
              "contains_ai": true/false,
              "ai_confidence": 0.0-1.0,
              "high_risks": [
                {
                  "description": "...",
                  "category": "...",
                  "eu_act_reference": "Article X",
                  "confidence_score": 0.0-1.0
                }
              ],
              "low_risks": [...]
            }
            ```

            Respond ONLY with valid JSON, no additional text.
            """;

    private static final String JUDGE_SYSTEM_PROMPT =
            "You are an expert evaluator. Respond only with valid JSON.";

    private static final String JUDGE_PROMPT = """
            You are evaluating the quality of an AI compliance analysis.

            **Original Technical Document (excerpt):**
            %s

            **EU AI Act Context:**
            %s

            **Analysis Result to Evaluate:**
            %s

            **Evaluation Criteria:**
            1. **Accuracy (0-1)**: Are the identified AI components and risks accurate?
            2. **Completeness (0-1)**: Did the analysis cover all relevant aspects?
            3. **Consistency (0-1)**: Are the risk classifications consistent with EU AI Act?

            Provide scores and reasoning in JSON format:

            ```json
            {
              "accuracy_score": 0.0-1.0,
              "completeness_score": 0.0-1.0,
              "consistency_score": 0.0-1.0,
              "overall_score": 0.0-1.0,
              "reasoning": "Detailed explanation of scores..."
            }
            ```

            Respond ONLY with valid JSON.
            """;

    private final ChatClient analysisChatClient;
    private final ChatClient judgeChatClient;
    private final ResilientCaller resilientCaller;
    private final ObjectMapper objectMapper;

    public ChatAnalysisModelClient(@Qualifier("analysisChatClient") ChatClient analysisChatClient,
                                   @Qualifier("judgeChatClient") ChatClient judgeChatClient,
                                   ResilientCaller resilientCaller,
                                   ObjectMapper objectMapper) {
        this.analysisChatClient = analysisChatClient;
        this.judgeChatClient = judgeChatClient;
        this.resilientCaller = resilientCaller;
        this.objectMapper = objectMapper;
    }

    @Override
    public Analysis analyze(String documentText, List<ContextPassage> context) {
        String contextBlock = IntStream.range(0, context.size())
                .mapToObj(i -> "[Context %d]\n%s".formatted(i + 1, context.get(i).text()))
                .collect(Collectors.joining("\n\n"));
        String prompt = ANALYSIS_PROMPT.formatted(contextBlock, truncate(documentText, ANALYSIS_DOCUMENT_CHARS));

        log.info("Calling model for project analysis ({} context passages)...", context.size());
        String content = complete(analysisChatClient, "AnalysisModel", ANALYSIS_SYSTEM_PROMPT, prompt,
                ChatOptions.builder().temperature(0.3).maxTokens(2000).build());

        Analysis analysis = ModelOutputDecoder.decodeAnalysis(parseJson(content));
        log.info("Analysis complete: '{}' (contains AI: {}, {} high / {} low risks)",
                analysis.projectName(), analysis.containsAi(),
                analysis.highRisks().size(), analysis.lowRisks().size());
        return analysis;
    }

    @Override
    public JudgeVerdict judge(String documentText, Analysis analysis, List<ContextPassage> context) {
        String contextBlock = context.stream()
                .limit(JUDGE_CONTEXT_PASSAGES)
                .map(ContextPassage::text)
                .collect(Collectors.joining("\n\n"));
        String prompt = JUDGE_PROMPT.formatted(
                truncate(documentText, JUDGE_DOCUMENT_CHARS), contextBlock, toJson(analysis));

        log.info("Calling model for judge evaluation...");
        String content = complete(judgeChatClient, "JudgeModel", JUDGE_SYSTEM_PROMPT, prompt,
                ChatOptions.builder().temperature(0.2).maxTokens(1000).build());

        JudgeVerdict verdict = ModelOutputDecoder.decodeJudge(parseJson(content));
        log.info("Judge score: {}", "%.2f".formatted(verdict.overall()));
        return verdict;
    }

    /**
     * Strips markdown code fences and parses the remainder leniently.
     */
    static JsonNode parseJson(String content) {
        String json = stripCodeFences(content);
        try {
            return LENIENT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse JSON from model response: {}\nContent: {}",
                    e.getOriginalMessage(), truncate(json, 500));
            throw new ModelOutputParseException("Model returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String stripCodeFences(String content) {
        String text = content.strip();
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        if (firstNewline < 0) {
            return "";
        }
        text = text.substring(firstNewline + 1);
        int closing = text.lastIndexOf("```");
        return (closing >= 0 ? text.substring(0, closing) : text).strip();
    }

    private String complete(ChatClient chatClient, String operation, String systemPrompt,
                            String userPrompt, ChatOptions options) {
        try {
            return resilientCaller.call(operation, () -> {
                ChatResponse chatResponse = chatClient.prompt()
                        .system(systemPrompt)
                        .user(userPrompt)
                        .options(options)
                        .call()
                        .chatResponse();

                logTokenUsage(chatResponse, operation);

                String content = (chatResponse != null && chatResponse.getResult() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                if (content == null || content.isBlank()) {
                    throw new IllegalStateException("Empty or null content in model response");
                }
                log.debug("{}: raw response {}", operation, truncate(content, 500));
                return content;
            });
        } catch (RuntimeException e) {
            throw new ModelCallException("%s call failed: %s".formatted(operation, e.getMessage()), e);
        }
    }

    private String toJson(Analysis analysis) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("project_name", analysis.projectName());
        payload.put("description", analysis.description());
        payload.put("contains_ai", analysis.containsAi());
        payload.put("ai_confidence", analysis.aiConfidence());
        payload.put("high_risks", analysis.highRisks().stream().map(ChatAnalysisModelClient::riskPayload).toList());
        payload.put("low_risks", analysis.lowRisks().stream().map(ChatAnalysisModelClient::riskPayload).toList());
        payload.put("metadata", analysis.metadata());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize analysis for the judge prompt", e);
        }
    }

    private static Map<String, Object> riskPayload(Risk risk) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("description", risk.description());
        payload.put("category", risk.category());
        payload.put("level", risk.level());
        payload.put("eu_act_reference", risk.euActReference());
        payload.put("confidence_score", risk.confidenceScore());
        return payload;
    }

    private static void logTokenUsage(ChatResponse chatResponse, String operation) {
        if (chatResponse == null || chatResponse.getMetadata() == null) return;
        var usage = chatResponse.getMetadata().getUsage();
        if (usage == null || usage.getTotalTokens() == null) return;
        log.debug("{}: {} tokens (model={})", operation, usage.getTotalTokens(), chatResponse.getMetadata().getModel());
    }

    private static String truncate(String text, int maxLen) {
        if (text == null || text.length() <= maxLen) return text;
        return text.substring(0, maxLen);
    }
}
