package com.openness.crawler.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LlmClient} backed by a LangChain4j chat model. Every answer is expected to be a JSON object,
 * optionally wrapped in prose or a code fence.
 */
public class LangChainLlmClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(LangChainLlmClient.class);
    private static final String TRUNCATION_SUFFIX = "...";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final int contentBudgetChars;

    public LangChainLlmClient(ChatModel chatModel, ObjectMapper objectMapper, int contentBudgetChars) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.contentBudgetChars = Math.max(1, contentBudgetChars);
    }

    @Override
    public SubpageSelection selectSubpages(SubpageSelectionRequest request) {
        if (request.maxPages() <= 0 || request.candidates().isEmpty()) {
            return new SubpageSelection(List.of(), "nothing to select", Map.of());
        }
        JsonNode root = ask(LlmPrompts.SELECTION_SYSTEM, LlmPrompts.selection(request));
        JsonNode urls = root.path("selected_urls");
        if (!urls.isArray()) {
            throw new LlmException("Response has no selected_urls array");
        }
        List<String> selected = new ArrayList<>();
        for (JsonNode url : urls) {
            if (url.isTextual() && !url.asText().isBlank() && selected.size() < request.maxPages()) {
                selected.add(url.asText().trim());
            }
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        JsonNode scoreNode = root.path("relevance_scores");
        if (scoreNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = scoreNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isNumber()) {
                    scores.put(field.getKey(), field.getValue().asDouble());
                }
            }
        }
        return new SubpageSelection(selected, root.path("reasoning").asText(""), scores);
    }

    @Override
    public CriterionAnalysis analyzeCriterion(CriterionAnalysisRequest request) {
        String excerpt = truncate(request.content());
        JsonNode root = ask(LlmPrompts.ANALYSIS_SYSTEM, LlmPrompts.analysis(request, excerpt));
        if (!root.has("fulfilled")) {
            throw new LlmException("Response has no fulfilled field");
        }
        List<String> evidence = new ArrayList<>();
        JsonNode evidenceNode = root.path("evidence");
        if (evidenceNode.isArray()) {
            evidenceNode.forEach(item -> {
                if (!item.asText("").isBlank()) {
                    evidence.add(item.asText());
                }
            });
        } else if (evidenceNode.isTextual() && !evidenceNode.asText().isBlank()) {
            evidence.add(evidenceNode.asText());
        }
        return new CriterionAnalysis(
            root.path("fulfilled").asBoolean(false),
            root.path("confidence").asDouble(0.0),
            root.path("justification").asText(""),
            evidence
        );
    }

    @Override
    public boolean ping() {
        try {
            ChatResponse response = chatModel.chat(ChatRequest.builder()
                .messages(UserMessage.from("Reply with the single word OK."))
                .build());
            String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
            return text != null && !text.isBlank();
        } catch (RuntimeException e) {
            log.warn("LLM connection check failed: {}", e.toString());
            return false;
        }
    }

    String truncate(String content) {
        if (content == null) {
            return "";
        }
        if (content.length() <= contentBudgetChars) {
            return content;
        }
        return content.substring(0, contentBudgetChars) + TRUNCATION_SUFFIX;
    }

    private JsonNode ask(String system, String user) {
        String text;
        try {
            ChatResponse response = chatModel.chat(ChatRequest.builder()
                .messages(SystemMessage.from(system), UserMessage.from(user))
                .build());
            text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        } catch (RuntimeException e) {
            throw new LlmException("LLM call failed: " + e.getMessage(), e);
        }
        if (text == null || text.isBlank()) {
            throw new LlmException("Empty LLM response");
        }
        return parseJsonObject(text);
    }

    JsonNode parseJsonObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new LlmException("No JSON object in LLM response");
        }
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new LlmException("LLM response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new LlmException("Malformed JSON in LLM response", e);
        }
    }
}
