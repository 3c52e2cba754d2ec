package com.openness.crawler.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LangChainLlmClientTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final LangChainLlmClient client = new LangChainLlmClient(chatModel, new ObjectMapper(), 20);

    @Test
    void parsesAnalysisWrappedInCodeFence() {
        reply("""
            Here is my verdict:
            ```json
            {"fulfilled": true, "confidence": 0.82, "justification": "report linked", "evidence": ["Jahresbericht 2023"]}
            ```
            """);

        CriterionAnalysis analysis = client.analyzeCriterion(request("Jahresbericht 2023 als PDF"));

        assertTrue(analysis.fulfilled());
        assertEquals(0.82, analysis.confidence());
        assertEquals("report linked", analysis.justification());
        assertThat(analysis.evidence()).containsExactly("Jahresbericht 2023");
    }

    @Test
    void clampsOutOfRangeConfidence() {
        reply("{\"fulfilled\": true, \"confidence\": 1.7, \"justification\": \"sure\", \"evidence\": \"single quote\"}");

        CriterionAnalysis analysis = client.analyzeCriterion(request("x"));

        assertEquals(1.0, analysis.confidence());
        assertThat(analysis.evidence()).containsExactly("single quote");
    }

    @Test
    void malformedJsonRaisesLlmException() {
        reply("{\"fulfilled\": true, \"confidence\": }");

        assertThatThrownBy(() -> client.analyzeCriterion(request("x"))).isInstanceOf(LlmException.class);
    }

    @Test
    void proseWithoutJsonRaisesLlmException() {
        reply("I cannot tell.");

        assertThatThrownBy(() -> client.analyzeCriterion(request("x")))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("No JSON object");
    }

    @Test
    void missingVerdictRaisesLlmException() {
        reply("{\"confidence\": 0.4}");

        assertThatThrownBy(() -> client.analyzeCriterion(request("x"))).isInstanceOf(LlmException.class);
    }

    @Test
    void transportFailureIsWrapped() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("connection reset"));

        assertThatThrownBy(() -> client.analyzeCriterion(request("x")))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("connection reset");
    }

    @Test
    void truncatesContentToBudgetBeforeSending() {
        reply("{\"fulfilled\": false, \"confidence\": 0.1, \"justification\": \"\", \"evidence\": []}");

        client.analyzeCriterion(request("abcdefghijklmnopqrstuvwxyz0123456789"));

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        String prompt = ((UserMessage) captor.getValue().messages().get(1)).singleText();
        assertThat(prompt).contains("abcdefghijklmnopqrst...");
        assertThat(prompt).doesNotContain("uvwxyz");
    }

    @Test
    void truncateKeepsShortContent() {
        assertEquals("short", client.truncate("short"));
        assertEquals("", client.truncate(null));
    }

    @Test
    void selectionIsCappedAtMaxPages() {
        reply("""
            {"selected_urls": ["https://example.org/a", "https://example.org/b", "https://example.org/c"],
             "reasoning": "governance first",
             "relevance_scores": {"https://example.org/a": 0.9, "https://example.org/b": "high"}}
            """);

        SubpageSelection selection = client.selectSubpages(selectionRequest(2));

        assertThat(selection.selectedUrls()).containsExactly("https://example.org/a", "https://example.org/b");
        assertEquals("governance first", selection.reasoning());
        assertThat(selection.relevanceScores()).containsOnlyKeys("https://example.org/a");
    }

    @Test
    void selectionWithoutUrlArrayRaisesLlmException() {
        reply("{\"reasoning\": \"none\"}");

        assertThatThrownBy(() -> client.selectSubpages(selectionRequest(2))).isInstanceOf(LlmException.class);
    }

    @Test
    void zeroPageSelectionSkipsModel() {
        SubpageSelection selection = client.selectSubpages(selectionRequest(0));

        assertThat(selection.selectedUrls()).isEmpty();
        verifyNoInteractions(chatModel);
    }

    @Test
    void pingReportsModelAvailability() {
        reply("OK");
        assertTrue(client.ping());

        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("401 unauthorized"));
        assertFalse(client.ping());
    }

    private void reply(String text) {
        when(chatModel.chat(any(ChatRequest.class)))
            .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
    }

    private static CriterionAnalysisRequest request(String content) {
        return new CriterionAnalysisRequest(
            content,
            "Jahresbericht",
            "Publishes an annual report",
            List.of("jahresbericht"),
            "https://example.org/"
        );
    }

    private static SubpageSelectionRequest selectionRequest(int maxPages) {
        return new SubpageSelectionRequest(
            "Hochschule Test",
            "https://example.org/",
            List.of(
                new SubpageCandidate("https://example.org/a", "A"),
                new SubpageCandidate("https://example.org/b", "B"),
                new SubpageCandidate("https://example.org/c", "C")
            ),
            List.of("Jahresbericht"),
            maxPages
        );
    }
}
