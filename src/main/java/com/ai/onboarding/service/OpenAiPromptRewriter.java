package com.ai.onboarding.service;

import com.ai.onboarding.conversation.ConversationState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rephrases onboarding prompts with OpenAI Chat Completions.
 */
@Service
public class OpenAiPromptRewriter implements PromptRewriter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiPromptRewriter.class);

    static final String SYSTEM_PROMPT = "You are a friendly insurance-onboarding assistant. "
            + "Keep replies warm, at most 3 short sentences, and ask ONLY for the field in the current step.";

    static final String ERROR_SYSTEM_PROMPT = "You are a helpful insurance assistant. "
            + "When users make input errors, gently guide them without sounding condescending.";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.model:gpt-4.1-nano}")
    private String openAiModel;

    @Value("${openai.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    public OpenAiPromptRewriter(RestTemplateBuilder builder,
                                @Value("${openai.connect-timeout:10s}") Duration connectTimeout,
                                @Value("${openai.read-timeout:30s}") Duration readTimeout) {
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Override
    public String rewrite(ConversationState state, String basePrompt, String userName) {
        String userPrompt = "Current state: " + state.getValue() + "\n"
                + "Base message: " + basePrompt + "\n"
                + "User name: " + (StringUtils.isNotBlank(userName) ? userName : "Not provided") + "\n\n"
                + "Rewrite the base message conversationally. "
                + "Use the user's name sparingly (about once every few turns).";
        String reply = chat(SYSTEM_PROMPT, userPrompt);
        if (StringUtils.isBlank(reply)) {
            log.warn("Using canned prompt for {}", state.getValue());
            return basePrompt;
        }
        return reply;
    }

    @Override
    public String rewriteError(ConversationState state, String userInput, String errorMessage) {
        String userPrompt = "The user provided invalid input for " + state.getValue() + ".\n"
                + "User input: \"" + userInput + "\"\n"
                + "Error: " + errorMessage + "\n"
                + "Create a friendly 1-2 sentence clarification.";
        String reply = chat(ERROR_SYSTEM_PROMPT, userPrompt);
        if (StringUtils.isBlank(reply)) {
            log.warn("Using canned guidance for {}", state.getValue());
            return "I didn't understand that. " + errorMessage;
        }
        return reply;
    }

    /** Returns the assistant text, or an empty string when the call is not possible or fails. */
    private String chat(String systemPrompt, String userPrompt) {
        if (StringUtils.isBlank(openAiApiKey)) {
            log.debug("OPENAI_API_KEY is not set; skipping rephrase");
            return "";
        }

        String url = StringUtils.removeEnd(baseUrl.trim(), "/") + "/chat/completions";

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(openAiApiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        Map<String, String> systemMsg = new HashMap<>();
        systemMsg.put("role", "system");
        systemMsg.put("content", systemPrompt);
        messages.add(systemMsg);
        Map<String, String> userMsg = new HashMap<>();
        userMsg.put("role", "user");
        userMsg.put("content", userPrompt);
        messages.add(userMsg);

        Map<String, Object> body = new HashMap<>();
        body.put("model", openAiModel);
        body.put("temperature", 0.7);
        body.put("max_tokens", 150);
        body.put("messages", messages);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            return root.path("choices").path(0).path("message").path("content").asText("").trim();
        } catch (Exception ex) {
            log.error("OpenAI rephrase failed", ex);
            return "";
        }
    }
}
