package com.ai.onboarding.websocket;

import com.ai.onboarding.dto.ChatReply;
import com.ai.onboarding.service.OnboardingFlowService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat endpoint of the onboarding assistant.
 * In: {@code {"type":"user_message","content":"..."}}. Out: {@code bot_message} and {@code state_update}.
 */
@Component
public class OnboardingChatHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(OnboardingChatHandler.class);

    static final String SESSION_KEY_ATTR = "onboardingSessionKey";
    static final String SESSION_QUERY_PARAM = "session";
    static final String SESSION_HEADER = "x-session-id";

    private final ObjectMapper mapper = new ObjectMapper();
    private final OnboardingFlowService flowService;

    public OnboardingChatHandler(OnboardingFlowService flowService) {
        this.flowService = flowService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String sessionKey = resolveSessionKey(session);
        session.getAttributes().put(SESSION_KEY_ATTR, sessionKey);
        log.info("Client connected | sessionKey={}", sessionKey);

        try {
            ChatReply reply = flowService.openConversation(sessionKey);
            sendBotMessage(session, reply);
            sendStateUpdate(session, reply);
        } catch (Exception e) {
            log.error("Failed to open onboarding for {}", sessionKey, e);
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String sessionKey = (String) session.getAttributes().get(SESSION_KEY_ATTR);

        JsonNode root;
        try {
            root = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed message from {}: {}", sessionKey, e.getOriginalMessage());
            return;
        }
        if (!"user_message".equals(root.path("type").asText())) {
            return;
        }
        String content = root.path("content").asText("");

        try {
            ChatReply reply = flowService.handleUserMessage(sessionKey, content);
            sendBotMessage(session, reply);
            if (reply.isAdvanced()) {
                sendStateUpdate(session, reply);
            }
        } catch (Exception e) {
            log.error("Onboarding pipeline error | sessionKey={}", sessionKey, e);
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Client {} disconnected ({})", session.getAttributes().get(SESSION_KEY_ATTR), status.getCode());
    }

    private void sendBotMessage(WebSocketSession session, ChatReply reply) throws IOException {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("state", reply.getPromptState().getValue());
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "bot_message");
        msg.put("content", reply.getContent());
        msg.put("data", data);
        send(session, msg);
    }

    private void sendStateUpdate(WebSocketSession session, ChatReply reply) throws IOException {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("current_state", reply.getCurrentState().getValue());
        data.put("progress", reply.getProgress());
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "state_update");
        msg.put("data", data);
        send(session, msg);
    }

    private void send(WebSocketSession session, Map<String, Object> msg) throws IOException {
        if (session.isOpen()) {
            session.sendMessage(new TextMessage(mapper.writeValueAsString(msg)));
        }
    }

    /** {@code ?session=} first, then the {@code x-session-id} header, then the client host. */
    static String resolveSessionKey(WebSocketSession session) {
        if (session.getUri() != null) {
            String fromQuery = UriComponentsBuilder.fromUri(session.getUri()).build()
                    .getQueryParams().getFirst(SESSION_QUERY_PARAM);
            if (StringUtils.isNotBlank(fromQuery)) return fromQuery.trim();
        }
        String fromHeader = session.getHandshakeHeaders().getFirst(SESSION_HEADER);
        if (StringUtils.isNotBlank(fromHeader)) return fromHeader.trim();

        InetSocketAddress remote = session.getRemoteAddress();
        return remote != null ? remote.getHostString() : session.getId();
    }
}
