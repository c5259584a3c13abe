package com.ai.onboarding.service;

import com.ai.onboarding.conversation.SessionData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * JSON form of {@link SessionData} as stored in {@code sessions.state_data}.
 */
@Component
public class SessionDataCodec {

    private static final Logger log = LoggerFactory.getLogger(SessionDataCodec.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public SessionData decode(String json) {
        if (StringUtils.isBlank(json)) return new SessionData();
        try {
            SessionData data = mapper.readValue(json, SessionData.class);
            return data != null ? data : new SessionData();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable session data, starting from empty: {}", e.getOriginalMessage());
            return new SessionData();
        }
    }

    public String encode(SessionData data) {
        try {
            return mapper.writeValueAsString(data != null ? data : new SessionData());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize session data", e);
        }
    }
}
