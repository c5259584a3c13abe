package com.ai.onboarding.websocket;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.WebSocketSession;

import java.net.InetSocketAddress;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OnboardingChatHandlerTest {

    private WebSocketSession session(String uri, String header) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getUri()).thenReturn(URI.create(uri));
        HttpHeaders headers = new HttpHeaders();
        if (header != null) headers.add("x-session-id", header);
        when(session.getHandshakeHeaders()).thenReturn(headers);
        when(session.getRemoteAddress()).thenReturn(InetSocketAddress.createUnresolved("10.0.0.5", 52000));
        return session;
    }

    @Test
    void sessionKeyPrefersQueryParameter() {
        assertThat(OnboardingChatHandler.resolveSessionKey(session("ws://host/ws?session=session_abc", "hdr")))
                .isEqualTo("session_abc");
    }

    @Test
    void sessionKeyFallsBackToHeaderThenHost() {
        assertThat(OnboardingChatHandler.resolveSessionKey(session("ws://host/ws", "hdr-1"))).isEqualTo("hdr-1");
        assertThat(OnboardingChatHandler.resolveSessionKey(session("ws://host/ws?session=", null))).isEqualTo("10.0.0.5");
    }
}
