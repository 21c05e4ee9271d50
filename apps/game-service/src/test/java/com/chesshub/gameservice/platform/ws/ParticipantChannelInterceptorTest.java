package com.chesshub.gameservice.platform.ws;

import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;

import java.security.Principal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class ParticipantChannelInterceptorTest {

    private final ParticipantChannelInterceptor interceptor = new ParticipantChannelInterceptor();

    @Test
    void shouldAdoptRequestedParticipantIdOnConnect() {
        StompHeaderAccessor accessor = connect();
        accessor.setNativeHeader(ParticipantChannelInterceptor.PARTICIPANT_HEADER, " alice ");

        interceptor.preSend(message(accessor), null);

        assertEquals("alice", accessor.getUser().getName());
    }

    @Test
    void shouldAssignRandomIdWhenNoneRequested() {
        StompHeaderAccessor first = connect();
        StompHeaderAccessor second = connect();

        interceptor.preSend(message(first), null);
        interceptor.preSend(message(second), null);

        Principal p1 = first.getUser();
        assertNotNull(p1);
        assertDoesNotThrow(() -> UUID.fromString(p1.getName()));
        assertNotEquals(p1.getName(), second.getUser().getName());
    }

    @Test
    void shouldIgnoreOversizedParticipantId() {
        StompHeaderAccessor accessor = connect();
        accessor.setNativeHeader(ParticipantChannelInterceptor.PARTICIPANT_HEADER, "x".repeat(100));

        interceptor.preSend(message(accessor), null);

        assertEquals(36, accessor.getUser().getName().length());
    }

    @Test
    void shouldLeaveOtherFramesUntouched() {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.SEND);
        accessor.setLeaveMutable(true);

        interceptor.preSend(message(accessor), null);

        assertNull(accessor.getUser());
    }

    private static StompHeaderAccessor connect() {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        accessor.setSessionId(UUID.randomUUID().toString());
        accessor.setLeaveMutable(true);
        return accessor;
    }

    private static Message<byte[]> message(StompHeaderAccessor accessor) {
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }
}
