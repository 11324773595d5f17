package com.textworld.adventureservice.games.textworld.interfaces.ws;

import com.textworld.adventureservice.games.textworld.domain.error.RoomRejection;
import com.textworld.adventureservice.games.textworld.domain.error.StateConflictException;
import com.textworld.adventureservice.games.textworld.interfaces.command.CommandDispatcher;
import com.textworld.adventureservice.games.textworld.interfaces.ws.dto.TextworldMessages;
import com.textworld.adventureservice.platform.transport.Envelope;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.adventureservice.platform.ws.PlayerPrincipal;
import com.textworld.web.common.CurrentPlayerInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TextworldWsControllerTest {

    private final CurrentPlayerInfo player = new CurrentPlayerInfo("p1", "阿明", "group.9");

    private CommandDispatcher dispatcher;
    private SimpMessagingTemplate messaging;
    private TextworldWsController controller;

    @BeforeEach
    void setUp() {
        dispatcher = mock(CommandDispatcher.class);
        messaging = mock(SimpMessagingTemplate.class);
        controller = new TextworldWsController(dispatcher, messaging);
    }

    private SimpMessageHeaderAccessor session(boolean authenticated) {
        SimpMessageHeaderAccessor sha = SimpMessageHeaderAccessor.create();
        sha.setSessionId("s1");
        if (authenticated) {
            sha.setUser(new PlayerPrincipal(player));
        }
        return sha;
    }

    private static TextworldMessages.InputCmd cmd(String text) {
        TextworldMessages.InputCmd cmd = new TextworldMessages.InputCmd();
        cmd.setText(text);
        return cmd;
    }

    @Test
    void sendsEachReplyToSender() {
        when(dispatcher.dispatch(any())).thenReturn(List.of("一", "二"));

        controller.input(cmd("/tw status"), session(true));

        verify(messaging, times(2)).convertAndSendToUser(eq("p1"), eq(TextworldWsController.REPLY_DESTINATION), any(Envelope.class));
        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(dispatcher).dispatch(captor.capture());
        assertThat(captor.getValue().sender()).isEqualTo(player);
        assertThat(captor.getValue().attachment()).isNull();
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void rejectionBecomesErrorEnvelope() {
        when(dispatcher.dispatch(any())).thenThrow(new StateConflictException(RoomRejection.FULL));

        controller.input(cmd("/tw join ab12cd34"), session(true));

        ArgumentCaptor<Envelope<String>> captor = ArgumentCaptor.forClass((Class) Envelope.class);
        verify(messaging).convertAndSendToUser(eq("p1"), eq(TextworldWsController.REPLY_DESTINATION), captor.capture());
        assertThat(captor.getValue().kind()).isEqualTo(Envelope.Kind.ERROR);
        assertThat(captor.getValue().channel()).isEqualTo("group.9");
        assertThat(captor.getValue().payload()).isEqualTo("❌ " + RoomRejection.FULL.message());
    }

    @Test
    void anonymousInputIsDropped() {
        controller.input(cmd("/tw list"), session(false));

        verifyNoInteractions(dispatcher, messaging);
    }
}
