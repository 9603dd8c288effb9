package com.bullrunhub.gameservice.games.bullrun.interfaces.ws;

import com.bullrunhub.gameservice.games.bullrun.application.RoomMessenger;
import com.bullrunhub.gameservice.games.bullrun.application.SessionCoordinator;
import com.bullrunhub.gameservice.games.bullrun.domain.enums.EventType;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomError;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomException;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.CommandReply;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.CreateRoomCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.SimpleCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.UpdatePlayerStateCmd;
import com.bullrunhub.gameservice.platform.ws.PlayerPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BullRunWsController")
class BullRunWsControllerTest {

    @Mock
    private SessionCoordinator coordinator;
    @Mock
    private RoomMessenger messenger;

    @InjectMocks
    private BullRunWsController controller;

    private SimpMessageHeaderAccessor sha;

    @BeforeEach
    void setUp() {
        sha = SimpMessageHeaderAccessor.create();
        sha.setSessionId("sess-1");
        sha.setUser(new PlayerPrincipal("sess-1"));
    }

    @Test
    @DisplayName("successful commands with a requestId get an ok reply carrying the result")
    void createRoom_ok() {
        Map<String, Object> data = Map.of("roomId", "ABC234", "hostId", "sess-1");
        when(coordinator.createRoom("sess-1", "Host")).thenReturn(data);
        CreateRoomCmd cmd = new CreateRoomCmd();
        cmd.setRequestId("r1");
        cmd.setPlayerName("Host");

        controller.createRoom(cmd, sha);

        verify(messenger).reply("sess-1", CommandReply.ok("r1", data));
    }

    @Test
    @DisplayName("rejections reach only the requester as a failed reply with the rejection message")
    void togglePause_rejected() {
        when(coordinator.togglePause("sess-1")).thenThrow(new RoomException(RoomError.NOT_HOST, "Only host can do that"));
        SimpleCmd cmd = new SimpleCmd();
        cmd.setRequestId("r2");

        controller.togglePause(cmd, sha);

        verify(messenger).reply("sess-1", CommandReply.fail("r2", "Only host can do that"));
        verify(messenger, never()).toRoom(anyString(), any(), any());
    }

    @Test
    @DisplayName("unexpected failures are reported with a generic message")
    void requestKeyExchange_unexpected() {
        when(coordinator.requestKeyExchange("sess-1")).thenThrow(new IllegalStateException("key material"));
        SimpleCmd cmd = new SimpleCmd();
        cmd.setRequestId("r3");

        controller.requestKeyExchange(cmd, sha);

        verify(messenger).reply("sess-1", CommandReply.fail("r3", "Request failed"));
    }

    @Test
    @DisplayName("fire-and-forget commands report failures as a private ERROR event")
    void updatePlayerState_failure_privateError() {
        doThrow(new IllegalStateException("boom")).when(coordinator).updatePlayerState("sess-1", 5.0, null);
        UpdatePlayerStateCmd cmd = new UpdatePlayerStateCmd();
        cmd.setNetworth(5.0);

        controller.updatePlayerState(cmd, sha);

        verify(messenger).toPlayer("sess-1", null, EventType.ERROR, Map.of("message", "Request failed"));
        verify(messenger, never()).reply(anyString(), any());
    }

    @Test
    @DisplayName("the session id identifies the player when no principal is attached")
    void playerId_fallsBackToSession() {
        SimpMessageHeaderAccessor anonymous = SimpMessageHeaderAccessor.create();
        anonymous.setSessionId("sess-9");
        SimpleCmd cmd = new SimpleCmd();

        controller.introCompleted(cmd, anonymous);

        verify(coordinator).introCompleted("sess-9");
        verify(messenger, never()).reply(anyString(), any());
    }
}
