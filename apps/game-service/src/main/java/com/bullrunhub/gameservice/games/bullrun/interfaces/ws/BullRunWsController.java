package com.bullrunhub.gameservice.games.bullrun.interfaces.ws;

import com.bullrunhub.gameservice.games.bullrun.application.RoomMessenger;
import com.bullrunhub.gameservice.games.bullrun.application.SessionCoordinator;
import com.bullrunhub.gameservice.games.bullrun.domain.constants.GameMessages;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.LeaveResult;
import com.bullrunhub.gameservice.games.bullrun.domain.enums.EventType;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomException;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.AdminSettingsCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.CommandReply;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.CreateRoomCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.JoinRoomCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.QuizCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.SimpleCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.StartGameCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.SubmitNetworthCmd;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.UpdatePlayerStateCmd;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * BullRun WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/bullrun.* 指令，交给 SessionCoordinator 处理。
 *
 * 带 requestId 的指令一律回一条 CommandReply（成功或失败）；
 * 不带 requestId 的指令失败时给本人私发一条 ERROR。
 * 任何失败都只影响发起者，不会波及房间内其他人。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class BullRunWsController {

    private final SessionCoordinator coordinator;
    private final RoomMessenger messenger;

    @MessageMapping("/bullrun.createRoom")
    public void createRoom(CreateRoomCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId, () -> coordinator.createRoom(playerId, cmd.getPlayerName()));
    }

    @MessageMapping("/bullrun.joinRoom")
    public void joinRoom(JoinRoomCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId,
                () -> coordinator.joinRoom(playerId, cmd.getRoomId(), cmd.getPlayerName()));
    }

    @MessageMapping("/bullrun.leaveRoom")
    public void leaveRoom(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId, () -> {
            LeaveResult r = coordinator.leaveRoom(playerId);
            return Map.of("left", r.leftRoom());
        });
    }

    @MessageMapping("/bullrun.startGame")
    public void startGame(StartGameCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId, () -> {
            coordinator.startGame(playerId, cmd.getAdminSettings(), cmd.getInitialGameState());
            return null;
        });
    }

    @MessageMapping("/bullrun.togglePause")
    public void togglePause(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId, () -> Map.of("toggled", coordinator.togglePause(playerId)));
    }

    @MessageMapping("/bullrun.updateAdminSettings")
    public void updateAdminSettings(AdminSettingsCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId,
                () -> coordinator.updateAdminSettings(playerId, cmd.getAdminSettings()));
    }

    @MessageMapping("/bullrun.requestKeyExchange")
    public void requestKeyExchange(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId, () -> coordinator.requestKeyExchange(playerId));
    }

    @MessageMapping("/bullrun.submitNetworth")
    public void submitNetworth(SubmitNetworthCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId, () -> coordinator.submitNetworth(playerId, cmd));
    }

    // ---- 无应答的高频指令 ----

    @MessageMapping("/bullrun.updatePlayerState")
    public void updatePlayerState(UpdatePlayerStateCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(null, playerId, () -> {
            coordinator.updatePlayerState(playerId, cmd.getNetworth(), cmd.getPortfolioBreakdown());
            return null;
        });
    }

    @MessageMapping("/bullrun.quizStarted")
    public void quizStarted(QuizCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(null, playerId, () -> {
            coordinator.quizStarted(playerId, cmd.getQuizCategory());
            return null;
        });
    }

    @MessageMapping("/bullrun.quizFinished")
    public void quizFinished(QuizCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(null, playerId, () -> {
            coordinator.quizFinished(playerId, cmd.getQuizCategory());
            return null;
        });
    }

    @MessageMapping("/bullrun.introCompleted")
    public void introCompleted(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        String playerId = playerId(sha);
        handle(cmd.getRequestId(), playerId, () -> {
            coordinator.introCompleted(playerId);
            return null;
        });
    }

    // ------------------------------------------------------------------

    /**
     * 执行指令并应答。
     * RoomException 的消息直接给客户端；其他异常只回通用文案，细节留在日志里。
     */
    void handle(String requestId, String playerId, Supplier<Object> action) {
        try {
            Object data = action.get();
            if (requestId != null) {
                messenger.reply(playerId, CommandReply.ok(requestId, data));
            }
        } catch (RoomException e) {
            log.debug("指令被拒绝: player={}, error={}, msg={}", playerId, e.getError(), e.getMessage());
            sendError(requestId, playerId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("指令处理异常: player={}", playerId, e);
            sendError(requestId, playerId, GameMessages.REQUEST_FAILED);
        }
    }

    private void sendError(String requestId, String playerId, String message) {
        if (requestId != null) {
            messenger.reply(playerId, CommandReply.fail(requestId, message));
        } else {
            messenger.toPlayer(playerId, null, EventType.ERROR, Map.of("message", message));
        }
    }

    private static String playerId(SimpMessageHeaderAccessor sha) {
        Principal user = sha.getUser();
        if (user != null) {
            return user.getName();
        }
        return Objects.requireNonNull(sha.getSessionId(), "session is null");
    }
}
