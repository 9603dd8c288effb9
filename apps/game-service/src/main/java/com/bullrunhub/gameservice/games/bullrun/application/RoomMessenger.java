package com.bullrunhub.gameservice.games.bullrun.application;

import com.bullrunhub.gameservice.games.bullrun.domain.enums.EventType;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.BroadcastEvent;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.CommandReply;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * STOMP 出口：房间广播、玩家私有事件、指令应答。
 */
@Component
@RequiredArgsConstructor
public class RoomMessenger {

    public static final String ROOM_TOPIC_PREFIX = "/topic/bullrun.room.";
    public static final String PRIVATE_EVENTS = "/queue/bullrun.events";
    public static final String REPLY_QUEUE = "/queue/bullrun.reply";

    private final SimpMessagingTemplate messaging;

    public static String topic(String roomCode) {
        return ROOM_TOPIC_PREFIX + roomCode;
    }

    public void toRoom(String roomCode, EventType type, Object payload) {
        messaging.convertAndSend(topic(roomCode), new BroadcastEvent(roomCode, type.name(), payload));
    }

    /** playerId 即连接的 Principal 名 */
    public void toPlayer(String playerId, String roomCode, EventType type, Object payload) {
        messaging.convertAndSendToUser(playerId, PRIVATE_EVENTS, new BroadcastEvent(roomCode, type.name(), payload));
    }

    public void reply(String playerId, CommandReply reply) {
        messaging.convertAndSendToUser(playerId, REPLY_QUEUE, reply);
    }
}
