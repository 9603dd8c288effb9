package com.bullrunhub.gameservice.games.bullrun.interfaces.http.dto;

import com.bullrunhub.gameservice.games.bullrun.domain.enums.PauseReason;
import com.bullrunhub.gameservice.games.bullrun.domain.model.AdminSettings;
import com.bullrunhub.gameservice.games.bullrun.domain.model.GameState;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PlayerInfo;
import com.bullrunhub.gameservice.games.bullrun.domain.model.Room;

import java.util.ArrayList;
import java.util.List;

/**
 * 房间只读视图（REST）：不含密钥、生活事件等私有数据。
 */
public record RoomView(String roomId,
                       String hostId,
                       long createdAt,
                       List<PlayerInfo> players,
                       AdminSettings adminSettings,
                       boolean started,
                       boolean ended,
                       boolean paused,
                       PauseReason pauseReason,
                       int currentYear,
                       int currentMonth) {

    public static RoomView of(Room room) {
        GameState gs = room.getGameState();
        return new RoomView(
                room.getCode(),
                room.getHostId(),
                room.getCreatedAt(),
                new ArrayList<>(room.getPlayers().values()),
                room.getAdminSettings(),
                gs.isStarted(),
                gs.isEnded(),
                gs.isPaused(),
                gs.getPauseReason(),
                gs.getCurrentYear(),
                gs.getCurrentMonth());
    }
}
