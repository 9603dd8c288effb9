package com.bullrunhub.gameservice.games.bullrun.domain.model;

import com.bullrunhub.gameservice.clock.scheduler.TickHandle;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 游戏房间实体。
 * 所有字段只在 RoomServiceImpl 中、持有该对象监视器时读写；对外一律使用 {@link #copy()} 出来的快照。
 */
@Data
public class Room {

    // ---- 基本信息 ----
    private final String code;
    private final String hostId;
    private final long createdAt;

    // ---- 成员（插入顺序即加入顺序，排行榜并列时按此排序）----
    private final Map<String, PlayerInfo> players = new LinkedHashMap<>();

    private AdminSettings adminSettings;
    private GameState gameState = new GameState();

    /** 运行中计时器的句柄，只在对局进行时存在 */
    @JsonIgnore
    private TickHandle tickHandle;

    public Room(String code, String hostId, long createdAt) {
        this.code = code;
        this.hostId = hostId;
        this.createdAt = createdAt;
    }

    /** 快照：不带计时器句柄 */
    public Room copy() {
        Room c = new Room(code, hostId, createdAt);
        players.forEach((id, p) -> c.getPlayers().put(id, p.copy()));
        c.setAdminSettings(adminSettings == null ? null : adminSettings.copy());
        c.setGameState(gameState.copy());
        return c;
    }
}
