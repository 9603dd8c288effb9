package com.bullrunhub.gameservice.games.bullrun.service;

import com.bullrunhub.gameservice.clock.scheduler.TickHandle;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.LeaveResult;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.TickAdvance;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.TriggeredLifeEvent;
import com.bullrunhub.gameservice.games.bullrun.domain.model.AdminSettings;
import com.bullrunhub.gameservice.games.bullrun.domain.model.InitialGameState;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PlayerInfo;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PortfolioBreakdown;
import com.bullrunhub.gameservice.games.bullrun.domain.model.Room;

import java.util.List;
import java.util.Optional;

/**
 * 房间登记表：房间与玩家状态的唯一权威来源。
 * 校验失败抛出 RoomException；返回的 Room / PlayerInfo 都是快照。
 */
public interface RoomService {

    /** 新建房间，房主以 0 净值入座，返回 6 位房间号 */
    String createRoom(String hostId, String hostName);

    /** 加入房间；房间不存在 / 已开局 / 已在房间内时失败 */
    Room joinRoom(String roomCode, String playerId, String playerName);

    /** 离开房间；房主离开或成员清空时删除房间并取消计时器 */
    LeaveResult leaveRoom(String playerId);

    /** 删除房间：取消计时器，清理所有成员的反向索引 */
    void deleteRoom(String roomCode);

    /** 开局前的校验（房主、未开局、至少 2 人），不修改状态 */
    void assertCanStart(String roomCode, String requesterId);

    /** 冻结配置，started=true，年月重置为 1/1 */
    void startGame(String roomCode, AdminSettings adminSettings);

    /** 保存房主下发的透传初始数据 */
    void applyInitialGameState(String roomCode, InitialGameState initial);

    /** 为每名成员生成生活事件；单个玩家失败只影响自己（得到空列表） */
    boolean generateLifeEventsForRoom(String roomCode, int eventsCount);

    /** 覆盖玩家最近上报的净值与分类，不做校验 */
    boolean updatePlayerState(String playerId, double networth, PortfolioBreakdown breakdown);

    /** 不含房主，按净值降序；并列时保持加入顺序 */
    List<PlayerInfo> getLeaderboard(String roomCode);

    /** 答题开始：加入等待列表，房间进入 QUIZ 暂停 */
    boolean markQuizStarted(String playerId, String category);

    /** 答题完成：移出等待列表，恰好清空的那一次返回 true（恢复运行） */
    boolean markQuizCompleted(String playerId, String category);

    /** 介绍看完：移出介绍等待列表，清空且没有答题屏障时返回 true（恢复运行） */
    boolean markIntroCompleted(String playerId);

    /** 手动暂停/恢复；未开局或处于答题屏障时返回 false */
    boolean togglePause(String roomCode);

    /** 清理从未开局且超过 maxAgeMs 的房间，返回清理数量 */
    int cleanupOldRooms(long maxAgeMs);

    /** 开局前修改房主配置 */
    AdminSettings updateAdminSettings(String roomCode, AdminSettings settings);

    Optional<Room> snapshot(String roomCode);

    Optional<String> findRoomCodeByPlayer(String playerId);

    List<String> listRoomCodes();

    /** 记录计时器句柄，删除房间时一并取消 */
    void attachTickHandle(String roomCode, TickHandle handle);

    /** 计时器一次触发中的状态推进（检查、进位、终局判定） */
    TickAdvance advanceClock(String roomCode, int totalYears);

    /** 翻转并应用本月到期的生活事件 */
    List<TriggeredLifeEvent> triggerDueLifeEvents(String roomCode, int year, int month);

    /** 标记终局，返回此前是否处于进行中 */
    boolean markGameEnded(String roomCode);
}
