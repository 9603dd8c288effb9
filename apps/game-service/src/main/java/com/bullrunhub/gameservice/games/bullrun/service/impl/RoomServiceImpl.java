package com.bullrunhub.gameservice.games.bullrun.service.impl;

import com.bullrunhub.gameservice.clock.scheduler.TickHandle;
import com.bullrunhub.gameservice.games.bullrun.domain.constants.GameMessages;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.LeaveResult;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.TickAdvance;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.TriggeredLifeEvent;
import com.bullrunhub.gameservice.games.bullrun.domain.enums.PauseReason;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomError;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomException;
import com.bullrunhub.gameservice.games.bullrun.domain.event.LifeEventGenerator;
import com.bullrunhub.gameservice.games.bullrun.domain.model.AdminSettings;
import com.bullrunhub.gameservice.games.bullrun.domain.model.GameState;
import com.bullrunhub.gameservice.games.bullrun.domain.model.InitialGameState;
import com.bullrunhub.gameservice.games.bullrun.domain.model.LifeEvent;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PlayerInfo;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PortfolioBreakdown;
import com.bullrunhub.gameservice.games.bullrun.domain.model.Room;
import com.bullrunhub.gameservice.games.bullrun.service.RoomService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 内存房间表。
 *
 * 并发模型：
 * - rooms / playerToRoom 为 ConcurrentHashMap，不需要跨房间的锁；
 * - 单个房间的所有读改写都在 synchronized(room) 内完成，处理器线程与计时器线程互斥；
 * - 对外返回的 Room / PlayerInfo 都是锁内复制的快照，序列化时不会与修改并发。
 */
@Slf4j
@Service
public class RoomServiceImpl implements RoomService {

    /** 排除 0/O、1/I 等易混字符 */
    static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 6;

    // ====== 内存房间表 ======
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    /** playerId -> roomCode */
    private final Map<String, String> playerToRoom = new ConcurrentHashMap<>();

    private final SecureRandom codeRnd = new SecureRandom();

    private final LifeEventGenerator lifeEventGenerator;

    /** 未配置 initialPocketCash 时，新玩家的起始现金 */
    private final double defaultStartingCash;

    public RoomServiceImpl(LifeEventGenerator lifeEventGenerator,
                           @Value("${bullrun.session.default-starting-cash:100000}") double defaultStartingCash) {
        this.lifeEventGenerator = lifeEventGenerator;
        this.defaultStartingCash = defaultStartingCash;
    }

    // =====================================================================
    // 房间生命周期
    // =====================================================================

    @Override
    public String createRoom(String hostId, String hostName) {
        if (playerToRoom.containsKey(hostId)) {
            throw new RoomException(RoomError.PLAYER_IN_OTHER_ROOM, GameMessages.PLAYER_IN_OTHER_ROOM);
        }
        Room room;
        String code;
        // putIfAbsent 保证并发创建时房间号也不会重复
        do {
            code = generateRoomCode();
            room = new Room(code, hostId, System.currentTimeMillis());
            room.getPlayers().put(hostId, PlayerInfo.host(hostId, hostName));
        } while (rooms.putIfAbsent(code, room) != null);

        playerToRoom.put(hostId, code);
        log.info("房间已创建: room={}, host={}", code, hostId);
        return code;
    }

    String generateRoomCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(CODE_ALPHABET.charAt(codeRnd.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    @Override
    public Room joinRoom(String roomCode, String playerId, String playerName) {
        return withRoom(roomCode, room -> {
            GameState gs = room.getGameState();
            if (gs.isStarted() || gs.isEnded()) {
                throw new RoomException(RoomError.GAME_ALREADY_STARTED, GameMessages.GAME_IN_PROGRESS);
            }
            if (room.getPlayers().containsKey(playerId)) {
                throw new RoomException(RoomError.PLAYER_ALREADY_PRESENT, GameMessages.PLAYER_ALREADY_IN_ROOM);
            }
            String other = playerToRoom.get(playerId);
            if (other != null && !other.equals(roomCode)) {
                throw new RoomException(RoomError.PLAYER_IN_OTHER_ROOM, GameMessages.PLAYER_IN_OTHER_ROOM);
            }
            double cash = room.getAdminSettings() == null
                    ? defaultStartingCash
                    : room.getAdminSettings().getInitialPocketCash();
            room.getPlayers().put(playerId, PlayerInfo.joiner(playerId, playerName, cash));
            playerToRoom.put(playerId, roomCode);
            log.info("玩家加入房间: room={}, player={}, players={}", roomCode, playerId, room.getPlayers().size());
            return room.copy();
        });
    }

    @Override
    public LeaveResult leaveRoom(String playerId) {
        String code = playerToRoom.get(playerId);
        if (code == null) {
            return LeaveResult.NOT_IN_ROOM;
        }
        Room room = rooms.get(code);
        if (room == null) {
            playerToRoom.remove(playerId, code);
            return LeaveResult.NOT_IN_ROOM;
        }
        boolean wasHost;
        boolean close;
        boolean resumed = false;
        synchronized (room) {
            PlayerInfo removed = room.getPlayers().remove(playerId);
            playerToRoom.remove(playerId, code);
            if (removed == null) {
                return LeaveResult.NOT_IN_ROOM;
            }
            wasHost = removed.isHost();
            GameState gs = room.getGameState();
            // 离开的玩家不能继续挡住屏障
            gs.getPlayersWaitingForIntro().remove(playerId);
            if (gs.getPlayersWaitingForQuiz().remove(playerId) && gs.getPlayersWaitingForQuiz().isEmpty()) {
                resumed = releaseQuizBarrier(gs);
            }
            close = wasHost || room.getPlayers().isEmpty();
        }
        log.info("玩家离开房间: room={}, player={}, wasHost={}", code, playerId, wasHost);
        if (close) {
            deleteRoom(code);
        }
        return new LeaveResult(code, wasHost, close, resumed && !close);
    }

    @Override
    public void deleteRoom(String roomCode) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            return;
        }
        synchronized (room) {
            if (!rooms.remove(roomCode, room)) {
                return;
            }
            TickHandle handle = room.getTickHandle();
            if (handle != null) {
                handle.cancel();
                room.setTickHandle(null);
            }
            room.getPlayers().keySet().forEach(pid -> playerToRoom.remove(pid, roomCode));
        }
        log.info("房间已删除: room={}", roomCode);
    }

    @Override
    public void assertCanStart(String roomCode, String requesterId) {
        withRoom(roomCode, room -> {
            if (!room.getHostId().equals(requesterId)) {
                throw new RoomException(RoomError.NOT_HOST, GameMessages.ONLY_HOST_CAN_START);
            }
            checkStartable(room);
            return null;
        });
    }

    private static void checkStartable(Room room) {
        GameState gs = room.getGameState();
        if (gs.isStarted() || gs.isEnded()) {
            throw new RoomException(RoomError.GAME_ALREADY_STARTED, GameMessages.GAME_ALREADY_STARTED);
        }
        if (room.getPlayers().size() < 2) {
            throw new RoomException(RoomError.INSUFFICIENT_PLAYERS, GameMessages.NEED_TWO_PLAYERS);
        }
    }

    @Override
    public void startGame(String roomCode, AdminSettings adminSettings) {
        withRoom(roomCode, room -> {
            checkStartable(room);
            AdminSettings settings = adminSettings == null ? new AdminSettings() : adminSettings.copy();
            room.setAdminSettings(settings);
            GameState gs = room.getGameState();
            gs.setStarted(true);
            gs.setCurrentYear(1);
            gs.setCurrentMonth(1);

            // 开局介绍：所有非房主玩家看完之前保持暂停
            List<String> introWaiting = new ArrayList<>();
            if (settings.isShowIntro()) {
                room.getPlayers().values().stream()
                        .filter(p -> !p.isHost())
                        .forEach(p -> introWaiting.add(p.getId()));
            }
            gs.setPlayersWaitingForIntro(introWaiting);
            if (gs.getPlayersWaitingForQuiz().isEmpty()) {
                if (introWaiting.isEmpty()) {
                    gs.resume();
                } else {
                    gs.pause(PauseReason.INTRO);
                }
            }
            log.info("对局开始: room={}, players={}, intro={}", roomCode, room.getPlayers().size(), !introWaiting.isEmpty());
            return null;
        });
    }

    @Override
    public void applyInitialGameState(String roomCode, InitialGameState initial) {
        if (initial == null) {
            return;
        }
        withRoom(roomCode, room -> {
            GameState gs = room.getGameState();
            if (initial.getSelectedAssets() != null) {
                gs.setSelectedAssets(initial.getSelectedAssets().deepCopy());
            }
            if (initial.getAssetUnlockSchedule() != null) {
                gs.setAssetUnlockSchedule(initial.getAssetUnlockSchedule().deepCopy());
            }
            if (initial.getYearlyQuotes() != null) {
                gs.setYearlyQuotes(new ArrayList<>(initial.getYearlyQuotes()));
            }
            if (initial.getQuizQuestionIndices() != null) {
                gs.setQuizQuestionIndices(new LinkedHashMap<>(initial.getQuizQuestionIndices()));
            }
            return null;
        });
    }

    @Override
    public boolean generateLifeEventsForRoom(String roomCode, int eventsCount) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            return false;
        }
        synchronized (room) {
            if (rooms.get(roomCode) != room) {
                return false;
            }
            Map<String, List<LifeEvent>> mapping = new LinkedHashMap<>();
            for (String playerId : room.getPlayers().keySet()) {
                try {
                    mapping.put(playerId, new ArrayList<>(
                            lifeEventGenerator.generateLifeEvents(eventsCount, room.getGameState().getAssetUnlockSchedule())));
                } catch (RuntimeException e) {
                    log.error("生活事件生成失败，该玩家使用空列表: room={}, player={}", roomCode, playerId, e);
                    mapping.put(playerId, new ArrayList<>());
                }
            }
            room.getGameState().setLifeEvents(mapping);
            return true;
        }
    }

    // =====================================================================
    // 玩家状态 / 排行榜
    // =====================================================================

    @Override
    public boolean updatePlayerState(String playerId, double networth, PortfolioBreakdown breakdown) {
        return withPlayerRoom(playerId, room -> {
            PlayerInfo p = room.getPlayers().get(playerId);
            if (p == null) {
                return false;
            }
            p.setNetworth(networth);
            p.setPortfolioBreakdown(breakdown == null ? new PortfolioBreakdown() : breakdown.copy());
            return true;
        }).orElse(false);
    }

    @Override
    public List<PlayerInfo> getLeaderboard(String roomCode) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            return List.of();
        }
        synchronized (room) {
            return leaderboardOf(room);
        }
    }

    /** List.sort 是稳定排序，并列时保持加入顺序；用比较而不是相减 */
    static List<PlayerInfo> leaderboardOf(Room room) {
        List<PlayerInfo> list = new ArrayList<>();
        room.getPlayers().values().stream()
                .filter(p -> !p.isHost())
                .forEach(p -> list.add(p.copy()));
        list.sort(Comparator.comparingDouble(PlayerInfo::getNetworth).reversed());
        return list;
    }

    // =====================================================================
    // 暂停 / 答题屏障 / 介绍
    // =====================================================================

    @Override
    public boolean markQuizStarted(String playerId, String category) {
        return withPlayerRoom(playerId, room -> {
            PlayerInfo p = room.getPlayers().get(playerId);
            GameState gs = room.getGameState();
            if (p == null || gs.isEnded()) {
                return false;
            }
            p.getQuizStatus().setCurrentQuiz(category);
            p.getQuizStatus().setCompleted(false);
            if (!gs.getPlayersWaitingForQuiz().contains(playerId)) {
                gs.getPlayersWaitingForQuiz().add(playerId);
            }
            gs.pause(PauseReason.QUIZ);
            return true;
        }).orElse(false);
    }

    @Override
    public boolean markQuizCompleted(String playerId, String category) {
        return withPlayerRoom(playerId, room -> {
            PlayerInfo p = room.getPlayers().get(playerId);
            if (p == null) {
                return false;
            }
            p.getQuizStatus().setCurrentQuiz(null);
            p.getQuizStatus().setCompleted(true);
            GameState gs = room.getGameState();
            // 不在等待列表里的完成请求不会触发恢复
            if (!gs.getPlayersWaitingForQuiz().remove(playerId) || !gs.getPlayersWaitingForQuiz().isEmpty()) {
                return false;
            }
            return releaseQuizBarrier(gs);
        }).orElse(false);
    }

    /** 答题屏障解除：还有人没看完介绍则回到 INTRO，否则恢复运行 */
    private static boolean releaseQuizBarrier(GameState gs) {
        if (gs.isStarted() && !gs.getPlayersWaitingForIntro().isEmpty()) {
            gs.pause(PauseReason.INTRO);
            return false;
        }
        gs.resume();
        return true;
    }

    @Override
    public boolean markIntroCompleted(String playerId) {
        return withPlayerRoom(playerId, room -> {
            GameState gs = room.getGameState();
            if (!gs.getPlayersWaitingForIntro().remove(playerId) || !gs.getPlayersWaitingForIntro().isEmpty()) {
                return false;
            }
            if (gs.getPauseReason() != PauseReason.INTRO) {
                return false;
            }
            gs.resume();
            return true;
        }).orElse(false);
    }

    @Override
    public boolean togglePause(String roomCode) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            return false;
        }
        synchronized (room) {
            GameState gs = room.getGameState();
            if (!gs.isStarted()) {
                return false;
            }
            // 手动操作不能越过屏障
            if (gs.getPauseReason() == PauseReason.QUIZ || gs.getPauseReason() == PauseReason.INTRO) {
                return false;
            }
            if (gs.isPaused()) {
                gs.resume();
            } else {
                gs.pause(PauseReason.MANUAL);
            }
            return true;
        }
    }

    // =====================================================================
    // 维护
    // =====================================================================

    @Override
    public int cleanupOldRooms(long maxAgeMs) {
        return cleanupOldRooms(maxAgeMs, System.currentTimeMillis());
    }

    int cleanupOldRooms(long maxAgeMs, long nowMs) {
        List<String> stale = new ArrayList<>();
        rooms.forEach((code, room) -> {
            synchronized (room) {
                GameState gs = room.getGameState();
                // 已结束的房间留给玩家自行离开
                if (!gs.isStarted() && !gs.isEnded() && nowMs - room.getCreatedAt() > maxAgeMs) {
                    stale.add(code);
                }
            }
        });
        stale.forEach(this::deleteRoom);
        if (!stale.isEmpty()) {
            log.info("清理空闲房间: count={}, rooms={}", stale.size(), stale);
        }
        return stale.size();
    }

    @Override
    public AdminSettings updateAdminSettings(String roomCode, AdminSettings settings) {
        return withRoom(roomCode, room -> {
            GameState gs = room.getGameState();
            if (gs.isStarted() || gs.isEnded()) {
                throw new RoomException(RoomError.GAME_ALREADY_STARTED, GameMessages.SETTINGS_LOCKED);
            }
            AdminSettings copy = settings == null ? new AdminSettings() : settings.copy();
            room.setAdminSettings(copy);
            return copy.copy();
        });
    }

    @Override
    public Optional<Room> snapshot(String roomCode) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            return Optional.empty();
        }
        synchronized (room) {
            return rooms.get(roomCode) == room ? Optional.of(room.copy()) : Optional.empty();
        }
    }

    @Override
    public Optional<String> findRoomCodeByPlayer(String playerId) {
        return Optional.ofNullable(playerToRoom.get(playerId));
    }

    @Override
    public List<String> listRoomCodes() {
        return new ArrayList<>(rooms.keySet());
    }

    // =====================================================================
    // 计时器协作
    // =====================================================================

    @Override
    public void attachTickHandle(String roomCode, TickHandle handle) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            handle.cancel();
            return;
        }
        synchronized (room) {
            if (rooms.get(roomCode) != room) {
                handle.cancel();
                return;
            }
            TickHandle old = room.getTickHandle();
            if (old != null && old != handle) {
                old.cancel();
            }
            room.setTickHandle(handle);
        }
    }

    @Override
    public TickAdvance advanceClock(String roomCode, int totalYears) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            return TickAdvance.of(TickAdvance.Status.ROOM_MISSING);
        }
        synchronized (room) {
            if (rooms.get(roomCode) != room) {
                return TickAdvance.of(TickAdvance.Status.ROOM_MISSING);
            }
            GameState gs = room.getGameState();
            if (!gs.isStarted() || gs.isEnded()) {
                return TickAdvance.of(TickAdvance.Status.NOT_RUNNING);
            }
            if (gs.isPaused()) {
                return TickAdvance.of(TickAdvance.Status.PAUSED);
            }
            int month = gs.getCurrentMonth() + 1;
            int year = gs.getCurrentYear();
            if (month > 12) {
                month = 1;
                year++;
            }
            if (year > totalYears) {
                endLocked(room);
                return new TickAdvance(TickAdvance.Status.FINISHED, gs.getCurrentYear(), gs.getCurrentMonth());
            }
            gs.setCurrentYear(year);
            gs.setCurrentMonth(month);
            return new TickAdvance(TickAdvance.Status.ADVANCED, year, month);
        }
    }

    @Override
    public List<TriggeredLifeEvent> triggerDueLifeEvents(String roomCode, int year, int month) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            return List.of();
        }
        List<TriggeredLifeEvent> fired = new ArrayList<>();
        synchronized (room) {
            Map<String, List<LifeEvent>> lifeMap = room.getGameState().getLifeEvents();
            if (lifeMap == null) {
                return List.of();
            }
            lifeMap.forEach((playerId, events) -> {
                for (LifeEvent ev : events) {
                    if (!ev.isDueAt(year, month)) {
                        continue;
                    }
                    // 先翻转标记，即使后续推送失败也不会重复触发
                    ev.setTriggered(true);
                    PlayerInfo p = room.getPlayers().get(playerId);
                    if (p == null) {
                        continue;
                    }
                    PortfolioBreakdown b = p.getPortfolioBreakdown();
                    if (b == null) {
                        b = new PortfolioBreakdown();
                        p.setPortfolioBreakdown(b);
                    }
                    b.setCash(b.getCash() + ev.getAmount());
                    p.setNetworth(p.getNetworth() + ev.getAmount());
                    fired.add(new TriggeredLifeEvent(playerId, ev.copy(), b.getCash()));
                }
            });
        }
        return fired;
    }

    @Override
    public boolean markGameEnded(String roomCode) {
        Room room = rooms.get(roomCode);
        if (room == null) {
            return false;
        }
        synchronized (room) {
            GameState gs = room.getGameState();
            if (!gs.isStarted() || gs.isEnded()) {
                return false;
            }
            endLocked(room);
            return true;
        }
    }

    private static void endLocked(Room room) {
        GameState gs = room.getGameState();
        gs.setEnded(true);
        gs.setStarted(false);
        gs.resume();
        gs.getPlayersWaitingForQuiz().clear();
        gs.getPlayersWaitingForIntro().clear();
        TickHandle handle = room.getTickHandle();
        if (handle != null) {
            handle.cancel();
            room.setTickHandle(null);
        }
    }

    // =====================================================================
    // helpers
    // =====================================================================

    /** 在房间锁内执行；房间不存在（或已被删除）时抛 ROOM_NOT_FOUND */
    private <T> T withRoom(String roomCode, Function<Room, T> action) {
        Room room = roomCode == null ? null : rooms.get(roomCode);
        if (room == null) {
            throw new RoomException(RoomError.ROOM_NOT_FOUND, GameMessages.ROOM_NOT_FOUND);
        }
        synchronized (room) {
            if (rooms.get(roomCode) != room) {
                throw new RoomException(RoomError.ROOM_NOT_FOUND, GameMessages.ROOM_NOT_FOUND);
            }
            return action.apply(room);
        }
    }

    private <T> Optional<T> withPlayerRoom(String playerId, Function<Room, T> action) {
        String code = playerToRoom.get(playerId);
        if (code == null) {
            return Optional.empty();
        }
        Room room = rooms.get(code);
        if (room == null) {
            return Optional.empty();
        }
        synchronized (room) {
            if (rooms.get(code) != room) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.apply(room));
        }
    }
}
