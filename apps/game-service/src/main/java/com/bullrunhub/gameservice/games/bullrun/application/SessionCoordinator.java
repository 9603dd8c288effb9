package com.bullrunhub.gameservice.games.bullrun.application;

import com.bullrunhub.gameservice.clock.scheduler.MonthTickScheduler;
import com.bullrunhub.gameservice.clock.scheduler.TickHandle;
import com.bullrunhub.gameservice.games.bullrun.domain.constants.GameMessages;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.LeaveResult;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.TickAdvance;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.TriggeredLifeEvent;
import com.bullrunhub.gameservice.games.bullrun.domain.enums.EventType;
import com.bullrunhub.gameservice.games.bullrun.domain.enums.PauseReason;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomError;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomException;
import com.bullrunhub.gameservice.games.bullrun.domain.keys.RoomKeyRegistry;
import com.bullrunhub.gameservice.games.bullrun.domain.keys.RoomKeys;
import com.bullrunhub.gameservice.games.bullrun.domain.model.AdminSettings;
import com.bullrunhub.gameservice.games.bullrun.domain.model.GameState;
import com.bullrunhub.gameservice.games.bullrun.domain.model.InitialGameState;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PlayerInfo;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PortfolioBreakdown;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PriceSnapshot;
import com.bullrunhub.gameservice.games.bullrun.domain.model.Room;
import com.bullrunhub.gameservice.games.bullrun.domain.repository.PriceSource;
import com.bullrunhub.gameservice.games.bullrun.domain.repository.SessionRecord;
import com.bullrunhub.gameservice.games.bullrun.domain.repository.SessionRecordRepository;
import com.bullrunhub.gameservice.games.bullrun.domain.valuation.NetworthCalculator;
import com.bullrunhub.gameservice.games.bullrun.domain.valuation.NetworthValidation;
import com.bullrunhub.gameservice.games.bullrun.interfaces.ws.dto.BullRunMessages.SubmitNetworthCmd;
import com.bullrunhub.gameservice.games.bullrun.service.RoomService;
import com.bullrunhub.gameservice.platform.crypto.EncryptedPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SessionCoordinator
 * ---------------------------------------
 * 对局协调器：串起房间登记表、密钥登记表、估值、行情源和月度推进调度器。
 *
 * 每个房间的状态机：Idle（无计时器）→ Running（计时器推进）→ Ended（计时器取消，不再推进）。
 *
 * 单次推进（tick）的顺序：
 *  1. 房间不存在 / 未开始 → 取消计时器；
 *  2. 暂停 → 本次什么都不做；
 *  3. 月份进位；
 *  4. 越过总年限 → 终局（最终排行榜 + GAME_ENDED），本次结束；
 *  5. 加密价格 PRICE_TICK 先于 TIME_PROGRESSION 广播；
 *  6. 到期的生活事件：先翻转、再入账、最后私发给本人；
 *  7. 广播完整 GAME_STATE。
 *
 * 所有房间/玩家状态的修改都经过 RoomService，这里只编排和广播。
 * 校验失败抛出 RoomException，由 WS 控制器转成失败应答。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCoordinator {

    private final RoomService roomService;
    private final RoomKeyRegistry keyRegistry;
    private final NetworthCalculator networthCalculator;
    private final PriceSource priceSource;
    private final SessionRecordRepository sessionRecords;
    private final MonthTickScheduler tickScheduler;
    private final LeaderboardThrottle leaderboardThrottle;
    private final RoomMessenger messenger;
    private final SessionSettings settings;

    /** 防止同一房间的两次 tick 重叠执行 */
    private final ConcurrentMap<String, AtomicBoolean> tickInFlight = new ConcurrentHashMap<>();

    /** 每个房间最近一次的权威价格，submitNetworth 估值用 */
    private final ConcurrentMap<String, PriceSnapshot> lastPrices = new ConcurrentHashMap<>();
    /** 正在开局的房间 */
    private final Set<String> startClaims = ConcurrentHashMap.newKeySet();

    // =====================================================================
    // 房间
    // =====================================================================

    /**
     * 创建房间
     * @return { roomId, hostId }
     */
    public Map<String, Object> createRoom(String playerId, String playerName) {
        if (StringUtils.isBlank(playerName)) {
            throw new RoomException(RoomError.INVALID_CONFIG, GameMessages.PLAYER_NAME_REQUIRED);
        }
        String code = roomService.createRoom(playerId, playerName.trim());
        Map<String, Object> data = Map.of("roomId", code, "hostId", playerId);
        messenger.toPlayer(playerId, code, EventType.ROOM_CREATED, data);
        return data;
    }

    /**
     * 加入房间：给加入者返回成员与配置，通知其他人，并刷新排行榜
     * @return { roomId, players, adminSettings }
     */
    public Map<String, Object> joinRoom(String playerId, String roomCode, String playerName) {
        if (StringUtils.isBlank(playerName)) {
            throw new RoomException(RoomError.INVALID_CONFIG, GameMessages.PLAYER_NAME_REQUIRED);
        }
        String code = StringUtils.upperCase(StringUtils.trim(roomCode));
        Room room = roomService.joinRoom(code, playerId, playerName.trim());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("roomId", code);
        data.put("players", new ArrayList<>(room.getPlayers().values()));
        data.put("adminSettings", room.getAdminSettings());

        messenger.toRoom(code, EventType.PLAYER_JOINED, Map.of("player", room.getPlayers().get(playerId)));
        requestLeaderboard(code);
        return data;
    }

    /**
     * 离开房间（主动离开与断线共用）。房主离开则关闭房间。
     */
    public LeaveResult leaveRoom(String playerId) {
        LeaveResult result = roomService.leaveRoom(playerId);
        if (!result.leftRoom()) {
            return result;
        }
        String code = result.roomCode();
        if (result.roomClosed()) {
            if (result.wasHost()) {
                messenger.toRoom(code, EventType.ERROR, Map.of("message", GameMessages.HOST_LEFT));
            }
            teardown(code);
            return result;
        }
        messenger.toRoom(code, EventType.PLAYER_LEFT, Map.of("playerId", playerId));
        if (result.resumed()) {
            messenger.toRoom(code, EventType.GAME_RESUMED, Map.of());
        }
        roomService.snapshot(code).ifPresent(room -> {
            if (room.getGameState().isStarted()) {
                messenger.toRoom(code, EventType.GAME_STATE, Map.of("gameState", room.getGameState()));
            }
        });
        requestLeaderboard(code);
        return result;
    }

    /**
     * 开局前修改配置（房主）
     */
    public AdminSettings updateAdminSettings(String playerId, AdminSettings adminSettings) {
        String code = requireRoomOf(playerId);
        requireHost(code, playerId, GameMessages.ONLY_HOST);
        AdminSettings saved = roomService.updateAdminSettings(code, adminSettings);
        messenger.toRoom(code, EventType.ADMIN_SETTINGS_UPDATED, Map.of("adminSettings", saved));
        return saved;
    }

    // =====================================================================
    // 开局
    // =====================================================================

    /**
     * 开局：占位 → 校验 → 行情与密钥初始化 → 登记表开局 → 生活事件 → 广播 → 启动计时器。
     * 同一房间同时只允许一个开局请求；登记表开局之前的任何失败都让房间保持 Idle，不会创建计时器。
     */
    public void startGame(String playerId, AdminSettings adminSettings, InitialGameState initial) {
        String code = requireRoomOf(playerId);
        if (!startClaims.add(code)) {
            log.warn("开局请求重复，已拒绝: room={}, player={}", code, playerId);
            throw new RoomException(RoomError.GAME_ALREADY_STARTED, GameMessages.GAME_IN_PROGRESS);
        }
        try {
            doStartGame(code, playerId, adminSettings, initial);
        } finally {
            startClaims.remove(code);
        }
    }

    private void doStartGame(String code, String playerId, AdminSettings adminSettings, InitialGameState initial) {
        // 校验在占位之后
        roomService.assertCanStart(code, playerId);

        AdminSettings cfg = adminSettings == null ? new AdminSettings() : adminSettings;
        if (cfg.getGameStartYear() == null || initial == null || initial.getSelectedAssets() == null
                || initial.getSelectedAssets().isNull()) {
            log.warn("开局配置缺失: room={}", code);
            throw new RoomException(RoomError.INVALID_CONFIG, GameMessages.INVALID_GAME_CONFIG);
        }

        initializeMarketData(code, initial, cfg.getGameStartYear());

        try {
            roomService.startGame(code, cfg);
        } catch (RoomException e) {
            // 持有占位，密钥只可能是本次创建的
            keyRegistry.cleanupRoomKeys(code);
            lastPrices.remove(code);
            throw e;
        }
        roomService.applyInitialGameState(code, initial);
        roomService.generateLifeEventsForRoom(code, cfg.resolveEventsCount(settings.getDefaultEventsCount()));

        Room room = roomService.snapshot(code)
                .orElseThrow(() -> new RoomException(RoomError.ROOM_NOT_FOUND, GameMessages.ROOM_NOT_FOUND));
        Map<String, Object> started = new LinkedHashMap<>();
        started.put("gameState", room.getGameState());
        started.put("adminSettings", room.getAdminSettings());
        messenger.toRoom(code, EventType.GAME_STARTED, started);
        requestLeaderboard(code);

        long monthMs = cfg.resolveMonthDuration(settings.getDefaultMonthDurationMs());
        TickHandle handle = startTimeProgression(code, monthMs);
        roomService.attachTickHandle(code, handle);
    }

    /**
     * 行情初始化（开局必需）：symbol → 预热（尽力而为）→ 确认开局月有权威价格 → 生成房间密钥。
     */
    private void initializeMarketData(String code, InitialGameState initial, int startYear) {
        List<String> symbols;
        PriceSnapshot first;
        try {
            symbols = priceSource.getGameSymbols(initial.getSelectedAssets());
            try {
                priceSource.preloadPricesForGame(symbols, startYear, settings.getTotalYears());
            } catch (RuntimeException e) {
                log.warn("行情预热失败，继续开局: room={}, err={}", code, e.toString());
            }
            first = priceSource.getPricesForDate(symbols, startYear, 1);
        } catch (RuntimeException e) {
            log.error("行情初始化异常: room={}", code, e);
            keyRegistry.markFailed(code, "market data error");
            throw new RoomException(RoomError.MARKET_DATA_UNAVAILABLE, GameMessages.DATABASE_ERROR);
        }
        if (first == null || first.isEmpty()) {
            log.error("行情初始化失败，开局月没有任何价格: room={}, startYear={}", code, startYear);
            keyRegistry.markFailed(code, "no prices for start month");
            throw new RoomException(RoomError.MARKET_DATA_UNAVAILABLE, GameMessages.DATABASE_UNAVAILABLE);
        }
        keyRegistry.initializeRoomKeys(code, symbols);
        lastPrices.put(code, first);
    }

    /**
     * 为房间安装周期任务，每 monthDurationMs 推进一个月
     */
    public TickHandle startTimeProgression(String roomCode, long monthDurationMs) {
        return tickScheduler.start(timerKey(roomCode), monthDurationMs, key -> tick(roomCode));
    }

    // =====================================================================
    // 推进
    // =====================================================================

    /**
     * 一次推进。上一次还没执行完时直接跳过本次。
     */
    public void tick(String roomCode) {
        AtomicBoolean flag = tickInFlight.computeIfAbsent(roomCode, k -> new AtomicBoolean(false));
        if (!flag.compareAndSet(false, true)) {
            log.debug("上一次推进尚未结束，跳过: room={}", roomCode);
            return;
        }
        try {
            doTick(roomCode);
        } finally {
            flag.set(false);
            if (roomService.snapshot(roomCode).isEmpty()) {
                tickInFlight.remove(roomCode, flag);
            }
        }
    }

    private void doTick(String code) {
        TickAdvance adv = roomService.advanceClock(code, settings.getTotalYears());
        switch (adv.status()) {
            case ROOM_MISSING, NOT_RUNNING -> {
                tickScheduler.stop(timerKey(code));
                return;
            }
            case PAUSED -> {
                return;
            }
            case FINISHED -> {
                finishGame(code, adv.year(), adv.month());
                return;
            }
            default -> {
                // ADVANCED
            }
        }

        Optional<Room> maybeRoom = roomService.snapshot(code);
        if (maybeRoom.isEmpty()) {
            return;
        }
        Room room = maybeRoom.get();
        int year = adv.year();
        int month = adv.month();

        // 价格先于时间推进
        broadcastPriceTick(code, room, year, month);
        messenger.toRoom(code, EventType.TIME_PROGRESSION, Map.of("year", year, "month", month));

        for (TriggeredLifeEvent t : roomService.triggerDueLifeEvents(code, year, month)) {
            try {
                messenger.toPlayer(t.playerId(), code, EventType.LIFE_EVENT,
                        Map.of("event", t.event(), "postPocketCash", t.postPocketCash()));
                log.info("生活事件已触发: room={}, player={}, amount={}", code, t.playerId(), t.event().getAmount());
            } catch (RuntimeException e) {
                log.warn("生活事件推送失败: room={}, player={}", code, t.playerId(), e);
            }
        }

        roomService.snapshot(code).ifPresent(r ->
                messenger.toRoom(code, EventType.GAME_STATE, Map.of("gameState", r.getGameState())));
        log.debug("推进完成: room={}, year={}, month={}", code, year, month);
    }

    /**
     * 查询并加密当月价格后广播。行情失败只跳过本次价格，时间照常推进。
     */
    private void broadcastPriceTick(String code, Room room, int year, int month) {
        Optional<RoomKeys> keys = keyRegistry.getRoomKeys(code);
        if (keys.isEmpty()) {
            log.warn("房间没有就绪密钥，跳过价格广播: room={}", code);
            return;
        }
        int calendarYear = calendarYear(room, year);
        try {
            PriceSnapshot prices = priceSource.getPricesForDate(keys.get().getSymbols(), calendarYear, month);
            // 房间已拆除时不再写回
            lastPrices.replace(code, prices);
            keyRegistry.encryptPriceData(code, prices).ifPresent(payload ->
                    messenger.toRoom(code, EventType.PRICE_TICK, priceTickPayload(year, month, payload)));
        } catch (RuntimeException e) {
            log.warn("行情查询失败，跳过本月价格广播: room={}, date={}-{}", code, calendarYear, month, e);
        }
    }

    private static int calendarYear(Room room, int simYear) {
        AdminSettings cfg = room.getAdminSettings();
        int startYear = cfg == null || cfg.getGameStartYear() == null ? 1 : cfg.getGameStartYear();
        return startYear + simYear - 1;
    }

    private static Map<String, Object> priceTickPayload(int year, int month, EncryptedPayload payload) {
        return Map.of("year", year, "month", month, "payload", payload);
    }

    // =====================================================================
    // 终局
    // =====================================================================

    /**
     * 调试用：直接走正常的终局路径
     * @return 房间此前是否在进行中
     */
    public boolean endGame(String roomCode) {
        if (!roomService.markGameEnded(roomCode)) {
            return false;
        }
        GameState gs = roomService.snapshot(roomCode).map(Room::getGameState).orElse(new GameState());
        finishGame(roomCode, gs.getCurrentYear(), gs.getCurrentMonth());
        return true;
    }

    private void finishGame(String code, int finalYear, int finalMonth) {
        tickScheduler.stop(timerKey(code));
        leaderboardThrottle.cancel(code);

        List<PlayerInfo> finalBoard = buildFinalLeaderboard(code, finalYear, finalMonth);
        messenger.toRoom(code, EventType.LEADERBOARD_UPDATE, Map.of("players", finalBoard));
        messenger.toRoom(code, EventType.GAME_ENDED, Map.of("finalYear", finalYear, "finalMonth", finalMonth));

        keyRegistry.cleanupRoomKeys(code);
        lastPrices.remove(code);
        log.info("对局结束: room={}, finalYear={}, finalMonth={}, players={}", code, finalYear, finalMonth, finalBoard.size());
    }

    /**
     * 终局排行榜：写入记录仓储后按玩家读回最新记录；仓储不可用时退回内存排行榜。
     */
    List<PlayerInfo> buildFinalLeaderboard(String code, int finalYear, int finalMonth) {
        List<PlayerInfo> inMemory = roomService.getLeaderboard(code);
        if (inMemory.isEmpty()) {
            return inMemory;
        }
        List<SessionRecord> records = new ArrayList<>();
        for (PlayerInfo p : inMemory) {
            SessionRecord r = new SessionRecord();
            r.setPlayerId(p.getId());
            r.setPlayerName(p.getName());
            r.setFinalNetworth(p.getNetworth());
            r.setPortfolioBreakdown(p.getPortfolioBreakdown());
            r.setFinalYear(finalYear);
            r.setFinalMonth(finalMonth);
            records.add(r);
        }
        try {
            String logId = sessionRecords.finalizeSession(code, records);
            List<SessionRecord> latest = sessionRecords.readLatestByPlayer(code);
            if (latest.isEmpty()) {
                log.warn("终局记录为空，使用内存排行榜: room={}, logId={}", code, logId);
                return inMemory;
            }
            Map<String, PlayerInfo> byId = new LinkedHashMap<>();
            inMemory.forEach(p -> byId.put(p.getId(), p));
            List<PlayerInfo> board = new ArrayList<>(latest.size());
            for (SessionRecord r : latest) {
                PlayerInfo p = byId.containsKey(r.getPlayerId())
                        ? byId.get(r.getPlayerId()).copy()
                        : PlayerInfo.joiner(r.getPlayerId(), r.getPlayerName(), 0);
                p.setNetworth(r.getFinalNetworth());
                if (r.getPortfolioBreakdown() != null) {
                    p.setPortfolioBreakdown(r.getPortfolioBreakdown().copy());
                }
                board.add(p);
            }
            log.info("终局记录已写入: room={}, logId={}, players={}", code, logId, board.size());
            return board;
        } catch (RuntimeException e) {
            log.warn("终局记录仓储不可用，使用内存排行榜: room={}", code, e);
            return inMemory;
        }
    }

    // =====================================================================
    // 暂停 / 答题 / 介绍
    // =====================================================================

    /**
     * 房主手动暂停/恢复；答题屏障或介绍期间无效
     */
    public boolean togglePause(String playerId) {
        String code = requireRoomOf(playerId);
        requireHost(code, playerId, GameMessages.ONLY_HOST);
        if (!roomService.togglePause(code)) {
            return false;
        }
        Room room = roomService.snapshot(code).orElse(null);
        if (room == null) {
            return false;
        }
        if (room.getGameState().isPaused()) {
            messenger.toRoom(code, EventType.GAME_PAUSED, Map.of("reason", PauseReason.MANUAL));
        } else {
            messenger.toRoom(code, EventType.GAME_RESUMED, Map.of());
        }
        return true;
    }

    public void quizStarted(String playerId, String category) {
        Optional<String> code = roomService.findRoomCodeByPlayer(playerId);
        if (code.isEmpty() || !roomService.markQuizStarted(playerId, category)) {
            return;
        }
        messenger.toRoom(code.get(), EventType.QUIZ_TRIGGERED, quizPayload(playerId, category));
        broadcastPaused(code.get());
    }

    public void quizFinished(String playerId, String category) {
        Optional<String> code = roomService.findRoomCodeByPlayer(playerId);
        if (code.isEmpty()) {
            return;
        }
        boolean resumed = roomService.markQuizCompleted(playerId, category);
        messenger.toRoom(code.get(), EventType.QUIZ_COMPLETED, quizPayload(playerId, category));
        if (resumed) {
            messenger.toRoom(code.get(), EventType.GAME_RESUMED, Map.of());
        } else {
            broadcastPaused(code.get());
        }
    }

    public void introCompleted(String playerId) {
        Optional<String> code = roomService.findRoomCodeByPlayer(playerId);
        if (code.isEmpty()) {
            return;
        }
        if (roomService.markIntroCompleted(playerId)) {
            messenger.toRoom(code.get(), EventType.GAME_RESUMED, Map.of());
        } else {
            broadcastPaused(code.get());
        }
    }

    private void broadcastPaused(String code) {
        roomService.snapshot(code).ifPresent(room -> {
            GameState gs = room.getGameState();
            if (!gs.isPaused()) {
                return;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("reason", gs.getPauseReason());
            if (gs.getPauseReason() == PauseReason.QUIZ) {
                payload.put("playersWaitingForQuiz", gs.getPlayersWaitingForQuiz());
            }
            if (!gs.getPlayersWaitingForIntro().isEmpty()) {
                payload.put("playersWaitingForIntro", gs.getPlayersWaitingForIntro());
            }
            messenger.toRoom(code, EventType.GAME_PAUSED, payload);
        });
    }

    private static Map<String, Object> quizPayload(String playerId, String category) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("playerId", playerId);
        payload.put("quizCategory", category);
        return payload;
    }

    // =====================================================================
    // 玩家状态 / 排行榜 / 估值
    // =====================================================================

    /**
     * 上报净值：只在对局进行中接受，随后合并广播排行榜
     */
    public void updatePlayerState(String playerId, double networth, PortfolioBreakdown breakdown) {
        Optional<String> code = roomService.findRoomCodeByPlayer(playerId);
        if (code.isEmpty() || !isRunning(code.get())) {
            return;
        }
        if (roomService.updatePlayerState(playerId, networth, breakdown)) {
            requestLeaderboard(code.get());
        }
    }

    /**
     * 服务端估值校验。只计算并记录，不拒绝客户端上报的数值。
     */
    public NetworthValidation submitNetworth(String playerId, SubmitNetworthCmd cmd) {
        String code = requireRoomOf(playerId);
        Room room = roomService.snapshot(code)
                .orElseThrow(() -> new RoomException(RoomError.ROOM_NOT_FOUND, GameMessages.ROOM_NOT_FOUND));
        GameState gs = room.getGameState();
        NetworthValidation result = networthCalculator.fullValidation(
                cmd.getNetworth(),
                cmd.getPocketCash(),
                cmd.getSavingsBalance(),
                cmd.getFixedDeposits(),
                cmd.getHoldings(),
                lastPrices.getOrDefault(code, PriceSnapshot.EMPTY),
                gs.getSelectedAssets(),
                gs.getCurrentYear(),
                gs.getCurrentMonth());
        if (!result.valid()) {
            log.warn("净值偏差超出容忍范围: room={}, player={}, client={}, server={}, deviation={}%",
                    code, playerId, result.clientNetworth(), result.serverNetworth(),
                    String.format("%.2f", result.deviation()));
        }
        updatePlayerState(playerId, cmd.getNetworth(), cmd.getPortfolioBreakdown());
        return result;
    }

    public void requestLeaderboard(String roomCode) {
        leaderboardThrottle.request(roomCode, () -> broadcastLeaderboardNow(roomCode));
    }

    void broadcastLeaderboardNow(String roomCode) {
        if (roomService.snapshot(roomCode).isEmpty()) {
            return;
        }
        messenger.toRoom(roomCode, EventType.LEADERBOARD_UPDATE, Map.of("players", roomService.getLeaderboard(roomCode)));
    }

    // =====================================================================
    // 密钥交换
    // =====================================================================

    /**
     * 返回房间密钥与 symbol 下标映射，同时私发一份 KEY_EXCHANGE；
     * 对局进行中再补发一次当月价格，客户端不必等下一次推进。
     */
    public Map<String, Object> requestKeyExchange(String playerId) {
        String code = requireRoomOf(playerId);
        RoomKeys keys = keyRegistry.getRoomKeys(code)
                .orElseThrow(() -> new RoomException(RoomError.INVALID_CONFIG, GameMessages.KEYS_NOT_READY));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("roomId", code);
        data.put("sessionKey", keys.getSessionKey().toBase64());
        data.put("assetIndexMap", keys.getIndexBySymbol());
        data.put("symbols", keys.getSymbols());

        messenger.toPlayer(playerId, code, EventType.KEY_EXCHANGE, data);

        roomService.snapshot(code).ifPresent(room -> {
            GameState gs = room.getGameState();
            if (!gs.isStarted() || gs.isEnded()) {
                return;
            }
            PriceSnapshot prices = lastPrices.get(code);
            if (prices == null) {
                return;
            }
            keyRegistry.encryptPriceData(code, prices).ifPresent(payload ->
                    messenger.toPlayer(playerId, code, EventType.PRICE_TICK,
                            priceTickPayload(gs.getCurrentYear(), gs.getCurrentMonth(), payload)));
        });
        return data;
    }

    // =====================================================================
    // 维护
    // =====================================================================

    /**
     * 清理从未开局的空闲房间，同时回收协调器侧的资源
     */
    public int sweepIdleRooms(long maxAgeMs) {
        List<String> before = roomService.listRoomCodes();
        int removed = roomService.cleanupOldRooms(maxAgeMs);
        if (removed > 0) {
            List<String> alive = roomService.listRoomCodes();
            before.stream().filter(c -> !alive.contains(c)).forEach(this::teardown);
        }
        return removed;
    }

    /** 房间删除后回收计时器、合并广播、密钥与价格缓存 */
    private void teardown(String code) {
        tickScheduler.stop(timerKey(code));
        leaderboardThrottle.cancel(code);
        keyRegistry.cleanupRoomKeys(code);
        lastPrices.remove(code);
        tickInFlight.remove(code);
    }

    /** 协调器是否还持有该房间的推进标记或价格缓存 */
    boolean holdsRoomState(String code) {
        return tickInFlight.containsKey(code) || lastPrices.containsKey(code);
    }

    // =====================================================================
    // helpers
    // =====================================================================

    private boolean isRunning(String code) {
        return roomService.snapshot(code)
                .map(r -> r.getGameState().isStarted() && !r.getGameState().isEnded())
                .orElse(false);
    }

    private String requireRoomOf(String playerId) {
        return roomService.findRoomCodeByPlayer(playerId)
                .orElseThrow(() -> new RoomException(RoomError.NOT_IN_ROOM, GameMessages.NOT_IN_ROOM));
    }

    private void requireHost(String code, String playerId, String message) {
        Room room = roomService.snapshot(code)
                .orElseThrow(() -> new RoomException(RoomError.ROOM_NOT_FOUND, GameMessages.ROOM_NOT_FOUND));
        if (!room.getHostId().equals(playerId)) {
            throw new RoomException(RoomError.NOT_HOST, message);
        }
    }

    static String timerKey(String roomCode) {
        return "bullrun:" + roomCode;
    }
}
