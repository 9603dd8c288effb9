package com.bullrunhub.gameservice.games.bullrun.infrastructure.redis.repo;

import com.bullrunhub.gameservice.games.bullrun.domain.repository.SessionRecord;
import com.bullrunhub.gameservice.games.bullrun.domain.repository.SessionRecordRepository;
import com.bullrunhub.gameservice.games.bullrun.infrastructure.redis.RedisKeys;
import com.bullrunhub.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RedisSessionRecordRepository
 * -------------------------------------------------------
 * 终局记录的 Redis 仓储实现。
 * - 每名玩家最新一条记录放在房间维度的 Hash 里，重复写入直接覆盖；
 * - 每次写入的整批记录另存一份，按 logId 查询；
 * - 记录只保留 48 小时，不承诺持久性。
 */
@Repository
@RequiredArgsConstructor
public class RedisSessionRecordRepository implements SessionRecordRepository {

    static final Duration RECORD_TTL = Duration.ofHours(48);

    private static final DateTimeFormatter LOG_TS = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String LOG_SUFFIX_CHARS = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private final RedisOps ops;
    private final SecureRandom rnd = new SecureRandom();

    /**
     * 写入终局记录，返回 logId（yyyyMMddHHmmss-XXXXX）
     */
    @Override
    public String finalizeSession(String roomCode, List<SessionRecord> records) {
        String logId = newLogId();
        long now = System.currentTimeMillis();
        Map<String, SessionRecord> byPlayer = new LinkedHashMap<>();
        for (SessionRecord r : records) {
            r.setLogId(logId);
            r.setRoomCode(roomCode);
            r.setRecordedAt(now);
            byPlayer.put(r.getPlayerId(), r);
        }
        String key = RedisKeys.latestRecords(roomCode);
        if (!byPlayer.isEmpty()) {
            ops.hSetAll(key, byPlayer);
            ops.expire(key, RECORD_TTL);
        }
        ops.setEx(RedisKeys.sessionLog(logId), new ArrayList<>(byPlayer.values()), RECORD_TTL);
        return logId;
    }

    /**
     * 每名玩家最新一条记录，按最终净值降序
     */
    @Override
    public List<SessionRecord> readLatestByPlayer(String roomCode) {
        List<SessionRecord> out = new ArrayList<>();
        ops.hGetAll(RedisKeys.latestRecords(roomCode)).values().forEach(v -> {
            if (v instanceof SessionRecord r) {
                out.add(r);
            }
        });
        out.sort(Comparator.comparingDouble(SessionRecord::getFinalNetworth).reversed());
        return out;
    }

    String newLogId() {
        StringBuilder sb = new StringBuilder(LocalDateTime.now().format(LOG_TS)).append('-');
        for (int i = 0; i < 5; i++) {
            sb.append(LOG_SUFFIX_CHARS.charAt(rnd.nextInt(LOG_SUFFIX_CHARS.length())));
        }
        return sb.toString();
    }
}
