package com.bullrunhub.gameservice.games.bullrun.domain.keys;

import com.bullrunhub.gameservice.games.bullrun.domain.model.PriceSnapshot;
import com.bullrunhub.gameservice.platform.crypto.CryptoService;
import com.bullrunhub.gameservice.platform.crypto.EncryptedPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 房间密钥登记表：每个活跃房间一把会话密钥 + 一份 symbol 下标映射。
 *
 * 这里是密钥的唯一持有者：其它组件不能生成、缓存或打印会话密钥。
 * 房间结束或删除时必须调用 {@link #cleanupRoomKeys(String)}，密钥字节会被清零。
 */
@Slf4j
@Component
public class RoomKeyRegistry {

    private final CryptoService cryptoService;

    private final ConcurrentMap<String, RoomKeyState> states = new ConcurrentHashMap<>();

    public RoomKeyRegistry(CryptoService cryptoService) {
        this.cryptoService = cryptoService;
    }

    /**
     * 生成新密钥并按字典序建立映射。重复初始化会销毁旧密钥。
     */
    public RoomKeys initializeRoomKeys(String roomId, Collection<String> symbols) {
        RoomKeys keys = new RoomKeys(cryptoService.generateSessionKey(roomId), symbols);
        RoomKeyState previous = states.put(roomId, new RoomKeyState.Ready(keys));
        destroy(previous);
        log.info("房间密钥已初始化: room={}, symbols={}", roomId, keys.size());
        return keys;
    }

    /** 初始化失败时记录原因，之前的密钥同时销毁 */
    public void markFailed(String roomId, String reason) {
        RoomKeyState previous = states.put(roomId, new RoomKeyState.Failed(reason));
        destroy(previous);
        log.warn("房间密钥初始化失败: room={}, reason={}", roomId, reason);
    }

    public RoomKeyState getState(String roomId) {
        return states.getOrDefault(roomId, RoomKeyState.UNINITIALIZED);
    }

    public Optional<RoomKeys> getRoomKeys(String roomId) {
        if (getState(roomId) instanceof RoomKeyState.Ready ready) {
            return Optional.of(ready.keys());
        }
        return Optional.empty();
    }

    /**
     * 把价格快照压缩成按下标排列的数组后加密。
     * 快照里没有的 symbol 填 0.0（表示“本月无权威价格”）。
     *
     * @return 房间没有就绪密钥时返回 empty，调用方不得广播
     */
    public Optional<EncryptedPayload> encryptPriceData(String roomId, PriceSnapshot snapshot) {
        Optional<RoomKeys> maybeKeys = getRoomKeys(roomId);
        if (maybeKeys.isEmpty()) {
            log.warn("房间没有就绪的密钥，跳过价格加密: room={}", roomId);
            return Optional.empty();
        }
        RoomKeys keys = maybeKeys.get();
        return Optional.of(cryptoService.encrypt(toPriceArray(keys, snapshot), keys.getSessionKey()));
    }

    static double[] toPriceArray(RoomKeys keys, PriceSnapshot snapshot) {
        double[] prices = new double[keys.size()];
        for (int i = 0; i < prices.length; i++) {
            Double p = snapshot.get(keys.symbolAt(i));
            if (p != null) {
                prices[i] = p;
            }
        }
        return prices;
    }

    /**
     * 不可恢复地删除房间密钥。
     * @return 删除前是否存在就绪密钥
     */
    public boolean cleanupRoomKeys(String roomId) {
        RoomKeyState previous = states.remove(roomId);
        boolean existed = previous instanceof RoomKeyState.Ready;
        destroy(previous);
        if (existed) {
            log.info("房间密钥已销毁: room={}", roomId);
        }
        return existed;
    }

    public int activeRoomCount() {
        return (int) states.values().stream().filter(s -> s instanceof RoomKeyState.Ready).count();
    }

    private static void destroy(RoomKeyState state) {
        if (state instanceof RoomKeyState.Ready ready) {
            ready.keys().getSessionKey().destroy();
        }
    }
}
