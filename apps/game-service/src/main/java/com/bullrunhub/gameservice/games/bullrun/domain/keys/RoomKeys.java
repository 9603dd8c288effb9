package com.bullrunhub.gameservice.games.bullrun.domain.keys;

import com.bullrunhub.gameservice.platform.crypto.SessionKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 单个房间的密钥与 symbol&lt;-&gt;index 双向映射。
 * symbols 按字典序排列，下标即价格数组中的位置。
 */
public final class RoomKeys {

    private final SessionKey sessionKey;
    private final List<String> symbols;
    private final Map<String, Integer> indexBySymbol;

    RoomKeys(SessionKey sessionKey, Iterable<String> rawSymbols) {
        this.sessionKey = sessionKey;
        TreeSet<String> sorted = new TreeSet<>();
        rawSymbols.forEach(sorted::add);
        this.symbols = Collections.unmodifiableList(new ArrayList<>(sorted));
        Map<String, Integer> idx = new LinkedHashMap<>();
        for (int i = 0; i < symbols.size(); i++) {
            idx.put(symbols.get(i), i);
        }
        this.indexBySymbol = Collections.unmodifiableMap(idx);
    }

    public SessionKey getSessionKey() {
        return sessionKey;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    /** symbol -> index，用于密钥交换时一次性下发 */
    public Map<String, Integer> getIndexBySymbol() {
        return indexBySymbol;
    }

    public String symbolAt(int index) {
        return symbols.get(index);
    }

    public int size() {
        return symbols.size();
    }
}
