package com.bullrunhub.gameservice.platform.crypto;

import java.util.Arrays;
import java.util.Base64;

/**
 * 房间会话密钥（AES-256）。
 * 只在内存中存在；{@link #destroy()} 会把字节清零，之后不可再用于加解密。
 */
public final class SessionKey {

    private final String roomId;
    private final byte[] key;
    private final long createdAt;
    private volatile boolean destroyed;

    public SessionKey(String roomId, byte[] key, long createdAt) {
        this.roomId = roomId;
        this.key = key.clone();
        this.createdAt = createdAt;
    }

    public String getRoomId() {
        return roomId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    /** 原始密钥字节的拷贝 */
    public byte[] bytes() {
        if (destroyed) {
            throw new IllegalStateException("session key destroyed");
        }
        return key.clone();
    }

    /** 用于密钥交换下发给客户端 */
    public String toBase64() {
        return Base64.getEncoder().encodeToString(bytes());
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /** 不可恢复的删除 */
    public void destroy() {
        Arrays.fill(key, (byte) 0);
        destroyed = true;
    }

    @Override
    public String toString() {
        // 不输出密钥内容
        return "SessionKey{roomId=" + roomId + ", createdAt=" + createdAt + "}";
    }
}
