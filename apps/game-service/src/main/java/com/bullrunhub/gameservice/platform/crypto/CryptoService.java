package com.bullrunhub.gameservice.platform.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM 加解密原语。
 *
 * - 每次加密都生成新的 96 位随机 IV；
 * - 认证标签（128 位）与密文分开传输；
 * - 标签校验失败一律抛出 {@link PayloadTamperedException}，绝不返回“看起来像对的”数据。
 *
 * 明文为 JSON：加密前用 Jackson 序列化，解密后反序列化。
 */
@Component
public class CryptoService {

    public static final int KEY_LENGTH = 32;
    public static final int IV_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    /** 默认重放窗口（毫秒） */
    private final long replayWindowMs;

    public CryptoService(ObjectMapper objectMapper,
                         @Value("${bullrun.crypto.replay-window-ms:30000}") long replayWindowMs) {
        this.objectMapper = objectMapper;
        this.replayWindowMs = replayWindowMs;
    }

    /**
     * 为房间生成一把全新的独立密钥，不从任何玩家信息派生。
     */
    public SessionKey generateSessionKey(String roomId) {
        byte[] key = new byte[KEY_LENGTH];
        random.nextBytes(key);
        SessionKey sessionKey = new SessionKey(roomId, key, System.currentTimeMillis());
        Arrays.fill(key, (byte) 0);
        return sessionKey;
    }

    public EncryptedPayload encrypt(Object data, SessionKey key) {
        byte[] plain;
        try {
            plain = objectMapper.writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload is not JSON-serializable", e);
        }
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        byte[] keyBytes = key.bytes();
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(keyBytes, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            // JCE 把 tag 追加在密文末尾，这里拆开
            byte[] sealed = cipher.doFinal(plain);
            int ctLen = sealed.length - TAG_LENGTH;
            Base64.Encoder enc = Base64.getEncoder();
            return new EncryptedPayload(
                    enc.encodeToString(iv),
                    enc.encodeToString(Arrays.copyOfRange(sealed, 0, ctLen)),
                    enc.encodeToString(Arrays.copyOfRange(sealed, ctLen, sealed.length)),
                    System.currentTimeMillis());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * 解密并反序列化为目标类型。
     * @throws PayloadTamperedException 认证失败
     */
    public <T> T decrypt(EncryptedPayload payload, SessionKey key, Class<T> type) {
        byte[] plain = decryptRaw(payload, key);
        try {
            return objectMapper.readValue(plain, type);
        } catch (IOException e) {
            throw new IllegalStateException("decrypted payload is not valid JSON", e);
        }
    }

    /**
     * 解密为原始 UTF-8 JSON 文本。
     */
    public String decryptToJson(EncryptedPayload payload, SessionKey key) {
        return new String(decryptRaw(payload, key), StandardCharsets.UTF_8);
    }

    private byte[] decryptRaw(EncryptedPayload payload, SessionKey key) {
        Base64.Decoder dec = Base64.getDecoder();
        byte[] iv;
        byte[] ct;
        byte[] tag;
        try {
            iv = dec.decode(payload.iv());
            ct = dec.decode(payload.data());
            tag = dec.decode(payload.tag());
        } catch (IllegalArgumentException e) {
            throw new PayloadTamperedException("payload is not valid base64", e);
        }
        if (iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
            throw new PayloadTamperedException("invalid iv or tag length", null);
        }
        byte[] sealed = new byte[ct.length + tag.length];
        System.arraycopy(ct, 0, sealed, 0, ct.length);
        System.arraycopy(tag, 0, sealed, ct.length, tag.length);
        byte[] keyBytes = key.bytes();
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(keyBytes, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new PayloadTamperedException("authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * 按默认重放窗口检查
     */
    public boolean isPayloadFresh(EncryptedPayload payload) {
        return isPayloadFresh(payload, replayWindowMs);
    }

    /**
     * 重放窗口检查：0 <= now - ts <= maxAgeMs。
     */
    public boolean isPayloadFresh(EncryptedPayload payload, long maxAgeMs) {
        return isPayloadFresh(payload, maxAgeMs, System.currentTimeMillis());
    }

    public boolean isPayloadFresh(EncryptedPayload payload, long maxAgeMs, long nowMs) {
        long age = nowMs - payload.ts();
        return age >= 0 && age <= maxAgeMs;
    }
}
