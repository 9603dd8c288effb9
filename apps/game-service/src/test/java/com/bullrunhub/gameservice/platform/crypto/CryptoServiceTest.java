package com.bullrunhub.gameservice.platform.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CryptoService")
class CryptoServiceTest {

    private CryptoService crypto;
    private SessionKey key;

    @BeforeEach
    void setUp() {
        crypto = new CryptoService(new ObjectMapper(), 30000);
        key = crypto.generateSessionKey("ROOM01");
    }

    @Test
    @DisplayName("generated keys are 32 random bytes, independent per call")
    void generateSessionKey_isFreshAndFullLength() {
        SessionKey other = crypto.generateSessionKey("ROOM01");

        assertThat(key.bytes()).hasSize(CryptoService.KEY_LENGTH);
        assertThat(other.bytes()).isNotEqualTo(key.bytes());
        assertThat(Base64.getDecoder().decode(key.toBase64())).isEqualTo(key.bytes());
        assertThat(key.toString()).doesNotContain(key.toBase64());
    }

    @Test
    @DisplayName("encrypt then decrypt returns the original value")
    void decrypt_returnsOriginal() {
        double[] prices = {1.5, 0.0, 72000.25};

        EncryptedPayload payload = crypto.encrypt(prices, key);

        assertThat(crypto.decrypt(payload, key, double[].class)).containsExactly(1.5, 0.0, 72000.25);
        assertThat(crypto.decryptToJson(payload, key)).isEqualTo("[1.5,0.0,72000.25]");
    }

    @Test
    @DisplayName("payload carries a 12-byte iv, a 16-byte tag and a fresh iv per call")
    void encrypt_layout() {
        EncryptedPayload a = crypto.encrypt("hello", key);
        EncryptedPayload b = crypto.encrypt("hello", key);

        assertThat(Base64.getDecoder().decode(a.iv())).hasSize(CryptoService.IV_LENGTH);
        assertThat(Base64.getDecoder().decode(a.tag())).hasSize(CryptoService.TAG_LENGTH);
        assertThat(a.iv()).isNotEqualTo(b.iv());
        assertThat(a.data()).isNotEqualTo(b.data());
    }

    @Test
    @DisplayName("any flipped byte in iv, ciphertext or tag fails closed")
    void decrypt_flippedByte_throws() {
        EncryptedPayload p = crypto.encrypt(new double[]{100.0, 200.0}, key);

        EncryptedPayload badData = new EncryptedPayload(p.iv(), flipFirstByte(p.data()), p.tag(), p.ts());
        EncryptedPayload badTag = new EncryptedPayload(p.iv(), p.data(), flipFirstByte(p.tag()), p.ts());
        EncryptedPayload badIv = new EncryptedPayload(flipFirstByte(p.iv()), p.data(), p.tag(), p.ts());

        assertThatThrownBy(() -> crypto.decrypt(badData, key, double[].class))
                .isInstanceOf(PayloadTamperedException.class);
        assertThatThrownBy(() -> crypto.decrypt(badTag, key, double[].class))
                .isInstanceOf(PayloadTamperedException.class);
        assertThatThrownBy(() -> crypto.decrypt(badIv, key, double[].class))
                .isInstanceOf(PayloadTamperedException.class);
    }

    @Test
    @DisplayName("decrypting with another room's key fails closed")
    void decrypt_wrongKey_throws() {
        EncryptedPayload p = crypto.encrypt("secret", key);
        SessionKey other = crypto.generateSessionKey("ROOM02");

        assertThatThrownBy(() -> crypto.decryptToJson(p, other)).isInstanceOf(PayloadTamperedException.class);
    }

    @Test
    @DisplayName("malformed base64 or truncated tag is treated as tampering")
    void decrypt_malformed_throws() {
        EncryptedPayload p = crypto.encrypt("x", key);

        assertThatThrownBy(() -> crypto.decryptToJson(new EncryptedPayload("%%%", p.data(), p.tag(), p.ts()), key))
                .isInstanceOf(PayloadTamperedException.class);
        String shortTag = Base64.getEncoder().encodeToString(new byte[8]);
        assertThatThrownBy(() -> crypto.decryptToJson(new EncryptedPayload(p.iv(), p.data(), shortTag, p.ts()), key))
                .isInstanceOf(PayloadTamperedException.class);
    }

    @Test
    @DisplayName("a destroyed key can no longer be used")
    void destroyedKey_isUnusable() {
        key.destroy();

        assertThat(key.isDestroyed()).isTrue();
        assertThatThrownBy(() -> crypto.encrypt("x", key)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("freshness window accepts 0..max age and rejects future or stale timestamps")
    void isPayloadFresh_window() {
        long now = 1_000_000L;

        assertThat(crypto.isPayloadFresh(new EncryptedPayload("", "", "", now), 30000, now)).isTrue();
        assertThat(crypto.isPayloadFresh(new EncryptedPayload("", "", "", now - 30000), 30000, now)).isTrue();
        assertThat(crypto.isPayloadFresh(new EncryptedPayload("", "", "", now - 30001), 30000, now)).isFalse();
        assertThat(crypto.isPayloadFresh(new EncryptedPayload("", "", "", now + 1), 30000, now)).isFalse();
        assertThat(crypto.isPayloadFresh(crypto.encrypt("x", key))).isTrue();
    }

    private static String flipFirstByte(String b64) {
        byte[] raw = Base64.getDecoder().decode(b64);
        raw[0] ^= 0x01;
        return Base64.getEncoder().encodeToString(raw);
    }
}
