package com.bullrunhub.gameservice.platform.crypto;

/**
 * 密文线上格式：iv / data / tag 均为 base64，ts 为签发时间（毫秒）。
 */
public record EncryptedPayload(String iv, String data, String tag, long ts) {
}
