package com.bullrunhub.gameservice.platform.crypto;

/**
 * 认证标签校验失败：密文、IV 或 tag 被篡改，或使用了错误的密钥。
 */
public class PayloadTamperedException extends RuntimeException {

    public PayloadTamperedException(String message, Throwable cause) {
        super(message, cause);
    }
}
