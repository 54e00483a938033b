package com.sunny.cron.core.lock;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Fencing token 生成器
 * <p>
 * 每次加锁尝试生成新的随机值，保证 release 不会误删其他尝试写入的锁
 *
 * @author Sunny
 * @date 2026-01-01
 */
public final class FencingTokens {

    private static final int TOKEN_BYTES = 24;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder TOKEN_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private FencingTokens() {
    }

    public static String next() {
        byte[] randomBytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return TOKEN_ENCODER.encodeToString(randomBytes);
    }
}
