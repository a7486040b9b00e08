package com.triflang.compiler.compiler;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * 输出混淆：SHA-256(口令) 为密钥，循环异或后做 URL 安全的 Base64 编码。
 *
 * <p>这只是混淆，不提供保密性或完整性校验。口令错误时解码得到乱码
 * （非法 UTF-8 序列替换为 U+FFFD），不会抛出“口令错误”。</p>
 */
public final class OutputObfuscator {

    private OutputObfuscator() {
    }

    public static String encrypt(String text, String passphrase) {
        byte[] key = deriveKey(passphrase);
        byte[] data = text.getBytes(StandardCharsets.UTF_8);
        return Base64.getUrlEncoder().encodeToString(xor(data, key));
    }

    /**
     * @throws IllegalArgumentException 口令为空或输入不是合法的 URL 安全 Base64
     */
    public static String decrypt(String encoded, String passphrase) {
        byte[] key = deriveKey(passphrase);
        byte[] data = Base64.getUrlDecoder().decode(encoded.trim());
        return new String(xor(data, key), StandardCharsets.UTF_8);
    }

    private static byte[] xor(byte[] data, byte[] key) {
        byte[] result = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = (byte) (data[i] ^ key[i % key.length]);
        }
        return result;
    }

    /**
     * 计算口令的 SHA-256 摘要
     */
    static byte[] deriveKey(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("Passphrase must not be empty");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return md.digest(passphrase.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
