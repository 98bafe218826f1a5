package org.muma.respkv.utils;

import java.nio.charset.StandardCharsets;

/**
 * 数字解析工具类
 * 规则与 Redis 的 string2ll 一致：可选的 '-' 加十进制数字，不接受 '+'、空白、前导 0 以及 "-0"
 */
public final class NumberUtils {

    // Long.MIN_VALUE 的十进制表示为 20 个字符
    private static final int MAX_LONG_CHARS = 20;

    private NumberUtils() {
    }

    /**
     * @throws NumberFormatException 格式不合法或超出 long 范围
     */
    public static long parseLong(byte[] bytes) {
        if (bytes == null || bytes.length == 0 || bytes.length > MAX_LONG_CHARS) {
            throw new NumberFormatException("not an integer");
        }
        if (bytes.length == 1 && bytes[0] == '0') {
            return 0;
        }

        int start = bytes[0] == '-' ? 1 : 0;
        if (start >= bytes.length || bytes[start] < '1' || bytes[start] > '9') {
            throw new NumberFormatException("not an integer");
        }
        for (int i = start + 1; i < bytes.length; i++) {
            if (bytes[i] < '0' || bytes[i] > '9') {
                throw new NumberFormatException("not an integer");
            }
        }
        // 格式已校验，这里只可能因为溢出失败
        return Long.parseLong(new String(bytes, 0, bytes.length, StandardCharsets.US_ASCII));
    }
}
