package org.muma.respkv.protocol;

import java.nio.charset.StandardCharsets;

// 4. 批量字符串 ($) - 支持 null (表示 $-1)
public record BulkString(byte[] content) implements RedisMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Key / field 专用构造：ISO-8859-1 与字节一一对应，二进制 key 可以原样还原
     */
    public static BulkString ofKey(String key) {
        return new BulkString(key == null ? null : key.getBytes(StandardCharsets.ISO_8859_1));
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public String asKey() {
        return content == null ? null : new String(content, StandardCharsets.ISO_8859_1);
    }

    public boolean isNull() {
        return content == null;
    }
}
