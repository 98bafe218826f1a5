package org.muma.respkv.common;

import java.util.Locale;

public enum RedisDataType {
    STRING, LIST, HASH, SET;

    // TYPE 命令的返回值
    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
