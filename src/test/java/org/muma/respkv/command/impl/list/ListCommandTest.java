package org.muma.respkv.command.impl.list;

import org.junit.jupiter.api.Test;
import org.muma.respkv.command.AbstractCommandTest;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.RedisArray;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListCommandTest extends AbstractCommandTest {

    @Test
    void testPushOrder() {
        // LPUSH 多元素依次插入头部
        assertEquals(3, asLong(exec("LPUSH", "l", "a", "b", "c")));
        assertEquals(List.of("c", "b", "a"), asList(exec("LRANGE", "l", "0", "-1")));

        assertEquals(5, asLong(exec("RPUSH", "l", "d", "e")));
        assertEquals(List.of("c", "b", "a", "d", "e"), asList(exec("LRANGE", "l", "0", "-1")));
        assertEquals(5, asLong(exec("LLEN", "l")));
    }

    @Test
    void testLRangeBounds() {
        exec("RPUSH", "l", "0", "1", "2", "3", "4");

        assertEquals(List.of("1", "2"), asList(exec("LRANGE", "l", "1", "2")));
        assertEquals(List.of("3", "4"), asList(exec("LRANGE", "l", "-2", "100")));
        assertEquals(List.of("0", "1", "2", "3", "4"), asList(exec("LRANGE", "l", "-100", "100")));
        assertEquals(List.of(), asList(exec("LRANGE", "l", "3", "1")));
        assertEquals(List.of(), asList(exec("LRANGE", "l", "5", "10")));
        assertEquals(List.of(), asList(exec("LRANGE", "missing", "0", "-1")));
        assertEquals("ERR value is not an integer or out of range", errorOf(exec("LRANGE", "l", "a", "1")));
    }

    @Test
    void testPop() {
        exec("RPUSH", "l", "a", "b", "c");

        assertEquals("a", asString(exec("LPOP", "l")));
        assertEquals("c", asString(exec("RPOP", "l")));
        assertEquals("b", asString(exec("LPOP", "l")));

        // 弹空后 key 被删除
        assertEquals(0, asLong(exec("EXISTS", "l")));
        assertEquals(BulkString.NULL, exec("LPOP", "l"));
        assertEquals(0, asLong(exec("LLEN", "l")));
    }

    @Test
    void testPopWithCount() {
        exec("RPUSH", "l", "a", "b", "c");

        assertEquals(List.of("a", "b"), asList(exec("LPOP", "l", "2")));
        assertEquals(List.of("c"), asList(exec("RPOP", "l", "10")));
        assertEquals(0, asLong(exec("EXISTS", "l")));

        assertEquals(RedisArray.NULL, exec("LPOP", "l", "2"));
        assertEquals("ERR value is out of range, must be positive", errorOf(exec("LPOP", "l", "-1")));
    }

    @Test
    void testLIndex() {
        exec("RPUSH", "l", "a", "b", "c");

        assertEquals("a", asString(exec("LINDEX", "l", "0")));
        assertEquals("c", asString(exec("LINDEX", "l", "-1")));
        assertEquals(BulkString.NULL, exec("LINDEX", "l", "3"));
        assertEquals(BulkString.NULL, exec("LINDEX", "l", "-4"));
        assertEquals(BulkString.NULL, exec("LINDEX", "missing", "0"));
    }

    @Test
    void testWrongType() {
        exec("SET", "s", "v");

        assertTrue(errorOf(exec("RPUSH", "s", "x")).startsWith("WRONGTYPE"));
        assertTrue(errorOf(exec("LPOP", "s")).startsWith("WRONGTYPE"));
        assertTrue(errorOf(exec("LRANGE", "s", "0", "-1")).startsWith("WRONGTYPE"));
        assertTrue(errorOf(exec("LLEN", "s")).startsWith("WRONGTYPE"));
        assertEquals("v", asString(exec("GET", "s")));
    }
}
