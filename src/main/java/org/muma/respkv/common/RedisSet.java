package org.muma.respkv.common;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Redis Set 封装
 * byte[] 没有值语义，所以用 ByteBuffer.wrap 作为成员的 key
 */
public class RedisSet {

    private final Set<ByteBuffer> members = new HashSet<>();

    public int add(byte[] member) {
        return members.add(ByteBuffer.wrap(member)) ? 1 : 0;
    }

    public int remove(byte[] member) {
        return members.remove(ByteBuffer.wrap(member)) ? 1 : 0;
    }

    public boolean contains(byte[] member) {
        return members.contains(ByteBuffer.wrap(member));
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public List<byte[]> getAll() {
        List<byte[]> result = new ArrayList<>(members.size());
        for (ByteBuffer bb : members) {
            result.add(toBytes(bb));
        }
        return result;
    }

    private byte[] toBytes(ByteBuffer bb) {
        byte[] bytes = new byte[bb.remaining()];
        // duplicate 避免修改原 ByteBuffer 的 position，保证在 Set 中依然有效
        bb.duplicate().get(bytes);
        return bytes;
    }
}
