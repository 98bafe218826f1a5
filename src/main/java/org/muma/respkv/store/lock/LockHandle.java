package org.muma.respkv.store.lock;

/**
 * 已持有的一组 stripe 锁，close 时逆序释放
 */
public final class LockHandle implements AutoCloseable {

    static final LockHandle EMPTY = new LockHandle(null, new int[0]);

    private final KeyLockManager owner;
    private final int[] indexes;
    private boolean released;

    LockHandle(KeyLockManager owner, int[] indexes) {
        this.owner = owner;
        this.indexes = indexes;
    }

    @Override
    public void close() {
        if (released || owner == null) return;
        released = true;
        owner.release(indexes);
    }
}
