package com.work.lock.core.support;

import com.work.lock.core.exception.LockException;
import com.work.lock.core.store.ExtendResult;
import com.work.lock.core.store.LockStore;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单进程内模拟 Redis 语义的 {@link LockStore}：key 过期（惰性清理）、条件删除、BLPOP 阻塞等待。
 * <p>
 * 所有操作共用一把锁，语义上等价于 Redis 的单线程执行模型。适用于测试和单机部署，
 * 多个等待者被唤醒的先后顺序不做保证。
 */
public class InMemoryLockStore implements LockStore {

    private static final class Entry {
        final String value;
        long expireAtNanos;

        Entry(String value, long expireAtNanos) {
            this.value = value;
            this.expireAtNanos = expireAtNanos;
        }
    }

    private static final class ListEntry {
        final Deque<String> items = new ArrayDeque<>();
        long expireAtNanos;
    }

    // 每写入这么多次做一轮全量清理，否则只被写过一次的 key 过期后永远留在 map 里
    static final int PURGE_EVERY = 256;

    private final ReentrantLock mutex = new ReentrantLock();
    private final Condition pushed = mutex.newCondition();
    private final Map<String, Entry> values = new HashMap<>();
    private final Map<String, ListEntry> lists = new HashMap<>();
    private int writesSincePurge;

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        mutex.lock();
        try {
            if (liveValue(key) != null || liveList(key) != null) {
                return false;
            }
            values.put(key, new Entry(value, deadline(ttl)));
            afterWrite();
            return true;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public String get(String key) {
        mutex.lock();
        try {
            Entry entry = liveValue(key);
            return entry == null ? null : entry.value;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public boolean deleteIfEquals(String key, String expected) {
        mutex.lock();
        try {
            Entry entry = liveValue(key);
            if (entry == null || !entry.value.equals(expected)) {
                return false;
            }
            values.remove(key);
            return true;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public ExtendResult expireIfEquals(String key, String expected, Duration ttl) {
        mutex.lock();
        try {
            Entry entry = liveValue(key);
            if (entry == null || !entry.value.equals(expected)) {
                return ExtendResult.NOT_OWNER;
            }
            if (entry.expireAtNanos == 0L) {
                return ExtendResult.NOT_EXPIRABLE;
            }
            entry.expireAtNanos = deadline(ttl);
            return ExtendResult.EXTENDED;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public boolean blockingPop(String key, Duration timeout) {
        long remaining = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
        mutex.lock();
        try {
            while (true) {
                ListEntry list = liveList(key);
                if (list != null) {
                    list.items.pollFirst();
                    if (list.items.isEmpty()) {
                        lists.remove(key);
                    }
                    return true;
                }
                if (remaining <= 0L) {
                    return false;
                }
                if (timeout == null) {
                    pushed.await();
                } else {
                    remaining = pushed.awaitNanos(remaining);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException("interrupted while waiting on " + key, e);
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public void signal(String key, Duration ttl) {
        mutex.lock();
        try {
            values.remove(key);
            ListEntry list = new ListEntry();
            list.items.addFirst("1");
            list.expireAtNanos = deadline(ttl);
            lists.put(key, list);
            afterWrite();
            pushed.signalAll();
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public void delete(String key) {
        mutex.lock();
        try {
            values.remove(key);
            lists.remove(key);
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public List<String> scan(String pattern) {
        mutex.lock();
        try {
            purgeExpired();
            List<String> keys = new ArrayList<>();
            for (String key : values.keySet()) {
                if (matches(pattern, key)) {
                    keys.add(key);
                }
            }
            for (String key : lists.keySet()) {
                if (matches(pattern, key)) {
                    keys.add(key);
                }
            }
            return keys;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * 列表长度（信号 key 检查用）。
     */
    public int listLength(String key) {
        mutex.lock();
        try {
            ListEntry list = liveList(key);
            return list == null ? 0 : list.items.size();
        } finally {
            mutex.unlock();
        }
    }

    /**
     * 剩余存活时间；key 不存在返回 null，没有过期时间返回 -1ms（对齐 Redis PTTL 的 -1）。
     */
    public Duration remainingTtl(String key) {
        mutex.lock();
        try {
            Entry entry = liveValue(key);
            if (entry == null) {
                return null;
            }
            if (entry.expireAtNanos == 0L) {
                return Duration.ofMillis(-1);
            }
            return Duration.ofNanos(entry.expireAtNanos - System.nanoTime());
        } finally {
            mutex.unlock();
        }
    }

    /**
     * 当前存活 key 的数量。
     */
    public int size() {
        mutex.lock();
        try {
            purgeExpired();
            return values.size() + lists.size();
        } finally {
            mutex.unlock();
        }
    }

    /**
     * map 中实际保留的条目数，包括已过期但尚未清理的。
     */
    int retainedEntries() {
        mutex.lock();
        try {
            return values.size() + lists.size();
        } finally {
            mutex.unlock();
        }
    }

    private void afterWrite() {
        if (++writesSincePurge >= PURGE_EVERY) {
            purgeExpired();
        }
    }

    private Entry liveValue(String key) {
        Entry entry = values.get(key);
        if (entry != null && expired(entry.expireAtNanos)) {
            values.remove(key);
            return null;
        }
        return entry;
    }

    private ListEntry liveList(String key) {
        ListEntry list = lists.get(key);
        if (list != null && (expired(list.expireAtNanos) || list.items.isEmpty())) {
            lists.remove(key);
            return null;
        }
        return list;
    }

    private void purgeExpired() {
        writesSincePurge = 0;
        for (Iterator<Map.Entry<String, Entry>> it = values.entrySet().iterator(); it.hasNext(); ) {
            if (expired(it.next().getValue().expireAtNanos)) {
                it.remove();
            }
        }
        for (Iterator<Map.Entry<String, ListEntry>> it = lists.entrySet().iterator(); it.hasNext(); ) {
            if (expired(it.next().getValue().expireAtNanos)) {
                it.remove();
            }
        }
    }

    private static boolean matches(String pattern, String key) {
        if (pattern.endsWith("*")) {
            return key.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return key.equals(pattern);
    }

    private static long deadline(Duration ttl) {
        if (ttl == null) {
            return 0L;
        }
        long at = System.nanoTime() + ttl.toNanos();
        // 0 保留给“不过期”
        return at == 0L ? 1L : at;
    }

    private static boolean expired(long expireAtNanos) {
        return expireAtNanos != 0L && System.nanoTime() - expireAtNanos >= 0L;
    }
}
