package com.work.lock.core.store;

import java.time.Duration;
import java.util.List;

/**
 * 锁协议依赖的存储能力。默认实现基于 Redis（{@link com.work.lock.core.store.impl.RedisLockStore}），
 * 测试与单机场景可使用 {@link com.work.lock.core.support.InMemoryLockStore}。
 * <p>
 * 各方法的原子性由实现保证；连接类异常原样抛出，组件本身不做重试。
 */
public interface LockStore {

    /**
     * SET key value NX [PX ttl]。
     *
     * @param ttl 过期时间，null 表示不过期
     * @return true 表示写入成功
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * @return 当前值，不存在时返回 null
     */
    String get(String key);

    /**
     * 仅当当前值等于 expected 时删除（compare-and-delete）。
     */
    boolean deleteIfEquals(String key, String expected);

    /**
     * 仅当当前值等于 expected 且 key 带有过期时间时，把过期时间重置为 ttl。
     */
    ExtendResult expireIfEquals(String key, String expected, Duration ttl);

    /**
     * 阻塞弹出列表头部元素（BLPOP）。
     *
     * @param timeout 最长等待时间，null 表示一直等待
     * @return true 表示收到信号，false 表示超时
     */
    boolean blockingPop(String key, Duration timeout);

    /**
     * 清空列表后推入一个唤醒令牌，并为列表设置过期时间，避免旧信号堆积。
     */
    void signal(String key, Duration ttl);

    void delete(String key);

    /**
     * 增量扫描匹配 pattern（glob 风格，仅支持结尾的 *）的 key。
     */
    List<String> scan(String pattern);

    /**
     * 校验持有者并删除，成功后发出唤醒信号。实现可以覆盖为单次原子调用。
     *
     * @return false 表示持有者不匹配，此时不会发出信号
     */
    default boolean releaseAndSignal(String holderKey, String signalKey, String expected, Duration signalTtl) {
        if (!deleteIfEquals(holderKey, expected)) {
            return false;
        }
        signal(signalKey, signalTtl);
        return true;
    }
}
