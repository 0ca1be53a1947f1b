package com.work.lock.core.support;

import com.work.lock.core.store.ExtendResult;

import java.time.Duration;

/**
 * 锁生命周期的可观测性端口，在创建工厂时注入，不依赖全局 logger 配置。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体日志/metrics 实现
 * - 回调在调用线程（或续期线程）上同步执行，实现方不应阻塞
 */
public interface LockEventListener {

    default void acquiring(String name, String ownerId) {
    }

    default void acquired(String name, String ownerId) {
    }

    /**
     * 非阻塞获取失败，或阻塞获取在 timeout 内未成功。
     */
    default void acquireFailed(String name, String ownerId) {
    }

    /**
     * 即将阻塞等待信号；wait 为 null 表示一直等到信号。
     */
    default void waiting(String name, String ownerId, Duration wait) {
    }

    default void released(String name, String ownerId) {
    }

    default void renewed(String name, String ownerId) {
    }

    /**
     * 续期时发现锁已不属于自己，续期任务随即停止。
     */
    default void renewalLost(String name, String ownerId, ExtendResult result) {
    }

    /**
     * 续期时访问存储出错；任务保持调度，等待下一轮。
     */
    default void renewalFailed(String name, String ownerId, Throwable error) {
    }

    default void reset(String name) {
    }
}
