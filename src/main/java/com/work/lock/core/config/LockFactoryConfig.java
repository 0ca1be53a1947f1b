package com.work.lock.core.config;

import java.time.Duration;

import static com.work.lock.core.support.ValidationUtils.optionalDuration;
import static com.work.lock.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可。
 */
public class LockFactoryConfig {

    private final Duration signalExpire;
    private final Duration idleWakeInterval;
    private final int renewalThreads;

    /**
     * @param signalExpire     release/reset 推入的唤醒信号保留多久
     * @param idleWakeInterval 未配置 expire 时阻塞等待的兜底唤醒间隔，null 表示一直等到信号
     * @param renewalThreads   续期调度线程数
     */
    public LockFactoryConfig(Duration signalExpire, Duration idleWakeInterval, int renewalThreads) {
        this.signalExpire = requirePositive(signalExpire, "signalExpire");
        this.idleWakeInterval = optionalDuration(idleWakeInterval, "idleWakeInterval");
        if (renewalThreads <= 0) {
            throw new IllegalArgumentException("renewalThreads must be > 0");
        }
        this.renewalThreads = renewalThreads;
    }

    public static LockFactoryConfig defaultConfig() {
        return new LockFactoryConfig(Duration.ofMillis(1000), null, 1);
    }

    public Duration getSignalExpire() {
        return signalExpire;
    }

    public Duration getIdleWakeInterval() {
        return idleWakeInterval;
    }

    public int getRenewalThreads() {
        return renewalThreads;
    }
}
