package com.work.lock.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 仅存在于 demo/宿主包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.lock.core.config.LockFactoryConfig} 与
 * {@link com.work.lock.core.config.LockOptions}。
 */
@Validated
@ConfigurationProperties(prefix = "redis-lock")
public class RedisLockProperties {

    public enum StoreType {
        REDIS,
        MEMORY
    }

    /**
     * 存储实现：redis（默认）或 memory（单进程，测试/本地用）。
     */
    @NotNull
    private StoreType store = StoreType.REDIS;

    /**
     * release/reset 推入的唤醒信号保留多久。
     */
    @NotNull
    private Duration signalExpire = Duration.ofMillis(1000);

    /**
     * 未配置 expire 时阻塞等待的兜底唤醒间隔，不配置表示一直等到信号。
     */
    private Duration idleWakeInterval;

    /**
     * 单次 BLPOP 的最长阻塞时间，必须小于 spring.redis.timeout。
     */
    @NotNull
    private Duration maxBlock = Duration.ofSeconds(30);

    @Min(1)
    private int renewalThreads = 1;

    /**
     * {@link com.work.lock.core.lock.LockCoordinator} 使用的默认锁参数。
     */
    private Duration defaultExpire;

    private Duration defaultTimeout;

    private boolean defaultAutoRenewal;

    @Valid
    private Recovery recovery = new Recovery();

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Duration getSignalExpire() {
        return signalExpire;
    }

    public void setSignalExpire(Duration signalExpire) {
        this.signalExpire = signalExpire;
    }

    public Duration getIdleWakeInterval() {
        return idleWakeInterval;
    }

    public void setIdleWakeInterval(Duration idleWakeInterval) {
        this.idleWakeInterval = idleWakeInterval;
    }

    public Duration getMaxBlock() {
        return maxBlock;
    }

    public void setMaxBlock(Duration maxBlock) {
        this.maxBlock = maxBlock;
    }

    public int getRenewalThreads() {
        return renewalThreads;
    }

    public void setRenewalThreads(int renewalThreads) {
        this.renewalThreads = renewalThreads;
    }

    public Duration getDefaultExpire() {
        return defaultExpire;
    }

    public void setDefaultExpire(Duration defaultExpire) {
        this.defaultExpire = defaultExpire;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public boolean isDefaultAutoRenewal() {
        return defaultAutoRenewal;
    }

    public void setDefaultAutoRenewal(boolean defaultAutoRenewal) {
        this.defaultAutoRenewal = defaultAutoRenewal;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    /**
     * 启动时的崩溃恢复。
     */
    public static class Recovery {

        /**
         * 启动时强制释放全部锁。
         */
        private boolean resetAllOnStartup = false;

        /**
         * 启动时强制释放的锁名（resetAllOnStartup=true 时忽略）。
         */
        @NotNull
        private List<String> resetNames = new ArrayList<>();

        public boolean isResetAllOnStartup() {
            return resetAllOnStartup;
        }

        public void setResetAllOnStartup(boolean resetAllOnStartup) {
            this.resetAllOnStartup = resetAllOnStartup;
        }

        public List<String> getResetNames() {
            return resetNames;
        }

        public void setResetNames(List<String> resetNames) {
            this.resetNames = resetNames;
        }
    }
}
