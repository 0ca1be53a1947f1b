package com.work.lock.core.config;

import com.work.lock.core.exception.LockConfigurationException;

import java.time.Duration;

import static com.work.lock.core.support.ValidationUtils.optionalDuration;

/**
 * 单个锁句柄的参数。
 * <ul>
 *     <li>{@code ownerId}：持有者标识；为空时由句柄随机生成。跨进程共享同一 id 即可互相识别。</li>
 *     <li>{@code expire}：持有者 key 的过期时间；为空表示永不过期。</li>
 *     <li>{@code timeout}：阻塞获取的默认等待上限；为空表示无限等待。</li>
 *     <li>{@code autoRenewal}：后台按 2/3 expire 的周期续期，必须配合 expire 使用。</li>
 * </ul>
 * 0 视为未设置，负数在构造时即抛出 {@link LockConfigurationException}。
 * 若 expire 小于 timeout 且未开启 autoRenewal，acquire 时会拒绝该组合。
 */
public final class LockOptions {

    private static final LockOptions DEFAULTS = builder().build();

    private final String ownerId;
    private final Duration expire;
    private final Duration timeout;
    private final boolean autoRenewal;

    private LockOptions(Builder builder) {
        this.ownerId = builder.ownerId;
        this.expire = optionalDuration(builder.expire, "expire");
        this.timeout = optionalDuration(builder.timeout, "timeout");
        this.autoRenewal = builder.autoRenewal;
        if (autoRenewal && expire == null) {
            throw new LockConfigurationException("autoRenewal 需要同时设置 expire");
        }
        if (ownerId != null && ownerId.isEmpty()) {
            throw new LockConfigurationException("ownerId 不能为空字符串");
        }
    }

    public static LockOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .ownerId(ownerId)
                .expire(expire)
                .timeout(timeout)
                .autoRenewal(autoRenewal);
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Duration getExpire() {
        return expire;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isAutoRenewal() {
        return autoRenewal;
    }

    /**
     * 续期周期：expire 的 2/3，未开启续期时返回 null。
     */
    public Duration getRenewalInterval() {
        if (!autoRenewal) {
            return null;
        }
        return expire.multipliedBy(2).dividedBy(3);
    }

    @Override
    public String toString() {
        return "LockOptions{ownerId=" + ownerId
                + ", expire=" + expire
                + ", timeout=" + timeout
                + ", autoRenewal=" + autoRenewal + '}';
    }

    public static final class Builder {

        private String ownerId;
        private Duration expire;
        private Duration timeout;
        private boolean autoRenewal;

        private Builder() {
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder expire(Duration expire) {
            this.expire = expire;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder autoRenewal(boolean autoRenewal) {
            this.autoRenewal = autoRenewal;
            return this;
        }

        public LockOptions build() {
            return new LockOptions(this);
        }
    }
}
