package com.work.lock.demo.config;

import com.work.lock.core.config.LockFactoryConfig;
import com.work.lock.core.config.LockOptions;
import com.work.lock.core.lock.DistributedLockFactory;
import com.work.lock.core.lock.LockCoordinator;
import com.work.lock.core.store.LockStore;
import com.work.lock.core.store.impl.RedisLockStore;
import com.work.lock.core.support.InMemoryLockStore;
import com.work.lock.core.support.LockEventListener;
import com.work.lock.core.support.LoggingLockEventListener;
import com.work.lock.demo.recovery.LockRecoveryRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * 默认使用 Redis 存储；redis-lock.store=memory 时使用进程内实现。
 */
@Configuration
@EnableConfigurationProperties(RedisLockProperties.class)
public class RedisLockConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "redis-lock", name = "store", havingValue = "redis", matchIfMissing = true)
    public LockStore redisLockStore(StringRedisTemplate redisTemplate, RedisLockProperties properties) {
        return new RedisLockStore(redisTemplate, properties.getMaxBlock());
    }

    @Bean
    @ConditionalOnProperty(prefix = "redis-lock", name = "store", havingValue = "memory")
    public LockStore inMemoryLockStore() {
        return new InMemoryLockStore();
    }

    /**
     * 业务侧提供自定义 LockEventListener Bean（例如接入 metrics）时覆盖默认的日志实现。
     */
    @Bean
    @ConditionalOnMissingBean(LockEventListener.class)
    public LockEventListener lockEventListener() {
        return new LoggingLockEventListener();
    }

    @Bean
    public LockFactoryConfig lockFactoryConfig(RedisLockProperties properties) {
        return new LockFactoryConfig(
                properties.getSignalExpire(),
                properties.getIdleWakeInterval(),
                properties.getRenewalThreads()
        );
    }

    @Bean(destroyMethod = "close")
    public DistributedLockFactory distributedLockFactory(LockStore lockStore,
                                                         LockFactoryConfig config,
                                                         LockEventListener listener) {
        return new DistributedLockFactory(lockStore, config, listener);
    }

    @Bean
    public LockCoordinator lockCoordinator(DistributedLockFactory factory, RedisLockProperties properties) {
        LockOptions defaults = LockOptions.builder()
                .expire(properties.getDefaultExpire())
                .timeout(properties.getDefaultTimeout())
                .autoRenewal(properties.isDefaultAutoRenewal())
                .build();
        return new LockCoordinator(factory, defaults);
    }

    @Bean
    public LockRecoveryRunner lockRecoveryRunner(DistributedLockFactory factory, RedisLockProperties properties) {
        return new LockRecoveryRunner(factory, properties.getRecovery());
    }
}
