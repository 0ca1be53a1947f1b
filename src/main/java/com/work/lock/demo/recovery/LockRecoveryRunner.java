package com.work.lock.demo.recovery;

import com.work.lock.core.lock.DistributedLockFactory;
import com.work.lock.demo.config.RedisLockProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import static com.work.lock.core.support.ValidationUtils.requireNonNull;

/**
 * 启动时清理上次崩溃遗留的锁。默认不做任何事，需要显式开启。
 */
public class LockRecoveryRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(LockRecoveryRunner.class);

    private final DistributedLockFactory lockFactory;
    private final RedisLockProperties.Recovery recovery;

    public LockRecoveryRunner(DistributedLockFactory lockFactory, RedisLockProperties.Recovery recovery) {
        this.lockFactory = requireNonNull(lockFactory, "lockFactory");
        this.recovery = requireNonNull(recovery, "recovery");
    }

    @Override
    public void run(ApplicationArguments args) {
        if (recovery.isResetAllOnStartup()) {
            int count = lockFactory.resetAll();
            LOGGER.info("[lock] startup recovery, reset all locks, count={}", count);
            return;
        }
        for (String name : recovery.getResetNames()) {
            lockFactory.reset(name);
        }
        if (!recovery.getResetNames().isEmpty()) {
            LOGGER.info("[lock] startup recovery, reset names={}", recovery.getResetNames());
        }
    }
}
