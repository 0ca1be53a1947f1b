package com.work.lock.demo.recovery;

import com.work.lock.core.lock.DistributedLockFactory;
import com.work.lock.demo.config.RedisLockProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.Arrays;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class LockRecoveryRunnerTest {

    @Test
    public void does_nothing_by_default() {
        DistributedLockFactory factory = mock(DistributedLockFactory.class);

        new LockRecoveryRunner(factory, new RedisLockProperties.Recovery()).run(new DefaultApplicationArguments());

        verifyNoInteractions(factory);
    }

    @Test
    public void resets_all_when_enabled() {
        DistributedLockFactory factory = mock(DistributedLockFactory.class);
        RedisLockProperties.Recovery recovery = new RedisLockProperties.Recovery();
        recovery.setResetAllOnStartup(true);
        recovery.setResetNames(Arrays.asList("a", "b"));

        new LockRecoveryRunner(factory, recovery).run(new DefaultApplicationArguments());

        verify(factory).resetAll();
        verify(factory, never()).reset(anyString());
    }

    @Test
    public void resets_named_locks() {
        DistributedLockFactory factory = mock(DistributedLockFactory.class);
        RedisLockProperties.Recovery recovery = new RedisLockProperties.Recovery();
        recovery.setResetNames(Arrays.asList("a", "b"));

        new LockRecoveryRunner(factory, recovery).run(new DefaultApplicationArguments());

        verify(factory).reset("a");
        verify(factory).reset("b");
        verify(factory, never()).resetAll();
    }
}
