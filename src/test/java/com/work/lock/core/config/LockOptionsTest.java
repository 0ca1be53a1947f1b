package com.work.lock.core.config;

import com.work.lock.core.exception.LockConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class LockOptionsTest {

    @Test
    public void zero_durations_mean_disabled() {
        LockOptions options = LockOptions.builder().expire(Duration.ZERO).timeout(Duration.ZERO).build();

        assertNull(options.getExpire());
        assertNull(options.getTimeout());
    }

    @Test
    public void negative_durations_are_rejected() {
        assertThrows(LockConfigurationException.class,
                () -> LockOptions.builder().expire(Duration.ofSeconds(-1)).build());
        assertThrows(LockConfigurationException.class,
                () -> LockOptions.builder().expire(Duration.ofSeconds(-123)).build());
        assertThrows(LockConfigurationException.class,
                () -> LockOptions.builder().timeout(Duration.ofMillis(-1)).build());
    }

    @Test
    public void auto_renewal_requires_expire() {
        assertThrows(LockConfigurationException.class, () -> LockOptions.builder().autoRenewal(true).build());
    }

    @Test
    public void renewal_interval_is_two_thirds_of_expire() {
        LockOptions options = LockOptions.builder().expire(Duration.ofSeconds(3)).autoRenewal(true).build();

        assertEquals(Duration.ofSeconds(2), options.getRenewalInterval());
        assertNull(LockOptions.builder().expire(Duration.ofSeconds(3)).build().getRenewalInterval());
    }

    @Test
    public void empty_owner_id_is_rejected() {
        assertThrows(LockConfigurationException.class, () -> LockOptions.builder().ownerId("").build());
    }

    @Test
    public void to_builder_copies_all_fields() {
        LockOptions options = LockOptions.builder()
                .ownerId("id")
                .expire(Duration.ofSeconds(5))
                .timeout(Duration.ofSeconds(2))
                .autoRenewal(true)
                .build();

        LockOptions copy = options.toBuilder().build();

        assertEquals("id", copy.getOwnerId());
        assertEquals(Duration.ofSeconds(5), copy.getExpire());
        assertEquals(Duration.ofSeconds(2), copy.getTimeout());
        assertTrue(copy.isAutoRenewal());
    }

    @Test
    public void factory_config_rejects_bad_values() {
        assertThrows(IllegalArgumentException.class, () -> new LockFactoryConfig(Duration.ZERO, null, 1));
        assertThrows(IllegalArgumentException.class, () -> new LockFactoryConfig(Duration.ofSeconds(1), null, 0));
        assertThrows(LockConfigurationException.class,
                () -> new LockFactoryConfig(Duration.ofSeconds(1), Duration.ofSeconds(-1), 1));
        assertNull(new LockFactoryConfig(Duration.ofSeconds(1), Duration.ZERO, 1).getIdleWakeInterval());
    }
}
