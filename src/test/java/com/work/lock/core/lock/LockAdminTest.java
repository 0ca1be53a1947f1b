package com.work.lock.core.lock;

import com.work.lock.core.support.InMemoryLockStore;
import com.work.lock.core.support.LockEventListener;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class LockAdminTest {

    private final InMemoryLockStore store = new InMemoryLockStore();
    private final LockEventListener listener = mock(LockEventListener.class);
    private final LockAdmin admin = new LockAdmin(store, listener, Duration.ofSeconds(1));

    @Test
    public void reset_all_with_no_locks_is_noop() {
        assertEquals(0, admin.resetAll());
        assertEquals(0, store.size());
        verifyNoInteractions(listener);
    }

    @Test
    public void reset_deletes_holder_and_leaves_one_signal() {
        store.setIfAbsent("lock:foo", "someone", null);

        admin.reset("foo");

        assertNull(store.get("lock:foo"));
        assertEquals(1, store.listLength("lock-signal:foo"));
        verify(listener).reset("foo");
    }

    @Test
    public void reset_all_only_touches_holder_keys() {
        store.setIfAbsent("lock:foobar1", "a", null);
        store.setIfAbsent("lock:foobar2", "b", Duration.ofSeconds(30));
        store.setIfAbsent("unrelated", "c", null);

        assertEquals(2, admin.resetAll());

        assertNull(store.get("lock:foobar1"));
        assertNull(store.get("lock:foobar2"));
        assertEquals("c", store.get("unrelated"));
        assertEquals(1, store.listLength("lock-signal:foobar1"));
        assertEquals(1, store.listLength("lock-signal:foobar2"));
    }
}
