package com.gateflow.core.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DurableWritesTest {

    private StateStore store;
    private DurableWrites writes;

    @BeforeEach
    void setUp() {
        store = mock(StateStore.class);
        writes = new DurableWrites(store);
    }

    private static StateStoreException failure(String key) {
        return new StateStoreException(key, "disk full", new IOException("ENOSPC"));
    }

    @Test
    void requiredWriteSucceedsFirstTime() {
        writes.writeRequired("k", Map.of());
        verify(store, times(1)).write(eq("k"), any());
    }

    @Test
    void requiredWriteIsRetriedOnce() {
        doThrow(failure("k")).doNothing().when(store).write(eq("k"), any());

        writes.writeRequired("k", Map.of());

        verify(store, times(2)).write(eq("k"), any());
    }

    @Test
    void requiredWritePropagatesSecondFailure() {
        doThrow(failure("k"), failure("k")).when(store).write(eq("k"), any());

        var e = assertThrows(StateStoreException.class, () -> writes.writeRequired("k", Map.of()));

        assertEquals(1, e.getSuppressed().length);
        verify(store, times(2)).write(eq("k"), any());
    }

    @Test
    void requiredWritePropagatesSameInstanceThrownTwice() {
        StateStoreException failure = failure("k");
        doThrow(failure).when(store).write(eq("k"), any());

        var e = assertThrows(StateStoreException.class, () -> writes.writeRequired("k", Map.of()));

        assertSame(failure, e);
        assertEquals(0, e.getSuppressed().length);
    }

    @Test
    void auxiliaryWriteReportsFailureWithoutThrowing() {
        doThrow(failure("audit")).when(store).write(eq("audit"), any());

        assertFalse(writes.writeAuxiliary("audit", Map.of()));
        verify(store, times(2)).write(eq("audit"), any());
    }

    @Test
    void auxiliaryWriteReportsSuccess() {
        assertTrue(writes.writeAuxiliary("audit", Map.of()));
    }
}
