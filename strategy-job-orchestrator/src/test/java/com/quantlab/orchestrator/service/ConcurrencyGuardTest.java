package com.quantlab.orchestrator.service;

import com.quantlab.orchestrator.repository.JobStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for global slot accounting.
 */
@ExtendWith(MockitoExtension.class)
class ConcurrencyGuardTest {

    @Mock
    private JobStore jobStore;

    @Test
    void testTryAcquireSlot_RespectsCap() {
        ConcurrencyGuard guard = new ConcurrencyGuard(jobStore, 2);

        assertTrue(guard.tryAcquireSlot(1L));
        assertTrue(guard.tryAcquireSlot(2L));
        assertFalse(guard.tryAcquireSlot(3L));
        assertFalse(guard.hasFreeSlot());
    }

    @Test
    void testTryAcquireSlot_IdempotentPerJob() {
        ConcurrencyGuard guard = new ConcurrencyGuard(jobStore, 1);

        assertTrue(guard.tryAcquireSlot(1L));
        assertTrue(guard.tryAcquireSlot(1L));
        assertEquals(1, guard.slotsInUse());
    }

    @Test
    void testRelease_FreesSlotOnce() {
        ConcurrencyGuard guard = new ConcurrencyGuard(jobStore, 1);
        guard.tryAcquireSlot(1L);

        assertTrue(guard.release(1L));
        assertFalse(guard.release(1L));
        assertTrue(guard.tryAcquireSlot(2L));
    }

    @Test
    void testRestoreSlot_IgnoresCap() {
        ConcurrencyGuard guard = new ConcurrencyGuard(jobStore, 1);

        guard.restoreSlot(1L);
        guard.restoreSlot(2L);

        assertEquals(2, guard.slotsInUse());
        assertFalse(guard.tryAcquireSlot(3L));
    }
}
