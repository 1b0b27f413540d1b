package net.tessera.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunStatusTest {

    @Test
    void forwardTransitions_areAllowed() {
        assertTrue(RunStatus.QUEUED.canTransitionTo(RunStatus.NOT_STARTED));
        assertTrue(RunStatus.NOT_STARTED.canTransitionTo(RunStatus.STARTED));
        assertTrue(RunStatus.STARTED.canTransitionTo(RunStatus.SUCCESS));
        assertTrue(RunStatus.QUEUED.canTransitionTo(RunStatus.CANCELED));
    }

    @Test
    void terminalStatuses_doNotMove() {
        for (RunStatus s : RunStatus.values()) {
            if (!s.isTerminal()) continue;
            assertTrue(s.canTransitionTo(s));
            assertFalse(s.canTransitionTo(RunStatus.STARTED), s + " -> STARTED");
        }
        assertFalse(RunStatus.STARTED.canTransitionTo(RunStatus.QUEUED));
    }

    @Test
    void from_isCaseInsensitive() {
        assertEquals(RunStatus.SUCCESS, RunStatus.from("success"));
        assertThrows(IllegalArgumentException.class, () -> RunStatus.from(null));
    }
}
