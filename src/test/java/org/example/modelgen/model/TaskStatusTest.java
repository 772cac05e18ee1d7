package org.example.modelgen.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskStatusTest {

    @Test
    void parse_mapsKnownValuesCaseInsensitively() {
        assertEquals(TaskStatus.SUCCESS, TaskStatus.parse("success"));
        assertEquals(TaskStatus.CANCELLED, TaskStatus.parse(" Cancelled "));
        assertEquals(TaskStatus.QUEUED, TaskStatus.parse("QUEUED"));
    }

    @Test
    void parse_unknownOrMissingFallsBackToProcessing() {
        assertEquals(TaskStatus.PROCESSING, TaskStatus.parse("rendering"));
        assertEquals(TaskStatus.PROCESSING, TaskStatus.parse(null));
        assertFalse(TaskStatus.isRecognized("rendering"));
        assertTrue(TaskStatus.isRecognized("timeout"));
    }

    @Test
    void terminalStatuses() {
        assertTrue(TaskStatus.SUCCESS.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertTrue(TaskStatus.CANCELLED.isTerminal());
        assertTrue(TaskStatus.TIMEOUT.isTerminal());
        assertFalse(TaskStatus.QUEUED.isTerminal());
        assertFalse(TaskStatus.PROCESSING.isTerminal());

        assertTrue(TaskStatus.isTerminalValue("cancelled"));
        assertFalse(TaskStatus.isTerminalValue("rendering"));
        assertFalse(TaskStatus.isTerminalValue(null));
    }
}
