package org.example.modelgen.entity;

public enum JobState {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    DISCARDED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == DISCARDED;
    }
}
