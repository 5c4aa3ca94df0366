package com.openforge.fleetcore.research;

public enum RunStatus {

    PENDING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
