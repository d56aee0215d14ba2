package com.linlay.reasoningrelay.relay;

public enum RelayState {
    INIT,
    RUNNING,
    DRAINING,
    DONE,
    TIMEOUT;

    public boolean isTerminal() {
        return this == DONE || this == TIMEOUT;
    }
}
