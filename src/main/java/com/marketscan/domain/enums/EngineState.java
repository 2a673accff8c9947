package com.marketscan.domain.enums;

public enum EngineState {
    STOPPED,
    RUNNING,
    STOPPING
}
