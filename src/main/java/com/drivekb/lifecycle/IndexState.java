package com.drivekb.lifecycle;

public enum IndexState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    FAILED
}
