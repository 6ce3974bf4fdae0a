package com.signal.model;

public enum SignalStatus {
    PENDING,
    WIN,
    LOSS
}
