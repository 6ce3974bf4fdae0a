package com.signal.model;

public enum SignalDirection {
    CALL,
    PUT
}
