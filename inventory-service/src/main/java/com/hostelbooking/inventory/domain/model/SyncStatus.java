package com.hostelbooking.inventory.domain.model;

public enum SyncStatus {
    NEVER,
    SUCCESS,
    PARTIAL,
    FAILED
}
