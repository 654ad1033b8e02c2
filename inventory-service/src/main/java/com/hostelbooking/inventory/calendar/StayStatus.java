package com.hostelbooking.inventory.calendar;

public enum StayStatus {
    CONFIRMED,
    BLOCKED,
    CANCELLED
}
