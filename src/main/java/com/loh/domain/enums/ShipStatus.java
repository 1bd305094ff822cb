package com.loh.domain.enums;

public enum ShipStatus {
    ACTIVE,
    DESTROYED
}
