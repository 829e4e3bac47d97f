package com.frontline.core.domain.influence;

public enum EventPriority {
    HIGH,
    NORMAL,
    LOW
}
