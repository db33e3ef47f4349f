package com.changesentinel.core.model;

public enum MonitorMode {
    PAGE,
    LIST
}
