package com.sldce.backend.enums;

public enum AuditEventStatus {
    SUCCESS,
    FAILURE
}
