package com.medtracker.auth.enums;

/**
 * Security audit event types.
 */
public enum AuditEventType {
    LOGIN_SUCCESS("auth.login.success"),
    LOGIN_FAILURE("auth.login.failure"),
    LOCKOUT_TRIGGER("auth.lockout.trigger"),
    LOGOUT("auth.logout"),
    REGISTER_SUCCESS("auth.register.success"),
    REGISTER_FAILURE("auth.register.failure"),
    DEMO_START("auth.demo.start");

    private final String code;

    AuditEventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
