package com.medtracker.auth.enums;

/**
 * Channel a caller identity was established through.
 */
public enum AuthSurface {
    SESSION,
    TOKEN
}
