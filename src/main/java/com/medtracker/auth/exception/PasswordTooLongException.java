package com.medtracker.auth.exception;

/**
 * Password exceeds the 72 byte input ceiling of BCrypt.
 */
public class PasswordTooLongException extends RuntimeException {

    public PasswordTooLongException(int byteLength) {
        super("Password is " + byteLength + " bytes, maximum is 72");
    }
}
