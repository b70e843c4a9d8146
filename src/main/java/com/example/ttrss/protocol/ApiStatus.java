package com.example.ttrss.protocol;

/**
 * Envelope-level status. The server sends 0 for OK; every other value is treated as an error.
 */
public enum ApiStatus {
    OK(0),
    ERROR(1);

    private final int wireValue;

    ApiStatus(int wireValue) {
        this.wireValue = wireValue;
    }

    public static ApiStatus fromWire(int value) {
        return value == OK.wireValue ? OK : ERROR;
    }
}
