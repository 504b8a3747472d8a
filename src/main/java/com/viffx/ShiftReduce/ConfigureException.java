package com.viffx.ShiftReduce;

/**
 * Thrown for command line settings that are missing, malformed or contradict each other.
 */
public class ConfigureException extends Exception {
    public ConfigureException(String message) {
        super(message);
    }

    public ConfigureException(String message, Throwable cause) {
        super(message, cause);
    }
}
