package com.eventfullyengineered.jstreamlistener.infrastructure;

public final class Ensure {

    private Ensure() {
        // static utility
    }

    public static boolean isNullOrEmpty(String string) {
        return string == null || string.isEmpty();
    }

    public static <T> T notNull(T t) {
        if (t == null) {
            throw new NullPointerException();
        }
        return t;
    }

    public static <T> T notNull(T t, String argumentName) {
        if (t == null) {
            throw new NullPointerException(argumentName + " should not be null.");
        }
        return t;
    }

    public static String notNullOrEmpty(String argument, String argumentName) {
        if (isNullOrEmpty(argument)) {
            throw new IllegalArgumentException(argumentName + " should not be null or empty.");
        }
        return argument;
    }

    public static void positive(long number, String argumentName) {
        if (number <= 0) {
            throw new IllegalArgumentException(argumentName + " should be positive.");
        }
    }
}
