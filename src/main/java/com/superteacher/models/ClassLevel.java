package com.superteacher.models;

import java.util.Optional;

/**
 * CBSE class levels the assistant grades for
 */
public enum ClassLevel {
    CLASS_6(6),
    CLASS_7(7),
    CLASS_8(8),
    CLASS_9(9),
    CLASS_10(10),
    CLASS_11(11),
    CLASS_12(12);

    private final int number;

    ClassLevel(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public String getDisplayName() {
        return "Class " + number;
    }

    public static Optional<ClassLevel> fromNumber(int number) {
        for (ClassLevel level : values()) {
            if (level.number == number) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
