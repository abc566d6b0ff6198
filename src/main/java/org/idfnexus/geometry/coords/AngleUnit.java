package org.idfnexus.geometry.coords;

import java.util.Locale;

/**
 * IDF {@code <defaults><angle unit="..."/>} 声明的角度单位。
 */
public enum AngleUnit {
    DEGREE,
    RADIAN;

    public static AngleUnit parse(String value) {
        if (value == null || value.isBlank()) {
            return DEGREE;
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("rad")) {
            return RADIAN;
        }
        if (lower.startsWith("deg")) {
            return DEGREE;
        }
        throw new IllegalArgumentException("未知的角度单位：" + value);
    }

    public double toRadians(double angle) {
        return this == DEGREE ? Math.toRadians(angle) : angle;
    }

    public double toDegrees(double angle) {
        return this == DEGREE ? angle : Math.toDegrees(angle);
    }
}
