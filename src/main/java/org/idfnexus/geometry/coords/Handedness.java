package org.idfnexus.geometry.coords;

import java.util.Locale;

/**
 * IDF 参考坐标系的手性（只识别左手/右手）。
 */
public enum Handedness {
    RIGHT,
    LEFT;

    public static Handedness parse(String value) {
        if (value == null || value.isBlank()) {
            return RIGHT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "right" -> RIGHT;
            case "left" -> LEFT;
            default -> throw new IllegalArgumentException("未知的 handedness：" + value);
        };
    }
}
