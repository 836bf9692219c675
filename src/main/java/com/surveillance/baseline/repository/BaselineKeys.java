package com.surveillance.baseline.repository;

/**
 * User-key layout and slot validation shared by the baseline sets.
 *
 * Keys are deterministic, so every row of a camera can be addressed without a scan:
 * 24 x 7 activity slots, and one class index record per hour.
 *
 * Camera ids and class labels are free text and may contain the separator, so each
 * of them is written as {@code <length>#<text>}. Two different slots never share a key.
 */
public final class BaselineKeys {

    public static final int HOURS_PER_DAY = 24;
    public static final int DAYS_PER_WEEK = 7;

    private BaselineKeys() {}

    public static String activityKey(String cameraId, int hour, int dayOfWeek) {
        return component(cameraId) + ":" + hour + ":" + dayOfWeek;
    }

    public static String classKey(String cameraId, int hour, String detectionClass) {
        return component(cameraId) + ":" + hour + ":" + component(detectionClass);
    }

    public static String classIndexKey(String cameraId, int hour) {
        return component(cameraId) + ":" + hour;
    }

    private static String component(String text) {
        return text.length() + "#" + text;
    }

    public static String requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    public static int requireHour(int hour) {
        if (hour < 0 || hour >= HOURS_PER_DAY) {
            throw new IllegalArgumentException("hour must be within 0-23, got " + hour);
        }
        return hour;
    }

    public static int requireDayOfWeek(int dayOfWeek) {
        if (dayOfWeek < 0 || dayOfWeek >= DAYS_PER_WEEK) {
            throw new IllegalArgumentException("dayOfWeek must be within 0-6, got " + dayOfWeek);
        }
        return dayOfWeek;
    }
}
