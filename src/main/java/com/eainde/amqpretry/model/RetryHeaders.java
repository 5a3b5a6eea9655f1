package com.eainde.amqpretry.model;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Header keys carried by a message once it has entered the retry ladder.
 * Either all three are present or none of them are.
 */
public final class RetryHeaders {

    public static final String RETRY_NUMBER = "_retryNumber";
    public static final String EXCHANGE_NAME = "_exchangeName";
    public static final String ROUTING_KEY = "_routingKey";

    private static final Pattern DIGITS = Pattern.compile("\\+?\\d+");

    private RetryHeaders() {
    }

    /**
     * Reads the number of attempts already made. The header travels as a string on the wire,
     * but numeric values are accepted too. Absent or unparsable values count as zero,
     * counts beyond the int range as {@link Integer#MAX_VALUE}.
     *
     * @param headers The message headers, may be null.
     * @return The retry number, never negative.
     */
    public static int retryNumber(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        Object value = headers.get(RETRY_NUMBER);
        if (value instanceof Number number) {
            return clamp(number.longValue());
        }
        if (value == null) {
            return 0;
        }
        String text = value.toString().trim();
        try {
            return clamp(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return DIGITS.matcher(text).matches() ? Integer.MAX_VALUE : 0;
        }
    }

    private static int clamp(long retryNumber) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0L, retryNumber));
    }

    public static String exchangeName(Map<String, Object> headers) {
        return stringHeader(headers, EXCHANGE_NAME);
    }

    public static String routingKey(Map<String, Object> headers) {
        return stringHeader(headers, ROUTING_KEY);
    }

    private static String stringHeader(Map<String, Object> headers, String key) {
        if (headers == null) {
            return null;
        }
        Object value = headers.get(key);
        return value != null ? value.toString() : null;
    }
}
