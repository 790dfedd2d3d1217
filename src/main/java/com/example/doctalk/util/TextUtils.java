package com.example.doctalk.util;

import com.example.doctalk.model.ChatMessage;

import java.util.List;

public final class TextUtils {

    private static final String ELLIPSIS = "...";

    private TextUtils() {
    }

    /**
     * Last {@code max} messages, oldest first.
     */
    public static List<ChatMessage> recent(List<ChatMessage> messages, int max) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        int size = messages.size();
        int startIdx = Math.max(0, size - max);
        return List.copyOf(messages.subList(startIdx, size));
    }

    /**
     * Single-line preview of at most {@code maxLength} characters, ellipsis included.
     */
    public static String preview(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").trim();
        if (flat.length() <= maxLength) {
            return flat;
        }
        int cut = Math.max(0, maxLength - ELLIPSIS.length());
        return flat.substring(0, cut) + ELLIPSIS;
    }

    /**
     * For log lines.
     */
    public static String truncate(String s, int maxLen) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + ELLIPSIS;
    }
}
