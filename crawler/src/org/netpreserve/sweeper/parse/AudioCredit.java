package org.netpreserve.sweeper.parse;

import org.jetbrains.annotations.Nullable;

/**
 * Audio attribution shown on a detail page, "title - author". Titles may themselves contain " - " so the author
 * is whatever follows the last separator.
 */
public record AudioCredit(String title, @Nullable String author) {
    private static final String SEPARATOR = " - ";

    public static @Nullable AudioCredit parse(@Nullable String text) {
        if (text == null || text.isBlank()) return null;
        String trimmed = text.strip();
        int i = trimmed.lastIndexOf(SEPARATOR);
        if (i < 0) return new AudioCredit(trimmed, null);
        String author = trimmed.substring(i + SEPARATOR.length()).strip();
        return new AudioCredit(trimmed.substring(0, i).strip(), author.isEmpty() ? null : author);
    }
}
