package org.netpreserve.sweeper.parse;

import org.jetbrains.annotations.Nullable;

public final class Thumbnails {
    private Thumbnails() {
    }

    /**
     * Reduces a CDN thumbnail URL to the part that stays stable across signatures and renditions:
     * {@code .../obj/abc123~tplv-noop.image?x-expires=...} becomes {@code abc123}.
     */
    public static @Nullable String essence(@Nullable String url) {
        if (url == null || url.isBlank()) return null;
        String s = url.strip();
        int cut = s.indexOf('?');
        if (cut >= 0) s = s.substring(0, cut);
        cut = s.indexOf('#');
        if (cut >= 0) s = s.substring(0, cut);
        s = s.substring(s.lastIndexOf('/') + 1);
        cut = s.indexOf('~');
        if (cut >= 0) s = s.substring(0, cut);
        cut = s.lastIndexOf('.');
        if (cut > 0) s = s.substring(0, cut);
        return s.isEmpty() ? null : s;
    }
}
