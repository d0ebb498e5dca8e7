package org.netpreserve.sweeper.parse;

import org.netpreserve.sweeper.util.Url;

/**
 * Identity of an item as encoded in its canonical URL, e.g. {@code https://host/@owner/video/7312345678901234567}.
 *
 * @param owner  username the URL is filed under
 * @param kind   item kind ("video", "photo")
 * @param itemId numeric item id, unique within the owner
 */
public record ItemKey(String owner, String kind, String itemId) {

    /**
     * @throws IllegalArgumentException if the URL isn't an item URL
     */
    public static ItemKey fromUrl(Url url) {
        var segments = url.canonical().pathSegments();
        if (segments.size() != 3 || !segments.get(0).startsWith("@") || segments.get(0).length() < 2) {
            throw new IllegalArgumentException("Not an item URL: " + url);
        }
        String itemId = segments.get(2);
        if (!itemId.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Item URL has non-numeric id: " + url);
        }
        return new ItemKey(segments.get(0).substring(1), segments.get(1), itemId);
    }
}
