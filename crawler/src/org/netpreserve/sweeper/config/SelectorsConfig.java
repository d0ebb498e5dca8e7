package org.netpreserve.sweeper.config;

import org.netpreserve.sweeper.browser.SelectorSpec;
import org.netpreserve.sweeper.util.Url;

import java.util.List;

/**
 * Where to find things on the target site. Selectors are written as {@code "css"} to read an element's text or
 * {@code "css @attribute"} to read an attribute. Item-level selectors are relative to the listing tile or comment
 * they belong to.
 *
 * @param baseUrl             site root
 * @param targetPath          path of a target's listing page, {@code {username}} is replaced
 * @param listingReady        present once a listing has rendered
 * @param listingItem         one tile per item on the listing
 * @param itemLink            item link within a tile
 * @param itemThumbnail       thumbnail image within a tile
 * @param itemAlt             thumbnail alternative text within a tile
 * @param itemCount           light count (e.g. plays) within a tile
 * @param errorTitle          heading of the site's error panel
 * @param targetMissingTexts  error headings meaning the target is gone or private
 * @param itemMissingTexts    error headings meaning the item is gone
 * @param displayName         target display name on the listing
 * @param followers           target follower count on the listing
 * @param detailReady         present once a detail page has rendered
 * @param title               item title or description
 * @param published           publication date text
 * @param publishedSeparator  separator in front of the date within the publication text
 * @param audio               audio attribution
 * @param likeCount           like count
 * @param commentCount        comment count
 * @param collectCount        bookmark count
 * @param comment             one element per top-level comment
 * @param commentAuthor       comment author within a comment
 * @param commentText         comment body within a comment
 * @param commentLikes        comment like count within a comment
 * @param maxComments         upper bound on comments read from a detail page
 * @param closeDetail         button that closes a detail overlay and returns to the listing
 * @param loggedIn            present only when the browser profile is logged in
 */
public record SelectorsConfig(
        Url baseUrl,
        String targetPath,
        SelectorSpec listingReady,
        SelectorSpec listingItem,
        SelectorSpec itemLink,
        SelectorSpec itemThumbnail,
        SelectorSpec itemAlt,
        SelectorSpec itemCount,
        SelectorSpec errorTitle,
        List<String> targetMissingTexts,
        List<String> itemMissingTexts,
        SelectorSpec displayName,
        SelectorSpec followers,
        SelectorSpec detailReady,
        SelectorSpec title,
        SelectorSpec published,
        String publishedSeparator,
        SelectorSpec audio,
        SelectorSpec likeCount,
        SelectorSpec commentCount,
        SelectorSpec collectCount,
        SelectorSpec comment,
        SelectorSpec commentAuthor,
        SelectorSpec commentText,
        SelectorSpec commentLikes,
        int maxComments,
        SelectorSpec closeDetail,
        SelectorSpec loggedIn
) {
    public Url targetUrl(String username) {
        return baseUrl.withPath(targetPath.replace("{username}", username));
    }
}
