package org.netpreserve.sweeper.parse;

import org.junit.jupiter.api.Test;
import org.netpreserve.sweeper.util.Url;

import static org.junit.jupiter.api.Assertions.*;

class ItemKeyTest {
    @Test
    public void keyFromItemUrl() {
        var key = ItemKey.fromUrl(new Url("https://www.tiktok.com/@some.one/video/7312345678901234567?is_from_webapp=1"));
        assertEquals(new ItemKey("some.one", "video", "7312345678901234567"), key);
    }

    @Test
    public void sameItemSameKey() {
        var a = ItemKey.fromUrl(new Url("https://WWW.TikTok.com/@user/photo/123/"));
        var b = ItemKey.fromUrl(new Url("https://www.tiktok.com/@user/photo/123#comments"));
        assertEquals(a, b);
    }

    @Test
    public void rejectsOtherUrls() {
        assertThrows(IllegalArgumentException.class, () -> ItemKey.fromUrl(new Url("https://www.tiktok.com/@user")));
        assertThrows(IllegalArgumentException.class,
                () -> ItemKey.fromUrl(new Url("https://www.tiktok.com/@user/video/abc")));
        assertThrows(IllegalArgumentException.class,
                () -> ItemKey.fromUrl(new Url("https://www.tiktok.com/music/some-song-123")));
    }

    @Test
    public void audioCreditSplitsOnLastSeparator() {
        assertEquals(new AudioCredit("Song - Remix", "Artist"), AudioCredit.parse("Song - Remix - Artist"));
        assertEquals(new AudioCredit("original sound", null), AudioCredit.parse(" original sound "));
        assertNull(AudioCredit.parse(""));
    }

    @Test
    public void thumbnailEssence() {
        assertEquals("abc123", Thumbnails.essence(
                "https://p16-sign.example.com/tos-alisg-p-0037/abc123~tplv-photomode-zoomcover:720:720.jpeg?x-expires=1"));
        assertEquals("abc123", Thumbnails.essence("https://cdn.example.com/obj/abc123.webp"));
        assertEquals("abc123", Thumbnails.essence("abc123"));
        assertNull(Thumbnails.essence(null));
    }
}
