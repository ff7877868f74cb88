package de.bsommerfeld.lexicon.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MediaDataTest {

    @Test
    void constructor_shouldCopyContent() {
        byte[] bytes = { 1, 2, 3 };
        MediaData media = new MediaData("D", "a.png", "image/png", 1, 1, bytes);

        bytes[0] = 9;

        assertArrayEquals(new byte[] { 1, 2, 3 }, media.content());
    }

    @Test
    void content_shouldReturnCopy() {
        MediaData media = new MediaData("D", "a.png", "image/png", 1, 1, new byte[] { 1, 2, 3 });

        media.content()[0] = 9;

        assertEquals(1, media.content()[0]);
    }

    @Test
    void equals_shouldCompareBytes() {
        MediaData first = new MediaData("D", "a.png", "image/png", 1, 1, new byte[] { 1, 2 });
        MediaData second = new MediaData("D", "a.png", "image/png", 1, 1, new byte[] { 1, 2 });
        MediaData other = new MediaData("D", "a.png", "image/png", 1, 1, new byte[] { 1, 3 });

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, other);
    }

    @Test
    void nullContent_shouldBeAllowed() {
        MediaData media = new MediaData("D", "a.png", "image/png", 0, 0, null);

        assertNull(media.content());
        assertEquals(media, new MediaData("D", "a.png", "image/png", 0, 0, null));
    }
}
