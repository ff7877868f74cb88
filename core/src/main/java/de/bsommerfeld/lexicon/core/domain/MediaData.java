package de.bsommerfeld.lexicon.core.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Binary media file bundled with a dictionary. The content array is copied
 * on the way in and out, and equality compares bytes.
 *
 * @param dictionary owning dictionary title
 * @param path       archive-relative path
 * @param mediaType  MIME type
 * @param width      pixel width, 0 for non-images
 * @param height     pixel height, 0 for non-images
 * @param content    raw bytes, stored as-is
 */
public record MediaData(String dictionary, String path, String mediaType, int width, int height, byte[] content) {

    public MediaData {
        content = content == null ? null : content.clone();
    }

    @Override
    public byte[] content() {
        return content == null ? null : content.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MediaData other))
            return false;
        return width == other.width && height == other.height
                && Objects.equals(dictionary, other.dictionary)
                && Objects.equals(path, other.path)
                && Objects.equals(mediaType, other.mediaType)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(dictionary, path, mediaType, width, height) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "MediaData[dictionary=" + dictionary + ", path=" + path + ", mediaType=" + mediaType
                + ", width=" + width + ", height=" + height
                + ", content=" + (content == null ? "null" : content.length + " bytes") + "]";
    }
}
