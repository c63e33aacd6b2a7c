package com.superteacher.models;

import java.net.URI;
import java.util.Objects;

/**
 * An uploaded image, either as raw bytes, as a reference the vision service
 * can fetch, or both once the bytes have been stored.
 */
public final class ImageSource {
    private final String fileName;
    private final byte[] bytes;
    private final URI uri;

    private ImageSource(String fileName, byte[] bytes, URI uri) {
        if (bytes == null && uri == null) {
            throw new IllegalArgumentException("an image needs bytes or a URI");
        }
        this.fileName = fileName;
        this.bytes = bytes;
        this.uri = uri;
    }

    public static ImageSource ofBytes(String fileName, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new ImageSource(fileName, bytes.clone(), null);
    }

    public static ImageSource ofUri(String uri) {
        return new ImageSource(null, null, URI.create(uri.trim()));
    }

    public ImageSource withUri(URI storedAt) {
        return new ImageSource(fileName, bytes, storedAt);
    }

    public String getFileName() {
        return fileName;
    }

    public boolean hasBytes() {
        return bytes != null;
    }

    public byte[] getBytes() {
        return bytes == null ? null : bytes.clone();
    }

    public URI getUri() {
        return uri;
    }

    /**
     * Text used by offline collaborators to pick canned output: the file name
     * if known, otherwise the URI.
     */
    public String hint() {
        if (fileName != null && !fileName.isBlank()) {
            return fileName;
        }
        return uri == null ? "" : uri.toString();
    }

    @Override
    public String toString() {
        return "ImageSource{" + hint() + (bytes != null ? ", " + bytes.length + " bytes" : "") + '}';
    }
}
