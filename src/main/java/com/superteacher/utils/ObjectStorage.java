package com.superteacher.utils;

import java.io.IOException;
import java.net.URI;

/**
 * Durable place for uploaded image bytes, so the vision service can be given
 * a reference instead of the bytes themselves.
 */
public interface ObjectStorage {

    URI store(String fileName, byte[] bytes) throws IOException;
}
