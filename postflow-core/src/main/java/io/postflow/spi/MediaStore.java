package io.postflow.spi;

import java.net.URI;

/**
 * Resolves an opaque media reference into a URL a platform can fetch.
 */
@FunctionalInterface
public interface MediaStore {

    URI resolveUrl(String mediaRef);
}
