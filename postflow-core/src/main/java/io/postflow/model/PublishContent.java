package io.postflow.model;

import java.net.URI;
import java.util.List;

/**
 * Fully resolved content handed to a platform publisher.
 */
public record PublishContent(String text, List<URI> mediaUrls, String linkPreview) {
  public PublishContent {
    text = text == null ? "" : text;
    mediaUrls = mediaUrls == null ? List.of() : List.copyOf(mediaUrls);
  }

  public boolean hasMedia() {
    return !mediaUrls.isEmpty();
  }

  public boolean hasLink() {
    return linkPreview != null && !linkPreview.isBlank();
  }
}
