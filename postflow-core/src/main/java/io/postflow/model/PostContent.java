package io.postflow.model;

import java.util.List;

/**
 * Post content as returned by the content store. Media are opaque references that the
 * media store resolves to fetchable URLs.
 */
public record PostContent(String text, List<String> mediaRefs, String linkPreview) {
  public PostContent {
    text = text == null ? "" : text;
    mediaRefs = mediaRefs == null ? List.of() : List.copyOf(mediaRefs);
  }
}
