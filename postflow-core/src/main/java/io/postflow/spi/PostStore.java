package io.postflow.spi;

import io.postflow.model.PostContent;

import java.util.Optional;

/**
 * Read-only access to post content owned by the authoring side of the system.
 */
@FunctionalInterface
public interface PostStore {

    /**
     * @return the post content, or empty if the post no longer exists
     */
    Optional<PostContent> getContent(String postId);
}
