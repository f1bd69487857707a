package io.postflow.demo;

import io.postflow.event.PublicationEvent;
import io.postflow.model.PostContent;
import io.postflow.spi.MediaStore;
import io.postflow.spi.NotificationSink;
import io.postflow.spi.PostStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.net.URI;
import java.util.Arrays;
import java.util.List;

/**
 * Content collaborators backed by the application's {@code posts} and {@code media_files}
 * tables.
 */
@Configuration
public class ContentStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ContentStoreConfiguration.class);

    @Bean
    public PostStore postStore(JdbcTemplate jdbcTemplate) {
        return postId -> jdbcTemplate.query(
                "SELECT content, media_refs, link_url FROM posts WHERE id = ?",
                (rs, rowNum) -> new PostContent(rs.getString("content"), mediaRefs(rs.getString("media_refs")),
                        rs.getString("link_url")),
                postId).stream().findFirst();
    }

    @Bean
    public MediaStore mediaStore(JdbcTemplate jdbcTemplate) {
        return mediaRef -> {
            List<String> urls = jdbcTemplate.queryForList(
                    "SELECT s3_url FROM media_files WHERE id = ?", String.class, mediaRef);
            if (urls.isEmpty()) {
                throw new IllegalArgumentException("Unknown media file: " + mediaRef);
            }
            return URI.create(urls.get(0));
        };
    }

    @Bean
    public NotificationSink notificationSink() {
        return event -> {
            if (event.outcome() == PublicationEvent.Outcome.PUBLISHED) {
                log.info("[Published] schedule={} platform={} remotePostId={}",
                        event.scheduleId(), event.platform().tag(), event.remotePostId());
            } else {
                log.warn("[Failed] schedule={} platform={} kind={} attempts={} error={}",
                        event.scheduleId(), event.platform().tag(), event.errorKind(),
                        event.attemptCount(), event.errorMessage());
            }
        };
    }

    private static List<String> mediaRefs(String column) {
        if (column == null || column.isBlank()) {
            return List.of();
        }
        return Arrays.stream(column.split(","))
                .map(String::trim)
                .filter(ref -> !ref.isEmpty())
                .toList();
    }
}
