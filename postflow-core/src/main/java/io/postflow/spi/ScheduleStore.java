package io.postflow.spi;

import io.postflow.model.Schedule;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for schedules.
 */
public interface ScheduleStore {

    /**
     * Lists active, not completed schedules due at {@code now} that have no publications yet.
     */
    List<Schedule> findDue(Connection conn, Instant now, int limit);

    Optional<Schedule> findById(Connection conn, String scheduleId);

    /**
     * Marks the schedule completed when {@code expectedPublications} publications exist and
     * all of them are terminal. Safe to call repeatedly and concurrently.
     *
     * @return 1 if the flag flipped, 0 otherwise
     */
    int refreshCompletion(Connection conn, String scheduleId, int expectedPublications, Instant now);

    void insert(Connection conn, Schedule schedule);

    /**
     * Activates or cancels a schedule. Attempts already claimed run to completion.
     */
    int setActive(Connection conn, String scheduleId, boolean active, Instant now);
}
