package com.wadechandler.notification.dispatch.schedule;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Cron-capable scheduler that fires rule schedules. Transient failures surface as
 * {@link com.wadechandler.notification.dispatch.exception.ScheduleBackendException}.
 */
public interface ScheduleBackend {

    void createSchedule(ScheduleDefinition definition);

    /**
     * Replace an existing schedule's spec, state and action; creates the schedule if it does not exist.
     */
    void updateSchedule(ScheduleDefinition definition);

    /**
     * @return false if there was no such schedule
     */
    boolean deleteSchedule(String scheduleId);

    Optional<ScheduleSnapshot> getSchedule(String scheduleId);

    /**
     * Listing entries, optionally only those of one enterprise. Calendars are not populated.
     */
    List<ScheduleSnapshot> listSchedules(UUID enterpriseId);
}
