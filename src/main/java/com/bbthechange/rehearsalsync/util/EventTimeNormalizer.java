package com.bbthechange.rehearsalsync.util;

import com.bbthechange.rehearsalsync.model.DeviceCalendarEvent;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Converts calendar event times to the instants stored on availability slots.
 * <p>
 * All-day events are pinned to their local calendar date: 00:00:00.000 to 23:59:59.999 UTC,
 * so a one-day event never spills into a second day when read in another time zone.
 * Timed events keep their instants.
 */
public class EventTimeNormalizer {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    private final ZoneId deviceZone;

    public EventTimeNormalizer(ZoneId deviceZone) {
        this.deviceZone = deviceZone;
    }

    public SlotTimes normalize(DeviceCalendarEvent event) {
        if (event.isAllDay()) {
            LocalDate date = LocalDate.ofInstant(event.getStartDate(), deviceZone);
            return new SlotTimes(
                date.atStartOfDay().toInstant(ZoneOffset.UTC),
                date.atTime(END_OF_DAY).toInstant(ZoneOffset.UTC));
        }
        return new SlotTimes(event.getStartDate(), event.getEndDate());
    }

    /**
     * UTC midnight of the local date containing {@code instant}, the form all-day slots are stored in.
     */
    public Instant allDayStartOf(Instant instant) {
        return LocalDate.ofInstant(instant, deviceZone).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    public record SlotTimes(Instant startsAt, Instant endsAt) {
    }
}
