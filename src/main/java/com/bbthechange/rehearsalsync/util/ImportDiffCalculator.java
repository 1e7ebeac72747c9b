package com.bbthechange.rehearsalsync.util;

import com.bbthechange.rehearsalsync.dto.ImportPlan;
import com.bbthechange.rehearsalsync.dto.SlotUpdate;
import com.bbthechange.rehearsalsync.model.AvailabilitySlot;
import com.bbthechange.rehearsalsync.model.DeviceCalendarEvent;
import com.bbthechange.rehearsalsync.model.SlotSource;
import com.bbthechange.rehearsalsync.model.SlotType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Three-way diff between device calendar events, backend slots and exported event IDs.
 * <p>
 * Only backend slots owned by calendar import take part, and only when they start inside the
 * import window or belong to an event that was read from the calendar.
 * Calendar events that are exported rehearsals never become slots and are counted as skipped.
 */
public class ImportDiffCalculator {

    private static final Logger logger = LoggerFactory.getLogger(ImportDiffCalculator.class);

    private final EventTimeNormalizer timeNormalizer;
    private final String defaultTitle;
    private final SlotSource importSource;

    public ImportDiffCalculator(EventTimeNormalizer timeNormalizer, String defaultTitle, SlotSource importSource) {
        this.timeNormalizer = timeNormalizer;
        this.defaultTitle = defaultTitle;
        this.importSource = importSource;
    }

    public ImportPlan calculate(Collection<DeviceCalendarEvent> events,
                                Collection<AvailabilitySlot> slots,
                                Set<String> exportedEventIds,
                                Instant windowStart,
                                Instant windowEnd) {
        int skipped = 0;
        Map<String, DeviceCalendarEvent> calendarEvents = new LinkedHashMap<>();
        Map<String, DeviceCalendarEvent> seen = new LinkedHashMap<>();
        for (DeviceCalendarEvent event : events) {
            if (seen.putIfAbsent(event.getId(), event) != null) {
                continue;
            }
            if (exportedEventIds.contains(event.getId())) {
                logger.debug("Skipping exported rehearsal event {}", event.getId());
                skipped++;
                continue;
            }
            calendarEvents.put(event.getId(), event);
        }

        // All-day slots are stored at UTC midnight of their local date, so their window is by date too
        Instant allDayStart = timeNormalizer.allDayStartOf(windowStart);
        Instant allDayEnd = timeNormalizer.allDayStartOf(windowEnd);
        Map<String, AvailabilitySlot> backendSlots = new LinkedHashMap<>();
        for (AvailabilitySlot slot : slots) {
            if (!slot.isImportOwned()) {
                continue;
            }
            boolean visible = seen.containsKey(slot.getExternalEventId())
                || (slot.isAllDay()
                    ? inWindow(slot.getStartsAt(), allDayStart, allDayEnd)
                    : inWindow(slot.getStartsAt(), windowStart, windowEnd));
            if (visible) {
                backendSlots.putIfAbsent(slot.getExternalEventId(), slot);
            }
        }

        List<String> toDelete = new ArrayList<>();
        for (String externalEventId : backendSlots.keySet()) {
            if (!calendarEvents.containsKey(externalEventId) && !exportedEventIds.contains(externalEventId)) {
                logger.debug("Slot for event {} no longer in calendar", externalEventId);
                toDelete.add(externalEventId);
            }
        }

        List<AvailabilitySlot> toAdd = new ArrayList<>();
        List<SlotUpdate> toUpdate = new ArrayList<>();
        for (DeviceCalendarEvent event : calendarEvents.values()) {
            EventTimeNormalizer.SlotTimes times = timeNormalizer.normalize(event);
            String title = titleOf(event);
            AvailabilitySlot existing = backendSlots.get(event.getId());

            if (existing == null) {
                toAdd.add(AvailabilitySlot.builder()
                    .startsAt(times.startsAt())
                    .endsAt(times.endsAt())
                    .type(SlotType.BUSY)
                    .source(importSource)
                    .externalEventId(event.getId())
                    .title(title)
                    .allDay(event.isAllDay())
                    .build());
            } else if (hasChanged(existing, times, title, event.isAllDay())) {
                logger.debug("Event {} changed since last import", event.getId());
                toUpdate.add(SlotUpdate.builder()
                    .externalEventId(event.getId())
                    .startsAt(times.startsAt())
                    .endsAt(times.endsAt())
                    .title(title)
                    .allDay(event.isAllDay())
                    .build());
            } else {
                skipped++;
            }
        }

        logger.info("Import diff: {} to add, {} to update, {} to delete, {} unchanged",
            toAdd.size(), toUpdate.size(), toDelete.size(), skipped);

        return new ImportPlan(toAdd, toUpdate, toDelete, skipped, calendarEvents, backendSlots);
    }

    private boolean hasChanged(AvailabilitySlot slot, EventTimeNormalizer.SlotTimes times,
                               String title, boolean allDay) {
        return !Objects.equals(slot.getStartsAt(), times.startsAt())
            || !Objects.equals(slot.getEndsAt(), times.endsAt())
            || !Objects.equals(slot.getTitle(), title)
            || slot.isAllDay() != allDay;
    }

    private String titleOf(DeviceCalendarEvent event) {
        String title = event.getTitle();
        return title == null || title.isBlank() ? defaultTitle : title;
    }

    private static boolean inWindow(Instant instant, Instant start, Instant end) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
