package com.bbthechange.rehearsalsync.dto;

import com.bbthechange.rehearsalsync.model.AvailabilitySlot;
import com.bbthechange.rehearsalsync.model.DeviceCalendarEvent;

import java.util.List;
import java.util.Map;

/**
 * Changes needed to bring backend availability in line with the device calendars.
 * The three change sets are disjoint by external event ID.
 *
 * @param toAdd          slots to create, one per untracked calendar event
 * @param toUpdate       field updates for events whose slot is out of date
 * @param toDelete       external event IDs whose event left the calendar
 * @param skipped        events needing no change, including exported rehearsals seen in the calendar
 * @param calendarEvents importable calendar events by event ID
 * @param backendSlots   importable backend slots by external event ID
 */
public record ImportPlan(
        List<AvailabilitySlot> toAdd,
        List<SlotUpdate> toUpdate,
        List<String> toDelete,
        int skipped,
        Map<String, DeviceCalendarEvent> calendarEvents,
        Map<String, AvailabilitySlot> backendSlots
) {

    public boolean isEmpty() {
        return toAdd.isEmpty() && toUpdate.isEmpty() && toDelete.isEmpty();
    }

    public int changeCount() {
        return toAdd.size() + toUpdate.size() + toDelete.size();
    }
}
