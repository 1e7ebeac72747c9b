package com.bbthechange.rehearsalsync.service;

import com.bbthechange.rehearsalsync.model.DeviceCalendar;

import java.util.List;
import java.util.Optional;

public interface CalendarManagementService {

    /**
     * Calendars the app may write to. Empty when calendar access is not granted.
     */
    List<DeviceCalendar> listWritableCalendars();

    /**
     * The primary writable calendar, else the first writable one.
     */
    Optional<DeviceCalendar> getDefaultCalendar();
}
