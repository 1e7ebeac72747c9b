package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.client.DeviceCalendarClient;
import com.bbthechange.rehearsalsync.exception.CalendarPermissionException;
import com.bbthechange.rehearsalsync.model.DeviceCalendar;
import com.bbthechange.rehearsalsync.service.CalendarManagementService;
import com.bbthechange.rehearsalsync.service.CalendarPermissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class CalendarManagementServiceImpl implements CalendarManagementService {

    private static final Logger logger = LoggerFactory.getLogger(CalendarManagementServiceImpl.class);

    private final DeviceCalendarClient deviceCalendarClient;
    private final CalendarPermissionService permissionService;

    @Autowired
    public CalendarManagementServiceImpl(DeviceCalendarClient deviceCalendarClient,
                                         CalendarPermissionService permissionService) {
        this.deviceCalendarClient = deviceCalendarClient;
        this.permissionService = permissionService;
    }

    @Override
    public List<DeviceCalendar> listWritableCalendars() {
        if (!permissionService.hasPermission()) {
            logger.debug("No calendar permission, returning no calendars");
            return List.of();
        }
        try {
            return deviceCalendarClient.listCalendars().stream()
                .filter(DeviceCalendar::isWritable)
                .collect(Collectors.toList());
        } catch (CalendarPermissionException e) {
            logger.warn("Calendar permission revoked while listing calendars");
            return List.of();
        }
    }

    @Override
    public Optional<DeviceCalendar> getDefaultCalendar() {
        List<DeviceCalendar> calendars = listWritableCalendars();
        return calendars.stream()
            .filter(DeviceCalendar::isPrimary)
            .findFirst()
            .or(() -> calendars.stream().findFirst());
    }
}
