package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.client.DeviceCalendarClient;
import com.bbthechange.rehearsalsync.exception.CalendarPermissionException;
import com.bbthechange.rehearsalsync.service.CalendarPermissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class CalendarPermissionServiceImpl implements CalendarPermissionService {

    private static final Logger logger = LoggerFactory.getLogger(CalendarPermissionServiceImpl.class);

    private final DeviceCalendarClient deviceCalendarClient;

    @Autowired
    public CalendarPermissionServiceImpl(DeviceCalendarClient deviceCalendarClient) {
        this.deviceCalendarClient = deviceCalendarClient;
    }

    @Override
    public boolean hasPermission() {
        try {
            return deviceCalendarClient.hasPermission();
        } catch (Exception e) {
            logger.warn("Could not check calendar permission, treating as not granted", e);
            return false;
        }
    }

    @Override
    public boolean requestPermission() {
        try {
            boolean granted = deviceCalendarClient.requestPermission();
            logger.info("Calendar permission request {}", granted ? "granted" : "denied");
            return granted;
        } catch (Exception e) {
            logger.warn("Calendar permission request failed, treating as not granted", e);
            return false;
        }
    }

    @Override
    public void requirePermission() {
        if (!hasPermission()) {
            throw new CalendarPermissionException();
        }
    }
}
