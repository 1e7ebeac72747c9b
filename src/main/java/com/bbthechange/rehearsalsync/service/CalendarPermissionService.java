package com.bbthechange.rehearsalsync.service;

/**
 * Gate for device calendar access. Any failure to determine access counts as not granted.
 */
public interface CalendarPermissionService {

    boolean hasPermission();

    boolean requestPermission();

    /**
     * @throws com.bbthechange.rehearsalsync.exception.CalendarPermissionException if access is not granted
     */
    void requirePermission();
}
