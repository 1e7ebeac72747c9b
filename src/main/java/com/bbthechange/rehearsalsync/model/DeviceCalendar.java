package com.bbthechange.rehearsalsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A calendar as reported by the device.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceCalendar {

    private String id;
    private String title;
    private boolean writable;
    private boolean primary;
}
