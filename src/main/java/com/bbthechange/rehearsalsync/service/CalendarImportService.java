package com.bbthechange.rehearsalsync.service;

import com.bbthechange.rehearsalsync.dto.ImportResult;
import com.bbthechange.rehearsalsync.util.ProgressListener;

import java.util.Collection;

/**
 * Reconciles backend availability with events in the device calendars.
 */
public interface CalendarImportService {

    /**
     * Add, update and delete imported slots so they match the given calendars.
     * Only a missing permission or a failed slot fetch is thrown; apply failures are counted.
     */
    ImportResult reconcile(Collection<String> calendarIds, ProgressListener progress);

    /**
     * Delete every imported slot from the backend, then forget the import tracking.
     * Tracking is kept when the backend call fails.
     */
    ImportResult removeAll(ProgressListener progress);
}
