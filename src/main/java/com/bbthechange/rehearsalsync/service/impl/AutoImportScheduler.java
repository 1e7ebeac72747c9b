package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.model.AutoSyncDecision;
import com.bbthechange.rehearsalsync.service.AutoImportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic import trigger for hosts that never report foreground transitions.
 * Applies the same interval policy as a foreground trigger.
 * Runs when calendar-sync.auto-import.scheduler-enabled=true.
 */
@Service
@ConditionalOnProperty(name = "calendar-sync.auto-import.scheduler-enabled", havingValue = "true")
public class AutoImportScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AutoImportScheduler.class);

    private final AutoImportService autoImportService;

    public AutoImportScheduler(AutoImportService autoImportService) {
        this.autoImportService = autoImportService;
    }

    @Scheduled(fixedDelayString = "${calendar-sync.auto-import.check-interval:PT5M}",
               initialDelayString = "${calendar-sync.auto-import.check-interval:PT5M}")
    public void checkImport() {
        AutoSyncDecision decision = autoImportService.performAutoSync();
        logger.debug("Scheduled import check: {}", decision);
    }
}
