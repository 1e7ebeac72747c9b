package com.bbthechange.rehearsalsync.config;

import com.bbthechange.rehearsalsync.model.SlotSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "calendar-sync")
public class CalendarSyncProperties {

    public enum StoreType {
        DYNAMODB, MEMORY
    }

    private int exportBatchSize = 10;

    private int importChunkSize = 50;

    private int importWindowDays = 365;

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration throttleWindow = Duration.ofSeconds(5);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration duplicateTolerance = Duration.ofSeconds(60);

    @DurationUnit(ChronoUnit.DAYS)
    private Duration duplicateSearchWindow = Duration.ofDays(1);

    private int reminderMinutesBefore = 30;

    private String eventTitlePrefix = "Rehearsal: ";

    private String defaultImportTitle = "Calendar Event";

    private SlotSource importSource = SlotSource.APPLE_CALENDAR;

    private int executorThreads = 10;

    private StoreType mappingStore = StoreType.DYNAMODB;

    private String tableName = "RehearsalSyncTable";

    private String storeNamespace = "default";

    private final AutoImport autoImport = new AutoImport();

    public static class AutoImport {

        private boolean schedulerEnabled = false;

        private Duration checkInterval = Duration.ofMinutes(5);

        public boolean isSchedulerEnabled() {
            return schedulerEnabled;
        }

        public void setSchedulerEnabled(boolean schedulerEnabled) {
            this.schedulerEnabled = schedulerEnabled;
        }

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }
    }

    public int getExportBatchSize() {
        return exportBatchSize;
    }

    public void setExportBatchSize(int exportBatchSize) {
        this.exportBatchSize = exportBatchSize;
    }

    public int getImportChunkSize() {
        return importChunkSize;
    }

    public void setImportChunkSize(int importChunkSize) {
        this.importChunkSize = importChunkSize;
    }

    public int getImportWindowDays() {
        return importWindowDays;
    }

    public void setImportWindowDays(int importWindowDays) {
        this.importWindowDays = importWindowDays;
    }

    public Duration getThrottleWindow() {
        return throttleWindow;
    }

    public void setThrottleWindow(Duration throttleWindow) {
        this.throttleWindow = throttleWindow;
    }

    public Duration getDuplicateTolerance() {
        return duplicateTolerance;
    }

    public void setDuplicateTolerance(Duration duplicateTolerance) {
        this.duplicateTolerance = duplicateTolerance;
    }

    public Duration getDuplicateSearchWindow() {
        return duplicateSearchWindow;
    }

    public void setDuplicateSearchWindow(Duration duplicateSearchWindow) {
        this.duplicateSearchWindow = duplicateSearchWindow;
    }

    public int getReminderMinutesBefore() {
        return reminderMinutesBefore;
    }

    public void setReminderMinutesBefore(int reminderMinutesBefore) {
        this.reminderMinutesBefore = reminderMinutesBefore;
    }

    public String getEventTitlePrefix() {
        return eventTitlePrefix;
    }

    public void setEventTitlePrefix(String eventTitlePrefix) {
        this.eventTitlePrefix = eventTitlePrefix;
    }

    public String getDefaultImportTitle() {
        return defaultImportTitle;
    }

    public void setDefaultImportTitle(String defaultImportTitle) {
        this.defaultImportTitle = defaultImportTitle;
    }

    public SlotSource getImportSource() {
        return importSource;
    }

    public void setImportSource(SlotSource importSource) {
        this.importSource = importSource;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public StoreType getMappingStore() {
        return mappingStore;
    }

    public void setMappingStore(StoreType mappingStore) {
        this.mappingStore = mappingStore;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getStoreNamespace() {
        return storeNamespace;
    }

    public void setStoreNamespace(String storeNamespace) {
        this.storeNamespace = storeNamespace;
    }

    public AutoImport getAutoImport() {
        return autoImport;
    }
}
