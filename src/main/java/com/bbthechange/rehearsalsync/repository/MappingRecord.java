package com.bbthechange.rehearsalsync.repository;

/**
 * The independently keyed records kept by the mapping store.
 */
public enum MappingRecord {
    EXPORT_MAPPINGS("export-mappings"),
    IMPORT_TRACKING("import-tracking"),
    SYNC_SETTINGS("sync-settings");

    private final String storeName;

    MappingRecord(String storeName) {
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }
}
