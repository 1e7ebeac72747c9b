package com.bbthechange.rehearsalsync.repository.impl;

import com.bbthechange.rehearsalsync.exception.RepositoryException;
import com.bbthechange.rehearsalsync.model.MappingItem;
import com.bbthechange.rehearsalsync.repository.MappingRecord;
import com.bbthechange.rehearsalsync.repository.MappingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchWriteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchWriteResult;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.WriteBatch;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Mapping store on the single sync table.
 * Each record is one partition ("SYNC#namespace#record"), each entry one item keyed by sort key.
 */
public class DynamoDbMappingStore implements MappingStore {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbMappingStore.class);

    // DynamoDB limit for a single BatchWriteItem call
    static final int BATCH_DELETE_SIZE = 25;
    static final int MAX_BATCH_ATTEMPTS = 3;

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<MappingItem> table;
    private final String namespace;

    public DynamoDbMappingStore(DynamoDbEnhancedClient enhancedClient, String tableName, String namespace) {
        this.enhancedClient = enhancedClient;
        this.table = enhancedClient.table(tableName, TableSchema.fromBean(MappingItem.class));
        this.namespace = namespace;
    }

    @Override
    public Optional<String> get(MappingRecord record, String key) {
        try {
            MappingItem item = table.getItem(key(record, key));
            return Optional.ofNullable(item).map(MappingItem::getPayload);
        } catch (DynamoDbException e) {
            logger.error("Failed to read {} entry {}", record.getStoreName(), key, e);
            throw new RepositoryException("Failed to read " + record.getStoreName() + " entry", e);
        }
    }

    @Override
    public void put(MappingRecord record, String key, String value) {
        try {
            MappingItem item = new MappingItem(partitionKey(record), key, value);
            item.touch();
            table.putItem(item);
            logger.debug("Stored {} entry {}", record.getStoreName(), key);
        } catch (DynamoDbException e) {
            logger.error("Failed to store {} entry {}", record.getStoreName(), key, e);
            throw new RepositoryException("Failed to store " + record.getStoreName() + " entry", e);
        }
    }

    @Override
    public void delete(MappingRecord record, String key) {
        try {
            table.deleteItem(key(record, key));
        } catch (DynamoDbException e) {
            logger.error("Failed to delete {} entry {}", record.getStoreName(), key, e);
            throw new RepositoryException("Failed to delete " + record.getStoreName() + " entry", e);
        }
    }

    @Override
    public Map<String, String> list(MappingRecord record) {
        try {
            Map<String, String> entries = new LinkedHashMap<>();
            queryRecord(record).forEach(item -> entries.put(item.getSk(), item.getPayload()));
            return entries;
        } catch (DynamoDbException e) {
            logger.error("Failed to list {}", record.getStoreName(), e);
            throw new RepositoryException("Failed to list " + record.getStoreName(), e);
        }
    }

    @Override
    public void clear(MappingRecord record) {
        try {
            List<Key> keys = queryRecord(record).stream()
                .map(item -> Key.builder()
                    .partitionValue(item.getPk())
                    .sortValue(item.getSk())
                    .build())
                .collect(Collectors.toList());
            for (int i = 0; i < keys.size(); i += BATCH_DELETE_SIZE) {
                deleteBatch(record, keys.subList(i, Math.min(i + BATCH_DELETE_SIZE, keys.size())));
            }
            logger.info("Cleared {} {} entries", keys.size(), record.getStoreName());
        } catch (DynamoDbException e) {
            logger.error("Failed to clear {}", record.getStoreName(), e);
            throw new RepositoryException("Failed to clear " + record.getStoreName(), e);
        }
    }

    private void deleteBatch(MappingRecord record, List<Key> keys) {
        List<Key> pending = keys;
        for (int attempt = 1; attempt <= MAX_BATCH_ATTEMPTS && !pending.isEmpty(); attempt++) {
            WriteBatch.Builder<MappingItem> batchBuilder = WriteBatch.builder(MappingItem.class)
                .mappedTableResource(table);
            pending.forEach(batchBuilder::addDeleteItem);

            BatchWriteResult result = enhancedClient.batchWriteItem(BatchWriteItemEnhancedRequest.builder()
                .writeBatches(batchBuilder.build())
                .build());
            pending = result.unprocessedDeleteItemsForTable(table);
            if (!pending.isEmpty()) {
                logger.warn("{} {} deletes unprocessed after attempt {}", pending.size(), record.getStoreName(), attempt);
            }
        }
        if (!pending.isEmpty()) {
            throw new RepositoryException("Failed to clear " + record.getStoreName() + ": "
                + pending.size() + " entries not deleted");
        }
    }

    private List<MappingItem> queryRecord(MappingRecord record) {
        QueryConditional queryConditional = QueryConditional
            .keyEqualTo(Key.builder()
                .partitionValue(partitionKey(record))
                .build());

        return table.query(QueryEnhancedRequest.builder()
                .queryConditional(queryConditional)
                .build())
            .stream()
            .flatMap(page -> page.items().stream())
            .collect(Collectors.toList());
    }

    private Key key(MappingRecord record, String key) {
        return Key.builder()
            .partitionValue(partitionKey(record))
            .sortValue(key)
            .build();
    }

    String partitionKey(MappingRecord record) {
        return "SYNC#" + namespace + "#" + record.getStoreName();
    }
}
