package com.bbthechange.rehearsalsync.repository.impl;

import com.bbthechange.rehearsalsync.exception.RepositoryException;
import com.bbthechange.rehearsalsync.model.MappingItem;
import com.bbthechange.rehearsalsync.repository.MappingRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchWriteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchWriteResult;
import software.amazon.awssdk.enhanced.dynamodb.model.Page;
import software.amazon.awssdk.enhanced.dynamodb.model.PageIterable;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DynamoDbMappingStore with mocked enhanced client operations.
 */
@ExtendWith(MockitoExtension.class)
class DynamoDbMappingStoreTest {

    private static final String TABLE_NAME = "RehearsalSyncTable";

    // Real schema needed for WriteBatch operations
    private static final TableSchema<MappingItem> MAPPING_ITEM_SCHEMA = TableSchema.fromBean(MappingItem.class);

    @Mock
    private DynamoDbEnhancedClient enhancedClient;

    @Mock
    private DynamoDbTable<MappingItem> table;

    private DynamoDbMappingStore store;

    @BeforeEach
    void setUp() {
        when(enhancedClient.table(eq(TABLE_NAME), any(TableSchema.class))).thenReturn(table);
        lenient().when(table.tableSchema()).thenReturn(MAPPING_ITEM_SCHEMA);
        lenient().when(table.tableName()).thenReturn(TABLE_NAME);
        lenient().when(enhancedClient.batchWriteItem(any(BatchWriteItemEnhancedRequest.class)))
            .thenReturn(BatchWriteResult.builder().unprocessedRequests(Map.of()).build());

        store = new DynamoDbMappingStore(enhancedClient, TABLE_NAME, "device-1");
    }

    @Test
    void partitionKey_IncludesNamespaceAndRecordName() {
        assertThat(store.partitionKey(MappingRecord.IMPORT_TRACKING)).isEqualTo("SYNC#device-1#import-tracking");
    }

    @Test
    void put_WritesItemWithPayloadAndType() {
        // When
        store.put(MappingRecord.EXPORT_MAPPINGS, "rehearsal-1", "{\"eventId\":\"evt-1\"}");

        // Then
        ArgumentCaptor<MappingItem> captor = ArgumentCaptor.forClass(MappingItem.class);
        verify(table).putItem(captor.capture());
        MappingItem item = captor.getValue();
        assertThat(item.getPk()).isEqualTo("SYNC#device-1#export-mappings");
        assertThat(item.getSk()).isEqualTo("rehearsal-1");
        assertThat(item.getPayload()).isEqualTo("{\"eventId\":\"evt-1\"}");
        assertThat(item.getItemType()).isEqualTo(MappingItem.ITEM_TYPE);
        assertThat(item.getUpdatedAt()).isNotNull();
    }

    @Test
    void get_ExistingItem_ReturnsPayload() {
        when(table.getItem(any(Key.class)))
            .thenReturn(new MappingItem("SYNC#device-1#sync-settings", "settings", "{}"));

        assertThat(store.get(MappingRecord.SYNC_SETTINGS, "settings")).contains("{}");
    }

    @Test
    void get_MissingItem_ReturnsEmpty() {
        when(table.getItem(any(Key.class))).thenReturn(null);

        assertThat(store.get(MappingRecord.SYNC_SETTINGS, "settings")).isEmpty();
    }

    @Test
    void get_DynamoDbFailure_ThrowsRepositoryException() {
        when(table.getItem(any(Key.class))).thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> store.get(MappingRecord.EXPORT_MAPPINGS, "r1"))
            .isInstanceOf(RepositoryException.class)
            .hasMessageContaining("export-mappings");
    }

    @Test
    void delete_CallsDeleteItem() {
        store.delete(MappingRecord.IMPORT_TRACKING, "e1");

        verify(table).deleteItem(any(Key.class));
    }

    @Test
    void list_ReturnsEntriesBySortKey() {
        mockQueryResults(List.of(
            new MappingItem("SYNC#device-1#import-tracking", "e1", "a"),
            new MappingItem("SYNC#device-1#import-tracking", "e2", "b")));

        Map<String, String> entries = store.list(MappingRecord.IMPORT_TRACKING);

        assertThat(entries).containsExactly(Map.entry("e1", "a"), Map.entry("e2", "b"));
    }

    @Test
    void clear_NoItems_NoBatchWrite() {
        mockQueryResults(List.of());

        store.clear(MappingRecord.EXPORT_MAPPINGS);

        verify(enhancedClient, never()).batchWriteItem(any(BatchWriteItemEnhancedRequest.class));
    }

    @Test
    void clear_26Items_TwoBatchCalls() {
        mockQueryResults(createItems(26));

        store.clear(MappingRecord.EXPORT_MAPPINGS);

        verify(enhancedClient, times(2)).batchWriteItem(any(BatchWriteItemEnhancedRequest.class));
    }

    @Test
    void clear_50Items_TwoBatchCalls() {
        mockQueryResults(createItems(50));

        store.clear(MappingRecord.EXPORT_MAPPINGS);

        verify(enhancedClient, times(2)).batchWriteItem(any(BatchWriteItemEnhancedRequest.class));
    }

    @Test
    void clear_UnprocessedDeletes_RetriesOnlyThoseKeys() {
        mockQueryResults(createItems(3));
        when(enhancedClient.batchWriteItem(any(BatchWriteItemEnhancedRequest.class)))
            .thenReturn(unprocessed("rehearsal-2"))
            .thenReturn(BatchWriteResult.builder().unprocessedRequests(Map.of()).build());

        store.clear(MappingRecord.EXPORT_MAPPINGS);

        ArgumentCaptor<BatchWriteItemEnhancedRequest> captor = ArgumentCaptor.forClass(BatchWriteItemEnhancedRequest.class);
        verify(enhancedClient, times(2)).batchWriteItem(captor.capture());
        Collection<WriteRequest> retried = captor.getAllValues().get(1).writeBatches().iterator().next().writeRequests();
        assertThat(retried).singleElement()
            .satisfies(request -> assertThat(request.deleteRequest().key().get("sk").s()).isEqualTo("rehearsal-2"));
    }

    @Test
    void clear_DeletesStillUnprocessedAfterRetries_ThrowsRepositoryException() {
        mockQueryResults(createItems(2));
        when(enhancedClient.batchWriteItem(any(BatchWriteItemEnhancedRequest.class)))
            .thenReturn(unprocessed("rehearsal-1"));

        assertThatThrownBy(() -> store.clear(MappingRecord.EXPORT_MAPPINGS))
            .isInstanceOf(RepositoryException.class)
            .hasMessageContaining("1 entries not deleted");
        verify(enhancedClient, times(DynamoDbMappingStore.MAX_BATCH_ATTEMPTS))
            .batchWriteItem(any(BatchWriteItemEnhancedRequest.class));
    }

    private BatchWriteResult unprocessed(String sortKey) {
        WriteRequest request = WriteRequest.builder()
            .deleteRequest(DeleteRequest.builder()
                .key(Map.of(
                    "pk", AttributeValue.builder().s("SYNC#device-1#export-mappings").build(),
                    "sk", AttributeValue.builder().s(sortKey).build()))
                .build())
            .build();
        return BatchWriteResult.builder()
            .unprocessedRequests(Map.of(TABLE_NAME, List.of(request)))
            .build();
    }

    private List<MappingItem> createItems(int count) {
        List<MappingItem> items = new ArrayList<>();
        IntStream.range(0, count).forEach(i ->
            items.add(new MappingItem("SYNC#device-1#export-mappings", "rehearsal-" + i, "{}")));
        return items;
    }

    @SuppressWarnings("unchecked")
    private void mockQueryResults(List<MappingItem> items) {
        Page<MappingItem> page = mock(Page.class);
        when(page.items()).thenReturn(items);

        PageIterable<MappingItem> pageIterable = mock(PageIterable.class);
        when(pageIterable.stream()).thenReturn(Stream.of(page));
        when(table.query(any(QueryEnhancedRequest.class))).thenReturn(pageIterable);
    }
}
