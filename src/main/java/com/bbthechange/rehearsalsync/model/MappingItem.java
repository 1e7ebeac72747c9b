package com.bbthechange.rehearsalsync.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * One stored entry of a calendar sync record.
 * The partition key names the record, the sort key is the entry key and
 * the payload carries the serialized value.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
@DynamoDbBean
public class MappingItem extends BaseItem {

    public static final String ITEM_TYPE = "CALENDAR_SYNC_RECORD";

    private String payload;

    public MappingItem(String pk, String sk, String payload) {
        super();
        this.setItemType(ITEM_TYPE);
        this.setPk(pk);
        this.setSk(sk);
        this.payload = payload;
    }
}
