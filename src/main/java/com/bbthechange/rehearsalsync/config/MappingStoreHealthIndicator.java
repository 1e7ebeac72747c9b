package com.bbthechange.rehearsalsync.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Health indicator for the DynamoDB table holding sync mappings.
 */
@Component
@ConditionalOnProperty(name = "calendar-sync.mapping-store", havingValue = "dynamodb", matchIfMissing = true)
public class MappingStoreHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final CalendarSyncProperties properties;

    @Autowired
    public MappingStoreHealthIndicator(DynamoDbClient dynamoDbClient, CalendarSyncProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.properties = properties;
    }

    @Override
    public Health health() {
        String tableName = properties.getTableName();
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(tableName).build()
            );

            TableStatus status = response.table().tableStatus();
            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("table", tableName)
                    .withDetail("status", "ACTIVE")
                    .withDetail("itemCount", response.table().itemCount())
                    .build();
            }
            return Health.down()
                .withDetail("table", tableName)
                .withDetail("status", status.toString())
                .withDetail("reason", tableName + " not active")
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
