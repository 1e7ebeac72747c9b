package com.bbthechange.rehearsalsync.config;

import com.bbthechange.rehearsalsync.model.MappingItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the sync table on startup when it does not exist yet.
 */
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final CalendarSyncProperties properties;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                    CalendarSyncProperties properties) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(properties.getTableName());
    }

    void createTableIfNotExists(String tableName) {
        DynamoDbTable<MappingItem> table = dynamoDbEnhancedClient.table(tableName,
            TableSchema.fromBean(MappingItem.class));
        try {
            // Throws if the table doesn't exist
            table.describeTable();
            logger.info("Table {} already exists", tableName);

        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(ProvisionedThroughput.builder()
                    .readCapacityUnits(5L)
                    .writeCapacityUnits(5L)
                    .build())
                .build());
            logger.info("Table {} created successfully", tableName);
        } catch (Exception e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }
}
