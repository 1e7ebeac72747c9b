package com.bbthechange.rehearsalsync.config;

import com.bbthechange.rehearsalsync.repository.MappingStore;
import com.bbthechange.rehearsalsync.repository.impl.DynamoDbMappingStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;

/**
 * DynamoDB clients and the table-backed mapping store.
 * Active unless calendar-sync.mapping-store=memory.
 */
@Configuration
@ConditionalOnProperty(name = "calendar-sync.mapping-store", havingValue = "dynamodb", matchIfMissing = true)
public class DynamoDBConfig {

    @Value("${aws.region:us-east-1}")
    private String region;

    @Value("${aws.dynamodb.endpoint:}")
    private String endpoint;

    @Bean
    public DynamoDbClient dynamoDbClient() {
        var builder = DynamoDbClient.builder()
                .region(Region.of(region));

        if (!endpoint.isEmpty()) {
            // DynamoDB Local accepts any credentials
            builder.endpointOverride(URI.create(endpoint))
                   .credentialsProvider(StaticCredentialsProvider.create(
                       AwsBasicCredentials.create("local", "local")
                   ));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }

        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    @Bean
    public MappingStore mappingStore(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                     CalendarSyncProperties properties) {
        return new DynamoDbMappingStore(dynamoDbEnhancedClient,
                properties.getTableName(), properties.getStoreNamespace());
    }

    @Bean
    @ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
    public DynamoDBTableInitializer dynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                                             CalendarSyncProperties properties) {
        return new DynamoDBTableInitializer(dynamoDbEnhancedClient, properties);
    }
}
