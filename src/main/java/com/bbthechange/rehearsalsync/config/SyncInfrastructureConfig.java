package com.bbthechange.rehearsalsync.config;

import com.bbthechange.rehearsalsync.client.DeviceCalendarClient;
import com.bbthechange.rehearsalsync.client.InMemoryDeviceCalendarClient;
import com.bbthechange.rehearsalsync.repository.MappingStore;
import com.bbthechange.rehearsalsync.repository.impl.InMemoryMappingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Beans shared by the export, import and auto-import services.
 */
@Configuration
public class SyncInfrastructureConfig {

    private static final Logger logger = LoggerFactory.getLogger(SyncInfrastructureConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Bounded pool for concurrent calendar and backend calls.
     */
    @Bean(name = "calendarSyncExecutor", destroyMethod = "shutdown")
    public ExecutorService calendarSyncExecutor(CalendarSyncProperties properties) {
        AtomicInteger threadNumber = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "calendar-sync-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getExecutorThreads(), threadFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceCalendarClient deviceCalendarClient() {
        logger.info("No native calendar bridge configured, using in-memory device calendar");
        return new InMemoryDeviceCalendarClient();
    }

    @Bean
    @ConditionalOnProperty(name = "calendar-sync.mapping-store", havingValue = "memory")
    public MappingStore inMemoryMappingStore() {
        logger.info("Using in-memory mapping store");
        return new InMemoryMappingStore();
    }
}
