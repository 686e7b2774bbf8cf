package com.microsoft.finops.config;

import com.microsoft.finops.adapters.CloudCostAdapter;
import com.microsoft.finops.adapters.ResourceMetadataProvider;
import com.microsoft.finops.adapters.csv.CsvBillingExportAdapter;
import com.microsoft.finops.domain.model.CloudProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for cloud billing adapters and ingestion infrastructure.
 *
 * A CSV export directory configured for a cloud takes precedence over any
 * adapter bean registered for the same cloud.
 */
@Configuration
@Slf4j
public class AdapterConfig {

    @Bean
    public Map<CloudProvider, CloudCostAdapter> costAdapters(ObjectProvider<CloudCostAdapter> adapters,
                                                             FinOpsProperties properties) {
        Map<CloudProvider, CloudCostAdapter> byCloud = new EnumMap<>(CloudProvider.class);
        for (CloudCostAdapter adapter : adapters.orderedStream().toList()) {
            if (byCloud.putIfAbsent(adapter.getProvider(), adapter) != null) {
                throw new IllegalStateException("More than one cost adapter for " + adapter.getProvider());
            }
        }
        properties.getIngestion().getCsvDirectories().forEach((cloud, directory) -> {
            log.info("Using billing export directory {} for {}", directory, cloud);
            byCloud.put(cloud, new CsvBillingExportAdapter(cloud, Path.of(directory)));
        });
        byCloud.forEach((cloud, adapter) -> {
            if (!adapter.validateCredentials()) {
                log.warn("Cost adapter for {} reports missing or invalid credentials, syncs will fail", cloud);
            }
        });
        log.info("Registered cost adapters for {}", byCloud.keySet());
        return byCloud;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(FinOpsProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getIngestion().getParallelism()), runnable -> {
            Thread thread = new Thread(runnable, "ingestion-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * No inventory collector wired: governance sees only cost record attributes.
     * A @Primary provider (e.g. the local one) replaces it.
     */
    @Bean
    public ResourceMetadataProvider resourceMetadataProvider() {
        return (cloud, resourceId) -> Optional.empty();
    }
}
