package com.microsoft.finops.config;

import com.microsoft.finops.adapters.CloudCostAdapter;
import com.microsoft.finops.adapters.RawCostFact;
import com.microsoft.finops.adapters.ResourceMetadata;
import com.microsoft.finops.adapters.ResourceMetadataProvider;
import com.microsoft.finops.budget.BudgetService;
import com.microsoft.finops.domain.model.BudgetPeriod;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.domain.repository.BudgetRepository;
import com.microsoft.finops.governance.GovernanceRuleEngine;
import com.microsoft.finops.ingestion.CostIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Local development configuration.
 *
 * ENABLED WHEN: app.env=local (the default)
 *
 * This configuration:
 * 1. Disables JWT authentication
 * 2. Enables permissive CORS for localhost
 * 3. Provides synthetic billing adapters for AWS, Azure and GCP
 * 4. Seeds three budgets and syncs the last weeks of synthetic spend on startup
 *
 * NO CLOUD CREDENTIALS REQUIRED!
 */
@Configuration
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalDevConfig {

    @Bean
    @Primary
    public SecurityFilterChain localSecurityFilterChain(HttpSecurity http) throws Exception {
        log.info("🔓 LOCAL MODE: Security disabled for development");

        http
            .cors(cors -> cors.configurationSource(localCorsConfig()))
            .csrf(AbstractHttpConfigurer::disable)
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll());

        return http.build();
    }

    @Bean
    public CorsConfigurationSource localCorsConfig() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOriginPatterns(List.of(
            "http://localhost:*",
            "https://localhost:*"
        ));
        config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(List.of("*"));
        config.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);

        log.info("🌐 LOCAL MODE: CORS enabled for localhost:*");
        return source;
    }

    @Bean
    public CloudCostAdapter syntheticAwsAdapter() {
        log.info("📊 LOCAL MODE: Using synthetic AWS billing data");
        return new SyntheticCostAdapter(CloudProvider.AWS, List.of(
            new SyntheticResource("111111111111", null, "AmazonEC2", "i-0a1b2c3d4e5f-web", "us-east-1", "USD", 45,
                Map.of("Team", "Engineering", "Environment", "prod", "CostCenter", "CC-100")),
            new SyntheticResource("111111111111", null, "AmazonEC2", "i-gpu-train-01", "us-west-2", "USD", 120,
                Map.of("Team", "DataScience", "Environment", "dev", "CostCenter", "CC-300")),
            new SyntheticResource("111111111111", null, "AmazonS3", "arn:aws:s3:::finops-logs", "us-east-1", "USD", 8,
                Map.of("team", "Platform", "Environment", "prod")),
            new SyntheticResource("222222222222", null, "AmazonRDS", "db-orders", "eu-west-1", "USD", 30,
                Map.of("Team", "Engineering", "Environment", "prod", "CostCenter", "CC-100")),
            new SyntheticResource("222222222222", null, "AWSLambda", "fn-thumbnailer", "us-east-1", "USD", 3,
                Map.of())
        ));
    }

    @Bean
    public CloudCostAdapter syntheticAzureAdapter() {
        log.info("📊 LOCAL MODE: Using synthetic Azure billing data");
        return new SyntheticCostAdapter(CloudProvider.AZURE, List.of(
            new SyntheticResource("sub-contoso-prod", "rg-api", "Virtual Machines", "vm-api-01", "eastus", "USD", 38,
                Map.of("Team", "Engineering", "Environment", "prod", "CostCenter", "CC-100")),
            new SyntheticResource("sub-contoso-prod", "rg-reporting", "SQL Database", "sql-reporting", "westeurope", "USD", 22,
                Map.of("Team", "Finance", "Environment", "prod", "CostCenter", "CC-200")),
            new SyntheticResource("sub-contoso-prod", "rg-diag", "Storage", "stdiag01", "eastus", "USD", 4,
                Map.of())
        ));
    }

    @Bean
    public CloudCostAdapter syntheticGcpAdapter() {
        log.info("📊 LOCAL MODE: Using synthetic GCP billing data (EUR)");
        return new SyntheticCostAdapter(CloudProvider.GCP, List.of(
            new SyntheticResource("01A2B3-C4D5E6", "analytics-prod", "BigQuery", "bq-analytics", "us-central1", "EUR", 25,
                Map.of("team", "DataScience", "env", "prod", "cost-center", "CC-300")),
            new SyntheticResource("01A2B3-C4D5E6", "etl-staging", "Compute Engine", "etl-worker-1", "us-east1", "EUR", 15,
                Map.of("team", "Engineering", "env", "staging", "cost-center", "CC-100")),
            new SyntheticResource("01A2B3-C4D5E6", "ml-dev", "Compute Engine", "gke-gpu-pool-1", "us-central1", "EUR", 60,
                Map.of("team", "DataScience", "env", "dev"))
        ));
    }

    /**
     * Inventory for the synthetic resources, so attribute policies have something to match.
     */
    @Bean
    @Primary
    public ResourceMetadataProvider localResourceMetadataProvider() {
        Map<String, ResourceMetadata> inventory = Map.of(
            "i-0a1b2c3d4e5f-web", new ResourceMetadata("i-0a1b2c3d4e5f-web", "m5.xlarge", false, Map.of()),
            "i-gpu-train-01", new ResourceMetadata("i-gpu-train-01", "p3.2xlarge", true, Map.of()),
            "vm-api-01", new ResourceMetadata("vm-api-01", "Standard_D4s_v3", false, Map.of()),
            "etl-worker-1", new ResourceMetadata("etl-worker-1", "n2-standard-4", false, Map.of()),
            "gke-gpu-pool-1", new ResourceMetadata("gke-gpu-pool-1", "a2-highgpu-1g", true, Map.of())
        );
        return (cloud, resourceId) -> Optional.ofNullable(inventory.get(resourceId));
    }

    @Bean
    public LocalDataBootstrap localDataBootstrap(BudgetRepository budgetRepository,
                                                 BudgetService budgetService,
                                                 CostIngestionService ingestionService,
                                                 GovernanceRuleEngine governanceRuleEngine,
                                                 Clock clock,
                                                 @Value("${finops.local.bootstrap-days:30}") int bootstrapDays) {
        return new LocalDataBootstrap(budgetRepository, budgetService, ingestionService, governanceRuleEngine,
                clock, bootstrapDays);
    }

    /**
     * Seeds budgets and loads synthetic spend after the default policies exist.
     */
    @Order(10)
    @RequiredArgsConstructor
    static class LocalDataBootstrap implements CommandLineRunner {

        private final BudgetRepository budgetRepository;
        private final BudgetService budgetService;
        private final CostIngestionService ingestionService;
        private final GovernanceRuleEngine governanceRuleEngine;
        private final Clock clock;
        private final int bootstrapDays;

        @Override
        public void run(String... args) {
            LocalDate today = LocalDate.now(clock);
            LocalDate monthStart = today.withDayOfMonth(1);

            if (budgetRepository.count() == 0) {
                budgetService.create(new BudgetService.BudgetRequest(
                        "Engineering", "tag:team=Engineering", BigDecimal.valueOf(3500), null,
                        BudgetPeriod.MONTHLY, monthStart, BigDecimal.valueOf(80)));
                budgetService.create(new BudgetService.BudgetRequest(
                        "Production", "tag:environment=prod", BigDecimal.valueOf(6000), null,
                        BudgetPeriod.MONTHLY, monthStart, BigDecimal.valueOf(80)));
                budgetService.create(new BudgetService.BudgetRequest(
                        "Total AWS", "cloud=AWS", BigDecimal.valueOf(10000), null,
                        BudgetPeriod.MONTHLY, monthStart, BigDecimal.valueOf(90)));
                log.info("🌱 LOCAL MODE: Seeded 3 budgets");
            }

            if (bootstrapDays > 0) {
                ingestionService.sync(TimeWindow.ofDays(today.minusDays(bootstrapDays), today));
                governanceRuleEngine.evaluate();
            }
        }
    }

    record SyntheticResource(
            String accountId,
            String projectId,
            String serviceCode,
            String resourceId,
            String region,
            String currency,
            int baseDailyCost,
            Map<String, String> tags
    ) {
    }

    /**
     * Deterministic billing source: the same cloud and day always produce the
     * same facts, so re-syncing a window is idempotent.
     */
    static class SyntheticCostAdapter implements CloudCostAdapter {

        private final CloudProvider provider;
        private final List<SyntheticResource> resources;

        SyntheticCostAdapter(CloudProvider provider, List<SyntheticResource> resources) {
            this.provider = provider;
            this.resources = List.copyOf(resources);
        }

        @Override
        public CloudProvider getProvider() {
            return provider;
        }

        @Override
        public List<RawCostFact> fetch(TimeWindow window) {
            log.debug("SYNTHETIC: Fetching {} billing data for {}", provider, window);

            List<RawCostFact> facts = new ArrayList<>();
            for (LocalDate day = window.startDate(); day.isBefore(window.endDate()); day = day.plusDays(1)) {
                Random random = new Random(Objects.hash(provider.name(), day.toString()));
                TimeWindow usage = TimeWindow.ofDay(day);

                for (SyntheticResource resource : resources) {
                    BigDecimal amount = BigDecimal.valueOf(resource.baseDailyCost())
                            .multiply(BigDecimal.valueOf(0.8 + random.nextDouble() * 0.4))
                            .setScale(2, RoundingMode.HALF_EVEN);
                    facts.add(new RawCostFact(provider, resource.accountId(), resource.projectId(),
                            resource.serviceCode(), resource.resourceId(), resource.region(), resource.tags(),
                            usage.start(), usage.end(), amount, resource.currency(), "Usage"));
                }

                // Monthly promotional credit on the first resource's account
                if (day.getDayOfMonth() == 1) {
                    SyntheticResource first = resources.get(0);
                    facts.add(new RawCostFact(provider, first.accountId(), first.projectId(),
                            first.serviceCode(), null, first.region(), Map.of(),
                            usage.start(), usage.end(), BigDecimal.valueOf(-25), first.currency(), "Credit"));
                }
            }
            return facts;
        }

        @Override
        public boolean validateCredentials() {
            return true; // Always valid in synthetic mode
        }
    }
}
