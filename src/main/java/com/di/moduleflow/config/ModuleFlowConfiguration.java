package com.di.moduleflow.config;

import com.di.moduleflow.model.StatusReport;
import com.di.moduleflow.pipeline.ModulePipeline;
import com.di.moduleflow.schema.InMemorySchemaRegistry;
import com.di.moduleflow.schema.SchemaRegistry;
import com.di.moduleflow.storage.Database;
import com.di.moduleflow.storage.InMemoryDatabase;
import com.di.moduleflow.storage.JdbcDatabase;
import com.di.moduleflow.storage.StatusReportHistory;
import com.di.moduleflow.util.ModuleMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Wires one pipeline run: run identity, storage, history, resolved config, execution context
 * and the {@link ModulePipeline} that modules are built from.
 */
@Slf4j
@Configuration
public class ModuleFlowConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineRun pipelineRun(Clock clock) {
        return PipelineRun.start(clock);
    }

    // ------------------------------------------------------------------ //
    // Storage                                                             //
    // ------------------------------------------------------------------ //

    @Bean
    @ConditionalOnProperty(name = "moduleflow.storage.type", havingValue = "memory", matchIfMissing = true)
    public Database inMemoryDatabase() {
        log.info("[CONFIG] storage=memory");
        return new InMemoryDatabase();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "moduleflow.storage.type", havingValue = "jdbc")
    public HikariDataSource moduleflowDataSource(StorageProperties storage) {
        StorageProperties.Jdbc jdbc = storage.getJdbc();
        if (jdbc.getUrl() == null || jdbc.getUrl().isBlank()) {
            throw new IllegalStateException("moduleflow.storage.jdbc.url is required when moduleflow.storage.type=jdbc");
        }
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbc.getUrl());
        hikariConfig.setUsername(jdbc.getUsername());
        hikariConfig.setPassword(jdbc.getPassword());
        hikariConfig.setDriverClassName(jdbc.getDriverClassName());
        hikariConfig.setMaximumPoolSize(jdbc.getMaximumPoolSize());
        hikariConfig.setPoolName("moduleflow");
        if (jdbc.getUrl().contains("postgresql")) {
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        }
        return new HikariDataSource(hikariConfig);
    }

    @Bean
    @ConditionalOnProperty(name = "moduleflow.storage.type", havingValue = "jdbc")
    public Database jdbcDatabase(HikariDataSource moduleflowDataSource, PipelineRun run) {
        log.info("[CONFIG] storage=jdbc pool={}", moduleflowDataSource.getPoolName());
        return new JdbcDatabase(new JdbcTemplate(moduleflowDataSource), run.runId());
    }

    // ------------------------------------------------------------------ //
    // Run context                                                         //
    // ------------------------------------------------------------------ //

    @Bean
    public PipelineConfig pipelineConfig(PipelineProperties props,
                                         PipelineRun run,
                                         Database database,
                                         ObjectMapper objectMapper) {
        List<StatusReport> history = new StatusReportHistory(database)
                .lastRunDetail(props.getOrganizationId(), DefaultPipelineConfig.statusTarget(props));
        return new DefaultPipelineConfig(props, run, history, objectMapper);
    }

    @Bean
    public ExecutionContext executionContext(PipelineConfig pipelineConfig, Clock clock) {
        return ExecutionContext.of(pipelineConfig, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaRegistry schemaRegistry() {
        return new InMemorySchemaRegistry();
    }

    @Bean
    public ModulePipeline modulePipeline(Database database,
                                         SchemaRegistry schemaRegistry,
                                         ExecutionContext executionContext,
                                         ModuleMetrics moduleMetrics) {
        return new ModulePipeline(database, schemaRegistry, executionContext, moduleMetrics);
    }
}
