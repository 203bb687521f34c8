package com.di.moduleflow;

import com.di.moduleflow.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Boots the module execution kernel. Pipelines obtain
 * {@link com.di.moduleflow.pipeline.ModulePipeline} from the context and run their modules
 * through it; the JDBC pool is built by {@code ModuleFlowConfiguration}, not auto-configured.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@Slf4j
@ConfigurationPropertiesScan
public class ModuleFlowApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(ModuleFlowApplication.class, args);
		PipelineConfig config = ctx.getBean(PipelineConfig.class);
		log.info("[STARTUP] moduleflow ready: organizationId={} runId={} firstRun={}",
				config.getOrganizationId(), config.getRunId(), config.isFirstRun());
	}
}
