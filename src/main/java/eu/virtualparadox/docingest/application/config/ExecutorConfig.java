package eu.virtualparadox.docingest.application.config;

import eu.virtualparadox.docingest.application.executor.IngestionExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    // initialized and shut down by the container
    @Bean
    public IngestionExecutor ingestionExecutor(final IngestionProperties properties) {
        return new IngestionExecutor(properties.workers());
    }
}
