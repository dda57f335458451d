package com.phillippitts.modelorchestrator.config;

import com.phillippitts.modelorchestrator.config.properties.ModelCatalogProperties;
import com.phillippitts.modelorchestrator.service.analysis.ModelCatalog;
import com.phillippitts.modelorchestrator.service.degradation.MemoryProbe;
import com.phillippitts.modelorchestrator.service.degradation.OperatingSystemMemoryProbe;
import com.phillippitts.modelorchestrator.service.sequential.EchoModelBackend;
import com.phillippitts.modelorchestrator.service.sequential.ModelBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Collaborators of the orchestration core that have a swappable implementation.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryProbe memoryProbe() {
        return new OperatingSystemMemoryProbe();
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelBackend modelBackend() {
        LOG.info("No ModelBackend configured; using the echo backend");
        return new EchoModelBackend();
    }

    @Bean
    public ModelCatalog modelCatalog(ModelCatalogProperties props) {
        ModelCatalog catalog = new ModelCatalog(props.toModelTypes());
        LOG.info("Model catalog loaded: {} model(s) {}", catalog.size(),
                catalog.all().stream().map(m -> m.id()).toList());
        return catalog;
    }
}
