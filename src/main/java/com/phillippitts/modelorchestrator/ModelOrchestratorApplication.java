package com.phillippitts.modelorchestrator;

import com.phillippitts.modelorchestrator.config.properties.AllocatorProperties;
import com.phillippitts.modelorchestrator.config.properties.ConcurrencyProperties;
import com.phillippitts.modelorchestrator.config.properties.DegradationProperties;
import com.phillippitts.modelorchestrator.config.properties.ModelCatalogProperties;
import com.phillippitts.modelorchestrator.config.properties.ScoringProperties;
import com.phillippitts.modelorchestrator.config.properties.SequentialProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ScoringProperties.class,
        AllocatorProperties.class,
        DegradationProperties.class,
        SequentialProperties.class,
        ConcurrencyProperties.class,
        ModelCatalogProperties.class
})
@EnableScheduling
public class ModelOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelOrchestratorApplication.class, args);
    }

}
