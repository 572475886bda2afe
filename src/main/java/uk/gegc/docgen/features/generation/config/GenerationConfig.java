package uk.gegc.docgen.features.generation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {
}
