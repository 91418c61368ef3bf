package com.treeroll.reference.service;

import com.treeroll.service.core.config.RollupProperties;
import com.treeroll.service.core.fact.CsvFactSource;
import com.treeroll.service.core.fact.FactSource;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Exposes the configured CSV fact table to configured-hierarchy runs. */
@Configuration
public class FactSourceConfig {

    @Bean
    @ConditionalOnProperty(prefix = "treeroll.facts", name = "location")
    public FactSource csvFactSource(RollupProperties properties, ResourceLoader resourceLoader) {
        RollupProperties.Facts facts = properties.getFacts();
        return new CsvFactSource(resourceLoader.getResource(facts.getLocation()), Set.copyOf(facts.getMeasures()));
    }
}
