package com.supplychain.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Site-specific additions merged over the built-in location and sector tables.
 */
@Configuration
@ConfigurationProperties(prefix = "supplychain.normalization")
@Data
public class NormalizationProperties {

    /** alias → catalog name, e.g. {@code ams: Amsterdam}. */
    private Map<String, String> extraLocationAliases = new HashMap<>();

    /** keyword → canonical sector, e.g. {@code lithium: energy}. */
    private Map<String, String> extraSectorKeywords = new HashMap<>();
}
