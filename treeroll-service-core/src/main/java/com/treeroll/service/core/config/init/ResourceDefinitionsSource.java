package com.treeroll.service.core.config.init;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.treeroll.service.core.config.JacksonConfig;
import com.treeroll.service.core.config.model.RollupDefinitions;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

/** Scans a location for YAML/JSON definition files and parses each into {@link RollupDefinitions}. */
public class ResourceDefinitionsSource {

    private static final Logger log = LoggerFactory.getLogger(ResourceDefinitionsSource.class);

    private final String baseLocation; // e.g. "classpath:/rollup-definitions/"
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ResourceDefinitionsSource(String baseLocation, ObjectMapper jsonMapper) {
        this.baseLocation = baseLocation.endsWith("/") ? baseLocation : baseLocation + "/";
        this.jsonMapper = jsonMapper;
        this.yamlMapper = JacksonConfig.configure(new ObjectMapper(new YAMLFactory()));
    }

    public List<RollupDefinitions> load() throws IOException {
        PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

        String ymlPattern = baseLocation + "**/*.yml";
        String yamlPattern = baseLocation + "**/*.yaml";
        String jsonPattern = baseLocation + "**/*.json";

        Resource[] yml = resolver.getResources(ymlPattern);
        Resource[] yaml = resolver.getResources(yamlPattern);
        Resource[] json = resolver.getResources(jsonPattern);

        log.debug(
                "ResourceDefinitionsSource scanning: base={}, counts=[yml={}, yaml={}, json={}]",
                baseLocation,
                yml.length,
                yaml.length,
                json.length);

        // Stable load order by URL.
        List<Resource> resources = Stream.of(yml, yaml, json)
                .flatMap(Arrays::stream)
                .filter(r -> r.exists() && r.isReadable())
                .sorted(Comparator.comparing(ResourceDefinitionsSource::safeName))
                .toList();

        List<RollupDefinitions> all = new ArrayList<>();
        for (Resource r : resources) {
            String fname = safeName(r);
            RollupDefinitions parsed = parse(r, fname);
            if (parsed.isEmpty()) {
                log.warn("Definitions: {} contains no metrics, dimensions, hierarchies or catalog entries", fname);
                continue;
            }
            log.info(
                    "Definitions: parsed {} (metrics={}, dimensions={}, hierarchies={}, catalog={})",
                    fname,
                    parsed.metrics().size(),
                    parsed.dimensions().size(),
                    parsed.hierarchies().size(),
                    parsed.catalog().size());
            all.add(parsed);
        }
        return all;
    }

    private RollupDefinitions parse(Resource resource, String fname) throws IOException {
        ObjectMapper mapper = fname.toLowerCase(Locale.ROOT).endsWith(".json") ? jsonMapper : yamlMapper;
        try (InputStream in = resource.getInputStream()) {
            RollupDefinitions parsed = mapper.readValue(in, RollupDefinitions.class);
            return parsed == null ? new RollupDefinitions(null, null, null, null) : parsed;
        } catch (IOException ex) {
            throw new IOException("Failed to parse definitions file " + fname + ": " + ex.getMessage(), ex);
        }
    }

    private static String safeName(Resource r) {
        try {
            return r.getURL().toString();
        } catch (IOException ex) {
            return String.valueOf(r.getFilename());
        }
    }
}
