package com.treeroll.service.core.config.init;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.treeroll.service.core.config.JacksonConfig;
import com.treeroll.service.core.config.RegistrySnapshot;
import com.treeroll.service.core.config.RollupProperties;
import com.treeroll.service.core.config.RollupRegistry;
import org.junit.jupiter.api.Test;

class DefinitionsInitializerTest {

    private final RollupRegistry registry = new RollupRegistry();
    private final RollupProperties properties = new RollupProperties();
    private final DefinitionsInitializer initializer =
            new DefinitionsInitializer(registry, properties, JacksonConfig.configure(new ObjectMapper()));

    @Test
    void startupSwapsInTheLoadedSnapshot() {
        properties.getDefinitions().setLocation("classpath:/test-definitions/");

        initializer.onStartup();

        RegistrySnapshot snapshot = registry.current();
        assertThat(snapshot.metrics().size()).isEqualTo(4);
        assertThat(snapshot.dimensions().get("type").column()).isEqualTo("kind");
        assertThat(snapshot.hierarchies()).containsOnlyKeys("by_type");
        assertThat(snapshot.catalog().get("type").otherLabel()).isEqualTo("Other types");
    }

    @Test
    void disabledStartupLeavesRegistryEmpty() {
        properties.getDefinitions().setEnabled(false);
        properties.getDefinitions().setLocation("classpath:/test-definitions/");

        initializer.onStartup();

        assertThat(registry.current()).isEqualTo(RegistrySnapshot.empty());
    }

    @Test
    void failedReloadKeepsThePreviousSnapshot() {
        properties.getDefinitions().setLocation("classpath:/test-definitions/");
        RegistrySnapshot loaded = initializer.reload();

        properties.getDefinitions().setLocation("classpath:/broken-definitions/");
        assertThatThrownBy(initializer::reload)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate metric id: duration_sum");

        properties.getDefinitions().setLocation("classpath:/malformed-definitions/");
        assertThatThrownBy(initializer::reload)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("malformed-definitions");

        assertThat(registry.current()).isSameAs(loaded);
    }
}
