package com.libragraph.boxes.core.config;

import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BoxesConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        BoxesConfig config = BoxesConfig.defaults();

        assertThat(config.maxDepth()).isEqualTo(256);
        assertThat(config.cacheMaxEntries()).isEqualTo(4096);
        assertThat(config.maxRenderedAtoms()).isEqualTo(100_000);
    }

    @Test
    void loadReadsBundledProperties() {
        assertThat(BoxesConfig.load()).isEqualTo(BoxesConfig.defaults());
    }

    @Test
    void fromAppliesOverrides() {
        Config source = new SmallRyeConfigBuilder()
                .withDefaultValue(BoxesConfig.MAX_DEPTH, "8")
                .withDefaultValue(BoxesConfig.CACHE_MAX_ENTRIES, "0")
                .build();

        BoxesConfig config = BoxesConfig.from(source);

        assertThat(config.maxDepth()).isEqualTo(8);
        assertThat(config.cacheMaxEntries()).isZero();
        assertThat(config.maxRenderedAtoms()).isEqualTo(BoxesConfig.DEFAULT_MAX_RENDERED_ATOMS);
    }

    @Test
    void fromRejectsInvalidValue() {
        Config source = new SmallRyeConfigBuilder()
                .withDefaultValue(BoxesConfig.MAX_DEPTH, "0")
                .build();

        assertThatIllegalArgumentException()
                .isThrownBy(() -> BoxesConfig.from(source))
                .withMessageContaining(BoxesConfig.MAX_DEPTH);
    }

    @Test
    void rejectsNegativeCacheSize() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new BoxesConfig(4, -1, 10))
                .withMessageContaining(BoxesConfig.CACHE_MAX_ENTRIES);
    }
}
