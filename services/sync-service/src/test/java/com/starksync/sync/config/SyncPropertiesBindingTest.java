package com.starksync.sync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SyncProperties binding Tests")
class SyncPropertiesBindingTest {

    private static SyncProperties bind(String resource) throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load(resource, new ClassPathResource(resource));
        StandardEnvironment environment = new StandardEnvironment();
        sources.forEach(environment.getPropertySources()::addLast);
        return new Binder(ConfigurationPropertySources.get(environment))
                .bind("starksync", SyncProperties.class)
                .orElseGet(SyncProperties::new);
    }

    @Test
    @DisplayName("Should bind the packaged configuration with network overrides left unset")
    void shouldBindPackagedConfiguration() throws IOException {
        SyncProperties properties = bind("application.yml");

        assertThat(properties.getNetwork()).isNotNull();
        assertThat(properties.getNetwork().getStateContractAddress()).isNull();
        assertThat(properties.getNetwork().getDeploymentBlock()).isNull();
        assertThat(properties.getIngestion().getWindowSize()).isEqualTo(10_000L);
    }
}
