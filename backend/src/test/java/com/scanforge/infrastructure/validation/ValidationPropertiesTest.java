package com.scanforge.infrastructure.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationPropertiesTest {

    @Test
    @DisplayName("application.yml binds to the same settings as the defaults")
    void yaml_matches_defaults() throws IOException {
        List<PropertySource<?>> sources =
                new YamlPropertySourceLoader().load("application", new ClassPathResource("application.yml"));
        Binder binder = new Binder(ConfigurationPropertySources.from(sources));

        ValidationProperties bound = binder.bind("validation", Bindable.ofInstance(new ValidationProperties()))
                .orElseGet(ValidationProperties::new);

        assertThat(bound).isEqualTo(new ValidationProperties());
        assertThat(bound.getRecognizedLibraries()).contains("pandas", "numpy", "yfinance", "polygon");
    }
}
