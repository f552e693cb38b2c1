package com.vidnyan.linthub.adapter.out.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.linthub.LinthubProperties;
import com.vidnyan.linthub.application.port.out.OverrideCatalog;
import com.vidnyan.linthub.domain.rule.Overrides;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Set;

/**
 * Override table loaded once from a JSON resource.
 * The resource maps a code to the codes that suppress it: {@code {"F401": ["W0611"]}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClasspathOverrideCatalog implements OverrideCatalog {

    private final ObjectMapper objectMapper;
    private final LinthubProperties properties;
    private final ResourceLoader resourceLoader;

    private Overrides overrides;

    @PostConstruct
    public void load() {
        overrides = load(properties.getOverridesLocation());
        log.info("Loaded {} override entries from {}",
                overrides.suppressors().size(), properties.getOverridesLocation());
    }

    Overrides load(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            Map<String, Set<String>> table = objectMapper.readValue(in, new TypeReference<>() {});
            return new Overrides(table);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load overrides from " + location, e);
        }
    }

    @Override
    public Overrides get() {
        return overrides;
    }
}
