package com.goldminer.backend.services.sms.rules;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads YAML rule files from Spring resource locations.
 * Property names in the files are snake_case.
 */
@Component
public class RuleFileReader {

    public static final long UNKNOWN_VERSION = -1L;

    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper;

    public RuleFileReader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @return empty when the file does not exist
     * @throws RuleConfigurationException when the file exists but is not valid YAML for {@code type}
     */
    public <T> Optional<T> read(String location, Class<T> type) {
        return read(location, stream -> yamlMapper.readValue(stream, type));
    }

    public <T> Optional<T> read(String location, TypeReference<T> type) {
        return read(location, stream -> yamlMapper.readValue(stream, type));
    }

    /**
     * Last modification time of the file, or {@link #UNKNOWN_VERSION} when it cannot be determined.
     */
    public long lastModified(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            return UNKNOWN_VERSION;
        }
        try {
            return resource.lastModified();
        } catch (IOException e) {
            return UNKNOWN_VERSION;
        }
    }

    private <T> Optional<T> read(String location, YamlBinder<T> binder) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            return Optional.empty();
        }
        T value;
        try (InputStream in = resource.getInputStream()) {
            value = binder.bind(in);
        } catch (IOException e) {
            throw new RuleConfigurationException("Invalid rule file " + location + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new RuleConfigurationException("Rule file " + location + " is empty");
        }
        return Optional.of(value);
    }

    @FunctionalInterface
    private interface YamlBinder<T> {
        T bind(InputStream in) throws IOException;
    }
}
