package com.ns.funnel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link FunnelDefinition} documents from YAML.
 */
public final class FunnelDefinitionLoader {
    private static final Logger logger = LoggerFactory.getLogger(FunnelDefinitionLoader.class);

    private FunnelDefinitionLoader() {
    }

    private static Yaml newYaml() {
        LoaderOptions opts = new LoaderOptions();
        opts.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(FunnelDefinition.class, opts));
    }

    public static FunnelDefinition fromString(String yamlText) {
        try {
            FunnelDefinition definition = newYaml().load(yamlText);
            if (definition == null) {
                throw new IllegalStateException("Funnel definition is empty");
            }
            return definition;
        } catch (YAMLException e) {
            throw new IllegalStateException("Failed to parse funnel definition: " + e.getMessage(), e);
        }
    }

    public static FunnelDefinition fromFile(Path path) {
        logger.debug("Loading funnel definition from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            FunnelDefinition definition = newYaml().load(reader);
            if (definition == null) {
                throw new IllegalStateException("Funnel definition is empty: " + path);
            }
            return definition;
        } catch (IOException | YAMLException e) {
            throw new IllegalStateException("Failed to load funnel definition: " + path, e);
        }
    }

    public static FunnelDefinition fromClasspath(String resource) {
        try (InputStream in = FunnelDefinitionLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Funnel definition not found in classpath: " + resource);
            }
            FunnelDefinition definition = newYaml().load(in);
            if (definition == null) {
                throw new IllegalStateException("Funnel definition is empty: " + resource);
            }
            return definition;
        } catch (IOException | YAMLException e) {
            throw new IllegalStateException("Failed to load funnel definition: " + resource, e);
        }
    }
}
