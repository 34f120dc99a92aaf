package org.janelia.coreprep.cdi;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.janelia.coreprep.config.ApplicationConfig;
import org.janelia.coreprep.config.ApplicationConfigImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the application configuration. Sources are applied in call order so a later source
 * overrides the keys of an earlier one. Environment variables prefixed with <code>COREPREP_</code>
 * override a key, with '_' mapped to '.' (e.g. COREPREP_CorePrep_Margin sets CorePrep.Margin), at the point
 * the environment is applied, so they beat the properties files but not the command line arguments.
 */
public class ApplicationConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationConfigProvider.class);

    private static final String DEFAULT_APPLICATION_CONFIG_RESOURCES = "/coreprep.properties";
    private static final String ENV_PREFIX = "env.";
    private static final String ENV_OVERRIDE_PREFIX = "env.coreprep_";

    private static final Map<String, String> APP_DYNAMIC_ARGS = new HashMap<>();

    public static Map<String, String> getAppDynamicArgs() {
        return APP_DYNAMIC_ARGS;
    }

    public static void setAppDynamicArgs(Map<String, String> appDynamicArgs) {
        APP_DYNAMIC_ARGS.clear();
        if (appDynamicArgs != null) {
            APP_DYNAMIC_ARGS.putAll(appDynamicArgs);
        }
    }

    private final ApplicationConfig applicationConfig = new ApplicationConfigImpl();

    public ApplicationConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_APPLICATION_CONFIG_RESOURCES)
                .fromProperties(System.getProperties())
                .fromMap(System.getenv().entrySet().stream().collect(Collectors.toMap(entry -> ENV_PREFIX + entry.getKey(), Map.Entry::getValue)));
    }

    public ApplicationConfigProvider fromResource(String resourceName) {
        if (StringUtils.isBlank(resourceName)) {
            return this;
        }
        try (InputStream configStream = this.getClass().getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Application config resource {} not found", resourceName);
                return this;
            }
            LOG.info("Reading application config from resource {}", resourceName);
            return fromInputStream(configStream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ApplicationConfigProvider fromEnvVar(String envVarName) {
        if (StringUtils.isBlank(envVarName)) {
            return this;
        }
        String envVarValue = System.getenv(envVarName);
        if (StringUtils.isBlank(envVarValue)) {
            return this;
        }
        LOG.info("Reading application config from environment {} -> {}", envVarName, envVarValue);
        return fromFile(envVarValue);
    }

    public ApplicationConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        File file = new File(fileName);
        if (file.exists() && file.isFile()) {
            try (InputStream fileInputStream = new FileInputStream(file)) {
                LOG.info("Reading application config from file {}", file);
                return fromInputStream(fileInputStream);
            } catch (IOException e) {
                LOG.error("Error reading configuration file {}", fileName, e);
                throw new UncheckedIOException(e);
            }
        } else {
            LOG.warn("Configuration file {} not found", fileName);
        }
        return this;
    }

    public ApplicationConfigProvider fromMap(Map<String, String> map) {
        applicationConfig.putAll(map);
        injectEnvProps(map);
        return this;
    }

    public ApplicationConfigProvider fromProperties(Properties properties) {
        properties.stringPropertyNames().forEach(k -> applicationConfig.put(k, properties.getProperty(k)));
        return this;
    }

    private ApplicationConfigProvider fromInputStream(InputStream stream) {
        try {
            applicationConfig.load(stream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    private void injectEnvProps(Map<String, String> source) {
        source.entrySet().stream()
                .filter(entry -> entry.getKey().toLowerCase().startsWith(ENV_OVERRIDE_PREFIX))
                .forEach(entry -> {
                    String newKey = entry.getKey().substring(ENV_OVERRIDE_PREFIX.length()).replace('_', '.');
                    LOG.debug("Overriding env entry {} with {} -> {}", entry.getKey(), newKey, entry.getValue());
                    applicationConfig.put(newKey, entry.getValue());
                });
    }

    public ApplicationConfig build() {
        return applicationConfig;
    }

}
