package org.janelia.coreprep.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;

public class ApplicationConfigImpl implements ApplicationConfig {
    private final Map<String, String> configProperties = new HashMap<>();

    @Override
    public String getStringPropertyValue(String name) {
        return StringUtils.trimToNull(configProperties.get(name));
    }

    @Override
    public String getStringPropertyValue(String name, String defaultValue) {
        String value = getStringPropertyValue(name);
        return value == null ? defaultValue : value;
    }

    @Override
    public Boolean getBooleanPropertyValue(String name, boolean defaultValue) {
        String stringValue = getStringPropertyValue(name);
        return StringUtils.isBlank(stringValue) ? defaultValue : Boolean.valueOf(stringValue);
    }

    @Override
    public Integer getIntegerPropertyValue(String name) {
        return getIntegerPropertyValue(name, null);
    }

    @Override
    public Integer getIntegerPropertyValue(String name, Integer defaultValue) {
        String stringValue = getStringPropertyValue(name);
        if (StringUtils.isBlank(stringValue)) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(stringValue);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value '" + stringValue + "' for " + name, e);
        }
    }

    @Override
    public Long getLongPropertyValue(String name, Long defaultValue) {
        String stringValue = getStringPropertyValue(name);
        if (StringUtils.isBlank(stringValue)) {
            return defaultValue;
        }
        try {
            return Long.valueOf(stringValue);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid long value '" + stringValue + "' for " + name, e);
        }
    }

    @Override
    public Double getDoublePropertyValue(String name, Double defaultValue) {
        String stringValue = getStringPropertyValue(name);
        if (StringUtils.isBlank(stringValue)) {
            return defaultValue;
        }
        try {
            return Double.valueOf(stringValue);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value '" + stringValue + "' for " + name, e);
        }
    }

    @Override
    public List<String> getStringListPropertyValue(String name) {
        String stringValue = getStringPropertyValue(name);
        if (StringUtils.isBlank(stringValue)) {
            return ImmutableList.of();
        } else {
            return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(stringValue);
        }
    }

    @Override
    public void load(InputStream stream) throws IOException {
        Properties toLoad = new Properties();
        toLoad.load(stream);
        putAll(Maps.fromProperties(toLoad));
    }

    @Override
    public void put(String key, String value) {
        configProperties.put(key, value);
    }

    @Override
    public void putAll(Map<String, String> properties) {
        configProperties.putAll(properties);
    }

    @Override
    public Map<String, String> asMap() {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        configProperties.forEach((k, v) -> {
            if (k != null && v != null) builder.put(k, v);
        });
        return builder.build();
    }
}
