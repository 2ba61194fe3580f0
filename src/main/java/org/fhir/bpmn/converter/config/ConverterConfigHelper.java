package org.fhir.bpmn.converter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fhir.bpmn.converter.layout.LayoutSettings;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

@Slf4j
public class ConverterConfigHelper {
    public static final String DEFAULT_CONFIG_RESOURCE = "converter-config.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    public static ConverterConfig loadConfigFile(String configFilePath) throws IOException {
        ConverterConfig config = mapper.readValue(new File(configFilePath), ConverterConfig.class);
        return normalize(config);
    }

    /**
     * Loads the bundled default configuration, or built-in defaults when the resource is absent.
     */
    public static ConverterConfig loadDefault() {
        ClassLoader cl = ConverterConfigHelper.class.getClassLoader();
        try (InputStream configStream = cl.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (configStream == null) {
                log.debug("No {} on the classpath, using built-in defaults", DEFAULT_CONFIG_RESOURCE);
                return new ConverterConfig();
            }
            return normalize(mapper.readValue(configStream, ConverterConfig.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config resource: " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    private static ConverterConfig normalize(ConverterConfig config) {
        if (config.layout == null) {
            config.layout = new LayoutSettings();
        }
        config.layout.validate();
        return config;
    }
}
