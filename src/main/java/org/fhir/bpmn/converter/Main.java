package org.fhir.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.fhir.bpmn.converter.bpmn.BpmnXmlGenerator;
import org.fhir.bpmn.converter.config.ConverterConfig;
import org.fhir.bpmn.converter.config.ConverterConfigHelper;
import org.fhir.bpmn.converter.plandefinition.PlanDefinitionHelper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Converts a PlanDefinition JSON file into a .bpmn file.
 *
 * Usage:
 *   plandefinition-to-bpmn plan.json                    -- writes diagram.bpmn
 *   plandefinition-to-bpmn plan.json -o care.bpmn       -- writes care.bpmn
 *   plandefinition-to-bpmn --sample                     -- converts the bundled sample
 */
@Slf4j
@Command(
        name = "plandefinition-to-bpmn",
        mixinStandardHelpOptions = true,
        version = "plandefinition-to-bpmn 1.0.0",
        description = "Convert a FHIR PlanDefinition JSON document into a BPMN 2.0 diagram"
)
public class Main implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_CONVERSION_FAILED = 1;
    static final int EXIT_IO_FAILED = 2;

    static final String SAMPLE_RESOURCE = "sample-plandefinition.json";

    @Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "PlanDefinition JSON file")
    private Path input;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", defaultValue = "diagram.bpmn",
            description = "BPMN file to write (default: ${DEFAULT-VALUE})")
    private Path output;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE",
            description = "Converter configuration JSON, defaults to the bundled converter-config.json")
    private Path configPath;

    @Option(names = "--validate", description = "Validate the generated BPMN against the BPMN 2.0 schema")
    private boolean validate;

    @Option(names = "--fallback-on-error", description = "Write an empty diagram when the conversion fails")
    private boolean fallbackOnError;

    @Option(names = "--sample", description = "Convert the bundled sample PlanDefinition instead of INPUT")
    private boolean sample;

    @Override
    public Integer call() {
        ConverterConfig config;
        String json;
        try {
            config = configPath != null
                    ? ConverterConfigHelper.loadConfigFile(configPath.toString())
                    : ConverterConfigHelper.loadDefault();
            json = readInput();
        } catch (IOException e) {
            log.error("Failed to read input: {}", e.getMessage());
            return EXIT_IO_FAILED;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error(e.getMessage());
            return EXIT_IO_FAILED;
        }

        config.validateOutput = config.validateOutput || validate;
        config.writeFallbackOnError = config.writeFallbackOnError || fallbackOnError;

        String xml;
        int exitCode;
        try {
            ConversionResult result = new PlanDefinitionToBpmnConverter(config).convert(json);
            result.warnings().forEach(warning -> System.err.println("Warning: " + warning));
            xml = result.xml();
            exitCode = EXIT_OK;
        } catch (ConversionException e) {
            log.error("Error converting PlanDefinition to BPMN ({}): {}", e.getReason(), e.getMessage());
            if (!config.writeFallbackOnError) {
                return EXIT_CONVERSION_FAILED;
            }
            xml = BpmnXmlGenerator.emptyDefinitions();
            exitCode = EXIT_CONVERSION_FAILED;
        }

        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write BPMN file {}: {}", output, e.getMessage());
            return EXIT_IO_FAILED;
        }

        log.info("Wrote {}", output);
        return exitCode;
    }

    private String readInput() throws IOException {
        if (sample) {
            try (InputStream sampleStream = Main.class.getClassLoader().getResourceAsStream(SAMPLE_RESOURCE)) {
                if (sampleStream == null) {
                    throw new IllegalStateException("Sample resource not found: " + SAMPLE_RESOURCE);
                }
                return new String(sampleStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        if (input == null) {
            throw new IllegalArgumentException("No INPUT file given, pass a PlanDefinition JSON file or --sample");
        }
        return PlanDefinitionHelper.readFile(input);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
