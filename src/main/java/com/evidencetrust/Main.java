package com.evidencetrust;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.enhancement.ExternalEvaluator;
import com.evidencetrust.enhancement.ExternalEvaluators;
import com.evidencetrust.evidence.JsonlEvidenceLog;
import com.evidencetrust.governance.EnhancementRequest;
import com.evidencetrust.governance.GovernanceConfig;
import com.evidencetrust.governance.GovernanceEngine;
import com.evidencetrust.governance.GovernanceReport;
import com.evidencetrust.governance.ReportHasher;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.PipelineBundle;
import com.evidencetrust.input.ReviewInput;
import com.evidencetrust.runtime.AppConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "evidence-trust",
        mixinStandardHelpOptions = true,
        version = "evidence-trust 0.1.0",
        description = "Scores compliance evidence and emits a governance report.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "pipeline")
    Mode mode;

    @Option(names = { "-i", "--input" }, description = "JSON input: a pipeline bundle, a document bundle, or a report to verify")
    Path input;

    @Option(names = { "-o", "--output" }, description = "Write the report here instead of stdout")
    Path output;

    @Option(names = "--evaluator", description = "External evaluator model, or 'deterministic' (default from config)")
    String evaluator;

    @Option(names = "--timeout-ms", description = "Upper bound on the external evaluation in milliseconds")
    Long timeoutMs;

    @Option(names = "--evidence-dir", description = "Directory evidence log names are resolved against (default from config)")
    Path evidenceDir;

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    enum Mode {
        pipeline,
        document,
        verify_report
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (input == null) {
            log.error("--input is required");
            return 2;
        }
        if (!Files.isRegularFile(input)) {
            log.error("Input file not found: {}", input);
            return 2;
        }

        if (timeoutMs != null && timeoutMs <= 0) {
            log.error("--timeout-ms must be positive");
            return 2;
        }

        if (mode == Mode.verify_report) {
            return verifyReport();
        }

        AppConfig appConfig = loadConfig(Path.of(configPath));
        GovernanceConfig config;
        try {
            config = appConfig.toGovernanceConfig();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration in {}: {}", configPath, e.getMessage());
            return 2;
        }

        ReviewInput reviewInput;
        try {
            reviewInput = mode == Mode.document
                    ? mapper.readValue(input.toFile(), DocumentBundle.class)
                    : mapper.readValue(input.toFile(), PipelineBundle.class);
        } catch (JsonProcessingException e) {
            log.error("Input {} is not a valid {} bundle: {}", input, mode, e.getOriginalMessage());
            return 2;
        }

        String evaluatorName = evaluator == null ? appConfig.getEnhancement().getEvaluator() : evaluator;
        EnhancementRequest request = EnhancementRequest.of(
                evaluatorName,
                timeoutMs == null ? null : Duration.ofMillis(timeoutMs));
        ExternalEvaluator externalEvaluator = request.engaged()
                ? ExternalEvaluators.fromConfig(appConfig.getEnhancement(), request.evaluatorName(), config.adjustmentBounds(), new OkHttpClient())
                        .orElse(null)
                : null;

        Path logDirectory = evidenceDir == null ? Path.of(appConfig.getEvidence().getDirectory()) : evidenceDir;
        log.info("Reviewing {} input {} (evidence dir {}, evaluator {})", mode, input, logDirectory, request.evaluatorName());

        GovernanceEngine engine = new GovernanceEngine(config, new JsonlEvidenceLog(logDirectory), externalEvaluator, Clock.systemUTC());
        GovernanceReport report = engine.review(reviewInput, request);
        writeReport(report);
        return 0;
    }

    private int verifyReport() throws IOException {
        GovernanceReport report;
        try {
            report = mapper.readValue(input.toFile(), GovernanceReport.class);
        } catch (JsonProcessingException e) {
            log.error("Input {} is not a valid governance report: {}", input, e.getOriginalMessage());
            return 2;
        }
        boolean valid = new ReportHasher().verify(report);
        if (valid) {
            log.info("Report {} hash verified", report.id());
            return 0;
        }
        log.error("Report {} hash mismatch; the report was modified after it was issued", report.id());
        return 1;
    }

    private void writeReport(GovernanceReport report) throws IOException {
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        if (output == null) {
            System.out.println(json);
            return;
        }
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, json);
        log.info("Report written to {}", output);
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        return yamlMapper.readValue(config.toFile(), AppConfig.class);
    }
}
