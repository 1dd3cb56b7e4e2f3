package com.example.konvertor.interfaces.cli;

import com.example.konvertor.application.exception.ApplicationException;
import com.example.konvertor.application.service.ConversionService;
import com.example.konvertor.application.service.CsvExportService;
import com.example.konvertor.domain.exception.DomainException;
import com.example.konvertor.domain.model.ConversionOptions;
import com.example.konvertor.domain.model.ConversionResult;
import com.example.konvertor.domain.model.DocumentAttributes;
import com.example.konvertor.domain.model.NormalizationReport;
import com.example.konvertor.infrastructure.exception.CsvProcessingException;
import com.example.konvertor.infrastructure.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-interactive command-line conversion.
 * <p>
 * Usage: {@code <input.csv> [output.xml] [--delimiter=;] [--keep-empty] [--cleaned-csv=path]
 * --cislo_ud=.. --datum_ud=.. --mandant_id=.. --druh_ud=.. --typ_ud=.. --text_ud=..}.
 * Every document attribute is required. Files are written only after the whole conversion succeeds.
 */
@Component
@ConditionalOnProperty(prefix = "konvertor.cli", name = "enabled", havingValue = "true")
public class ConversionCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConversionCommandLineRunner.class);

    private final ConversionService conversionService;
    private final CsvExportService csvExportService;
    private int exitCode;

    public ConversionCommandLineRunner(ConversionService conversionService, CsvExportService csvExportService) {
        this.conversionService = conversionService;
        this.csvExportService = csvExportService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.isEmpty()) {
            log.error("Usage: <input.csv> [output.xml] [--delimiter=;] [--keep-empty] [--cleaned-csv=path] "
                    + "--cislo_ud=.. --datum_ud=.. --mandant_id=.. --druh_ud=.. --typ_ud=.. --text_ud=..");
            exitCode = 2;
            return;
        }
        Path input = Path.of(files.get(0));
        Path output = files.size() > 1 ? Path.of(files.get(1)) : defaultOutput(input);

        Map<String, String> values = new HashMap<>();
        for (String name : DocumentAttributes.NAMES) {
            values.put(name, option(args, name));
        }
        ConversionOptions options = new ConversionOptions(
                ConversionOptions.parseDelimiter(option(args, "delimiter")),
                args.containsOption("keep-empty") ? Boolean.TRUE : null,
                true);

        try {
            ConversionResult result = conversionService.convert(input, DocumentAttributes.fromMap(values), options);
            String cleanedCsv = option(args, "cleaned-csv");
            if (cleanedCsv != null) {
                writeCleanedCsv(Path.of(cleanedCsv), result);
            }
            Files.writeString(output, result.xml(), StandardCharsets.UTF_8);
            logSummary(result, output);
            exitCode = 0;
        } catch (DomainException | ApplicationException | InfrastructureException ex) {
            log.error("Conversion failed: {}", ex.getMessage());
            exitCode = 1;
        } catch (IOException ex) {
            log.error("Unable to write {}", output, ex);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void writeCleanedCsv(Path target, ConversionResult result) {
        String charsetName = result.normalization().report().charset();
        Charset charset = charsetName != null ? Charset.forName(charsetName) : StandardCharsets.UTF_8;
        try {
            Files.writeString(target, csvExportService.export(result.normalization().table()), charset);
        } catch (IOException ex) {
            throw new CsvProcessingException("Unable to write the cleaned CSV to " + target, ex);
        }
        log.info("Cleaned CSV written to {}", target);
    }

    private void logSummary(ConversionResult result, Path output) {
        NormalizationReport report = result.normalization().report();
        log.info("Wrote {} ({} line items)", output, result.document().items().size());
        log.info("Encoding: {}, delimiter: '{}', rows before header: {}", report.charset(), report.delimiter(),
                report.rowsBeforeHeader());
        log.info("Kept columns: {}", String.join(", ", report.keptColumns()));
        if (report.trailerRow() != null) {
            log.info("Trailer removed from row {}", report.trailerRow());
        }
        log.info("Filled names: {}, removed summary rows: {}{}, excluded rows: {}, resulting rows: {}",
                report.filledNames(), report.removedSummaries(),
                report.trailingSummaryRemoved() ? " (including the last one)" : "",
                report.excludedRows(), report.rowCount());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + ".xml");
    }
}
