package com.example.konvertor.application.service;

import com.example.konvertor.application.exception.DocumentAttributesValidationException;
import com.example.konvertor.domain.exception.CsvFileRequiredException;
import com.example.konvertor.domain.exception.CsvNotFoundException;
import com.example.konvertor.domain.exception.HeaderNotFoundException;
import com.example.konvertor.domain.model.ConversionOptions;
import com.example.konvertor.domain.model.ConversionResult;
import com.example.konvertor.domain.model.DocumentAttributes;
import com.example.konvertor.domain.model.LineItem;
import com.example.konvertor.domain.model.NormalizationReport;
import com.example.konvertor.domain.model.NormalizationResult;
import com.example.konvertor.domain.model.Side;
import com.example.konvertor.infrastructure.csv.CharsetResolver;
import com.example.konvertor.infrastructure.csv.CsvTableReader;
import com.example.konvertor.testing.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Exercises the whole conversion pipeline with real collaborators.
 */
class ConversionServiceTest {

    private static final DocumentAttributes PAYROLL_ATTRIBUTES = new DocumentAttributes(
            "250901", "30.09.2025", "1", "ID mzdy", "I", "Zaúčtovanie miezd");

    private final ConversionService service = new ConversionService(
            new CsvTableReader(new CharsetResolver(), ';'),
            new TableNormalizationService(new SummaryFolder(),
                    TableNormalizationService.DEFAULT_TRAILER_MARKER,
                    TableNormalizationService.DEFAULT_EXCLUDED_ITEM_NAME),
            new DocumentAssemblyService(),
            new DocumentXmlSerializer(),
            false);

    @TempDir
    Path tempDir;

    /**
     * Converts the payroll export fixture and compares it with the expected XML byte for byte.
     */
    @Test
    void convertProducesExpectedXmlForPayrollExport() {
        MockMultipartFile file = new MockMultipartFile("file", "payroll-export.csv", "text/csv",
                Fixtures.bytes("payroll-export.csv"));

        ConversionResult result = service.convert(file, PAYROLL_ATTRIBUTES, ConversionOptions.defaults());

        assertThat(result.fileName()).isEqualTo("payroll-export.csv");
        assertThat(result.xml()).isEqualTo(Fixtures.text("payroll-export.xml"));
        assertThat(result.document().items()).hasSize(8);
    }

    @Test
    void normalizeReportsWhatWasCleaned() {
        MockMultipartFile file = new MockMultipartFile("file", "payroll-export.csv", "text/csv",
                Fixtures.bytes("payroll-export.csv"));

        NormalizationResult result = service.normalize(file, null);
        NormalizationReport report = result.report();

        assertThat(report.charset()).isEqualTo("UTF-8");
        assertThat(report.delimiter()).isEqualTo(';');
        assertThat(report.rowsBeforeHeader()).isEqualTo(3);
        assertThat(report.keptColumns()).containsExactly("Názov", "Účet MD", "Účet Dal", "Stred.", "Zák.", "Činn.");
        assertThat(report.trailerRow()).isEqualTo(9);
        assertThat(report.filledNames()).isEqualTo(2);
        assertThat(report.removedSummaries()).isEqualTo(2);
        assertThat(report.excludedRows()).isEqualTo(1);
        assertThat(report.rowCount()).isEqualTo(5);
        assertThat(result.table().rows()).extracting(row -> row.get(0))
                .containsExactly("Hrubá mzda", "Hrubá mzda", "Odvody", "");
    }

    /**
     * Ensures exports saved in the Windows Central European code page decode to the same document.
     */
    @Test
    void convertDecodesWindows1250Input() {
        byte[] cp1250 = Fixtures.text("payroll-export.csv").getBytes(Charset.forName("windows-1250"));
        MockMultipartFile file = new MockMultipartFile("file", "payroll-export.csv", "text/csv", cp1250);

        ConversionResult result = service.convert(file, PAYROLL_ATTRIBUTES, ConversionOptions.defaults());

        assertThat(result.normalization().report().charset()).isEqualTo("windows-1250");
        assertThat(result.xml()).isEqualTo(Fixtures.text("payroll-export.xml"));
    }

    @Test
    void convertDropsExcludedRowAndEmitsBothSides() {
        String csv = "Názov;Účet MD;Účet Dal;Stred.;Zák.;Činn.\n"
                + "Mzdy;221;521;10;20;100,50\n"
                + "Výplata v hotovosti;;;;;\n";
        MockMultipartFile file = new MockMultipartFile("file", "mzdy.csv", "text/csv",
                csv.getBytes(StandardCharsets.UTF_8));

        ConversionResult result = service.convert(file, PAYROLL_ATTRIBUTES, ConversionOptions.defaults());

        assertThat(result.normalization().table().rows()).hasSize(1);
        assertThat(result.document().items()).containsExactly(
                new LineItem("100.50", "221", Side.DEBIT, "10", "20", "Mzdy"),
                new LineItem("100.50", "521", Side.CREDIT, "10", "20", "Mzdy"));
    }

    @Test
    void convertHonorsForcedDelimiterAndKeepEmpty() {
        String csv = "Názov,Účet MD,Účet Dal,Stred.,Zák.,Činn.\nMzdy,221,521,,,5\n";
        MockMultipartFile file = new MockMultipartFile("file", "mzdy.csv", "text/csv",
                csv.getBytes(StandardCharsets.UTF_8));

        ConversionResult result = service.convert(file, PAYROLL_ATTRIBUTES,
                new ConversionOptions(',', true, false));

        assertThat(result.normalization().report().delimiter()).isEqualTo(',');
        assertThat(result.xml()).contains("<polozka_ud suma=\"5\" ucet=\"221\" strana=\"M\" os=\"\" eo=\"\" text_pud=\"Mzdy\"/>");
    }

    /**
     * Ensures strict runs reject blank document attributes before reading the file.
     */
    @Test
    void convertRequiresAttributesWhenAsked() {
        MockMultipartFile file = new MockMultipartFile("file", "mzdy.csv", "text/csv", new byte[] {1});
        DocumentAttributes incomplete = new DocumentAttributes("1", "", "1", "ID", " ", "T");

        DocumentAttributesValidationException ex = assertThrows(DocumentAttributesValidationException.class,
                () -> service.convert(file, incomplete, new ConversionOptions(null, null, true)));

        assertThat(ex.getMessage()).contains("datum_ud", "typ_ud");
    }

    @Test
    void convertRejectsEmptyUpload() {
        MockMultipartFile file = new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]);

        assertThrows(CsvFileRequiredException.class,
                () -> service.convert(file, PAYROLL_ATTRIBUTES, ConversionOptions.defaults()));
    }

    @Test
    void convertFailsWhenHeaderIsMissing() {
        MockMultipartFile file = new MockMultipartFile("file", "other.csv", "text/csv",
                "a;b;c\n1;2;3\n".getBytes(StandardCharsets.UTF_8));

        assertThrows(HeaderNotFoundException.class,
                () -> service.convert(file, PAYROLL_ATTRIBUTES, ConversionOptions.defaults()));
    }

    @Test
    void convertReadsFileFromDisk() throws IOException {
        Path csv = tempDir.resolve("payroll-export.csv");
        Files.write(csv, Fixtures.bytes("payroll-export.csv"));

        ConversionResult result = service.convert(csv, PAYROLL_ATTRIBUTES, ConversionOptions.defaults());

        assertThat(result.fileName()).isEqualTo("payroll-export.csv");
        assertThat(result.xml()).isEqualTo(Fixtures.text("payroll-export.xml"));
    }

    @Test
    void convertReportsMissingPath() {
        Path missing = tempDir.resolve("missing.csv");

        assertThrows(CsvNotFoundException.class,
                () -> service.convert(missing, PAYROLL_ATTRIBUTES, ConversionOptions.defaults()));
    }
}
