package com.example.konvertor.application.service;

import com.example.konvertor.application.exception.DocumentAttributesValidationException;
import com.example.konvertor.domain.exception.CsvFileRequiredException;
import com.example.konvertor.domain.exception.CsvNotFoundException;
import com.example.konvertor.domain.model.AccountingDocument;
import com.example.konvertor.domain.model.ConversionOptions;
import com.example.konvertor.domain.model.ConversionResult;
import com.example.konvertor.domain.model.DocumentAttributes;
import com.example.konvertor.domain.model.NormalizationResult;
import com.example.konvertor.domain.model.RawTable;
import com.example.konvertor.infrastructure.csv.CsvTableReader;
import com.example.konvertor.infrastructure.exception.CsvProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Application-layer service that orchestrates a conversion run: read the CSV, normalize the table,
 * assemble the accounting document and serialize it. Nothing is returned unless every stage succeeds.
 */
@Service
public class ConversionService {

    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    private final CsvTableReader csvTableReader;
    private final TableNormalizationService normalizationService;
    private final DocumentAssemblyService assemblyService;
    private final DocumentXmlSerializer xmlSerializer;
    private final boolean keepEmptyAttributesByDefault;

    /**
     * Creates the service with its pipeline stages.
     *
     * @param csvTableReader               decodes and splits the input
     * @param normalizationService         cleans the raw rows
     * @param assemblyService              maps rows to line items
     * @param xmlSerializer                renders the document
     * @param keepEmptyAttributesByDefault used when a request does not say whether to keep empty attributes
     */
    public ConversionService(CsvTableReader csvTableReader,
                             TableNormalizationService normalizationService,
                             DocumentAssemblyService assemblyService,
                             DocumentXmlSerializer xmlSerializer,
                             @Value("${konvertor.xml.keep-empty-attributes:false}") boolean keepEmptyAttributesByDefault) {
        this.csvTableReader = csvTableReader;
        this.normalizationService = normalizationService;
        this.assemblyService = assemblyService;
        this.xmlSerializer = xmlSerializer;
        this.keepEmptyAttributesByDefault = keepEmptyAttributesByDefault;
    }

    /**
     * Normalizes an uploaded CSV file.
     *
     * @param file      uploaded CSV
     * @param delimiter delimiter to force, or {@code null} to sniff it
     * @return normalized table with its report
     * @throws CsvFileRequiredException when the file is null or empty
     */
    public NormalizationResult normalize(MultipartFile file, Character delimiter) {
        return normalizeBytes(readUpload(file), delimiter);
    }

    /**
     * Normalizes a CSV file on disk.
     *
     * @param csvPath   path to the CSV file
     * @param delimiter delimiter to force, or {@code null} to sniff it
     * @return normalized table with its report
     * @throws CsvNotFoundException when the path does not exist
     */
    public NormalizationResult normalize(Path csvPath, Character delimiter) {
        return normalizeBytes(readPath(csvPath), delimiter);
    }

    /**
     * Runs the full conversion for an uploaded CSV file.
     *
     * @param file       uploaded CSV
     * @param attributes document header attributes
     * @param options    conversion switches
     * @return normalization outcome, document and XML
     */
    public ConversionResult convert(MultipartFile file, DocumentAttributes attributes, ConversionOptions options) {
        validateAttributes(attributes, options);
        return convertBytes(readUpload(file), resolveFileName(file), attributes, options);
    }

    /**
     * Runs the full conversion for a CSV file on disk.
     *
     * @param csvPath    path to the CSV file
     * @param attributes document header attributes
     * @param options    conversion switches
     * @return normalization outcome, document and XML
     */
    public ConversionResult convert(Path csvPath, DocumentAttributes attributes, ConversionOptions options) {
        validateAttributes(attributes, options);
        String fileName = csvPath.getFileName() != null ? csvPath.getFileName().toString() : "input.csv";
        return convertBytes(readPath(csvPath), fileName, attributes, options);
    }

    private ConversionResult convertBytes(byte[] bytes, String fileName, DocumentAttributes attributes,
                                          ConversionOptions options) {
        NormalizationResult normalization = normalizeBytes(bytes, options.delimiter());
        AccountingDocument document = assemblyService.assemble(normalization.table(), attributes);
        boolean keepEmpty = options.keepEmptyAttributes() != null
                ? options.keepEmptyAttributes()
                : keepEmptyAttributesByDefault;
        String xml = xmlSerializer.serialize(document, keepEmpty);
        log.info("Converted {}: {} line item(s), {} bytes of XML", fileName, document.items().size(), xml.length());
        return new ConversionResult(fileName, normalization, document, xml);
    }

    private NormalizationResult normalizeBytes(byte[] bytes, Character delimiter) {
        RawTable raw = csvTableReader.read(bytes, delimiter);
        return normalizationService.normalize(raw);
    }

    private void validateAttributes(DocumentAttributes attributes, ConversionOptions options) {
        if (!options.requireAllAttributes()) {
            return;
        }
        List<String> missing = attributes.missingNames();
        if (!missing.isEmpty()) {
            throw new DocumentAttributesValidationException(missing);
        }
    }

    private byte[] readUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new CsvFileRequiredException();
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new CsvProcessingException("Unable to read the uploaded CSV file.", e);
        }
    }

    private byte[] readPath(Path csvPath) {
        if (csvPath == null) {
            throw new CsvFileRequiredException();
        }
        if (!Files.exists(csvPath)) {
            throw new CsvNotFoundException(csvPath.toAbsolutePath().toString());
        }
        try {
            return Files.readAllBytes(csvPath);
        } catch (IOException e) {
            throw new CsvProcessingException("Unable to read the CSV at " + csvPath, e);
        }
    }

    private String resolveFileName(MultipartFile file) {
        String original = file.getOriginalFilename();
        return original == null || original.isBlank() ? "upload.csv" : original;
    }
}
