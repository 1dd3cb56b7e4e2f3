package com.example.konvertor.interfaces.api;

import com.example.konvertor.application.service.ConversionService;
import com.example.konvertor.application.service.CsvExportService;
import com.example.konvertor.domain.model.ConversionOptions;
import com.example.konvertor.domain.model.ConversionResult;
import com.example.konvertor.domain.model.DocumentAttributes;
import com.example.konvertor.domain.model.NormalizationResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Interfaces-layer controller that accepts accounting CSV uploads and returns XML, cleaned CSV or a JSON preview.
 */
@Controller
@ResponseBody
public class ConversionController {

    private static final MediaType CSV_MEDIA_TYPE = MediaType.parseMediaType("text/csv");

    private final ConversionService conversionService;
    private final CsvExportService csvExportService;

    /**
     * Creates the controller with the required application services.
     *
     * @param conversionService service running the conversion pipeline
     * @param csvExportService  service writing the normalized table as CSV
     */
    public ConversionController(ConversionService conversionService, CsvExportService csvExportService) {
        this.conversionService = conversionService;
        this.csvExportService = csvExportService;
    }

    /**
     * Converts the uploaded CSV into an accounting document XML download.
     *
     * @param file       uploaded CSV export
     * @param attributes request parameters; the document attributes are read by their XML names
     * @param keepEmpty  whether empty attributes are written (optional)
     * @param delimiter  delimiter to force (optional)
     * @return XML document as a {@link ResponseEntity}
     */
    @PostMapping("/api/convert")
    public ResponseEntity<byte[]> convert(@RequestParam("file") MultipartFile file,
                                          @RequestParam Map<String, String> attributes,
                                          @RequestParam(value = "keepEmpty", required = false) Boolean keepEmpty,
                                          @RequestParam(value = "delimiter", required = false) String delimiter) {
        ConversionResult result = conversionService.convert(file, DocumentAttributes.fromMap(attributes),
                new ConversionOptions(ConversionOptions.parseDelimiter(delimiter), keepEmpty, false));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + xmlFileName(result.fileName()) + "\"")
                .contentType(MediaType.APPLICATION_XML)
                .body(result.xml().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the normalized table as a CSV download, encoded like the uploaded file.
     *
     * @param file      uploaded CSV export
     * @param delimiter delimiter to force (optional)
     * @return cleaned CSV as a {@link ResponseEntity}
     */
    @PostMapping("/api/normalize")
    public ResponseEntity<byte[]> normalize(@RequestParam("file") MultipartFile file,
                                            @RequestParam(value = "delimiter", required = false) String delimiter) {
        NormalizationResult result = conversionService.normalize(file, ConversionOptions.parseDelimiter(delimiter));
        String csv = csvExportService.export(result.table());
        Charset charset = result.report().charset() != null
                ? Charset.forName(result.report().charset())
                : StandardCharsets.UTF_8;
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"cleaned__" + fileName(file) + "\"")
                .contentType(new MediaType(CSV_MEDIA_TYPE, charset))
                .body(csv.getBytes(charset));
    }

    /**
     * JSON variant of {@link #convert} exposing the normalization report, the table and the document.
     *
     * @param file       uploaded CSV export
     * @param attributes request parameters; the document attributes are read by their XML names
     * @param keepEmpty  whether empty attributes are written (optional)
     * @param delimiter  delimiter to force (optional)
     * @return conversion result
     */
    @PostMapping(value = "/api/preview", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConversionResult> preview(@RequestParam("file") MultipartFile file,
                                                    @RequestParam Map<String, String> attributes,
                                                    @RequestParam(value = "keepEmpty", required = false) Boolean keepEmpty,
                                                    @RequestParam(value = "delimiter", required = false) String delimiter) {
        ConversionResult result = conversionService.convert(file, DocumentAttributes.fromMap(attributes),
                new ConversionOptions(ConversionOptions.parseDelimiter(delimiter), keepEmpty, false));
        return ResponseEntity.ok(result);
    }

    private String fileName(MultipartFile file) {
        String original = file.getOriginalFilename();
        return original == null || original.isBlank() ? "upload.csv" : original;
    }

    private String xmlFileName(String csvName) {
        int dot = csvName.lastIndexOf('.');
        return (dot > 0 ? csvName.substring(0, dot) : csvName) + ".xml";
    }
}
