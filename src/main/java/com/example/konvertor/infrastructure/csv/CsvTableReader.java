package com.example.konvertor.infrastructure.csv;

import com.example.konvertor.domain.model.DecodedText;
import com.example.konvertor.domain.model.RawTable;
import com.example.konvertor.infrastructure.exception.CsvProcessingException;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure service that splits decoded CSV text into raw rows using Apache Commons CSV.
 * The delimiter is either forced by the caller or sniffed from the beginning of the text.
 */
@Service
public class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);
    private static final int SAMPLE_LENGTH = 4096;
    private static final char[] CANDIDATE_DELIMITERS = {';', ',', '\t', '|'};

    private final CharsetResolver charsetResolver;
    private final char defaultDelimiter;

    /**
     * Creates the reader.
     *
     * @param charsetResolver  decodes raw bytes
     * @param defaultDelimiter delimiter used when sniffing finds no candidate
     */
    public CsvTableReader(CharsetResolver charsetResolver,
                          @Value("${konvertor.csv.default-delimiter:;}") char defaultDelimiter) {
        this.charsetResolver = charsetResolver;
        this.defaultDelimiter = defaultDelimiter;
    }

    /**
     * Decodes and parses the bytes into ragged rows.
     *
     * @param bytes           raw file content
     * @param forcedDelimiter delimiter to use instead of sniffing, or {@code null}
     * @return rows together with the charset and delimiter used
     */
    public RawTable read(byte[] bytes, Character forcedDelimiter) {
        DecodedText decoded = charsetResolver.decode(bytes);
        char delimiter = forcedDelimiter != null ? forcedDelimiter : sniffDelimiter(decoded.text());
        return new RawTable(parse(decoded.text(), delimiter), decoded.charset(), delimiter);
    }

    /**
     * Picks the delimiter that splits the sampled lines most consistently.
     * A candidate earns a point for every non-empty sampled line containing it and a second point when
     * the line repeats the previous line's count. The highest score wins; ties keep the candidate order.
     *
     * @param text decoded CSV text
     * @return detected delimiter, or the configured default when no candidate occurs
     */
    char sniffDelimiter(String text) {
        String sample = text.length() > SAMPLE_LENGTH ? text.substring(0, SAMPLE_LENGTH) : text;
        List<String> lines = sample.lines().filter(line -> !line.isBlank()).toList();

        char best = 0;
        int bestScore = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int score = 0;
            int previous = -1;
            for (String line : lines) {
                int count = count(line, candidate);
                if (count > 0) {
                    score += count == previous ? 2 : 1;
                }
                previous = count;
            }
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == 0) {
            log.warn("Could not detect the CSV delimiter; falling back to '{}'.", defaultDelimiter);
            return defaultDelimiter;
        }
        log.debug("Detected CSV delimiter '{}'", best);
        return best;
    }

    private List<List<String>> parse(String text, char delimiter) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setQuote('"')
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(false)
                .build();
        List<List<String>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            for (CSVRecord record : parser) {
                rows.add(record.toList());
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new CsvProcessingException("Unable to parse the CSV content.", ex);
        } catch (IllegalStateException ex) {
            throw new CsvProcessingException("Malformed CSV content: " + ex.getMessage(), ex);
        }
        return rows;
    }

    private static int count(String line, char candidate) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == candidate) {
                count++;
            }
        }
        return count;
    }
}
