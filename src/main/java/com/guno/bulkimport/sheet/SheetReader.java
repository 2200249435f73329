package com.guno.bulkimport.sheet;

import com.guno.bulkimport.config.ImportProperties;
import com.guno.bulkimport.exception.SubmissionPlanningException;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Sheet Reader - parses an uploaded CSV submission into headers and ordered rows
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SheetReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ImportProperties properties;

    public ParsedSheet read(String fileName, InputStream inputStream) {
        return read(fileName, new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    public ParsedSheet read(String fileName, Reader source) {
        ImportProperties.CsvSettings csv = properties.getCsv();

        try (CSVReader reader = new CSVReaderBuilder(skipByteOrderMark(source))
                .withCSVParser(new CSVParserBuilder()
                        .withSeparator(csv.getDelimiter())
                        .withQuoteChar(csv.getQuoteChar())
                        .build())
                .build()) {

            String[] headerRow = reader.readNext();
            if (headerRow == null) {
                throw new SubmissionPlanningException("No rows were found in file " + fileName + ".");
            }

            List<String> headers = Arrays.stream(headerRow)
                    .map(h -> h == null ? "" : h.trim())
                    .toList();

            List<SheetRow> rows = new ArrayList<>();
            int rowNumber = 0;
            String[] line;
            while ((line = reader.readNext()) != null) {
                rowNumber++;
                if (rowNumber > csv.getMaxRows()) {
                    throw new SubmissionPlanningException("File " + fileName + " has more than "
                            + csv.getMaxRows() + " data rows.");
                }
                SheetRow row = new SheetRow(rowNumber, Arrays.asList(line));
                if (row.isBlank()) {
                    log.debug("Ignoring blank row {} of {}", rowNumber, fileName);
                    continue;
                }
                if (line.length > headers.size()) {
                    throw new SubmissionPlanningException("Row " + rowNumber + " has " + line.length
                            + " cells but the header row only has " + headers.size() + " columns.");
                }
                rows.add(row);
            }

            log.info("Read {} data rows and {} columns from {}", rows.size(), headers.size(), fileName);
            return new ParsedSheet(fileName, headers, rows);

        } catch (CsvValidationException e) {
            throw new SubmissionPlanningException("File " + fileName + " is not valid CSV: " + e.getMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + fileName, e);
        }
    }

    private Reader skipByteOrderMark(Reader source) throws IOException {
        BufferedReader buffered = new BufferedReader(source);
        buffered.mark(1);
        int first = buffered.read();
        if (first != BYTE_ORDER_MARK) {
            buffered.reset();
        }
        return buffered;
    }
}
