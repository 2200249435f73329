package com.guno.bulkimport.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.bulkimport.config.ImportProperties;
import com.guno.bulkimport.exception.RowValidationException;
import com.guno.bulkimport.schema.FieldDef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Field Value Converter - coerces a trimmed cell into the Java value stored for a field
 */
@Component
@RequiredArgsConstructor
public class FieldValueConverter {

    private final ImportProperties properties;
    private final ObjectMapper objectMapper;

    public Object convert(String header, FieldDef field, String raw) {
        String value = raw.trim();
        ImportProperties.ValueSettings settings = properties.getValues();

        return switch (field.getType()) {
            case BOOLEAN -> toBoolean(header, value, settings);
            case INTEGER -> toLong(header, value);
            case DECIMAL -> toDecimal(header, value);
            case STRING -> toText(header, field, value);
            case DATE -> toDate(header, value, settings.getDateFormat());
            case DATETIME -> toDateTime(header, value, settings.getDateTimeFormat());
            case JSON -> toJson(header, value);
            case RELATION -> throw new IllegalArgumentException(header + " is resolved as a reference, not converted");
        };
    }

    private Boolean toBoolean(String header, String value, ImportProperties.ValueSettings settings) {
        String normalized = value.toLowerCase(Locale.ROOT);
        if (settings.getTrueValues().contains(normalized)) return Boolean.TRUE;
        if (settings.getFalseValues().contains(normalized)) return Boolean.FALSE;
        throw new RowValidationException(header + ": '" + value + "' is not a yes/no value.");
    }

    private Long toLong(String header, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new RowValidationException(header + ": '" + value + "' is not a whole number.");
        }
    }

    private BigDecimal toDecimal(String header, String value) {
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new RowValidationException(header + ": '" + value + "' is not a number.");
        }
    }

    private String toText(String header, FieldDef field, String value) {
        if (field.getMaxLength() != null && value.length() > field.getMaxLength()) {
            throw new RowValidationException(header + ": value is " + value.length()
                    + " characters long; the limit is " + field.getMaxLength() + ".");
        }
        return value;
    }

    private LocalDate toDate(String header, String value, String pattern) {
        try {
            return LocalDate.parse(value, DateTimeFormatter.ofPattern(pattern));
        } catch (DateTimeParseException e) {
            throw new RowValidationException(header + ": '" + value + "' is not a date in the format " + pattern + ".");
        }
    }

    private LocalDateTime toDateTime(String header, String value, String pattern) {
        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ofPattern(pattern));
        } catch (DateTimeParseException e) {
            throw new RowValidationException(header + ": '" + value + "' is not a date and time in the format "
                    + pattern + ".");
        }
    }

    private String toJson(String header, String value) {
        try {
            objectMapper.readTree(value);
            return value;
        } catch (JsonProcessingException e) {
            throw new RowValidationException(header + ": value is not valid JSON.");
        }
    }
}
