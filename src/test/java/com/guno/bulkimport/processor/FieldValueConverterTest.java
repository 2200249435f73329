package com.guno.bulkimport.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.bulkimport.config.ImportProperties;
import com.guno.bulkimport.exception.RowValidationException;
import com.guno.bulkimport.schema.FieldDef;
import com.guno.bulkimport.schema.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class FieldValueConverterTest {

    private FieldValueConverter converter;

    @BeforeEach
    void setUp() {
        converter = new FieldValueConverter(new ImportProperties(), new ObjectMapper());
    }

    @Test
    void shouldAcceptBooleanVocabulary() {
        FieldDef field = FieldDef.of("is_inactive", FieldType.BOOLEAN);

        assertThat(converter.convert("Grouping.is_inactive", field, "Yes")).isEqualTo(true);
        assertThat(converter.convert("Grouping.is_inactive", field, "checked")).isEqualTo(true);
        assertThat(converter.convert("Grouping.is_inactive", field, "N")).isEqualTo(false);
        assertThat(converter.convert("Grouping.is_inactive", field, "unchecked")).isEqualTo(false);
        assertThatThrownBy(() -> converter.convert("Grouping.is_inactive", field, "maybe"))
                .isInstanceOf(RowValidationException.class)
                .hasMessage("Grouping.is_inactive: 'maybe' is not a yes/no value.");
    }

    @Test
    void shouldParseDatesAndDateTimes() {
        assertThat(converter.convert("Person.birth_date", FieldDef.of("birth_date", FieldType.DATE), "1980-02-29"))
                .isEqualTo(LocalDate.of(1980, 2, 29));
        assertThat(converter.convert("Content.received_at", FieldDef.of("received_at", FieldType.DATETIME),
                "2021-06-01 13:45:00"))
                .isEqualTo(LocalDateTime.of(2021, 6, 1, 13, 45));
        assertThatThrownBy(() -> converter.convert("Person.birth_date",
                FieldDef.of("birth_date", FieldType.DATE), "01/02/1980"))
                .isInstanceOf(RowValidationException.class)
                .hasMessageContaining("yyyy-MM-dd");
    }

    @Test
    void shouldParseNumbers() {
        assertThat(converter.convert("Content.page_count", FieldDef.of("page_count", FieldType.INTEGER), " 12 "))
                .isEqualTo(12L);
        assertThat(converter.convert("Content.settlement_amount",
                FieldDef.of("settlement_amount", FieldType.DECIMAL), "1500.50"))
                .isEqualTo(new BigDecimal("1500.50"));
        assertThatThrownBy(() -> converter.convert("Content.page_count",
                FieldDef.of("page_count", FieldType.INTEGER), "12.5"))
                .isInstanceOf(RowValidationException.class)
                .hasMessageContaining("not a whole number");
    }

    @Test
    void shouldEnforceMaxLength() {
        FieldDef code = FieldDef.string("code", 3, false);

        assertThat(converter.convert("Grouping.code", code, "ABC")).isEqualTo("ABC");
        assertThatThrownBy(() -> converter.convert("Grouping.code", code, "ABCD"))
                .isInstanceOf(RowValidationException.class)
                .hasMessageContaining("the limit is 3");
    }

    @Test
    void shouldValidateJson() {
        FieldDef details = FieldDef.of("details", FieldType.JSON);

        assertThat(converter.convert("Content.details", details, "{\"pages\": [1, 2]}"))
                .isEqualTo("{\"pages\": [1, 2]}");
        assertThatThrownBy(() -> converter.convert("Content.details", details, "{pages"))
                .isInstanceOf(RowValidationException.class)
                .hasMessageContaining("not valid JSON");
    }
}
