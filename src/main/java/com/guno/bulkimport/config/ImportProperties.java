package com.guno.bulkimport.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Bulk Import Configuration
 *
 * Usage in application.yml:
 * bulk-import:
 *   csv:
 *     delimiter: ","
 *   processing:
 *     parallelism: 4
 *   reversal:
 *     policy: REFUSE
 */
@Configuration
@ConfigurationProperties(prefix = "bulk-import")
@Data
public class ImportProperties {

    private CsvSettings csv = new CsvSettings();
    private ProcessingSettings processing = new ProcessingSettings();
    private ValueSettings values = new ValueSettings();
    private ReversalSettings reversal = new ReversalSettings();

    /** Entity types that may appear in a template; empty means every registered type */
    private List<String> allowedEntities = new ArrayList<>();

    /** Field names that may never be set through an import */
    private List<String> blacklistedFields = new ArrayList<>();

    @Data
    public static class CsvSettings {
        private char delimiter = ',';
        private char quoteChar = '"';
        private int maxRows = 10000;
    }

    @Data
    public static class ProcessingSettings {
        private int parallelism = 4;
        private int submissionWorkers = 2;
    }

    @Data
    public static class ValueSettings {
        private Set<String> trueValues = Set.of("true", "yes", "checked", "t", "y");
        private Set<String> falseValues = Set.of("false", "no", "unchecked", "f", "n");
        private String dateFormat = "yyyy-MM-dd";
        private String dateTimeFormat = "yyyy-MM-dd HH:mm:ss";
    }

    @Data
    public static class ReversalSettings {
        private ReversalPolicy policy = ReversalPolicy.REFUSE;
    }

    public enum ReversalPolicy {
        /** Refuse the whole reversal when the submission updated anything */
        REFUSE,
        /** Leave updated instances alone and delete only what the submission created */
        SKIP_UPDATES
    }

    // Convenience methods
    public boolean isEntityAllowed(String entityType) {
        return allowedEntities.isEmpty() || allowedEntities.contains(entityType);
    }

    public boolean isFieldBlacklisted(String fieldName) {
        return blacklistedFields.contains(fieldName);
    }
}
