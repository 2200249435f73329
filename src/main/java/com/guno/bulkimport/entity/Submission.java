package com.guno.bulkimport.entity;

import com.guno.bulkimport.dto.EntityCounts;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Submission Entity - Maps to import_submission table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Submission {

    private Long id;
    private String fileName;
    private ImportAction action;
    @Builder.Default private boolean dryRun = false;
    @Builder.Default private SubmissionStatus status = SubmissionStatus.CREATED;

    @Builder.Default private LocalDateTime createdAt = LocalDateTime.now();
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default private List<String> planOrder = new ArrayList<>();
    @Builder.Default private Map<String, EntityCounts> counts = new LinkedHashMap<>();

    @Builder.Default private Integer totalRows = 0;
    @Builder.Default private Integer processedRows = 0;

    private String errors;

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean hasErrors() {
        return (errors != null && !errors.isBlank())
                || counts.values().stream().anyMatch(c -> c.getErrored() > 0);
    }
}
