package com.guno.bulkimport.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * External ID Mapping Entity - Maps to import_external_id table, unique per (entity_type, external_key)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExternalIdMapping {

    private String entityType;
    private String externalKey;
    private Long instanceId;
    private Long submissionId;
    @Builder.Default private LocalDateTime createdAt = LocalDateTime.now();
}
