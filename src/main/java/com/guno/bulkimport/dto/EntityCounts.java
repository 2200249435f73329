package com.guno.bulkimport.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.guno.bulkimport.entity.OutcomeAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate outcome counts for one entity type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityCounts {

    @Builder.Default private int created = 0;
    @Builder.Default private int updated = 0;
    @Builder.Default private int errored = 0;
    @Builder.Default private int skipped = 0;

    public void add(OutcomeAction action) {
        switch (action) {
            case CREATED -> created++;
            case UPDATED -> updated++;
            case ERRORED -> errored++;
            case SKIPPED -> skipped++;
        }
    }

    public void merge(EntityCounts other) {
        if (other == null) return;
        created += other.created;
        updated += other.updated;
        errored += other.errored;
        skipped += other.skipped;
    }

    public int getTotal() {
        return created + updated + errored + skipped;
    }
}
