package com.guno.bulkimport.processor;

import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.entity.OutcomeAction;
import com.guno.bulkimport.entity.OutcomeOrigin;
import com.guno.bulkimport.entity.RowOutcome;
import com.guno.bulkimport.exception.ExternalIdConflictException;
import com.guno.bulkimport.exception.RowPersistenceException;
import com.guno.bulkimport.exception.RowValidationException;
import com.guno.bulkimport.mapper.ColumnMapping;
import com.guno.bulkimport.mapper.ColumnRole;
import com.guno.bulkimport.mapper.ColumnSpec;
import com.guno.bulkimport.mapper.ResolutionKind;
import com.guno.bulkimport.repository.EntityStore;
import com.guno.bulkimport.repository.ExternalIdRepository;
import com.guno.bulkimport.schema.EntitySchema;
import com.guno.bulkimport.schema.SchemaRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Row Processor - builds, validates and persists the instance one row defines for one entity type.
 * Every row-scoped failure ends up as an ERRORED outcome; nothing row-scoped escapes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RowProcessor {

    private final SchemaRegistry schemaRegistry;
    private final EntityStore entityStore;
    private final ExternalIdRepository externalIdRepository;
    private final ReferenceResolver referenceResolver;
    private final FieldValueConverter converter;
    private final EntityValidator validator;
    private final KeyLockRegistry keyLockRegistry;

    public RowOutcome process(RowInstance instance, ProcessingContext context) {
        ColumnMapping mapping = context.getPlan().getMapping();
        String entityType = instance.getEntityType();
        String ownToken = ownCell(instance, mapping, ColumnRole.OWN_TOKEN);

        List<RowOutcome> referenceOutcomes = new ArrayList<>();
        RowOutcome outcome;

        try (KeyLockRegistry.Held held = keyLockRegistry.acquire(lockKeys(instance, mapping))) {
            outcome = processLocked(instance, context, mapping, referenceOutcomes);

            referenceOutcomes.forEach(context.getLedger()::record);
            context.getLedger().record(outcome);

            if (ownToken != null && context.getTokens().isDeclaredBy(entityType, ownToken, instance.getRowNumber())) {
                if (outcome.isErrored()) {
                    context.getTokens().failed(entityType, ownToken);
                } else {
                    context.getTokens().resolved(entityType, ownToken, outcome.getInstanceId());
                }
            }
        }

        if (outcome.isErrored()) {
            log.debug("Row {} {} failed: {}", instance.getRowNumber(), entityType, outcome.getErrorText());
        }
        return outcome;
    }

    /**
     * Keys this row may read or register: its own external ID and natural value plus every
     * external ID or natural value it references
     */
    public Set<String> lockKeys(RowInstance instance, ColumnMapping mapping) {
        Set<String> keys = new LinkedHashSet<>();
        String entityType = instance.getEntityType();
        String naturalKey = schemaRegistry.get(entityType).getNaturalKey();

        String ownExternalId = ownCell(instance, mapping, ColumnRole.OWN_EXTERNAL_ID);
        if (ownExternalId != null) {
            keys.add(KeyLockRegistry.key(entityType, "ext", ownExternalId));
        }
        for (ColumnSpec column : mapping.fieldColumns(entityType)) {
            String raw = instance.cell(column.getIndex());
            if (raw == null) continue;
            if (column.getKind() == ResolutionKind.DIRECT_VALUE) {
                if (column.getField().getName().equals(naturalKey)) {
                    keys.add(KeyLockRegistry.key(entityType, "nat", raw.toLowerCase(Locale.ROOT)));
                }
            } else if (column.getKind() == ResolutionKind.EXTERNAL_ID_REFERENCE) {
                keys.add(KeyLockRegistry.key(column.getTargetType(), "ext", raw));
            } else if (column.getKind() == ResolutionKind.NATURAL_VALUE_REFERENCE) {
                keys.add(KeyLockRegistry.key(column.getTargetType(), "nat", raw.toLowerCase(Locale.ROOT)));
            }
        }
        return keys;
    }

    public RowOutcome skipped(RowInstance instance) {
        return RowOutcome.builder()
                .rowNumber(instance.getRowNumber())
                .entityType(instance.getEntityType())
                .origin(OutcomeOrigin.ROW)
                .action(OutcomeAction.SKIPPED)
                .errors(new ArrayList<>(List.of("Skipped because the submission was cancelled.")))
                .build();
    }

    // ================================
    // ROW PIPELINE
    // ================================

    private RowOutcome processLocked(RowInstance instance, ProcessingContext context, ColumnMapping mapping,
                                     List<RowOutcome> referenceOutcomes) {
        String entityType = instance.getEntityType();
        int rowNumber = instance.getRowNumber();
        List<String> errors = new ArrayList<>(instance.getPreErrors());

        // Step 1: direct values and references
        Map<String, Object> values = new LinkedHashMap<>();
        for (ColumnSpec column : mapping.fieldColumns(entityType)) {
            String raw = instance.cell(column.getIndex());
            if (raw == null) continue;
            try {
                Object value = column.isReference()
                        ? referenceResolver.resolve(column, raw, rowNumber, context, referenceOutcomes)
                        : converter.convert(column.getHeader(), column.getField(), raw);
                values.put(column.getField().getName(), value);
            } catch (RowValidationException e) {
                errors.addAll(e.getErrors());
            } catch (RowPersistenceException e) {
                errors.add(column.getHeader() + ": " + e.getMessage());
            } catch (DataAccessException e) {
                errors.add(column.getHeader() + ": " + e.getMostSpecificCause().getMessage());
            }
        }

        // Step 2: own identifiers
        Long ownId = null;
        String rawId = ownCell(instance, mapping, ColumnRole.OWN_PRIMARY_KEY);
        if (rawId != null) {
            try {
                ownId = Long.parseLong(rawId);
            } catch (NumberFormatException e) {
                errors.add(entityType + ".id: '" + rawId + "' is not a valid id.");
            }
        }
        String ownExternalId = ownCell(instance, mapping, ColumnRole.OWN_EXTERNAL_ID);

        if (!errors.isEmpty()) {
            return errored(instance, errors);
        }

        // Step 3: persist in the row's own unit of work
        Long targetId = ownId;
        try {
            Persisted persisted = context.getUnitOfWork().execute(status ->
                    persist(entityType, values, targetId, ownExternalId, context));
            return RowOutcome.builder()
                    .rowNumber(rowNumber)
                    .entityType(entityType)
                    .origin(OutcomeOrigin.ROW)
                    .action(persisted.getAction())
                    .instanceId(persisted.getInstanceId())
                    .build();
        } catch (RowValidationException e) {
            errors.addAll(e.getErrors());
        } catch (RowPersistenceException e) {
            errors.add(e.getMessage());
        } catch (DataAccessException e) {
            errors.add(e.getMostSpecificCause().getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Unexpected failure on row {} {}: {}", rowNumber, entityType, e.getMessage(), e);
            errors.add("Unexpected error: " + e.getMessage());
        }
        return errored(instance, errors);
    }

    private Persisted persist(String entityType, Map<String, Object> values, Long ownId, String ownExternalId,
                              ProcessingContext context) {
        EntitySchema schema = schemaRegistry.get(entityType);
        ImportAction action = context.getAction();

        Long targetId = null;
        if (ownId != null) {
            if (!entityStore.exists(entityType, ownId)) {
                throw new RowValidationException(entityType + ".id: no " + entityType + " with id " + ownId + " exists.");
            }
            targetId = ownId;
        }

        if (ownExternalId != null) {
            Optional<Long> mapped = externalIdRepository.findInstanceId(entityType, ownExternalId);
            if (mapped.isPresent()) {
                if (targetId != null && !mapped.get().equals(targetId)) {
                    throw new ExternalIdConflictException(entityType, ownExternalId, mapped.get(), targetId);
                }
                targetId = mapped.get();
            } else if (targetId == null && !action.permitsCreation()) {
                throw new RowValidationException(entityType + ".external_id: no " + entityType
                        + " with external ID '" + ownExternalId + "' exists.");
            }
        }

        if (targetId == null && !action.permitsCreation()) {
            throw new RowValidationException(entityType + ": an id or external_id is required to update a record.");
        }

        if (targetId != null) {
            long id = targetId;
            Map<String, Object> merged = new LinkedHashMap<>(entityStore.findById(entityType, id)
                    .orElseThrow(() -> new RowValidationException(entityType + " " + id + " no longer exists.")));
            merged.putAll(values);
            requireValid(schema, merged);

            entityStore.update(entityType, id, values);
            if (ownExternalId != null) {
                externalIdRepository.register(entityType, ownExternalId, id, context.getSubmissionId());
            }
            return new Persisted(OutcomeAction.UPDATED, id);
        }

        requireValid(schema, values);
        long id = entityStore.create(entityType, values);
        if (ownExternalId != null) {
            externalIdRepository.register(entityType, ownExternalId, id, context.getSubmissionId());
        }
        return new Persisted(OutcomeAction.CREATED, id);
    }

    private void requireValid(EntitySchema schema, Map<String, Object> values) {
        List<String> problems = validator.validate(schema, values);
        if (!problems.isEmpty()) {
            throw new RowValidationException(problems);
        }
    }

    // === Helper Methods ===

    private String ownCell(RowInstance instance, ColumnMapping mapping, ColumnRole role) {
        return mapping.ownColumn(instance.getEntityType(), role)
                .map(column -> instance.cell(column.getIndex()))
                .orElse(null);
    }

    private RowOutcome errored(RowInstance instance, List<String> errors) {
        return RowOutcome.builder()
                .rowNumber(instance.getRowNumber())
                .entityType(instance.getEntityType())
                .origin(OutcomeOrigin.ROW)
                .action(OutcomeAction.ERRORED)
                .errors(errors)
                .build();
    }

    @Getter
    @AllArgsConstructor
    private static class Persisted {
        private final OutcomeAction action;
        private final long instanceId;
    }
}
