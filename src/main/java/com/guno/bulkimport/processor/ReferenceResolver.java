package com.guno.bulkimport.processor;

import com.guno.bulkimport.entity.OutcomeAction;
import com.guno.bulkimport.entity.OutcomeOrigin;
import com.guno.bulkimport.entity.RowOutcome;
import com.guno.bulkimport.exception.RowValidationException;
import com.guno.bulkimport.mapper.ColumnSpec;
import com.guno.bulkimport.repository.EntityStore;
import com.guno.bulkimport.repository.ExternalIdRepository;
import com.guno.bulkimport.repository.NaturalKeyService;
import com.guno.bulkimport.schema.EntitySchema;
import com.guno.bulkimport.schema.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reference Resolver - turns one reference cell into the id of the instance it points at.
 * Stubs and natural-value instances are created in their own unit of work and reported
 * through {@code created} as REFERENCE outcomes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceResolver {

    private final SchemaRegistry schemaRegistry;
    private final EntityStore entityStore;
    private final ExternalIdRepository externalIdRepository;
    private final NaturalKeyService naturalKeyService;
    private final FieldValueConverter converter;
    private final EntityValidator validator;

    public long resolve(ColumnSpec column, String raw, int rowNumber, ProcessingContext context,
                        List<RowOutcome> created) {
        String value = raw.trim();
        return switch (column.getKind()) {
            case PRIMARY_KEY_REFERENCE -> byPrimaryKey(column, value);
            case EXTERNAL_ID_REFERENCE -> byExternalId(column, value, rowNumber, context, created);
            case NATURAL_VALUE_REFERENCE -> byNaturalValue(column, value, rowNumber, context, created);
            case IMPLICIT_TOKEN_REFERENCE -> context.getTokens()
                    .resolve(column.getHeader(), column.getTargetType(), value, rowNumber);
            case DIRECT_VALUE -> throw new IllegalArgumentException(column.getHeader() + " is not a reference");
        };
    }

    // ================================
    // PRIMARY KEY
    // ================================

    private long byPrimaryKey(ColumnSpec column, String value) {
        long id;
        try {
            id = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new RowValidationException(column.getHeader() + ": '" + value + "' is not a valid id.");
        }
        if (!entityStore.exists(column.getTargetType(), id)) {
            throw new RowValidationException(column.getHeader() + ": no " + column.getTargetType()
                    + " with id " + id + " exists.");
        }
        return id;
    }

    // ================================
    // EXTERNAL ID
    // ================================

    private long byExternalId(ColumnSpec column, String key, int rowNumber, ProcessingContext context,
                              List<RowOutcome> created) {
        String target = column.getTargetType();
        Optional<Long> mapped = externalIdRepository.findInstanceId(target, key);
        if (mapped.isPresent()) {
            return mapped.get();
        }
        if (!context.getAction().permitsCreation()) {
            throw new RowValidationException(column.getHeader() + ": no " + target
                    + " with external ID '" + key + "' exists.");
        }

        Long id = context.getUnitOfWork().execute(status -> {
            long stubId = entityStore.create(target, Map.of());
            externalIdRepository.register(target, key, stubId, context.getSubmissionId());
            return stubId;
        });
        log.debug("Created stub {} #{} for external ID {} (row {})", target, id, key, rowNumber);
        created.add(referenceOutcome(rowNumber, target, id));
        return id;
    }

    // ================================
    // NATURAL VALUE
    // ================================

    private long byNaturalValue(ColumnSpec column, String value, int rowNumber, ProcessingContext context,
                                List<RowOutcome> created) {
        String target = column.getTargetType();
        Optional<Long> found;
        try {
            found = naturalKeyService.find(target, value);
        } catch (RowValidationException e) {
            throw new RowValidationException(column.getHeader() + ": " + e.getMessage());
        }
        if (found.isPresent()) {
            return found.get();
        }
        if (!context.getAction().permitsCreation()) {
            throw new RowValidationException(column.getHeader() + ": no " + target + " named '" + value + "' exists.");
        }

        EntitySchema schema = schemaRegistry.get(target);
        Object naturalValue = converter.convert(column.getHeader(), schema.naturalKeyField(), value);
        List<String> problems = validator.validate(schema, Map.of(schema.getNaturalKey(), naturalValue));
        if (!problems.isEmpty()) {
            throw new RowValidationException(problems);
        }

        Long id = context.getUnitOfWork().execute(status -> naturalKeyService.create(target, naturalValue.toString()));
        created.add(referenceOutcome(rowNumber, target, id));
        return id;
    }

    private RowOutcome referenceOutcome(int rowNumber, String entityType, long instanceId) {
        return RowOutcome.builder()
                .rowNumber(rowNumber)
                .entityType(entityType)
                .origin(OutcomeOrigin.REFERENCE)
                .action(OutcomeAction.CREATED)
                .instanceId(instanceId)
                .build();
    }
}
