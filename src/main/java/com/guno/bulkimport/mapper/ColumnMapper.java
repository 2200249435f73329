package com.guno.bulkimport.mapper;

import com.guno.bulkimport.config.ImportProperties;
import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.exception.SubmissionPlanningException;
import com.guno.bulkimport.schema.EntitySchema;
import com.guno.bulkimport.schema.FieldDef;
import com.guno.bulkimport.schema.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Column Mapper - decodes {@code Entity.field[.suffix]} headers into column specs.
 * Every problem found is collected and reported together as one planning failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ColumnMapper {

    static final String ID = "id";
    static final String EXTERNAL_ID = "external_id";
    static final String TOKEN = "token";

    private final SchemaRegistry schemaRegistry;
    private final ImportProperties properties;

    public ColumnMapping map(List<String> headers, ImportAction action) {
        List<String> problems = new ArrayList<>();
        List<ColumnSpec> columns = new ArrayList<>();

        Set<String> seenHeaders = new HashSet<>();
        Set<String> seenFields = new HashSet<>();
        Set<String> closedEntities = new HashSet<>();
        String previousEntity = null;

        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            int position = i + 1;

            if (header == null || header.isBlank()) {
                problems.add("Column " + position + " has no header.");
                continue;
            }
            if (!seenHeaders.add(header)) {
                problems.add("Column " + header + " appears more than once.");
                continue;
            }

            ColumnSpec column = decode(i, header, problems);
            if (column == null) continue;

            String entityType = column.getEntityType();
            if (!entityType.equals(previousEntity)) {
                if (previousEntity != null) closedEntities.add(previousEntity);
                if (closedEntities.contains(entityType)) {
                    problems.add("Columns for " + entityType + " must be next to each other; "
                            + header + " is separated from the other " + entityType + " columns.");
                }
                previousEntity = entityType;
            }

            String fieldKey = entityType + "." + (column.getField() == null
                    ? column.getRole().name() : column.getField().getName());
            if (!seenFields.add(fieldKey)) {
                problems.add("Column " + header + " sets a value that another column already sets.");
                continue;
            }
            columns.add(column);
        }

        ColumnMapping mapping = new ColumnMapping(columns);
        checkTokenTargets(mapping, problems);
        checkAction(mapping, action, problems);

        if (!problems.isEmpty()) {
            log.warn("❌ Column mapping failed with {} problem(s)", problems.size());
            throw new SubmissionPlanningException(problems);
        }

        log.info("Mapped {} columns across entity types {}", columns.size(), mapping.getEntityTypes());
        return mapping;
    }

    // === Header Decoding ===

    private ColumnSpec decode(int index, String header, List<String> problems) {
        String[] parts = header.split("\\.", -1);
        if (parts.length < 2 || parts.length > 3 || anyBlank(parts)) {
            problems.add("Column " + header + " is not of the form Entity.field or Entity.field.suffix.");
            return null;
        }

        String entityType = parts[0];
        String fieldName = parts[1];
        String suffix = parts.length == 3 ? parts[2] : null;

        EntitySchema schema = schemaRegistry.find(entityType).orElse(null);
        if (schema == null) {
            problems.add("Column " + header + " refers to unknown entity type " + entityType + ".");
            return null;
        }
        if (!properties.isEntityAllowed(entityType)) {
            problems.add("Column " + header + ": " + entityType + " records cannot be imported.");
            return null;
        }

        ColumnSpec.ColumnSpecBuilder column = ColumnSpec.builder()
                .index(index)
                .header(header)
                .entityType(entityType)
                .kind(ResolutionKind.DIRECT_VALUE);

        ColumnRole ownRole = ownRole(fieldName);
        if (ownRole != null) {
            if (suffix != null) {
                problems.add("Column " + header + ": " + fieldName + " does not take a suffix.");
                return null;
            }
            return column.role(ownRole).build();
        }

        if (properties.isFieldBlacklisted(fieldName)) {
            problems.add("Column " + header + ": field " + fieldName + " cannot be set by an import.");
            return null;
        }
        FieldDef field = schema.field(fieldName).orElse(null);
        if (field == null) {
            problems.add("Column " + header + ": " + entityType + " has no field " + fieldName + ".");
            return null;
        }
        column.role(ColumnRole.FIELD).field(field);

        if (suffix == null) {
            if (!field.isRelation()) {
                return column.build();
            }
            EntitySchema target = schemaRegistry.get(field.getTarget());
            if (!target.hasNaturalKey()) {
                problems.add("Column " + header + ": " + target.getName()
                        + " cannot be looked up by value; use " + header + ".pk, "
                        + header + ".externalid or " + header + ".token.");
                return null;
            }
            return column.kind(ResolutionKind.NATURAL_VALUE_REFERENCE).build();
        }

        ResolutionKind kind = ResolutionKind.fromSuffix(suffix);
        if (kind == null) {
            problems.add("Column " + header + " has unknown suffix " + suffix + ".");
            return null;
        }
        if (!field.isRelation()) {
            problems.add("Column " + header + ": " + fieldName + " is not a reference and takes no suffix.");
            return null;
        }
        return column.kind(kind).build();
    }

    private ColumnRole ownRole(String fieldName) {
        return switch (fieldName) {
            case ID -> ColumnRole.OWN_PRIMARY_KEY;
            case EXTERNAL_ID -> ColumnRole.OWN_EXTERNAL_ID;
            case TOKEN -> ColumnRole.OWN_TOKEN;
            default -> null;
        };
    }

    private boolean anyBlank(String[] parts) {
        for (String part : parts) {
            if (part.isBlank()) return true;
        }
        return false;
    }

    // === Submission-wide Checks ===

    private void checkTokenTargets(ColumnMapping mapping, List<String> problems) {
        for (ColumnSpec column : mapping.getColumns()) {
            if (column.getKind() == ResolutionKind.IMPLICIT_TOKEN_REFERENCE
                    && !mapping.hasOwnColumn(column.getTargetType(), ColumnRole.OWN_TOKEN)) {
                problems.add("Column " + column.getHeader() + " refers to " + column.getTargetType()
                        + " tokens but the file has no " + column.getTargetType() + "." + TOKEN + " column.");
            }
        }
    }

    private void checkAction(ColumnMapping mapping, ImportAction action, List<String> problems) {
        for (String entityType : mapping.getEntityTypes()) {
            boolean hasId = mapping.hasOwnColumn(entityType, ColumnRole.OWN_PRIMARY_KEY);
            boolean hasExternalId = mapping.hasOwnColumn(entityType, ColumnRole.OWN_EXTERNAL_ID);

            if (action == ImportAction.UPDATE && !hasId && !hasExternalId) {
                problems.add("Updating " + entityType + " records requires a " + entityType + "." + ID
                        + " or " + entityType + "." + EXTERNAL_ID + " column.");
            }
            if (action == ImportAction.CREATE && hasId) {
                problems.add("Creating " + entityType + " records cannot use a " + entityType + "." + ID
                        + " column; use " + entityType + "." + EXTERNAL_ID + " to match existing records.");
            }
        }
    }
}
