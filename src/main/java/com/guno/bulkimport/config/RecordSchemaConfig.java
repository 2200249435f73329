package com.guno.bulkimport.config;

import com.guno.bulkimport.schema.EntitySchema;
import com.guno.bulkimport.schema.FieldDef;
import com.guno.bulkimport.schema.FieldType;
import com.guno.bulkimport.schema.SchemaRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Record Schema Configuration - entity types of the records-management system that can be bulk imported.
 * Table and column names here are the only identifiers ever concatenated into SQL.
 */
@Configuration
public class RecordSchemaConfig {

    public static final String IDENTIFIER_TYPE = "IdentifierType";
    public static final String RELATIONSHIP_TYPE = "RelationshipType";
    public static final String GROUPING = "Grouping";
    public static final String PERSON = "Person";
    public static final String PERSON_IDENTIFIER = "PersonIdentifier";
    public static final String PERSON_GROUPING = "PersonGrouping";
    public static final String PERSON_RELATIONSHIP = "PersonRelationship";
    public static final String CONTENT = "Content";

    @Bean
    public SchemaRegistry schemaRegistry() {
        return new SchemaRegistry(List.of(
                identifierType(),
                relationshipType(),
                grouping(),
                person(),
                personIdentifier(),
                personGrouping(),
                personRelationship(),
                content()
        ));
    }

    // ================================
    // LOOKUP TYPES
    // ================================

    static EntitySchema identifierType() {
        return EntitySchema.builder(IDENTIFIER_TYPE, "rec_identifier_type")
                .naturalKey("name")
                .field(FieldDef.string("name", 256, true))
                .build();
    }

    static EntitySchema relationshipType() {
        return EntitySchema.builder(RELATIONSHIP_TYPE, "rec_relationship_type")
                .naturalKey("name")
                .field(FieldDef.string("name", 256, true))
                .build();
    }

    // ================================
    // CORE RECORDS
    // ================================

    static EntitySchema grouping() {
        return EntitySchema.builder(GROUPING, "rec_grouping")
                .naturalKey("name")
                .field(FieldDef.string("name", 256, true))
                .field(FieldDef.string("code", 64, false))
                .field(FieldDef.string("description", 4000, false))
                .field(FieldDef.of("is_inactive", FieldType.BOOLEAN))
                .field(FieldDef.relation("belongs_to", "belongs_to_grouping_id", GROUPING, false))
                .field(FieldDef.relation("contact_person", "contact_person_id", PERSON, false))
                .build();
    }

    static EntitySchema person() {
        return EntitySchema.builder(PERSON, "rec_person")
                .field(FieldDef.string("name", 256, true))
                .field(FieldDef.of("birth_date", FieldType.DATE))
                .field(FieldDef.of("is_law_enforcement", FieldType.BOOLEAN))
                .field(FieldDef.string("notes", 4000, false))
                .field(FieldDef.relation("employer", "employer_grouping_id", GROUPING, false))
                .rule(values -> {
                    Object birthDate = values.get("birth_date");
                    if (birthDate instanceof LocalDate && ((LocalDate) birthDate).isAfter(LocalDate.now())) {
                        return Optional.of("Birth date " + birthDate + " is in the future");
                    }
                    return Optional.empty();
                })
                .build();
    }

    static EntitySchema personIdentifier() {
        return EntitySchema.builder(PERSON_IDENTIFIER, "rec_person_identifier")
                .field(FieldDef.relation("person", "person_id", PERSON, true))
                .field(FieldDef.relation("identifier_type", "identifier_type_id", IDENTIFIER_TYPE, true))
                .field(FieldDef.string("identifier", 256, true))
                .field(FieldDef.of("as_of", FieldType.DATE))
                .build();
    }

    static EntitySchema personGrouping() {
        return EntitySchema.builder(PERSON_GROUPING, "rec_person_grouping")
                .field(FieldDef.relation("person", "person_id", PERSON, true))
                .field(FieldDef.relation("grouping", "grouping_id", GROUPING, true))
                .field(FieldDef.of("is_inactive", FieldType.BOOLEAN))
                .field(FieldDef.of("as_of", FieldType.DATE))
                .build();
    }

    static EntitySchema personRelationship() {
        return EntitySchema.builder(PERSON_RELATIONSHIP, "rec_person_relationship")
                .field(FieldDef.relation("subject_person", "subject_person_id", PERSON, true))
                .field(FieldDef.relation("object_person", "object_person_id", PERSON, true))
                .field(FieldDef.relation("type", "type_id", RELATIONSHIP_TYPE, true))
                .rule(values -> {
                    Object subject = values.get("subject_person");
                    if (subject != null && Objects.equals(subject, values.get("object_person"))) {
                        return Optional.of("Subject and object of a relationship must be different people");
                    }
                    return Optional.empty();
                })
                .build();
    }

    static EntitySchema content() {
        return EntitySchema.builder(CONTENT, "rec_content")
                .field(FieldDef.string("name", 256, false))
                .field(FieldDef.of("publication_date", FieldType.DATE))
                .field(FieldDef.string("link", 2048, false))
                .field(FieldDef.string("description", 4000, false))
                .field(FieldDef.of("page_count", FieldType.INTEGER))
                .field(FieldDef.of("settlement_amount", FieldType.DECIMAL))
                .field(FieldDef.of("received_at", FieldType.DATETIME))
                .field(FieldDef.of("details", FieldType.JSON))
                .rule(values -> {
                    Object link = values.get("link");
                    if (link instanceof String) {
                        String url = (String) link;
                        if (!url.startsWith("http://") && !url.startsWith("https://")) {
                            return Optional.of("Link " + url + " must be an http:// or https:// URL");
                        }
                    }
                    return Optional.empty();
                })
                .build();
    }
}
