package com.guno.bulkimport.schema;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entity Schema - static description of one importable entity type (table, fields, natural key, rules)
 */
@Getter
public class EntitySchema {

    private final String name;
    private final String table;
    private final String naturalKey;
    private final Map<String, FieldDef> fields;
    private final List<EntityRule> rules;

    private EntitySchema(Builder builder) {
        this.name = builder.name;
        this.table = builder.table;
        this.naturalKey = builder.naturalKey;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.rules = List.copyOf(builder.rules);
    }

    public Optional<FieldDef> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean hasNaturalKey() {
        return naturalKey != null;
    }

    public FieldDef naturalKeyField() {
        return naturalKey == null ? null : fields.get(naturalKey);
    }

    public List<FieldDef> requiredFields() {
        return fields.values().stream().filter(FieldDef::isRequired).toList();
    }

    public static Builder builder(String name, String table) {
        return new Builder(name, table);
    }

    public static class Builder {
        private final String name;
        private final String table;
        private String naturalKey;
        private final Map<String, FieldDef> fields = new LinkedHashMap<>();
        private final List<EntityRule> rules = new ArrayList<>();

        private Builder(String name, String table) {
            this.name = name;
            this.table = table;
        }

        public Builder naturalKey(String fieldName) {
            this.naturalKey = fieldName;
            return this;
        }

        public Builder field(FieldDef field) {
            if (fields.putIfAbsent(field.getName(), field) != null) {
                throw new IllegalArgumentException("Field " + field.getName() + " declared twice on " + name);
            }
            return this;
        }

        public Builder rule(EntityRule rule) {
            rules.add(rule);
            return this;
        }

        public EntitySchema build() {
            if (naturalKey != null && !fields.containsKey(naturalKey)) {
                throw new IllegalArgumentException("Natural key " + naturalKey + " is not a field of " + name);
            }
            return new EntitySchema(this);
        }
    }
}
