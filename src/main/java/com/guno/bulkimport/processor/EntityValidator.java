package com.guno.bulkimport.processor;

import com.guno.bulkimport.schema.EntityRule;
import com.guno.bulkimport.schema.EntitySchema;
import com.guno.bulkimport.schema.FieldDef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entity Validator - required fields and entity rules over the full set of values an instance will hold
 */
@Component
public class EntityValidator {

    public List<String> validate(EntitySchema schema, Map<String, Object> values) {
        List<String> errors = new ArrayList<>();

        for (FieldDef field : schema.requiredFields()) {
            if (values.get(field.getName()) == null) {
                errors.add(schema.getName() + "." + field.getName() + " is required.");
            }
        }

        for (EntityRule rule : schema.getRules()) {
            Optional<String> problem = rule.check(values);
            problem.ifPresent(p -> errors.add(schema.getName() + ": " + p + "."));
        }
        return errors;
    }
}
