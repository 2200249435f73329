package com.guno.bulkimport.schema;

import java.util.Map;
import java.util.Optional;

/**
 * Entity-level validation rule evaluated against the merged field values of one instance.
 * Returns an error message when the rule is violated.
 */
@FunctionalInterface
public interface EntityRule {

    Optional<String> check(Map<String, Object> values);
}
