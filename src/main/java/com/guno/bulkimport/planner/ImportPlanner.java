package com.guno.bulkimport.planner;

import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.exception.SubmissionPlanningException;
import com.guno.bulkimport.mapper.ColumnMapping;
import com.guno.bulkimport.mapper.ColumnSpec;
import com.guno.bulkimport.mapper.ResolutionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Import Planner - dependency graph of the entity types in a submission and its topological order.
 * Ties are broken by header order so the same file always plans the same way.
 */
@Component
@Slf4j
public class ImportPlanner {

    public ImportPlan plan(ColumnMapping mapping, ImportAction action) {
        List<String> types = mapping.getEntityTypes();
        Map<String, Set<String>> dependencies = buildGraph(mapping);

        List<String> order = new ArrayList<>();
        Set<String> remaining = new LinkedHashSet<>(types);

        while (!remaining.isEmpty()) {
            String next = null;
            for (String candidate : remaining) {
                if (isReady(candidate, dependencies, remaining)) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                List<String> cycle = cycleMembers(remaining, dependencies);
                log.warn("❌ Circular dependency between {}", cycle);
                throw new SubmissionPlanningException("Entity types " + String.join(", ", cycle)
                        + " reference each other in a cycle; split them into separate submissions.");
            }
            order.add(next);
            remaining.remove(next);
        }

        Set<String> sequential = new LinkedHashSet<>();
        for (ColumnSpec column : mapping.getColumns()) {
            if (column.getKind() == ResolutionKind.IMPLICIT_TOKEN_REFERENCE && column.isSelfReference()) {
                sequential.add(column.getEntityType());
            }
        }

        log.info("📋 Planned entity order {} (sequential: {})", order, sequential);
        return ImportPlan.builder()
                .action(action)
                .mapping(mapping)
                .order(Collections.unmodifiableList(order))
                .dependencies(dependencies)
                .sequentialTypes(Collections.unmodifiableSet(sequential))
                .build();
    }

    private Map<String, Set<String>> buildGraph(ColumnMapping mapping) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (String type : mapping.getEntityTypes()) {
            Set<String> targets = new LinkedHashSet<>();
            for (ColumnSpec column : mapping.fieldColumns(type)) {
                String target = column.getTargetType();
                if (target != null && mapping.getColumnsByEntity().containsKey(target)) {
                    targets.add(target);
                }
            }
            dependencies.put(type, Collections.unmodifiableSet(targets));
        }
        return Collections.unmodifiableMap(dependencies);
    }

    private boolean isReady(String type, Map<String, Set<String>> dependencies, Set<String> remaining) {
        for (String target : dependencies.get(type)) {
            if (!target.equals(type) && remaining.contains(target)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Drops the types that merely depend on a cycle, leaving the types that form it
     */
    private List<String> cycleMembers(Set<String> remaining, Map<String, Set<String>> dependencies) {
        Set<String> members = new LinkedHashSet<>(remaining);
        boolean pruned = true;
        while (pruned) {
            pruned = false;
            for (String type : new ArrayList<>(members)) {
                boolean referenced = members.stream()
                        .anyMatch(other -> !other.equals(type) && dependencies.get(other).contains(type));
                if (!referenced) {
                    members.remove(type);
                    pruned = true;
                }
            }
        }
        return new ArrayList<>(members);
    }
}
