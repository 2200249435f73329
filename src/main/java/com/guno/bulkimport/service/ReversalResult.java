package com.guno.bulkimport.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of reversing a committed submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReversalResult {

    private Long submissionId;
    @Builder.Default private int deleted = 0;
    @Builder.Default private int mappingsRemoved = 0;
    @Builder.Default private int updatesLeftInPlace = 0;
    @Builder.Default private Map<String, Integer> deletedByType = new LinkedHashMap<>();
}
