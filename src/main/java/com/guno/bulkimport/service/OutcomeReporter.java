package com.guno.bulkimport.service;

import com.guno.bulkimport.dto.EntityCounts;
import com.guno.bulkimport.entity.RowOutcome;
import com.guno.bulkimport.entity.Submission;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome Reporter - per-entity-type counts and the downloadable CSV detail report
 */
@Component
@Slf4j
public class OutcomeReporter {

    static final String[] REPORT_HEADER = {"row", "entity_type", "origin", "outcome", "instance_id", "errors"};

    public ImportReport report(Submission submission, List<RowOutcome> outcomes) {
        List<String> order = submission.getPlanOrder();
        List<RowOutcome> sorted = outcomes.stream().sorted(reportOrder(order)).toList();
        return ImportReport.builder()
                .submission(submission)
                .counts(count(sorted, order))
                .outcomes(sorted)
                .build();
    }

    public Map<String, EntityCounts> count(List<RowOutcome> outcomes, List<String> entityOrder) {
        Map<String, EntityCounts> counts = new LinkedHashMap<>();
        entityOrder.forEach(type -> counts.put(type, new EntityCounts()));
        for (RowOutcome outcome : outcomes) {
            counts.computeIfAbsent(outcome.getEntityType(), k -> new EntityCounts()).add(outcome.getAction());
        }
        return counts;
    }

    /**
     * Write the detail report; the writer is flushed but left open
     */
    public void writeCsv(ImportReport report, Writer writer) {
        CSVWriter csvWriter = new CSVWriter(writer,
                ICSVWriter.DEFAULT_SEPARATOR,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                ICSVWriter.DEFAULT_LINE_END);

        csvWriter.writeNext(REPORT_HEADER, false);
        for (RowOutcome outcome : report.getOutcomes()) {
            csvWriter.writeNext(new String[]{
                    String.valueOf(outcome.getRowNumber()),
                    outcome.getEntityType(),
                    outcome.getOrigin().name(),
                    outcome.getAction().name(),
                    outcome.getInstanceId() == null ? "" : String.valueOf(outcome.getInstanceId()),
                    outcome.getErrorText()
            }, false);
        }
        try {
            csvWriter.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write import report", e);
        }
        log.debug("Wrote {} report lines for submission #{}",
                report.getOutcomes().size(), report.getSubmission().getId());
    }

    /**
     * Row number, then planned entity-type order, then origin
     */
    private Comparator<RowOutcome> reportOrder(List<String> entityOrder) {
        return Comparator.comparingInt(RowOutcome::getRowNumber)
                .thenComparingInt(o -> position(entityOrder, o.getEntityType()))
                .thenComparing(RowOutcome::getOrigin)
                .thenComparingLong(RowOutcome::getSequence);
    }

    private int position(List<String> entityOrder, String entityType) {
        int index = entityOrder.indexOf(entityType);
        return index < 0 ? Integer.MAX_VALUE : index;
    }
}
