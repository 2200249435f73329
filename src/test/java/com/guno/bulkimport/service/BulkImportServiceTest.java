package com.guno.bulkimport.service;

import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.entity.OutcomeAction;
import com.guno.bulkimport.entity.OutcomeOrigin;
import com.guno.bulkimport.entity.RowOutcome;
import com.guno.bulkimport.entity.Submission;
import com.guno.bulkimport.entity.SubmissionStatus;
import com.guno.bulkimport.exception.SubmissionNotFoundException;
import com.guno.bulkimport.exception.SubmissionPlanningException;
import com.guno.bulkimport.planner.ImportPlan;
import com.guno.bulkimport.processor.CancellationRegistry;
import com.guno.bulkimport.processor.SubmissionEngine;
import com.guno.bulkimport.repository.ExternalIdRepository;
import com.guno.bulkimport.sheet.ParsedSheet;
import com.guno.bulkimport.sheet.SheetReader;
import com.guno.bulkimport.support.ImportTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * BulkImportService Test - end-to-end submissions against the H2 records catalog
 */
@Slf4j
class BulkImportServiceTest extends ImportTestSupport {

    @Autowired private BulkImportService bulkImportService;
    @Autowired private ExternalIdRepository externalIdRepository;
    @Autowired private SubmissionEngine submissionEngine;
    @Autowired private SheetReader sheetReader;
    @Autowired private CancellationRegistry cancellationRegistry;

    @Test
    void shouldCreateThenUpdateByExternalId() {
        ImportReport created = bulkImportService.commit("people.csv", csv(
                "Person.name,Person.external_id",
                "Jane Doe,P-100",
                "John Roe,P-101"), ImportAction.CREATE);

        assertThat(created.getSubmission().getStatus()).isEqualTo(SubmissionStatus.COMMITTED);
        assertThat(created.countsFor("Person").getCreated()).isEqualTo(2);
        assertThat(count("rec_person")).isEqualTo(2);
        long janeId = externalIdRepository.findInstanceId("Person", "P-100").orElseThrow();
        long johnId = externalIdRepository.findInstanceId("Person", "P-101").orElseThrow();

        ImportReport updated = bulkImportService.commit("people-update.csv", csv(
                "Person.external_id,Person.name",
                "P-100,Jane R. Doe"), ImportAction.UPDATE);

        assertThat(updated.getSubmission().getStatus()).isEqualTo(SubmissionStatus.COMMITTED);
        assertThat(updated.count(OutcomeAction.UPDATED)).isEqualTo(1);
        assertThat(updated.count(OutcomeAction.CREATED)).isZero();
        assertThat(personName(janeId)).isEqualTo("Jane R. Doe");
        assertThat(personName(johnId)).isEqualTo("John Roe");
        assertThat(count("rec_person")).isEqualTo(2);

        log.info("✅ Create then update by external ID completed");
    }

    @Test
    void shouldCommitValidRowsAndRecordOneErrorPerInvalidRow() {
        ImportReport report = bulkImportService.commit("partial.csv", csv(
                "Person.name,Person.birth_date",
                "Ann,1970-01-01",
                "Ben,1971-02-02",
                "Cal,not-a-date",
                "Dee,1973-04-04",
                "Eve,1974-05-05"), ImportAction.CREATE);

        assertThat(report.getSubmission().getStatus()).isEqualTo(SubmissionStatus.PARTIALLY_COMMITTED);
        assertThat(count("rec_person")).isEqualTo(4);
        assertThat(report.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getRowNumber()).isEqualTo(3);
            assertThat(error.getErrorText()).contains("Person.birth_date: 'not-a-date'");
            assertThat(error.getInstanceId()).isNull();
        });
        assertThat(report.countsFor("Person").getCreated()).isEqualTo(4);
        assertThat(report.countsFor("Person").getErrored()).isEqualTo(1);
    }

    @Test
    void shouldEndValidationFailedWhenEveryRowFails() {
        ImportReport report = bulkImportService.commit("bad.csv", csv(
                "Person.notes",
                "no name here",
                "nor here"), ImportAction.CREATE);

        assertThat(report.getSubmission().getStatus()).isEqualTo(SubmissionStatus.VALIDATION_FAILED);
        assertThat(report.getErrors()).hasSize(2)
                .allSatisfy(e -> assertThat(e.getErrorText()).isEqualTo("Person.name is required."));
        assertThat(count("rec_person")).isZero();
    }

    @Test
    void shouldBeIdempotentByExternalId() {
        String[] lines = {"Person.name,Person.external_id", "Jane Doe,P-100", "John Roe,P-101"};

        bulkImportService.commit("first.csv", csv(lines), ImportAction.CREATE);
        ImportReport second = bulkImportService.commit("second.csv", csv(lines), ImportAction.CREATE);

        assertThat(count("rec_person")).isEqualTo(2);
        assertThat(second.count(OutcomeAction.UPDATED)).isEqualTo(2);
        assertThat(count("import_external_id")).isEqualTo(2);
    }

    @Test
    void shouldUpdateOnlySuppliedFields() {
        bulkImportService.commit("create.csv", csv(
                "Person.name,Person.notes,Person.is_law_enforcement,Person.external_id",
                "Jane Doe,likes tea,no,P-1"), ImportAction.CREATE);
        long id = externalIdRepository.findInstanceId("Person", "P-1").orElseThrow();

        bulkImportService.commit("update.csv", csv(
                "Person.external_id,Person.notes,Person.name",
                "P-1,likes coffee,"), ImportAction.UPDATE);

        assertThat(personName(id)).isEqualTo("Jane Doe");
        assertThat(jdbcTemplate.queryForObject("SELECT notes FROM rec_person WHERE id = ?", String.class, id))
                .isEqualTo("likes coffee");
        assertThat(jdbcTemplate.queryForObject("SELECT is_law_enforcement FROM rec_person WHERE id = ?",
                Boolean.class, id)).isFalse();
    }

    @Test
    void shouldFailUpdateOfUnknownOrConflictingIdentifiers() {
        bulkImportService.commit("create.csv", csv(
                "Person.name,Person.external_id",
                "Jane Doe,P-1",
                "John Roe,P-2"), ImportAction.CREATE);
        long johnId = externalIdRepository.findInstanceId("Person", "P-2").orElseThrow();

        ImportReport report = bulkImportService.commit("update.csv", csv(
                "Person.id,Person.external_id,Person.name",
                ",P-404,Nobody",
                johnId + ",P-1,Renamed"), ImportAction.UPDATE);

        assertThat(report.getSubmission().getStatus()).isEqualTo(SubmissionStatus.VALIDATION_FAILED);
        List<RowOutcome> errors = report.getErrors();
        assertThat(errors).hasSize(2);
        assertThat(errors.get(0).getErrorText()).contains("no Person with external ID 'P-404' exists");
        assertThat(errors.get(1).getErrorText()).contains("External ID P-1 for Person is already registered");
        assertThat(personName(johnId)).isEqualTo("John Roe");
    }

    @Test
    void shouldCreateStubsAndNaturalValueTargets() {
        ImportReport report = bulkImportService.commit("identifiers.csv", csv(
                "Person.name,Person.external_id,Person.employer.externalid,"
                        + "PersonIdentifier.person.externalid,PersonIdentifier.identifier_type,PersonIdentifier.identifier",
                "Jane Doe,P-1,G-1,P-1,Badge,123",
                "John Roe,P-2,G-1,P-2,BADGE,456"), ImportAction.CREATE);

        assertThat(report.getSubmission().getStatus()).isEqualTo(SubmissionStatus.COMMITTED);
        assertThat(report.getSubmission().getPlanOrder()).containsExactly("Person", "PersonIdentifier");
        assertThat(count("rec_grouping")).isEqualTo(1);
        assertThat(count("rec_identifier_type")).isEqualTo(1);
        assertThat(count("rec_person_identifier")).isEqualTo(2);

        List<RowOutcome> references = report.getOutcomes().stream()
                .filter(o -> o.getOrigin() == OutcomeOrigin.REFERENCE)
                .toList();
        assertThat(references).extracting(RowOutcome::getRowNumber, RowOutcome::getEntityType)
                .containsExactly(tuple(1, "Grouping"), tuple(1, "IdentifierType"));

        Long employer = jdbcTemplate.queryForObject(
                "SELECT employer_grouping_id FROM rec_person WHERE id = ?", Long.class,
                externalIdRepository.findInstanceId("Person", "P-2").orElseThrow());
        assertThat(employer).isEqualTo(externalIdRepository.findInstanceId("Grouping", "G-1").orElseThrow());
    }

    @Test
    void shouldNotCreateReferenceTargetsWhenUpdating() {
        bulkImportService.commit("create.csv", csv("Person.name,Person.external_id", "Jane Doe,P-1"),
                ImportAction.CREATE);

        ImportReport report = bulkImportService.commit("update.csv", csv(
                "Person.external_id,Person.employer",
                "P-1,Acme"), ImportAction.UPDATE);

        assertThat(report.getErrors()).singleElement()
                .extracting(RowOutcome::getErrorText).asString()
                .contains("no Grouping named 'Acme' exists");
        assertThat(count("rec_grouping")).isZero();
    }

    @Test
    void shouldResolveImplicitTokensInRowOrder() {
        ImportReport report = bulkImportService.commit("groupings.csv", csv(
                "Grouping.token,Grouping.name,Grouping.belongs_to.token,Person.name,Person.employer.token",
                "root,Root,,Jane Doe,child",
                "child,Child,root,,",
                "early,Early,late,,",
                "late,Late,,,",
                "self,Self,self,,",
                "root,Duplicate,,,"), ImportAction.CREATE);

        List<RowOutcome> groupings = report.rowOutcomes("Grouping");
        assertThat(groupings).extracting(RowOutcome::getAction).containsExactly(
                OutcomeAction.CREATED, OutcomeAction.CREATED, OutcomeAction.ERRORED,
                OutcomeAction.CREATED, OutcomeAction.ERRORED, OutcomeAction.ERRORED);
        assertThat(groupings.get(2).getErrorText()).contains("refers to row 4, which has not been processed yet");
        assertThat(groupings.get(4).getErrorText()).contains("refers to this same row");
        assertThat(groupings.get(5).getErrorText()).contains("already used by row 1");

        Long parent = jdbcTemplate.queryForObject(
                "SELECT belongs_to_grouping_id FROM rec_grouping WHERE id = ?", Long.class,
                groupings.get(1).getInstanceId());
        assertThat(parent).isEqualTo(groupings.get(0).getInstanceId());

        RowOutcome jane = report.rowOutcomes("Person").get(0);
        Long employer = jdbcTemplate.queryForObject(
                "SELECT employer_grouping_id FROM rec_person WHERE id = ?", Long.class, jane.getInstanceId());
        assertThat(employer).isEqualTo(groupings.get(1).getInstanceId());
    }

    @Test
    void shouldAbortCycleBeforeAnyWrite() {
        assertThatThrownBy(() -> bulkImportService.commit("cycle.csv", csv(
                "Person.name,Person.external_id,Person.employer.externalid,"
                        + "Grouping.name,Grouping.external_id,Grouping.contact_person.externalid",
                "Jane Doe,P-1,G-1,Acme,G-1,P-1"), ImportAction.CREATE))
                .isInstanceOf(SubmissionPlanningException.class)
                .hasMessageContaining("cycle");

        assertThat(count("rec_person")).isZero();
        assertThat(count("rec_grouping")).isZero();
        assertThat(count("import_external_id")).isZero();
        assertThat(count("import_row_outcome")).isZero();

        Submission failed = bulkImportService.history(1).get(0);
        assertThat(failed.getStatus()).isEqualTo(SubmissionStatus.PLANNING_FAILED);
        assertThat(failed.getErrors()).contains("Person, Grouping");
        assertThat(failed.isCompleted()).isTrue();
    }

    @Test
    void shouldRecordPlanningFailureOfUnreadableHeaders() {
        assertThatThrownBy(() -> bulkImportService.validate("bad.csv", csv("Person.nickname", "JD"),
                ImportAction.CREATE))
                .isInstanceOf(SubmissionPlanningException.class);

        assertThat(bulkImportService.history(1).get(0).getStatus()).isEqualTo(SubmissionStatus.PLANNING_FAILED);
    }

    @Test
    void shouldPlanWithoutWriting() {
        ImportPlan plan = bulkImportService.plan("plan.csv", csv(
                "PersonGrouping.person.externalid,PersonGrouping.grouping,Person.name,Person.external_id,Grouping.name",
                "P-1,Acme,Jane,P-1,Acme"), ImportAction.CREATE);

        assertThat(plan.getOrder()).containsExactly("Person", "Grouping", "PersonGrouping");
        assertThat(count("import_submission")).isZero();
    }

    @Test
    void shouldRejectReverseAsFileAction() {
        assertThatThrownBy(() -> bulkImportService.commit("reverse.csv", csv("Person.name", "Jane"),
                ImportAction.REVERSE))
                .isInstanceOf(SubmissionPlanningException.class)
                .hasMessageContaining("REVERSE");
    }

    @Test
    void shouldWriteCsvReportInRowOrder() {
        Submission submission = bulkImportService.commit("report.csv", csv(
                "Person.name,Person.employer.externalid",
                "Jane Doe,G-1",
                ",G-2"), ImportAction.CREATE).getSubmission();

        StringWriter writer = new StringWriter();
        bulkImportService.writeReport(submission.getId(), writer);
        String[] lines = writer.toString().split("\n");

        assertThat(lines[0]).isEqualTo("row,entity_type,origin,outcome,instance_id,errors");
        assertThat(lines).hasSize(5);
        assertThat(lines[1]).startsWith("1,Person,ROW,CREATED,");
        assertThat(lines[2]).startsWith("1,Grouping,REFERENCE,CREATED,");
        assertThat(lines[3]).startsWith("2,Person,ROW,ERRORED,,");
        assertThat(lines[3]).contains("Person.name is required.");
        assertThat(lines[4]).startsWith("2,Grouping,REFERENCE,CREATED,");
    }

    @Test
    void shouldListHistoryAndExportExternalIds() {
        bulkImportService.commit("a.csv", csv("Person.name,Person.external_id", "Jane,P-1"), ImportAction.CREATE);
        bulkImportService.validate("b.csv", csv("Person.name,Person.external_id", "John,P-2"), ImportAction.CREATE);

        List<Submission> history = bulkImportService.history(10);
        assertThat(history).extracting(Submission::getFileName).containsExactly("b.csv", "a.csv");
        assertThat(history.get(0).isDryRun()).isTrue();

        StringWriter writer = new StringWriter();
        int exported = bulkImportService.exportExternalIds("Person", writer);

        long janeId = externalIdRepository.findInstanceId("Person", "P-1").orElseThrow();
        assertThat(exported).isEqualTo(1);
        assertThat(writer.toString()).isEqualTo("external_id,instance_id\nP-1," + janeId + "\n");
    }

    @Test
    void shouldKeepDryRunOutcomesIdenticalToCommit() {
        String[] lines = {
                "Grouping.name,Grouping.external_id,Person.name,Person.external_id,Person.employer.externalid,"
                        + "PersonIdentifier.person.externalid,PersonIdentifier.identifier_type,PersonIdentifier.identifier",
                "Acme,G-1,Jane Doe,P-1,G-1,P-1,Badge,123",
                ",,John Roe,P-2,G-2,P-2,Badge,",
                ",,,P-3,G-1,,,"};

        ImportReport dryRun = bulkImportService.validate("people.csv", csv(lines), ImportAction.CREATE);

        assertThat(dryRun.getSubmission().getStatus()).isEqualTo(SubmissionStatus.VALIDATION_FAILED);
        assertThat(count("rec_person")).isZero();
        assertThat(count("rec_grouping")).isZero();
        assertThat(count("rec_identifier_type")).isZero();
        assertThat(count("import_external_id")).isZero();

        ImportReport committed = bulkImportService.commit("people.csv", csv(lines), ImportAction.CREATE);

        assertThat(committed.getSubmission().getStatus()).isEqualTo(SubmissionStatus.PARTIALLY_COMMITTED);
        assertThat(describe(dryRun)).isEqualTo(describe(committed));
        assertThat(dryRun.getCounts()).isEqualTo(committed.getCounts());
        assertThat(count("rec_person")).isEqualTo(2);
    }

    @Test
    void shouldMatchDryRunWhenRowsReferenceNamesDefinedByOtherRows() {
        List<String> lines = new ArrayList<>();
        lines.add("Grouping.name,Grouping.belongs_to");
        for (int i = 0; i < 50; i++) {
            lines.add("Parent " + i + ",");
            lines.add("Child " + i + ",PARENT " + i);
        }
        String[] file = lines.toArray(new String[0]);

        ImportReport dryRun = bulkImportService.validate("tree.csv", csv(file), ImportAction.CREATE);
        ImportReport committed = bulkImportService.commit("tree.csv", csv(file), ImportAction.CREATE);

        assertThat(describe(committed)).isEqualTo(describe(dryRun));
        assertThat(committed.getOutcomes()).noneMatch(o -> o.getOrigin() == OutcomeOrigin.REFERENCE);
        assertThat(count("rec_grouping")).isEqualTo(100);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM rec_grouping c JOIN rec_grouping p ON p.id = c.belongs_to_grouping_id "
                        + "WHERE c.name LIKE 'Child%' AND p.name LIKE 'Parent%'", Long.class)).isEqualTo(50);
    }

    @Test
    void shouldSkipRemainingRowsOfCancelledSubmission() {
        ParsedSheet sheet = sheetReader.read("cancel.csv", csv("Person.name", "Ann", "Ben", "Cal"));
        Submission submission = submissionEngine.register("cancel.csv", ImportAction.CREATE, false);
        cancellationRegistry.cancel(submission.getId());

        submissionEngine.execute(submission, sheet);

        ImportReport report = bulkImportService.report(submission.getId());
        assertThat(report.getSubmission().getStatus()).isEqualTo(SubmissionStatus.CANCELLED);
        assertThat(report.getOutcomes()).hasSize(3)
                .allSatisfy(o -> assertThat(o.getAction()).isEqualTo(OutcomeAction.SKIPPED));
        assertThat(count("rec_person")).isZero();
        assertThat(bulkImportService.cancel(submission.getId())).isFalse();
    }

    @Test
    void shouldProcessSubmittedFileInBackground() throws InterruptedException {
        long id = bulkImportService.submit("background.csv", csv("Person.name", "Ann", "Ben"),
                ImportAction.CREATE, false);

        Submission submission = bulkImportService.getSubmission(id);
        for (int attempt = 0; attempt < 100 && !submission.isCompleted(); attempt++) {
            Thread.sleep(100);
            submission = bulkImportService.getSubmission(id);
        }

        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.COMMITTED);
        assertThat(submission.getTotalRows()).isEqualTo(2);
        assertThat(submission.getProcessedRows()).isEqualTo(2);
        assertThat(count("rec_person")).isEqualTo(2);
    }

    @Test
    void shouldFailForUnknownSubmission() {
        assertThatThrownBy(() -> bulkImportService.report(123456L))
                .isInstanceOf(SubmissionNotFoundException.class);
    }

    // === Helper Methods ===

    private static List<String> describe(ImportReport report) {
        return report.getOutcomes().stream()
                .map(o -> o.getRowNumber() + " " + o.getEntityType() + " " + o.getOrigin() + " "
                        + o.getAction() + " " + o.getErrorText())
                .toList();
    }
}
