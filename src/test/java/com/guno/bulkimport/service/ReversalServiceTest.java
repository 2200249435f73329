package com.guno.bulkimport.service;

import com.guno.bulkimport.config.ImportProperties;
import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.entity.OutcomeAction;
import com.guno.bulkimport.entity.Submission;
import com.guno.bulkimport.entity.SubmissionStatus;
import com.guno.bulkimport.exception.ReversalRefusedException;
import com.guno.bulkimport.exception.SubmissionPlanningException;
import com.guno.bulkimport.repository.ExternalIdRepository;
import com.guno.bulkimport.support.ImportTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.*;

/**
 * Reversal Service Test - undoing committed submissions
 */
@Slf4j
class ReversalServiceTest extends ImportTestSupport {

    @Autowired private BulkImportService bulkImportService;
    @Autowired private ReversalService reversalService;
    @Autowired private ExternalIdRepository externalIdRepository;
    @Autowired private ImportProperties properties;

    @AfterEach
    void resetPolicy() {
        properties.getReversal().setPolicy(ImportProperties.ReversalPolicy.REFUSE);
    }

    @Test
    void shouldDeleteEverythingACreateOnlySubmissionCreated() {
        Submission submission = commit(ImportAction.CREATE,
                "Person.name,Person.external_id,Person.employer.externalid",
                "Jane Doe,P-1,G-1",
                "John Roe,P-2,G-1");
        assertThat(count("rec_person")).isEqualTo(2);
        assertThat(count("rec_grouping")).isEqualTo(1);

        ReversalResult result = reversalService.reverse(submission.getId());

        assertThat(result.getDeleted()).isEqualTo(3);
        assertThat(result.getMappingsRemoved()).isEqualTo(3);
        assertThat(result.getDeletedByType()).containsEntry("Person", 2).containsEntry("Grouping", 1);
        assertThat(count("rec_person")).isZero();
        assertThat(count("rec_grouping")).isZero();
        assertThat(count("import_external_id")).isZero();
        assertThat(bulkImportService.getSubmission(submission.getId()).getStatus())
                .isEqualTo(SubmissionStatus.REVERSED);

        assertThatThrownBy(() -> reversalService.reverse(submission.getId()))
                .isInstanceOf(ReversalRefusedException.class)
                .hasMessageContaining("already been reversed");

        log.info("✅ Create-only submission reversed");
    }

    @Test
    void shouldDeleteReferencingRecordsBeforeTheirTargets() {
        Submission submission = commit(ImportAction.CREATE,
                "PersonIdentifier.person.externalid,PersonIdentifier.identifier_type,PersonIdentifier.identifier",
                "P-9,Badge,123",
                "P-9,Badge,456");
        assertThat(count("rec_person")).isEqualTo(1);
        assertThat(count("rec_identifier_type")).isEqualTo(1);
        assertThat(count("rec_person_identifier")).isEqualTo(2);

        ReversalResult result = reversalService.reverse(submission.getId());

        assertThat(result.getDeleted()).isEqualTo(4);
        assertThat(count("rec_person_identifier")).isZero();
        assertThat(count("rec_person")).isZero();
        assertThat(count("rec_identifier_type")).isZero();
    }

    @Test
    void shouldRefuseWhenExistingRecordsWereUpdated() {
        commit(ImportAction.CREATE, "Person.name,Person.external_id", "Jane Doe,P-1");
        Submission second = commit(ImportAction.CREATE,
                "Person.name,Person.external_id",
                "Jane R. Doe,P-1",
                "John Roe,P-2");

        assertThatThrownBy(() -> reversalService.reverse(second.getId()))
                .isInstanceOf(ReversalRefusedException.class)
                .hasMessageContaining("1 existing record(s) were updated");

        assertThat(count("rec_person")).isEqualTo(2);
        assertThat(count("import_external_id")).isEqualTo(2);
        assertThat(bulkImportService.getSubmission(second.getId()).getStatus())
                .isEqualTo(SubmissionStatus.COMMITTED);
    }

    @Test
    void shouldRefuseWhenAnInstanceCreatedBySameSubmissionWasUpdated() {
        Submission submission = commit(ImportAction.CREATE,
                "Grouping.name,Grouping.external_id,Grouping.belongs_to.externalid",
                "Child,C-1,G-1",
                "Parent,G-1,");
        ImportReport report = bulkImportService.report(submission.getId());
        assertThat(report.count(OutcomeAction.CREATED)).isEqualTo(2);
        assertThat(report.count(OutcomeAction.UPDATED)).isEqualTo(1);

        assertThatThrownBy(() -> reversalService.reverse(submission.getId()))
                .isInstanceOf(ReversalRefusedException.class)
                .hasMessageContaining("1 existing record(s) were updated");

        assertThat(count("rec_grouping")).isEqualTo(2);
        assertThat(count("import_external_id")).isEqualTo(2);
        assertThat(bulkImportService.getSubmission(submission.getId()).getStatus())
                .isEqualTo(SubmissionStatus.COMMITTED);
    }

    @Test
    void shouldLeaveUpdatesInPlaceWhenConfiguredTo() {
        properties.getReversal().setPolicy(ImportProperties.ReversalPolicy.SKIP_UPDATES);
        commit(ImportAction.CREATE, "Person.name,Person.external_id", "Jane Doe,P-1");
        long janeId = externalIdRepository.findInstanceId("Person", "P-1").orElseThrow();
        Submission second = commit(ImportAction.CREATE,
                "Person.name,Person.external_id",
                "Jane R. Doe,P-1",
                "John Roe,P-2");

        ReversalResult result = reversalService.reverse(second.getId());

        assertThat(result.getDeleted()).isEqualTo(1);
        assertThat(result.getUpdatesLeftInPlace()).isEqualTo(1);
        assertThat(count("rec_person")).isEqualTo(1);
        assertThat(personName(janeId)).isEqualTo("Jane R. Doe");
        assertThat(externalIdRepository.findInstanceId("Person", "P-1")).contains(janeId);
        assertThat(externalIdRepository.findInstanceId("Person", "P-2")).isEmpty();
    }

    @Test
    void shouldRollBackWhenCreatedRecordsAreStillReferenced() {
        Submission people = commit(ImportAction.CREATE, "Person.name,Person.external_id", "Jane Doe,P-1");
        commit(ImportAction.CREATE,
                "PersonIdentifier.person.externalid,PersonIdentifier.identifier_type,PersonIdentifier.identifier",
                "P-1,Badge,123");

        assertThatThrownBy(() -> reversalService.reverse(people.getId()))
                .isInstanceOf(ReversalRefusedException.class)
                .hasMessageContaining("still referenced elsewhere");

        assertThat(count("rec_person")).isEqualTo(1);
        assertThat(externalIdRepository.findInstanceId("Person", "P-1")).isPresent();
        assertThat(bulkImportService.getSubmission(people.getId()).getStatus())
                .isEqualTo(SubmissionStatus.COMMITTED);
    }

    @Test
    void shouldRefuseWhileACreatedGroupingIsStillSomeonesEmployer() {
        Submission groupings = commit(ImportAction.CREATE, "Grouping.name,Grouping.external_id", "Acme,G-1");
        commit(ImportAction.CREATE, "Person.name,Person.employer.externalid", "Jane Doe,G-1");

        assertThatThrownBy(() -> reversalService.reverse(groupings.getId()))
                .isInstanceOf(ReversalRefusedException.class)
                .hasMessageContaining("still referenced elsewhere");

        assertThat(count("rec_grouping")).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM rec_person p JOIN rec_grouping g ON g.id = p.employer_grouping_id",
                Long.class)).isEqualTo(1);
    }

    @Test
    void shouldRemoveStubsLeftByACommitWhereEveryRowFailed() {
        Submission failed = commit(ImportAction.CREATE,
                "Person.notes,Person.employer.externalid",
                "no name,G-1");
        assertThat(failed.getStatus()).isEqualTo(SubmissionStatus.VALIDATION_FAILED);
        assertThat(count("rec_grouping")).isEqualTo(1);

        ReversalResult result = reversalService.reverse(failed.getId());

        assertThat(result.getDeletedByType()).containsEntry("Grouping", 1);
        assertThat(count("rec_grouping")).isZero();
    }

    @Test
    void shouldRefuseDryRunsAndPlanningFailures() {
        Submission dryRun = bulkImportService.validate("dry.csv", csv("Person.name", "Jane"), ImportAction.CREATE)
                .getSubmission();

        assertThatThrownBy(() -> reversalService.reverse(dryRun.getId()))
                .isInstanceOf(ReversalRefusedException.class)
                .hasMessageContaining("dry run");

        assertThatThrownBy(() -> bulkImportService.commit("bad.csv", csv("Person.nickname", "JD"),
                ImportAction.CREATE))
                .isInstanceOf(SubmissionPlanningException.class);
        Submission planningFailed = bulkImportService.history(1).get(0);

        assertThatThrownBy(() -> reversalService.reverse(planningFailed.getId()))
                .isInstanceOf(ReversalRefusedException.class)
                .hasMessageContaining("failed planning");
    }

    // === Helper Methods ===

    private Submission commit(ImportAction action, String... lines) {
        return bulkImportService.commit("reversal.csv", csv(lines), action).getSubmission();
    }
}
