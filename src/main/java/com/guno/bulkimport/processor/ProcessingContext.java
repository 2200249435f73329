package com.guno.bulkimport.processor;

import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.planner.ImportPlan;
import lombok.Builder;
import lombok.Getter;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * State shared by every row of one running submission
 */
@Getter
@Builder
public class ProcessingContext {

    private final long submissionId;
    private final ImportAction action;
    private final boolean dryRun;
    private final ImportPlan plan;
    private final TokenRegistry tokens;
    private final SubmissionLedger ledger;

    /** REQUIRES_NEW for commit runs, NESTED savepoints inside the dry-run transaction */
    private final TransactionTemplate unitOfWork;
}
