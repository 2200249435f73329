package com.guno.bulkimport.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors and transaction templates used by the submission engine
 */
@Configuration
@Slf4j
public class ImportExecutorConfig {

    /** Runs whole submissions in the background */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService submissionExecutor(ImportProperties properties) {
        int workers = Math.max(1, properties.getProcessing().getSubmissionWorkers());
        log.info("Submission executor initialized with {} worker(s)", workers);
        return Executors.newFixedThreadPool(workers, namedThreads("submission-"));
    }

    /** Processes rows of one entity type in parallel */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService rowExecutor(ImportProperties properties) {
        int parallelism = Math.max(1, properties.getProcessing().getParallelism());
        log.info("Row executor initialized with parallelism {}", parallelism);
        return Executors.newFixedThreadPool(parallelism, namedThreads("import-row-"));
    }

    @Bean
    public TransactionTemplate requiresNewTransaction(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }

    @Bean
    public TransactionTemplate nestedTransaction(PlatformTransactionManager transactionManager) {
        if (transactionManager instanceof DataSourceTransactionManager) {
            ((DataSourceTransactionManager) transactionManager).setNestedTransactionAllowed(true);
        }
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        return template;
    }

    @Bean
    public TransactionTemplate requiredTransaction(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
