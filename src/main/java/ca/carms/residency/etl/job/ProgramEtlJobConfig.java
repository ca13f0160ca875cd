package ca.carms.residency.etl.job;

import ca.carms.residency.etl.ProgramEtlPipeline;
import ca.carms.residency.etl.RunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Batch wiring for the ETL pipeline. The job is launched by an external
 * trigger; the pipeline manages its own load transaction, so the tasklet step
 * runs without one.
 */
@Slf4j
@Configuration
public class ProgramEtlJobConfig {

    public static final String JOB_NAME = "programEtlJob";

    @Bean
    public Job programEtlJob(JobRepository jobRepository, Step programEtlStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
            .incrementer(new RunIdIncrementer())
            .start(programEtlStep)
            .build();
    }

    @Bean
    public Step programEtlStep(JobRepository jobRepository, ProgramEtlPipeline pipeline) {
        return new StepBuilder("programEtlStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                RunResult result = pipeline.run();

                ExecutionContext context = chunkContext.getStepContext().getStepExecution().getExecutionContext();
                result.getCountsPerTable().forEach((table, count) -> context.putInt("count." + table, count));
                context.putInt("errors", result.getErrors().size());
                context.putInt("warnings", result.getWarnings().size());
                contribution.incrementWriteCount(result.getCountsPerTable().values().stream()
                    .mapToInt(Integer::intValue).sum());

                log.info("{} completed for match iteration {}", JOB_NAME, result.getMatchIterationId());
                return RepeatStatus.FINISHED;
            }, new ResourcelessTransactionManager())
            .build();
    }
}
