package ca.carms.residency.etl.job;

import ca.carms.residency.repository.ProgramStreamRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBatchTest
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("ProgramEtlJob Batch Tests")
class ProgramEtlJobConfigTest {

    @Autowired
    private JobLauncherTestUtils jobLauncherTestUtils;

    @Autowired
    private ProgramStreamRepository programStreamRepository;

    @Test
    @DisplayName("Should run the ETL job to completion and record counts in the step context")
    void shouldCompleteJob() throws Exception {
        // When
        JobExecution execution = jobLauncherTestUtils.launchJob(
            jobLauncherTestUtils.getUniqueJobParameters());

        // Then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getJobInstance().getJobName()).isEqualTo(ProgramEtlJobConfig.JOB_NAME);

        StepExecution step = execution.getStepExecutions().iterator().next();
        assertThat(step.getExecutionContext().getInt("count.program_streams")).isEqualTo(4);
        assertThat(step.getExecutionContext().getInt("errors")).isEqualTo(1);
        assertThat(step.getWriteCount()).isPositive();
        assertThat(programStreamRepository.count()).isEqualTo(4);
    }
}
