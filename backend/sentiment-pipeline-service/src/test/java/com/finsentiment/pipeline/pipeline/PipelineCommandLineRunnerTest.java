package com.finsentiment.pipeline.pipeline;

import com.finsentiment.pipeline.entity.RunStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineCommandLineRunnerTest {

    @Mock
    private PipelineEngine pipelineEngine;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    @InjectMocks
    private PipelineCommandLineRunner runner;

    @Test
    @DisplayName("Failed만 종료 코드 1")
    void exitCodes() {
        assertThat(PipelineCommandLineRunner.exitCode(RunStatus.COMPLETED)).isZero();
        assertThat(PipelineCommandLineRunner.exitCode(RunStatus.STOPPED)).isZero();
        assertThat(PipelineCommandLineRunner.exitCode(RunStatus.FAILED)).isEqualTo(1);
    }

    @Test
    @DisplayName("해당 실행이 종료 상태가 될 때까지 대기")
    void waitsForTerminalState() throws InterruptedException {
        // given
        RunSnapshot running = RunSnapshot.builder().runId("run-1").running(true).status(RunStatus.RUNNING).build();
        RunSnapshot done = running.toBuilder().running(false).status(RunStatus.COMPLETED).build();
        when(pipelineEngine.status()).thenReturn(running, running, done);
        ReflectionTestUtils.setField(runner, "pollMillis", 1L);

        // when
        RunSnapshot result = runner.awaitTermination("run-1");

        // then
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
    }
}
