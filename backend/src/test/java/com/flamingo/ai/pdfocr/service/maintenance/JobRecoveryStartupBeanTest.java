package com.flamingo.ai.pdfocr.service.maintenance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pdfocr.dispatch.JobDispatcher;
import com.flamingo.ai.pdfocr.domain.entity.JobUpdate;
import com.flamingo.ai.pdfocr.domain.enums.JobStatus;
import com.flamingo.ai.pdfocr.store.InMemoryTaskStore;
import com.flamingo.ai.pdfocr.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JobRecoveryStartupBeanTest {

  @Mock private JobDispatcher jobDispatcher;

  private InMemoryTaskStore taskStore;
  private JobRecoveryStartupBean recoveryBean;

  @BeforeEach
  void setUp() {
    taskStore = new InMemoryTaskStore();
    recoveryBean = new JobRecoveryStartupBean(taskStore, jobDispatcher);
    when(jobDispatcher.submit(anyString())).thenReturn(true);
  }

  @Test
  void shouldFailJobsInterruptedMidRun() {
    taskStore.create("interrupted", "a.pdf");
    taskStore.update("interrupted", JobUpdate.status(JobStatus.PROCESSING));
    taskStore.update("interrupted", JobUpdate.totalPages(3));

    recoveryBean.run();

    assertThat(taskStore.get("interrupted").getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(taskStore.get("interrupted").getErrorMessage())
        .isEqualTo(JobRecoveryStartupBean.INTERRUPTED_MESSAGE);
    verify(jobDispatcher, never()).submit("interrupted");
  }

  @Test
  void shouldResubmitPendingJobsOldestFirst() {
    taskStore.create("first", "a.pdf");
    taskStore.create("second", "b.pdf");
    taskStore.create("third", "c.pdf");

    recoveryBean.run();

    InOrder order = inOrder(jobDispatcher);
    order.verify(jobDispatcher).submit("first");
    order.verify(jobDispatcher).submit("second");
    order.verify(jobDispatcher).submit("third");
  }

  @Test
  void shouldLeaveTerminalJobsAlone() {
    taskStore.create("done", "a.pdf");
    taskStore.update("done", JobUpdate.status(JobStatus.PROCESSING));
    taskStore.update("done", JobUpdate.status(JobStatus.COMPLETED));

    recoveryBean.run();

    assertThat(taskStore.get("done").getStatus()).isEqualTo(JobStatus.COMPLETED);
    verify(jobDispatcher, never()).submit(anyString());
  }

  @Test
  void shouldNotBlockStartupWhenStoreIsUnavailable() {
    TaskStore broken = Mockito.mock(TaskStore.class);
    when(broken.list(JobStatus.PROCESSING)).thenThrow(new IllegalStateException("db down"));

    new JobRecoveryStartupBean(broken, jobDispatcher).run();

    verify(jobDispatcher, never()).submit(anyString());
  }
}
