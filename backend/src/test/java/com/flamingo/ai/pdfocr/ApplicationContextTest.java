package com.flamingo.ai.pdfocr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.pdfocr.artifact.ArtifactStore;
import com.flamingo.ai.pdfocr.dispatch.JobDispatcher;
import com.flamingo.ai.pdfocr.pipeline.GroundingTagParser;
import com.flamingo.ai.pdfocr.pipeline.OcrEngine;
import com.flamingo.ai.pdfocr.pipeline.PipelineRunner;
import com.flamingo.ai.pdfocr.service.job.JobService;
import com.flamingo.ai.pdfocr.service.maintenance.JobMaintenanceService;
import com.flamingo.ai.pdfocr.store.TaskStore;
import jakarta.servlet.Filter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

/**
 * Integration test that verifies the Spring application context loads correctly. The recognizer
 * is mocked so the test runs without an inference server.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private OcrEngine ocrEngine;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core beans should be available")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(TaskStore.class)).isNotNull();
    assertThat(applicationContext.getBean(ArtifactStore.class)).isNotNull();
    assertThat(applicationContext.getBean(JobDispatcher.class)).isNotNull();
    assertThat(applicationContext.getBean(PipelineRunner.class)).isNotNull();
    assertThat(applicationContext.getBean(JobService.class)).isNotNull();
    assertThat(applicationContext.getBean(JobMaintenanceService.class)).isNotNull();
    assertThat(applicationContext.getBean(GroundingTagParser.class)).isNotNull();
  }

  @Test
  @DisplayName("Endpoints are open when no auth token is configured")
  void endpointsShouldBeOpenWithoutToken() throws Exception {
    MockMvc mockMvc =
        MockMvcBuilders.webAppContextSetup((WebApplicationContext) applicationContext)
            .addFilters(applicationContext.getBean("springSecurityFilterChain", Filter.class))
            .build();

    mockMvc.perform(get("/jobs")).andExpect(status().isOk());
    mockMvc.perform(get("/queue/status")).andExpect(status().isOk());
  }
}
