package com.flamingo.ai.pdfocr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background job execution. */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /**
   * Worker pool that runs OCR pipelines.
   *
   * <p>Core and max size are both the configured concurrency limit, and the queue is unbounded, so
   * extra jobs wait in FIFO order instead of spawning threads or being rejected.
   */
  @Bean(name = "jobDispatchExecutor")
  public ThreadPoolTaskExecutor jobDispatchExecutor(OcrConfig ocrConfig) {
    OcrConfig.Dispatcher dispatcher = ocrConfig.getDispatcher();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(dispatcher.getMaxConcurrentJobs());
    executor.setMaxPoolSize(dispatcher.getMaxConcurrentJobs());
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("ocr-job-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(dispatcher.getShutdownAwaitSeconds());
    executor.initialize();
    return executor;
  }
}
