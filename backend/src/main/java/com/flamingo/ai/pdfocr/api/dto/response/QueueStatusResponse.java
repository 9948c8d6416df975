package com.flamingo.ai.pdfocr.api.dto.response;

import com.flamingo.ai.pdfocr.dispatch.QueueSnapshot;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the dispatcher queue. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusResponse {

  private int queueSize;
  private List<String> queuedJobs;
  private List<String> runningJobs;
  private int maxConcurrentJobs;

  public static QueueStatusResponse from(QueueSnapshot snapshot, int maxConcurrentJobs) {
    return QueueStatusResponse.builder()
        .queueSize(snapshot.queueSize())
        .queuedJobs(snapshot.queued())
        .runningJobs(snapshot.running())
        .maxConcurrentJobs(maxConcurrentJobs)
        .build();
  }
}
