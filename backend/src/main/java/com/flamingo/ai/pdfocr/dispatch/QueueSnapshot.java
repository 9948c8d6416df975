package com.flamingo.ai.pdfocr.dispatch;

import java.util.List;

/**
 * Point-in-time view of the dispatcher.
 *
 * @param queued accepted jobs waiting for a worker, oldest first
 * @param running jobs currently executing
 */
public record QueueSnapshot(List<String> queued, List<String> running) {

  public QueueSnapshot {
    queued = List.copyOf(queued);
    running = List.copyOf(running);
  }

  public int queueSize() {
    return queued.size();
  }
}
