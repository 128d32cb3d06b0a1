package com.gentoro.batchinfer.source;

import com.gentoro.batchinfer.model.Job;
import java.util.List;
import org.slf4j.Logger;

/** Drops jobs that carry an image, since the inference endpoint is text-only. */
public class TextOnlyJobSource implements JobSource {
  private static final Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(TextOnlyJobSource.class);

  private final JobSource delegate;

  public TextOnlyJobSource(JobSource delegate) {
    this.delegate = delegate;
  }

  @Override
  public List<Job> load() {
    List<Job> all = delegate.load();
    List<Job> textOnly = all.stream().filter(job -> !job.hasImage()).toList();
    if (textOnly.size() < all.size()) {
      log.info("Skipping {} multimodal jobs from {}", all.size() - textOnly.size(), describe());
    }
    return textOnly;
  }

  @Override
  public String describe() {
    return delegate.describe();
  }
}
