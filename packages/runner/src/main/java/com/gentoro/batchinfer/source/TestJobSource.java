package com.gentoro.batchinfer.source;

import com.gentoro.batchinfer.model.AnswerType;
import com.gentoro.batchinfer.model.Job;
import java.util.List;

/** Built-in toy question for exercising the pipeline end to end. */
public class TestJobSource implements JobSource {

  @Override
  public List<Job> load() {
    return List.of(
        new Job(
            "test_q1",
            "Let $N = 36036$. Find the number of primitive Dirichlet characters of conductor $N$"
                + " and order $6$.",
            AnswerType.EXACT_MATCH,
            ""));
  }

  @Override
  public String describe() {
    return "built-in test questions";
  }
}
