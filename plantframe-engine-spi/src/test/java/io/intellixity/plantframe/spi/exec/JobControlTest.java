package io.intellixity.plantframe.spi.exec;

import io.intellixity.plantframe.error.CancelledException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class JobControlTest {

  @Test
  void hooksRunOnceOnCancel() {
    JobControl job = new JobControl("job-1", "h-1");
    AtomicInteger runs = new AtomicInteger();
    job.onCancel(runs::incrementAndGet);
    job.cancel();
    job.cancel();
    assertEquals(1, runs.get());
    assertThrows(CancelledException.class, job::checkpoint);

    job.onCancel(runs::incrementAndGet);
    assertEquals(2, runs.get());
  }

  @Test
  void removedHooksAreNotRun() {
    JobControl job = new JobControl("job-1", "h-1");
    AtomicInteger runs = new AtomicInteger();
    Runnable hook = runs::incrementAndGet;
    job.onCancel(hook);
    job.removeOnCancel(hook);
    job.cancel();
    assertEquals(0, runs.get());
  }
}
