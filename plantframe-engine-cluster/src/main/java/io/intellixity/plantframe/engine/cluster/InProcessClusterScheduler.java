package io.intellixity.plantframe.engine.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ClusterScheduler} simulating a cluster inside the JVM: a driver pool for jobs and one single-threaded
 * executor per node for tasks. Task {@code i} of a stage runs on node {@code i mod executorCount}.\n
 */
public final class InProcessClusterScheduler implements ClusterScheduler {
  private static final Logger log = LoggerFactory.getLogger(InProcessClusterScheduler.class);

  private final String name;
  private final ExecutorService drivers;
  private final List<ExecutorService> nodes;

  public InProcessClusterScheduler(String name, int executors, int maxDrivers) {
    this.name = Objects.requireNonNull(name, "name");
    if (executors < 1) throw new IllegalArgumentException("executors must be >= 1");
    if (maxDrivers < 1) throw new IllegalArgumentException("maxDrivers must be >= 1");
    this.drivers = Executors.newFixedThreadPool(maxDrivers, threads(name + "-driver"));
    List<ExecutorService> ns = new ArrayList<>(executors);
    for (int i = 0; i < executors; i++) ns.add(Executors.newSingleThreadExecutor(threads(name + "-node" + i)));
    this.nodes = List.copyOf(ns);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int executorCount() {
    return nodes.size();
  }

  @Override
  public <T> ClusterJob<T> submit(String jobId, Callable<T> driver) {
    Objects.requireNonNull(driver, "driver");
    Future<T> f = drivers.submit(driver);
    log.debug("plantframe.cluster op=submit scheduler={} job={}", name, jobId);
    return new FutureJob<>(jobId, f);
  }

  @Override
  public <T> List<Future<T>> launch(String jobId, String stage, List<Callable<T>> tasks) {
    List<Future<T>> out = new ArrayList<>(tasks.size());
    for (int i = 0; i < tasks.size(); i++) {
      out.add(nodes.get(i % nodes.size()).submit(tasks.get(i)));
    }
    if (log.isTraceEnabled()) {
      log.trace("plantframe.cluster op=launch scheduler={} job={} stage={} tasks={}", name, jobId, stage, tasks.size());
    }
    return out;
  }

  @Override
  public void close() {
    drivers.shutdownNow();
    for (ExecutorService n : nodes) n.shutdownNow();
    log.debug("plantframe.cluster op=close scheduler={}", name);
  }

  private static ThreadFactory threads(String prefix) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "plantframe-" + prefix + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  private record FutureJob<T>(String id, Future<T> future) implements ClusterJob<T> {
    @Override
    public T await() throws InterruptedException, ExecutionException {
      return future.get();
    }

    @Override
    public void cancel() {
      future.cancel(true);
    }

    @Override
    public boolean isDone() {
      return future.isDone();
    }
  }
}
