package io.intellixity.plantframe.analysis.run;

import io.intellixity.plantframe.analysis.config.ResolvedConfig;
import io.intellixity.plantframe.analysis.method.MethodDefinition;
import io.intellixity.plantframe.analysis.method.MethodRunContext;
import io.intellixity.plantframe.analysis.method.RoleSpec;
import io.intellixity.plantframe.error.*;
import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.EngineStats;
import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.toolkit.Toolkit;
import io.intellixity.plantframe.toolkit.ToolkitCatalog;
import io.intellixity.plantframe.toolkit.ToolkitId;
import io.intellixity.plantframe.toolkit.ToolkitParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * One run of a method against one engine.\n
 *
 * State machine: {@code CREATED -> VALIDATED -> RUNNING -> SUCCEEDED | FAILED}. Validation failures move
 * straight from {@code CREATED} to {@code FAILED} and the run function is never invoked.\n
 *
 * {@link #cancel()} may be called from any thread. The run notices it before its next step; a materialize
 * already in flight is cancelled on the engine.\n
 */
public final class ExecutionContext {
  private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

  public static final String STEP_VALIDATE = "validate";
  public static final String STEP_RUN = "run";
  public static final String STEP_MATERIALIZE = "materialize";

  private final String runId;
  private final MethodDefinition method;
  private final BackendEngine engine;
  private final ToolkitCatalog catalog;
  private final Map<String, ComputationHandle> bindings;
  private final Map<String, ?> rawConfig;
  private final Clock clock;

  private final List<ToolkitDiagnostic> diagnostics = new CopyOnWriteArrayList<>();
  private final List<String> warnings = new CopyOnWriteArrayList<>();
  private final AtomicReference<ComputationHandle> inFlight = new AtomicReference<>();

  private volatile RunState state = RunState.CREATED;
  private boolean started;
  private volatile boolean cancelRequested;
  private volatile RunFailure failure;
  private volatile Result result;
  private volatile String currentStep = STEP_VALIDATE;
  private ResolvedConfig config;

  public ExecutionContext(MethodDefinition method,
                          BackendEngine engine,
                          ToolkitCatalog catalog,
                          Map<String, ComputationHandle> bindings,
                          Map<String, ?> config) {
    this(UUID.randomUUID().toString(), method, engine, catalog, bindings, config, Clock.systemUTC());
  }

  public ExecutionContext(String runId,
                          MethodDefinition method,
                          BackendEngine engine,
                          ToolkitCatalog catalog,
                          Map<String, ComputationHandle> bindings,
                          Map<String, ?> config,
                          Clock clock) {
    if (runId == null || runId.isBlank()) throw new IllegalArgumentException("runId is required");
    this.runId = runId;
    this.method = Objects.requireNonNull(method, "method");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings == null ? Map.of() : bindings));
    this.rawConfig = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public String runId() { return runId; }
  public MethodDefinition method() { return method; }
  public BackendEngine engine() { return engine; }
  public RunState state() { return state; }

  /** Failure of a {@code FAILED} run, otherwise empty. */
  public Optional<RunFailure> failure() {
    return Optional.ofNullable(failure);
  }

  /** Toolkit diagnostics recorded so far; available whatever the outcome. */
  public List<ToolkitDiagnostic> diagnostics() {
    return List.copyOf(diagnostics);
  }

  public List<String> warnings() {
    return List.copyOf(warnings);
  }

  /** Result of a successful run. */
  public Result result() {
    RunState s = state;
    if (s == RunState.SUCCEEDED) return result;
    if (s == RunState.FAILED) {
      throw new IllegalStateException("Run " + runId + " of " + method.id() + " failed in step '" + failure.step()
          + "' (" + failure.kind() + ")", failure.cause());
    }
    throw new IllegalStateException("Run " + runId + " has not finished (state " + s + ")");
  }

  /**
   * Request cancellation. A no-op once the run is terminal.
   */
  public void cancel() {
    if (state.isTerminal()) return;
    cancelRequested = true;
    ComputationHandle h = inFlight.get();
    log.info("plantframe.run op=cancel runId={} method={} step={} inFlight={}", runId, method.id(), currentStep, h != null);
    if (h != null) engine.cancel(h);
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }

  /**
   * Validate, execute and materialize. Can only be called once.\n
   *
   * @throws PlantframeException the original error of the failed step; the context is then {@code FAILED}
   */
  public Result run() {
    synchronized (this) {
      if (started) throw new IllegalStateException("Run " + runId + " was already started (state " + state + ")");
      started = true;
    }

    Instant startedAt = clock.instant();
    EngineStats before = engine.stats();
    log.info("plantframe.run op=start runId={} method={} engine={} roles={}",
        runId, method.id(), engine.descriptor().id(), bindings.keySet());

    try {
      validate();
      state = RunState.VALIDATED;

      checkCancelled();
      state = RunState.RUNNING;
      currentStep = STEP_RUN;
      ComputationHandle out = method.runFunction().run(new RunView());
      if (out == null) throw new IllegalStateException("Method " + method.id() + " returned no result handle");

      checkCancelled();
      currentStep = STEP_MATERIALIZE;
      MaterializedFrame payload = materializeTracked(out);
      method.resultContract().check(payload.schema(), "Result of method " + method.id());

      Instant finishedAt = clock.instant();
      EngineStats used = engine.stats().since(before);
      Provenance provenance = new Provenance(runId, method.id(), engine.descriptor(), config.asMap(), lineageByRole(),
          startedAt, finishedAt);
      ResourceUsage usage = new ResourceUsage(Duration.between(startedAt, finishedAt).toMillis(),
          used.jobsSubmitted(), used.rowsMaterialized());
      result = new Result(payload, diagnostics, warnings, provenance, usage);
      state = RunState.SUCCEEDED;
      log.info("plantframe.run op=finish runId={} method={} outcome=succeeded rows={} engineJobs={} durationMs={}",
          runId, method.id(), payload.rowCount(), usage.engineJobs(), usage.wallClockMillis());
      return result;
    } catch (PlantframeException e) {
      throw fail(e, e.kind());
    } catch (RuntimeException e) {
      // Undeclared errors from method code are reported as execution failures, cause preserved.
      EngineExecutionException wrapped = new EngineExecutionException(engine.descriptor().id(),
          "Method " + method.id() + " failed in step '" + currentStep + "': " + e.getMessage(), e);
      throw fail(wrapped, wrapped.kind());
    } catch (Error e) {
      // Rethrown unwrapped; the run is still closed as failed.
      recordFailure(e, ErrorKind.ENGINE_EXECUTION);
      throw e;
    }
  }

  private RuntimeException fail(RuntimeException e, ErrorKind kind) {
    recordFailure(e, kind);
    return e;
  }

  private void recordFailure(Throwable e, ErrorKind kind) {
    failure = new RunFailure(currentStep, kind, e);
    state = RunState.FAILED;
    log.warn("plantframe.run op=finish runId={} method={} outcome=failed step={} kind={} error={}",
        runId, method.id(), currentStep, kind, e.toString());
  }

  private void validate() {
    Map<String, RoleSpec> roles = method.roles();

    List<String> undeclared = new ArrayList<>();
    for (String r : bindings.keySet()) if (!roles.containsKey(r)) undeclared.add(r);
    if (!undeclared.isEmpty()) {
      throw new SchemaException("Method " + method.id() + " does not declare roles " + undeclared
          + "; declared: " + roles.keySet());
    }
    List<String> missing = new ArrayList<>();
    for (RoleSpec r : roles.values()) if (r.required() && bindings.get(r.name()) == null) missing.add(r.name());
    if (!missing.isEmpty()) {
      throw new SchemaException("Method " + method.id() + " is missing required roles " + missing);
    }

    for (Map.Entry<String, ComputationHandle> e : bindings.entrySet()) {
      ComputationHandle h = e.getValue();
      if (h == null) continue;
      if (!h.isOwnedBy(engine)) {
        throw new BindingMismatchException("Role '" + e.getKey() + "' is bound to a handle of engine "
            + h.engine().descriptor().id() + ", run uses " + engine.descriptor().id());
      }
      h.ensureLive();
    }

    List<String> violations = new ArrayList<>();
    for (Map.Entry<String, ComputationHandle> e : bindings.entrySet()) {
      if (e.getValue() == null) continue;
      for (String v : roles.get(e.getKey()).contract().violations(e.getValue().schema())) {
        violations.add("role '" + e.getKey() + "': " + v);
      }
    }
    if (!violations.isEmpty()) {
      throw new SchemaException("Method " + method.id() + " inputs do not match: " + String.join("; ", violations));
    }

    for (ToolkitId t : method.toolkits()) {
      if (!catalog.contains(t)) {
        throw new NotFoundException("Method " + method.id() + " requires toolkit " + t + ", not in the catalog");
      }
    }

    config = method.configSchema().resolve(rawConfig);
    log.debug("plantframe.run op=validate runId={} method={} config={}", runId, method.id(), config);
  }

  private Map<String, List<DatasetRef>> lineageByRole() {
    Map<String, List<DatasetRef>> out = new LinkedHashMap<>();
    bindings.forEach((role, h) -> {
      if (h != null) out.put(role, h.lineage());
    });
    return out;
  }

  private void checkCancelled() {
    if (cancelRequested) {
      throw new CancelledException("Run " + runId + " of " + method.id() + " was cancelled before step '"
          + currentStep + "'");
    }
  }

  private MaterializedFrame materializeTracked(ComputationHandle h) {
    if (!h.isOwnedBy(engine)) {
      throw new BindingMismatchException("Handle " + h.id() + " does not belong to engine " + engine.descriptor().id());
    }
    inFlight.set(h);
    try {
      // cancel() may have run between the last check and publishing the handle
      if (cancelRequested) engine.cancel(h);
      return engine.materialize(h);
    } finally {
      inFlight.set(null);
    }
  }

  private final class RunView implements MethodRunContext {
    @Override
    public MethodDefinition method() {
      return method;
    }

    @Override
    public String runId() {
      return runId;
    }

    @Override
    public BackendEngine engine() {
      return engine;
    }

    @Override
    public ResolvedConfig config() {
      return config;
    }

    @Override
    public boolean hasRole(String role) {
      return bindings.get(role) != null;
    }

    @Override
    public ComputationHandle handle(String role) {
      ComputationHandle h = bindings.get(role);
      if (h == null) throw new NotFoundException("Role '" + role + "' is not bound for method " + method.id());
      return h;
    }

    @Override
    public ComputationHandle applyToolkit(String name, ComputationHandle input, ToolkitParams params) {
      ToolkitId id = method.toolkit(name);
      if (id == null) throw new NotFoundException("Method " + method.id() + " did not declare toolkit '" + name + "'");
      Toolkit toolkit = catalog.lookup(id);
      ToolkitParams p = params == null ? ToolkitParams.empty() : params;
      long t0 = System.nanoTime();
      ComputationHandle out = step("toolkit:" + id, () -> toolkit.apply(input, p));
      long ms = (System.nanoTime() - t0) / 1_000_000L;
      diagnostics.add(new ToolkitDiagnostic(id, p.asMap(), input.schema().names(), out.schema().names(), ms));
      log.debug("plantframe.run op=toolkit runId={} toolkit={} columns={} durationMs={}",
          runId, id, out.schema().names(), ms);
      return out;
    }

    @Override
    public <T> T step(String name, Supplier<T> body) {
      String outer = currentStep;
      currentStep = name;
      checkCancelled();
      T value = body.get();
      currentStep = outer;
      return value;
    }

    @Override
    public MaterializedFrame materialize(ComputationHandle handle) {
      checkCancelled();
      return materializeTracked(handle);
    }

    @Override
    public void warn(String message) {
      warnings.add(message);
      log.info("plantframe.run op=warn runId={} method={} message={}", runId, method.id(), message);
    }
  }
}
