package io.intellixity.plantframe.analysis.run;

import io.intellixity.plantframe.analysis.method.MethodDefinition;
import io.intellixity.plantframe.engine.local.LocalBackendEngine;
import io.intellixity.plantframe.engine.partitioned.PartitionedBackendEngine;
import io.intellixity.plantframe.error.*;
import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.EngineSettings;
import io.intellixity.plantframe.exec.ResourceLimits;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.toolkit.ToolkitCatalog;
import io.intellixity.plantframe.toolkit.ToolkitId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static io.intellixity.plantframe.analysis.run.DailyEnergyFixture.*;
import static org.junit.jupiter.api.Assertions.*;

final class ExecutionContextTest {
  private BackendEngine engine;

  @BeforeEach
  void openEngine() {
    engine = new LocalBackendEngine(EngineSettings.of("local"));
  }

  @AfterEach
  void closeEngine() {
    engine.close();
  }

  private ComputationHandle meterHandle() {
    return engine.source(meter(), new DatasetRef("plant-a/meter", "v1"));
  }

  private ExecutionContext context(MethodDefinition m, Map<String, ComputationHandle> bindings, Map<String, ?> config) {
    return new ExecutionContext(m, engine, catalog(), bindings, config);
  }

  @Test
  void successfulRunPackagesPayloadDiagnosticsAndProvenance() {
    ExecutionContext ctx = context(method(), Map.of("meter", meterHandle()), Map.of("scale", 2));
    assertEquals(RunState.CREATED, ctx.state());

    Result r = ctx.run();

    assertEquals(RunState.SUCCEEDED, ctx.state());
    assertSame(r, ctx.result());
    assertEquals(2, r.payload().rowCount());
    assertEquals(24.0, r.payload().doubleValue(0, "energy_kwh"), 1e-12);
    assertEquals(48.0, r.payload().doubleValue(1, "scaled"), 1e-12);

    assertEquals(1, r.diagnostics().size());
    ToolkitDiagnostic d = r.diagnostics().get(0);
    assertEquals(new ToolkitId("daily-sum", "1.0"), d.toolkit());
    assertEquals(List.of("time", "energy_kwh"), d.inputColumns());
    assertEquals(List.of("time", "energy_kwh"), d.outputColumns());

    Provenance p = r.provenance();
    assertEquals(ctx.runId(), p.runId());
    assertEquals("daily-energy", p.method().name());
    assertEquals("local", p.engine().variant());
    assertEquals(Map.of("scale", 2.0), p.parameters());
    assertEquals(Map.of("meter", List.of(new DatasetRef("plant-a/meter", "v1"))), p.datasets());
    assertFalse(p.finishedAt().isBefore(p.startedAt()));

    assertEquals(1, r.usage().engineJobs());
    assertEquals(2, r.usage().rowsMaterialized());
    assertTrue(r.warnings().isEmpty());
  }

  @Test
  void missingRoleFailsValidationWithoutInvokingTheRunFunction() {
    AtomicBoolean invoked = new AtomicBoolean();
    MethodDefinition m = method(ctx -> {
      invoked.set(true);
      return ctx.handle("meter");
    }).build();
    ExecutionContext ctx = context(m, Map.of(), Map.of());

    SchemaException e = assertThrows(SchemaException.class, ctx::run);

    assertTrue(e.getMessage().contains("meter"), e.getMessage());
    assertFalse(invoked.get());
    assertEquals(RunState.FAILED, ctx.state());
    RunFailure f = ctx.failure().orElseThrow();
    assertEquals(ExecutionContext.STEP_VALIDATE, f.step());
    assertEquals(ErrorKind.SCHEMA, f.kind());
    assertSame(e, f.cause());
    IllegalStateException noResult = assertThrows(IllegalStateException.class, ctx::result);
    assertSame(e, noResult.getCause());
    assertEquals(0, engine.stats().jobsSubmitted());
  }

  @Test
  void undeclaredRoleIsRejected() {
    ExecutionContext ctx = context(method(), Map.of("meter", meterHandle(), "curtailment", meterHandle()), Map.of());
    SchemaException e = assertThrows(SchemaException.class, ctx::run);
    assertTrue(e.getMessage().contains("curtailment"), e.getMessage());
  }

  @Test
  void roleDataMustSatisfyTheContract() {
    FrameSchema wrong = FrameSchema.builder().timestamp("time").strings("energy_kwh").build();
    ComputationHandle h = engine.source(MaterializedFrame.of(wrong, List.of(List.of(T0, "x"))), DatasetRef.of("bad"));
    ExecutionContext ctx = context(method(), Map.of("meter", h), Map.of());
    SchemaException e = assertThrows(SchemaException.class, ctx::run);
    assertTrue(e.getMessage().contains("energy_kwh"), e.getMessage());
    assertEquals(RunState.FAILED, ctx.state());
  }

  @Test
  void handlesOfAnotherEngineAreRejected() {
    try (BackendEngine other = new LocalBackendEngine(EngineSettings.of("local"))) {
      ComputationHandle foreign = other.source(meter(), DatasetRef.of("meter"));
      ExecutionContext ctx = context(method(), Map.of("meter", foreign), Map.of());
      assertThrows(BindingMismatchException.class, ctx::run);
      assertEquals(ErrorKind.BINDING_MISMATCH, ctx.failure().orElseThrow().kind());
    }
  }

  @Test
  void requiredToolkitMustBeInTheCatalog() {
    ExecutionContext ctx = new ExecutionContext(method(), engine, new ToolkitCatalog(), Map.of("meter", meterHandle()), Map.of());
    NotFoundException e = assertThrows(NotFoundException.class, ctx::run);
    assertTrue(e.getMessage().contains("daily-sum:1.0"), e.getMessage());
  }

  @Test
  void invalidConfigurationReportsEveryViolation() {
    ExecutionContext ctx = context(method(), Map.of("meter", meterHandle()), Map.of("scale", 5000, "bogus", true));
    ConfigValidationException e = assertThrows(ConfigValidationException.class, ctx::run);
    assertTrue(e.getMessage().contains("bogus"), e.getMessage());
    assertTrue(e.getMessage().contains("scale"), e.getMessage());
    assertEquals(ExecutionContext.STEP_VALIDATE, ctx.failure().orElseThrow().step());
  }

  @Test
  void resultMustSatisfyTheResultContract() {
    MethodDefinition m = method(ctx -> ctx.applyToolkit("daily-sum", ctx.handle("meter"))).build();
    ExecutionContext ctx = context(m, Map.of("meter", meterHandle()), Map.of());
    SchemaException e = assertThrows(SchemaException.class, ctx::run);
    assertTrue(e.getMessage().contains("scaled"), e.getMessage());
    assertEquals(ExecutionContext.STEP_MATERIALIZE, ctx.failure().orElseThrow().step());
    // toolkit diagnostics survive the failure
    assertEquals(1, ctx.diagnostics().size());
  }

  @Test
  void undeclaredErrorsAreWrappedWithTheFailingStep() {
    IllegalStateException boom = new IllegalStateException("boom");
    MethodDefinition m = method(ctx -> ctx.step("aggregate", () -> {
      throw boom;
    })).build();
    ExecutionContext ctx = context(m, Map.of("meter", meterHandle()), Map.of());

    EngineExecutionException e = assertThrows(EngineExecutionException.class, ctx::run);

    assertSame(boom, e.getCause());
    assertEquals(engine.descriptor().id(), e.engineId());
    RunFailure f = ctx.failure().orElseThrow();
    assertEquals("aggregate", f.step());
    assertEquals(ErrorKind.ENGINE_EXECUTION, f.kind());
  }

  @Test
  void errorsLeaveTheRunFailedAndAreRethrownAsIs() {
    AssertionError boom = new AssertionError("invariant broken");
    MethodDefinition m = method(ctx -> ctx.step("aggregate", () -> {
      throw boom;
    })).build();
    ExecutionContext ctx = context(m, Map.of("meter", meterHandle()), Map.of());

    AssertionError e = assertThrows(AssertionError.class, ctx::run);

    assertSame(boom, e);
    assertEquals(RunState.FAILED, ctx.state());
    RunFailure f = ctx.failure().orElseThrow();
    assertEquals("aggregate", f.step());
    assertEquals(ErrorKind.ENGINE_EXECUTION, f.kind());
    assertSame(boom, f.cause());
    assertSame(boom, assertThrows(IllegalStateException.class, ctx::result).getCause());
  }

  @Test
  void cancellationIsObservedBeforeTheNextStep() {
    AtomicReference<ExecutionContext> self = new AtomicReference<>();
    AtomicBoolean secondRan = new AtomicBoolean();
    MethodDefinition m = method(ctx -> {
      ComputationHandle h = ctx.step("first", () -> {
        self.get().cancel();
        return ctx.handle("meter");
      });
      return ctx.step("second", () -> {
        secondRan.set(true);
        return h;
      });
    }).build();
    ExecutionContext ctx = context(m, Map.of("meter", meterHandle()), Map.of());
    self.set(ctx);

    assertThrows(CancelledException.class, ctx::run);

    assertFalse(secondRan.get());
    assertTrue(ctx.isCancelRequested());
    assertEquals("second", ctx.failure().orElseThrow().step());
    assertEquals(ErrorKind.CANCELLED, ctx.failure().orElseThrow().kind());
  }

  @Test
  void cancelBeforeRunFailsWithoutTouchingTheEngine() {
    ExecutionContext ctx = context(method(), Map.of("meter", meterHandle()), Map.of());
    ctx.cancel();
    assertThrows(CancelledException.class, ctx::run);
    assertEquals(0, engine.stats().jobsSubmitted());
  }

  @Test
  void cancelIsForwardedToAnInFlightMaterialize() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    EngineSettings s = EngineSettings.of("partitioned", ResourceLimits.defaults().withWorkers(2));
    try (PartitionedBackendEngine partitioned = new PartitionedBackendEngine(s)) {
      MethodDefinition m = method(c -> c.handle("meter").derive("scaled", ColumnType.DOUBLE, r -> {
        started.countDown();
        try {
          Thread.sleep(50);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("interrupted", ie);
        }
        return 1.0;
      })).build();
      ExecutionContext ctx = new ExecutionContext(m, partitioned, catalog(),
          Map.of("meter", partitioned.source(meter(), DatasetRef.of("meter"))), Map.of());

      ExecutorService caller = Executors.newSingleThreadExecutor();
      try {
        Future<Result> f = caller.submit(ctx::run);
        assertTrue(started.await(10, TimeUnit.SECONDS));
        ctx.cancel();
        ExecutionException ex = assertThrows(ExecutionException.class, () -> f.get(30, TimeUnit.SECONDS));
        assertInstanceOf(CancelledException.class, ex.getCause());
        assertEquals(RunState.FAILED, ctx.state());
        assertEquals(ExecutionContext.STEP_MATERIALIZE, ctx.failure().orElseThrow().step());
        assertEquals(1, partitioned.stats().jobsCancelled());
      } finally {
        caller.shutdownNow();
      }
    }
  }

  @Test
  void contextRunsOnlyOnce() {
    ExecutionContext ctx = context(method(), Map.of("meter", meterHandle()), Map.of());
    ctx.run();
    assertThrows(IllegalStateException.class, ctx::run);
    assertEquals(RunState.SUCCEEDED, ctx.state());
  }

  @Test
  void undeclaredToolkitCannotBeApplied() {
    MethodDefinition m = method(ctx -> ctx.applyToolkit("hourly-sum", ctx.handle("meter"))).build();
    ExecutionContext ctx = context(m, Map.of("meter", meterHandle()), Map.of());
    NotFoundException e = assertThrows(NotFoundException.class, ctx::run);
    assertTrue(e.getMessage().contains("hourly-sum"), e.getMessage());
    assertEquals(ExecutionContext.STEP_RUN, ctx.failure().orElseThrow().step());
  }

  @Test
  void warningsAreCarriedIntoTheResult() {
    MethodDefinition m = method(ctx -> {
      ctx.warn("meter has gaps");
      return ctx.applyToolkit("daily-sum", ctx.handle("meter"))
          .derive("scaled", ColumnType.DOUBLE, r -> r.getDouble("energy_kwh"));
    }).build();
    Result r = context(m, Map.of("meter", meterHandle()), Map.of()).run();
    assertEquals(List.of("meter has gaps"), r.warnings());
    assertEquals(Map.of("scale", 1.0), r.provenance().parameters());
  }
}
