package io.intellixity.plantframe.analysis.session;

import io.intellixity.plantframe.analysis.io.DatasetLoader;
import io.intellixity.plantframe.analysis.method.InMemoryMethodRegistry;
import io.intellixity.plantframe.analysis.method.ListableMethodRegistry;
import io.intellixity.plantframe.analysis.method.MethodDefinition;
import io.intellixity.plantframe.analysis.run.ExecutionContext;
import io.intellixity.plantframe.analysis.run.Result;
import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.BackendEngines;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.toolkit.ToolkitCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * One engine plus the toolkit catalog and method registry runs are resolved against.\n
 *
 * Every handle of the session belongs to its engine; closing the session closes the engine.\n
 */
public final class AnalysisSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AnalysisSession.class);

  private final SessionConfig config;
  private final BackendEngine engine;
  private final ToolkitCatalog toolkits;
  private final ListableMethodRegistry methods;

  public AnalysisSession(SessionConfig config, BackendEngine engine, ToolkitCatalog toolkits,
                         ListableMethodRegistry methods) {
    this.config = Objects.requireNonNull(config, "config");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.toolkits = Objects.requireNonNull(toolkits, "toolkits");
    this.methods = Objects.requireNonNull(methods, "methods");
  }

  /** Session whose engine, toolkits and methods all come from classpath discovery. */
  public static AnalysisSession open(SessionConfig config) {
    return open(config, ToolkitCatalog.discover(), InMemoryMethodRegistry.discover());
  }

  public static AnalysisSession open(SessionConfig config, ToolkitCatalog toolkits, ListableMethodRegistry methods) {
    BackendEngine engine = BackendEngines.create(config.toEngineSettings());
    log.info("plantframe.session op=open engine={} variant={} mode={} toolkits={} methods={}",
        engine.descriptor().id(), engine.descriptor().variant(), engine.descriptor().mode(),
        toolkits.all().size(), methods.all().size());
    return new AnalysisSession(config, engine, toolkits, methods);
  }

  public SessionConfig config() { return config; }
  public BackendEngine engine() { return engine; }
  public ToolkitCatalog toolkits() { return toolkits; }
  public ListableMethodRegistry methods() { return methods; }

  public ComputationHandle source(MaterializedFrame data, DatasetRef dataset) {
    return engine.source(data, dataset);
  }

  public ComputationHandle load(DatasetLoader loader, String name, SchemaContract contract) {
    return loader.load(name, engine, contract);
  }

  public ExecutionContext newContext(String method, String version, Map<String, ComputationHandle> bindings,
                                     Map<String, ?> config) {
    return newContext(methods.lookup(method, version), bindings, config);
  }

  public ExecutionContext newContext(MethodDefinition method, Map<String, ComputationHandle> bindings,
                                     Map<String, ?> config) {
    return new ExecutionContext(method, engine, toolkits, bindings, config);
  }

  /** Create and run a context in one call. */
  public Result run(String method, String version, Map<String, ComputationHandle> bindings, Map<String, ?> config) {
    return newContext(method, version, bindings, config).run();
  }

  @Override
  public void close() {
    log.info("plantframe.session op=close engine={} stats={}", engine.descriptor().id(), engine.stats());
    engine.close();
  }
}
