package io.intellixity.plantframe.analysis.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.intellixity.plantframe.analysis.run.Result;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes run results as JSON: provenance, columns, rows, diagnostics, warnings and usage. */
public final class ResultJsonExporter {
  private final ObjectMapper mapper;

  public ResultJsonExporter() {
    this(false);
  }

  public ResultJsonExporter(boolean pretty) {
    SimpleModule module = new SimpleModule("plantframe-result");
    module.addSerializer(Result.class, new ResultJsonSerializer());
    this.mapper = new ObjectMapper().registerModule(module);
    if (pretty) mapper.enable(SerializationFeature.INDENT_OUTPUT);
  }

  public String toJson(Result result) {
    try {
      return mapper.writeValueAsString(result);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write result " + result.provenance().runId(), e);
    }
  }

  public void write(Result result, OutputStream out) throws IOException {
    mapper.writeValue(out, result);
  }

  public void write(Result result, Path file) {
    try (OutputStream out = Files.newOutputStream(file)) {
      write(result, out);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write result to " + file, e);
    }
  }
}
