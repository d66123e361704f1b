package io.intellixity.plantframe.query;

public enum Clause {
  AND,
  OR
}
