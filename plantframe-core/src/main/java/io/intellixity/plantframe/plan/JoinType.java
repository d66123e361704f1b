package io.intellixity.plantframe.plan;

public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  OUTER;

  public boolean keepsUnmatchedLeft() {
    return this == LEFT || this == OUTER;
  }

  public boolean keepsUnmatchedRight() {
    return this == RIGHT || this == OUTER;
  }
}
