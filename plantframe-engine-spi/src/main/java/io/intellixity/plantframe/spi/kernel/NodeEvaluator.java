package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.plan.*;

import java.util.List;

/** Evaluates one plan node over fully computed inputs on the calling thread. */
public final class NodeEvaluator implements PlanVisitor<RowSet> {
  private final List<RowSet> inputs;
  private final long memoryBudgetCells;

  private NodeEvaluator(List<RowSet> inputs, long memoryBudgetCells) {
    this.inputs = inputs;
    this.memoryBudgetCells = memoryBudgetCells;
  }

  /** @param memoryBudgetCells cells a generated result (resample gap filling) may reach before it is abandoned */
  public static RowSet evaluate(PlanNode node, List<RowSet> inputs, long memoryBudgetCells) {
    if (inputs.size() != node.inputs().size()) {
      throw new IllegalArgumentException(node.label() + " expects " + node.inputs().size() + " inputs, got " + inputs.size());
    }
    return node.accept(new NodeEvaluator(inputs, memoryBudgetCells));
  }

  /** Largest row count of {@code node}'s output that fits in {@code memoryBudgetCells}. */
  public static long rowBudget(PlanNode node, long memoryBudgetCells) {
    return memoryBudgetCells / Math.max(1, node.schema().size());
  }

  private RowSet in() {
    return inputs.get(0);
  }

  @Override
  public RowSet visit(SourceNode node) {
    return RowSet.of(node.data());
  }

  @Override
  public RowSet visit(SelectNode node) {
    return new RowSet(node.schema(), NarrowOps.select(in().rows(), in().schema(), node));
  }

  @Override
  public RowSet visit(FilterNode node) {
    return new RowSet(node.schema(), NarrowOps.filter(in().rows(), in().schema(), node));
  }

  @Override
  public RowSet visit(DeriveNode node) {
    return new RowSet(node.schema(), NarrowOps.derive(in().rows(), in().schema(), node));
  }

  @Override
  public RowSet visit(RenameNode node) {
    return new RowSet(node.schema(), NarrowOps.rename(in().rows()));
  }

  @Override
  public RowSet visit(ResampleNode node) {
    return new RowSet(node.schema(), ResampleKernel.run(in().rows(), in().schema(), node,
        rowBudget(node, memoryBudgetCells)));
  }

  @Override
  public RowSet visit(JoinNode node) {
    RowSet l = inputs.get(0);
    RowSet r = inputs.get(1);
    return new RowSet(node.schema(), JoinKernel.run(l.rows(), l.schema(), r.rows(), r.schema(), node));
  }

  @Override
  public RowSet visit(GroupAggregateNode node) {
    return new RowSet(node.schema(), GroupKernel.run(in().rows(), in().schema(), node));
  }
}
