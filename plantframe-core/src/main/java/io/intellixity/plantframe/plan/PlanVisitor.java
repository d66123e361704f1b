package io.intellixity.plantframe.plan;

public interface PlanVisitor<R> {
  R visit(SourceNode node);
  R visit(SelectNode node);
  R visit(FilterNode node);
  R visit(DeriveNode node);
  R visit(RenameNode node);
  R visit(ResampleNode node);
  R visit(JoinNode node);
  R visit(GroupAggregateNode node);
}
