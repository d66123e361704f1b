package io.intellixity.plantframe.query;

public interface FilterVisitor<Q> {
  Q visit(Condition condition);
  Q visit(LogicalGroup group);
  Q visit(NotElement not);
  Q visit(RowCondition rowCondition);
}
