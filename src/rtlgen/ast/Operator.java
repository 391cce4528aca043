package rtlgen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An operator applied to one or two operands.
 * Supported operators: "b" (boolean reduction), "~" (inversion), "==" and "!=".
 */
public final class Operator extends Value {
  private final String operator;
  private final List<Value> operands;

  public Operator(String operator, List<Value> operands) {
    this.operator = operator;
    this.operands = new ArrayList<>(operands);
    int expectedOperands;
    switch (operator) {
    case "b":
    case "~":
      expectedOperands = 1;
      break;
    case "==":
    case "!=":
      expectedOperands = 2;
      break;
    default:
      throw new IllegalArgumentException("Unknown operator '" + operator + "'");
    }
    if (operands.size() != expectedOperands)
      throw new IllegalArgumentException(String.format("Operator '%s' takes %d operands, got %d", operator, expectedOperands,
                                                       operands.size()));
  }

  public String getOperator() { return operator; }
  public List<Value> getOperands() { return Collections.unmodifiableList(operands); }

  @Override
  public Shape shape() {
    if (operator.equals("~"))
      return operands.get(0).shape();
    return Shape.unsigned(1);
  }

  @Override
  public String toString() {
    return "(" + operator + " " + operands.stream().map(Object::toString).collect(Collectors.joining(" ")) + ")";
  }
}
