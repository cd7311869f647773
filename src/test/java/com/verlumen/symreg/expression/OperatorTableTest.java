package com.verlumen.symreg.expression;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OperatorTableTest {
  @Test
  public void standard_holdsTheFourBinaryOperators() {
    assertThat(OperatorTable.standard().operators())
        .containsExactly(
            Operator.ADD, Operator.SUBTRACT, Operator.MULTIPLY, Operator.PROTECTED_DIVIDE)
        .inOrder();
  }

  @Test
  public void parse_readsSymbolList() {
    OperatorTable table = OperatorTable.parse(" +, pd ,inc");

    assertThat(table.operators())
        .containsExactly(Operator.ADD, Operator.PROTECTED_DIVIDE, Operator.INCREMENT)
        .inOrder();
  }

  @Test
  public void parse_unknownSymbol_throws() {
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> OperatorTable.parse("+,sqrt"));

    assertThat(thrown).hasMessageThat().contains("sqrt");
  }

  @Test
  public void of_empty_throws() {
    assertThrows(IllegalArgumentException.class, () -> OperatorTable.of(ImmutableList.of()));
    assertThrows(IllegalArgumentException.class, () -> OperatorTable.parse(" , "));
  }

  @Test
  public void of_dropsDuplicates() {
    assertThat(OperatorTable.of(Operator.ADD, Operator.ADD).operators())
        .containsExactly(Operator.ADD);
  }

  @Test
  public void arity_ofOperatorOutsideTable_throws() {
    OperatorTable table = OperatorTable.of(Operator.ADD);

    assertThat(table.arity(Operator.ADD)).isEqualTo(2);
    assertThrows(IllegalArgumentException.class, () -> table.arity(Operator.MULTIPLY));
  }

  @Test
  public void randomOperator_onlyReturnsTableMembers() {
    OperatorTable table = OperatorTable.of(Operator.SUBTRACT, Operator.INCREMENT);
    Random random = new Random(7);

    for (int i = 0; i < 200; i++) {
      assertThat(table.operators()).contains(table.randomOperator(random));
    }
  }
}
