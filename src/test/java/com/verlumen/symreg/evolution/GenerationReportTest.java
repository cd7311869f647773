package com.verlumen.symreg.evolution;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.symreg.expression.ExpressionParser;
import com.verlumen.symreg.expression.Node;
import com.verlumen.symreg.expression.OperatorTable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GenerationReportTest {
  @Test
  public void create_summarizesSortedPopulation() {
    Node best = parse("(+ x 1.0)");
    ImmutableList<ScoredIndividual> population =
        ImmutableList.of(
            ScoredIndividual.create(best, 0.5),
            ScoredIndividual.create(parse("x"), 2.0),
            ScoredIndividual.create(parse("(* x (- x 2.0))"), 3.0),
            ScoredIndividual.create(parse("4.0"), 8.0));

    GenerationReport report = GenerationReport.create(3, population);

    assertThat(report.generation()).isEqualTo(3);
    assertThat(report.populationSize()).isEqualTo(4);
    assertThat(report.best()).isEqualTo(best);
    assertThat(report.bestError()).isEqualTo(0.5);
    // Rank 4 / 2 = 2.
    assertThat(report.medianError()).isEqualTo(3.0);
    assertThat(report.worstError()).isEqualTo(8.0);
    // Sizes 3, 1, 5, 1.
    assertThat(report.meanProgramSize()).isWithin(1e-12).of(2.5);
    // Depths 1, 0, 2, 0.
    assertThat(report.meanDepth()).isWithin(1e-12).of(0.75);
  }

  @Test
  public void create_withEmptyPopulation_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> GenerationReport.create(0, ImmutableList.of()));
  }

  private static Node parse(String text) {
    return ExpressionParser.parse(text, OperatorTable.standard());
  }
}
