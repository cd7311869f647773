package com.verlumen.symreg.expression;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the prefix form produced by {@link Node#toString()}.
 *
 * <pre>
 *   &lt;e&gt; ::= &lt;number&gt; | x | ( &lt;symbol&gt; &lt;e&gt;* )
 * </pre>
 *
 * <p>Operators must belong to the given {@link OperatorTable} and receive exactly their arity in
 * arguments. Errors are reported as {@link IllegalArgumentException} with the offending position.
 */
public final class ExpressionParser {
  private static final Pattern NUMBER =
      Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");
  private static final Pattern SYMBOL = Pattern.compile("[^\\s()]+");

  private final String text;
  private final OperatorTable operatorTable;
  private int cursor = 0;

  public static Node parse(String text, OperatorTable operatorTable) {
    ExpressionParser parser = new ExpressionParser(checkNotNull(text), checkNotNull(operatorTable));
    Node node = parser.expression();
    parser.skipWhitespace();
    if (parser.cursor != text.length()) {
      throw parser.error("Unexpected trailing input");
    }
    return node;
  }

  private ExpressionParser(String text, OperatorTable operatorTable) {
    this.text = text;
    this.operatorTable = operatorTable;
  }

  private Node expression() {
    skipWhitespace();
    if (cursor >= text.length()) {
      throw error("Unexpected end of input");
    }
    if (text.charAt(cursor) == '(') {
      cursor++;
      return application();
    }
    String token = match(SYMBOL);
    if (token == null) {
      throw error("Unexpected ')'");
    }
    if (token.equals(Variable.SYMBOL)) {
      return Variable.get();
    }
    if (NUMBER.matcher(token).matches()) {
      return Constant.of(Double.parseDouble(token));
    }
    cursor -= token.length();
    throw error("Unknown terminal '" + token + "'");
  }

  private Node application() {
    skipWhitespace();
    int symbolStart = cursor;
    String symbol = match(SYMBOL);
    if (symbol == null) {
      throw error("Expected operator");
    }
    Operator operator =
        Operator.forSymbol(symbol)
            .filter(operatorTable::contains)
            .orElseThrow(
                () -> new IllegalArgumentException(
                    String.format("Unknown operator at %d: '%s'", symbolStart, symbol)));
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    int count = 0;
    while (true) {
      skipWhitespace();
      if (cursor >= text.length()) {
        throw error("Missing ')'");
      }
      if (text.charAt(cursor) == ')') {
        cursor++;
        break;
      }
      children.add(expression());
      count++;
    }
    if (count != operator.arity()) {
      throw new IllegalArgumentException(
          String.format(
              "Operator '%s' at %d takes %d arguments but got %d",
              symbol, symbolStart, operator.arity(), count));
    }
    return Application.of(operator, children.build());
  }

  private String match(Pattern pattern) {
    Matcher matcher = pattern.matcher(text);
    if (!matcher.find(cursor) || matcher.start() != cursor) {
      return null;
    }
    cursor = matcher.end();
    return matcher.group();
  }

  private void skipWhitespace() {
    while (cursor < text.length() && Character.isWhitespace(text.charAt(cursor))) {
      cursor++;
    }
  }

  private IllegalArgumentException error(String message) {
    return new IllegalArgumentException(String.format("%s at %d in '%s'", message, cursor, text));
  }
}
