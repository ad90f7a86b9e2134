package com.quantori.crp.api;

import com.quantori.crp.api.element.ElementTable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses condensed molecular formulas into an element composition and a net charge.
 * <p>
 * Supported syntax: element symbols with counts ({@code H2O}), nested groups in round, square or
 * curly brackets ({@code Ca(OH)2}, {@code K4[Fe(CN)6]}), hydrate separators {@code ·}, {@code .} or
 * {@code *} with an optional multiplier ({@code CuSO4·5H2O}) and a trailing charge written with a caret
 * ({@code Fe^2+}, {@code SO4^2-}), as sign plus magnitude ({@code Fe+3}), as repeated signs
 * ({@code NH4+}, {@code Fe+++}) or with superscripts ({@code Ce⁴⁺}). Digits directly before a trailing
 * sign are atom counts, so {@code Fe2+} is {@code Fe2} with a single positive charge.
 */
public final class FormulaParser {

  private static final Pattern CARET_CHARGE = Pattern.compile("\\^(\\d*)([+-])$|\\^([+-])(\\d*)$");
  private static final Pattern SIGN_MAGNITUDE_CHARGE = Pattern.compile("([+-])(\\d+)$");
  private static final Pattern REPEATED_SIGN_CHARGE = Pattern.compile("(\\++|-+)$");
  private static final Pattern HYDRATE_SEPARATOR = Pattern.compile("[·.*]");

  private final ElementTable elementTable;

  public FormulaParser() {
    this(ElementTable.defaultTable());
  }

  public FormulaParser(ElementTable elementTable) {
    this.elementTable = elementTable;
  }

  /**
   * Parses a formula.
   *
   * @param text formula text
   * @return composition, charge and the written formula without charge
   * @throws ValidationException if the formula is empty, malformed or names an unknown element
   */
  public ParsedFormula parse(String text) {
    if (StringUtils.isBlank(text)) {
      throw new ValidationException("Formula must not be empty");
    }
    String body = StringUtils.deleteWhitespace(text);
    int charge = 0;

    int superscriptStart = superscriptChargeStart(body);
    Matcher matcher;
    if (superscriptStart < body.length()) {
      charge = parseSuperscriptCharge(body.substring(superscriptStart), text);
      body = body.substring(0, superscriptStart);
    } else if ((matcher = CARET_CHARGE.matcher(body)).find()) {
      String digits = matcher.group(1) != null ? matcher.group(1) : matcher.group(4);
      String sign = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
      charge = signed(sign.charAt(0), digits.isEmpty() ? 1 : Integer.parseInt(digits));
      body = body.substring(0, matcher.start());
    } else if ((matcher = SIGN_MAGNITUDE_CHARGE.matcher(body)).find()) {
      charge = signed(matcher.group(1).charAt(0), Integer.parseInt(matcher.group(2)));
      body = body.substring(0, matcher.start());
    } else if ((matcher = REPEATED_SIGN_CHARGE.matcher(body)).find()) {
      charge = signed(matcher.group(1).charAt(0), matcher.group(1).length());
      body = body.substring(0, matcher.start());
    }
    if (body.isEmpty()) {
      throw new ValidationException("Formula has no elements: " + text);
    }

    Map<String, Integer> elements = new LinkedHashMap<>();
    for (String part : HYDRATE_SEPARATOR.split(body)) {
      if (part.isEmpty()) {
        throw new ValidationException("Malformed hydrate formula: " + text);
      }
      int multiplierEnd = 0;
      while (multiplierEnd < part.length() && Character.isDigit(part.charAt(multiplierEnd))) {
        multiplierEnd++;
      }
      int multiplier = multiplierEnd == 0 ? 1 : Integer.parseInt(part.substring(0, multiplierEnd));
      if (multiplier == 0) {
        throw new ValidationException("Zero multiplier in formula: " + text);
      }
      Cursor cursor = new Cursor(part, multiplierEnd, text);
      Map<String, Integer> group = parseGroup(cursor, (char) 0);
      group.forEach((symbol, count) -> elements.merge(symbol, count * multiplier, Integer::sum));
    }
    return new ParsedFormula(Collections.unmodifiableMap(elements), charge, body);
  }

  private Map<String, Integer> parseGroup(Cursor cursor, char closing) {
    Map<String, Integer> elements = new LinkedHashMap<>();
    while (cursor.hasNext()) {
      char c = cursor.peek();
      if (c == closing) {
        cursor.next();
        return elements;
      }
      if (c == '(' || c == '[' || c == '{') {
        cursor.next();
        Map<String, Integer> inner = parseGroup(cursor, closingOf(c));
        int count = cursor.readCount();
        inner.forEach((symbol, n) -> elements.merge(symbol, n * count, Integer::sum));
      } else if (Character.isUpperCase(c)) {
        String symbol = readSymbol(cursor);
        elements.merge(symbol, cursor.readCount(), Integer::sum);
      } else {
        throw cursor.error("Unexpected character '" + c + "'");
      }
    }
    if (closing != 0) {
      throw cursor.error("Unclosed group, expected '" + closing + "'");
    }
    return elements;
  }

  private String readSymbol(Cursor cursor) {
    StringBuilder symbol = new StringBuilder().append(cursor.next());
    if (cursor.hasNext() && Character.isLowerCase(cursor.peek())) {
      symbol.append(cursor.next());
    }
    String result = symbol.toString();
    if (!elementTable.contains(result)) {
      throw new ValidationException("Unknown element '" + result + "' in formula: " + cursor.source);
    }
    return result;
  }

  private static char closingOf(char opening) {
    return switch (opening) {
      case '(' -> ')';
      case '[' -> ']';
      default -> '}';
    };
  }

  private static int superscriptChargeStart(String body) {
    int start = body.length();
    while (start > 0) {
      char c = body.charAt(start - 1);
      if (ChargeNotation.SUPERSCRIPT_DIGITS.indexOf(c) < 0
          && c != ChargeNotation.SUPERSCRIPT_PLUS && c != ChargeNotation.SUPERSCRIPT_MINUS) {
        break;
      }
      start--;
    }
    return start;
  }

  private static int parseSuperscriptCharge(String suffix, String text) {
    int magnitude = 0;
    int signs = 0;
    char sign = 0;
    for (char c : suffix.toCharArray()) {
      int digit = ChargeNotation.SUPERSCRIPT_DIGITS.indexOf(c);
      if (digit >= 0) {
        magnitude = magnitude * 10 + digit;
      } else {
        if (sign != 0 && sign != c) {
          throw new ValidationException("Malformed charge in formula: " + text);
        }
        sign = c;
        signs++;
      }
    }
    if (sign == 0) {
      throw new ValidationException("Charge without sign in formula: " + text);
    }
    int value = magnitude == 0 ? signs : magnitude;
    return sign == ChargeNotation.SUPERSCRIPT_PLUS ? value : -value;
  }

  private static int signed(char sign, int magnitude) {
    return sign == '-' ? -magnitude : magnitude;
  }

  /**
   * Result of {@link #parse(String)}.
   */
  @Value
  public static class ParsedFormula {
    /**
     * Composition in order of first appearance.
     */
    Map<String, Integer> elements;
    int charge;
    /**
     * Written formula with whitespace and charge removed.
     */
    String notation;
  }

  private static final class Cursor {
    private final String text;
    private final String source;
    private int position;

    private Cursor(String text, int position, String source) {
      this.text = text;
      this.position = position;
      this.source = source;
    }

    boolean hasNext() {
      return position < text.length();
    }

    char peek() {
      return text.charAt(position);
    }

    char next() {
      return text.charAt(position++);
    }

    int readCount() {
      int start = position;
      while (hasNext() && Character.isDigit(peek())) {
        position++;
      }
      if (start == position) {
        return 1;
      }
      int count = Integer.parseInt(text.substring(start, position));
      if (count == 0) {
        throw error("Zero atom count");
      }
      return count;
    }

    ValidationException error(String message) {
      return new ValidationException(message + " at position " + position + " in formula: " + source);
    }
  }
}
