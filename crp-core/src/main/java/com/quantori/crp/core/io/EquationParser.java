package com.quantori.crp.core.io;

import com.quantori.crp.api.Molecule;
import com.quantori.crp.api.Phase;
import com.quantori.crp.api.ValidationException;
import com.quantori.crp.core.ReactionEngine;
import com.quantori.crp.core.model.Reaction;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses equation strings such as {@code CH4 + 2O2 -> CO2 + 2H2O}.
 * <p>
 * Accepted arrows are {@code ->}, {@code →} and {@code =}. Terms may carry a leading coefficient and a
 * trailing phase ({@code (s)}, {@code (l)}, {@code (g)}, {@code (aq)}). Trailing annotations
 * {@code [catalyst: MnO2]} and {@code [T=298K, P=1atm, solvent=water]} are read back into catalysts and
 * conditions, so the output of {@link Reaction#toString()} parses to an equivalent reaction. A plus sign
 * that belongs to an ionic charge ({@code Na+}, {@code Fe^2+}) does not separate terms.
 */
public class EquationParser {

  private static final String[] ARROWS = {"->", "→", "="};
  private static final String EMPTY_SIDE = "∅";
  private static final String CATALYST_PREFIX = "catalyst:";
  private static final Pattern TRAILING_ANNOTATION = Pattern.compile("\\[([^\\[\\]]*)]\\s*$");
  private static final Pattern COEFFICIENT = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(\\D.*)$");
  private static final Pattern PHASE_SUFFIX = Pattern.compile("^(.+?)\\((s|l|g|aq)\\)$");
  private static final Pattern NUMBER_WITH_UNIT = Pattern.compile("^([-+]?\\d+(?:\\.\\d+)?(?:[eE][-+]?\\d+)?)\\s*([A-Za-z]*)$");

  private final ReactionEngine engine;

  public EquationParser() {
    this(ReactionEngine.defaultEngine());
  }

  public EquationParser(ReactionEngine engine) {
    this.engine = engine;
  }

  /**
   * Parses an equation.
   *
   * @param equation equation text
   * @return new reaction bound to this parser's engine
   * @throws ValidationException if there is no arrow or a term or annotation is malformed
   */
  public Reaction parse(String equation) {
    if (StringUtils.isBlank(equation)) {
      throw new ValidationException("Equation is empty");
    }
    Reaction reaction = engine.newReaction();
    String body = equation.trim();
    List<String> annotations = new ArrayList<>();
    Matcher annotation = TRAILING_ANNOTATION.matcher(body);
    while (annotation.find() && isAnnotation(annotation.group(1))) {
      annotations.add(0, annotation.group(1).trim());
      body = body.substring(0, annotation.start()).trim();
      annotation = TRAILING_ANNOTATION.matcher(body);
    }

    int arrowIndex = -1;
    String arrow = null;
    for (String candidate : ARROWS) {
      arrowIndex = body.indexOf(candidate);
      if (arrowIndex >= 0) {
        arrow = candidate;
        break;
      }
    }
    if (arrow == null) {
      throw new ValidationException("Equation has no reaction arrow (->, → or =): " + equation);
    }

    String left = body.substring(0, arrowIndex);
    String right = body.substring(arrowIndex + arrow.length());
    if (right.contains(arrow)) {
      throw new ValidationException("Equation has more than one reaction arrow: " + equation);
    }
    for (String term : splitTerms(left)) {
      Term parsed = parseTerm(term);
      reaction.addReactant(Molecule.of(parsed.getFormula()), parsed.getCoefficient(), parsed.getPhase(), false);
    }
    for (String term : splitTerms(right)) {
      Term parsed = parseTerm(term);
      reaction.addProduct(Molecule.of(parsed.getFormula()), parsed.getCoefficient(), parsed.getPhase());
    }
    for (String text : annotations) {
      applyAnnotation(reaction, text);
    }
    return reaction;
  }

  /**
   * Splits one side of an equation into terms.
   *
   * @param side side text
   * @return trimmed terms, empty for a blank or {@code ∅} side
   */
  static List<String> splitTerms(String side) {
    String text = side.trim();
    List<String> terms = new ArrayList<>();
    if (text.isEmpty() || EMPTY_SIDE.equals(text)) {
      return terms;
    }
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '+' && separatesTerms(text, i)) {
        terms.add(requireTerm(text.substring(start, i), side));
        start = i + 1;
      }
    }
    terms.add(requireTerm(text.substring(start), side));
    return terms;
  }

  private static boolean separatesTerms(String text, int index) {
    boolean spaceBefore = index > 0 && Character.isWhitespace(text.charAt(index - 1));
    boolean spaceAfter = index + 1 < text.length() && Character.isWhitespace(text.charAt(index + 1));
    if (spaceBefore && spaceAfter) {
      return true;
    }
    if (index > 0 && text.charAt(index - 1) == '^') {
      return false;
    }
    if (index + 1 >= text.length()) {
      return false;
    }
    char next = text.charAt(index + 1);
    if (Character.isUpperCase(next) || next == '(') {
      return true;
    }
    return Character.isDigit(next) && index + 2 < text.length() && Character.isUpperCase(text.charAt(index + 2));
  }

  private static String requireTerm(String term, String side) {
    String trimmed = term.trim();
    if (trimmed.isEmpty()) {
      throw new ValidationException("Empty term in '" + side.trim() + "'");
    }
    return trimmed;
  }

  static Term parseTerm(String term) {
    double coefficient = 1.0;
    String rest = term.trim();
    Matcher coefficientMatcher = COEFFICIENT.matcher(rest);
    if (coefficientMatcher.matches()) {
      coefficient = Double.parseDouble(coefficientMatcher.group(1));
      rest = coefficientMatcher.group(2).trim();
    }
    Phase phase = null;
    Matcher phaseMatcher = PHASE_SUFFIX.matcher(rest);
    if (phaseMatcher.matches()) {
      rest = phaseMatcher.group(1).trim();
      phase = Phase.of(phaseMatcher.group(2));
    }
    return new Term(rest, coefficient, phase);
  }

  private static boolean isAnnotation(String content) {
    String text = content.trim().toLowerCase(Locale.ROOT);
    return text.startsWith(CATALYST_PREFIX) || text.contains("=");
  }

  private static void applyAnnotation(Reaction reaction, String text) {
    if (text.toLowerCase(Locale.ROOT).startsWith(CATALYST_PREFIX)) {
      for (String catalyst : text.substring(CATALYST_PREFIX.length()).split(",")) {
        Term parsed = parseTerm(requireTerm(catalyst, text));
        reaction.addReactant(Molecule.of(parsed.getFormula()), parsed.getCoefficient(), parsed.getPhase(), true);
      }
      return;
    }
    for (String entry : text.split(",")) {
      String[] keyValue = entry.split("=", 2);
      if (keyValue.length != 2 || StringUtils.isBlank(keyValue[0])) {
        throw new ValidationException("Malformed condition '" + entry.trim() + "'");
      }
      String key = keyValue[0].trim();
      String value = keyValue[1].trim();
      if ("T".equals(key)) {
        reaction.setTemperature(number(value, "K"));
      } else if ("P".equals(key)) {
        reaction.setPressure(number(value, "atm"));
      } else {
        reaction.setCondition(key, value);
      }
    }
  }

  private static double number(String value, String unit) {
    Matcher matcher = NUMBER_WITH_UNIT.matcher(value);
    if (!matcher.matches() || !(matcher.group(2).isEmpty() || matcher.group(2).equals(unit))) {
      throw new ValidationException("Expected a number in " + unit + ", got '" + value + "'");
    }
    return Double.parseDouble(matcher.group(1));
  }

  @Value
  static class Term {
    String formula;
    double coefficient;
    Phase phase;
  }
}
