package io.scpidoc.parser.impl;

import io.scpidoc.parser.api.Parameter;
import io.scpidoc.parser.api.ParameterKind;
import io.scpidoc.parser.api.SyntaxForms;
import io.scpidoc.parser.internal.IndexedFamily;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Derives a typed parameter list from a command's mnemonic, set form and examples.
 *
 * <p>Rules, in output order:
 *
 * <ol>
 *   <li>every indexed placeholder in the mnemonic ({@code CH<x>}) is an integer path parameter
 *   <li>a set form ending in a bare placeholder ({@code DATa:SOUrce CH<x>}) takes a {@code source}
 *       enumeration of the family members
 *   <li>the first brace group with literal options becomes one enumeration
 *   <li>without an argument enumeration, {@code <NR1>}, {@code <NR2>}/{@code <NR3>}/{@code <NRf>}
 *       and {@code <QString>} give an integer, float or string value
 * </ol>
 *
 * The first example that is not a query supplies a default when its last token fits the
 * parameter. When nothing is found, the arguments text may still name the value kind.
 */
public final class ParameterInference {

  private static final int PREVIEW_OPTIONS = 5;

  private final int maxEnumOptions;

  public ParameterInference(int maxEnumOptions) {
    if (maxEnumOptions < 1) {
      throw new IllegalArgumentException("maxEnumOptions must be positive: " + maxEnumOptions);
    }
    this.maxEnumOptions = maxEnumOptions;
  }

  /**
   * Infers parameters.
   *
   * @param mnemonic canonical mnemonic
   * @param forms split syntax
   * @param examples filtered example lines
   * @param argumentsText the entry's arguments text, may be {@code null}
   * @return parameters, unique by name
   */
  public List<Parameter> infer(
      String mnemonic, SyntaxForms forms, List<String> examples, String argumentsText) {
    Map<String, Parameter> params = new LinkedHashMap<>();
    addPathParameters(mnemonic, params);

    String setForm = forms.hasSet() ? forms.setForm() : "";
    addTrailingSource(setForm, params);
    addBraceEnumeration(setForm, params);
    if (params.values().stream().noneMatch(p -> p.kind() == ParameterKind.ENUMERATION)) {
      valueParameter(setForm).ifPresent(p -> params.putIfAbsent(p.name(), p));
    }

    if (params.isEmpty() && argumentsText != null) {
      fromArgumentsText(argumentsText).ifPresent(p -> params.put(p.name(), p));
    }
    return applyDefaults(new ArrayList<>(params.values()), exampleDefault(examples));
  }

  private static void addPathParameters(String mnemonic, Map<String, Parameter> params) {
    Matcher m = SyntaxHeuristics.indexedPlaceholders(mnemonic);
    while (m.find()) {
      Optional<IndexedFamily> family = IndexedFamily.forPrefix(m.group(1));
      if (family.isPresent()) {
        IndexedFamily f = family.get();
        params.putIfAbsent(
            f.parameterName(),
            Parameter.indexed(
                f.parameterName(),
                f.min(),
                f.max(),
                capitalize(f.parameterName()) + " number (" + f.min() + "-" + f.max() + ")"));
      }
    }
  }

  private void addTrailingSource(String setForm, Map<String, Parameter> params) {
    Optional<String> token = SyntaxHeuristics.trailingBarePlaceholder(setForm);
    if (token.isEmpty()) {
      return;
    }
    List<String> options = expandOption(token.get());
    if (!options.isEmpty()) {
      params.putIfAbsent("source", Parameter.enumeration("source", options, preview(options)));
    }
  }

  private void addBraceEnumeration(String setForm, Map<String, Parameter> params) {
    Matcher groups = SyntaxHeuristics.braceGroups(setForm);
    while (groups.find()) {
      List<String> raw = new ArrayList<>();
      for (String option : groups.group(1).split("\\|")) {
        if (!option.isBlank()) {
          raw.add(option.trim());
        }
      }
      if (raw.isEmpty() || raw.stream().allMatch(SyntaxHeuristics::isValuePlaceholder)) {
        continue;
      }
      Set<String> options = new LinkedHashSet<>();
      int expanded = 0;
      for (String option : raw) {
        if (SyntaxHeuristics.isValuePlaceholder(option)) {
          continue;
        }
        if (SyntaxHeuristics.indexedFamilyOf(option).isPresent()) {
          List<String> members = expandOption(option);
          expanded += members.size();
          options.addAll(members);
        } else {
          options.add(option);
        }
      }
      List<String> capped = cap(new ArrayList<>(options));
      if (capped.isEmpty()) {
        continue;
      }
      String name = enumerationName(capped, Math.min(expanded, capped.size()));
      params.putIfAbsent(name, Parameter.enumeration(name, capped, preview(capped)));
      return;
    }
  }

  static String enumerationName(List<String> options, int expandedCount) {
    if (SyntaxHeuristics.isBooleanPair(options)) {
      return "state";
    }
    if (expandedCount * 2 > options.size()) {
      return "source";
    }
    return "value";
  }

  private static Optional<Parameter> valueParameter(String setForm) {
    if (SyntaxHeuristics.isIntegerPlaceholder(setForm)) {
      return Optional.of(Parameter.value("value", ParameterKind.INTEGER, "Integer value"));
    }
    if (SyntaxHeuristics.isFloatPlaceholder(setForm)) {
      return Optional.of(Parameter.value("value", ParameterKind.FLOAT, "Floating point value"));
    }
    if (SyntaxHeuristics.isStringPlaceholder(setForm)) {
      return Optional.of(Parameter.value("label", ParameterKind.STRING, "Quoted string value"));
    }
    return Optional.empty();
  }

  static Optional<Parameter> fromArgumentsText(String argumentsText) {
    String lower = argumentsText.toLowerCase(Locale.ROOT);
    if (lower.contains("integer")) {
      return Optional.of(Parameter.value("value", ParameterKind.INTEGER, null));
    }
    if (lower.contains("float") || lower.contains("nr2") || lower.contains("nr3")) {
      return Optional.of(Parameter.value("value", ParameterKind.FLOAT, null));
    }
    if (lower.contains("string") || lower.contains("quoted")) {
      return Optional.of(Parameter.value("label", ParameterKind.STRING, null));
    }
    return Optional.empty();
  }

  /** Last token of the first non-query example snippet, or {@code null}. */
  static String exampleDefault(List<String> examples) {
    for (String example : examples) {
      if (example.contains("?")) {
        continue;
      }
      String snippet = ExampleSplitter.snippet(example).trim();
      int space = snippet.lastIndexOf(' ');
      if (space > 0) {
        return snippet.substring(space + 1);
      }
    }
    return null;
  }

  /**
   * Gives the example default to the last argument parameter it fits; enumerations left without a
   * default take their first option.
   */
  private static List<Parameter> applyDefaults(List<Parameter> params, String literal) {
    if (literal != null) {
      for (int i = params.size() - 1; i >= 0; i--) {
        Parameter p = params.get(i);
        if (p.isPathParameter()) {
          continue;
        }
        Object value = coerce(p, literal);
        if (value != null) {
          params.set(i, p.withDefault(value));
          break;
        }
      }
    }
    for (int i = 0; i < params.size(); i++) {
      Parameter p = params.get(i);
      if (p.kind() == ParameterKind.ENUMERATION && p.defaultValue() == null) {
        params.set(i, p.withDefault(p.options().get(0)));
      }
    }
    return params;
  }

  /**
   * Converts an example literal to a default of the parameter's kind.
   *
   * @return the default, or {@code null} when the literal does not fit
   */
  static Object coerce(Parameter p, String literal) {
    switch (p.kind()) {
      case INTEGER:
        if (SyntaxHeuristics.isNumericLiteral(literal)) {
          double d = Double.parseDouble(literal);
          if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
            return (int) d;
          }
        }
        return null;
      case FLOAT:
        return SyntaxHeuristics.isNumericLiteral(literal) ? Double.parseDouble(literal) : null;
      case STRING:
        return SyntaxHeuristics.isQuotedString(literal)
            ? literal.substring(1, literal.length() - 1)
            : null;
      case ENUMERATION:
        for (String option : p.options()) {
          if (option.equalsIgnoreCase(literal)) {
            return option;
          }
        }
        if (p.name().equals("state") && SyntaxHeuristics.isBooleanLike(literal)) {
          return literal.toUpperCase(Locale.ROOT);
        }
        return null;
      default:
        return null;
    }
  }

  private List<String> expandOption(String option) {
    Matcher m = SyntaxHeuristics.indexedPlaceholders(option.trim());
    if (!m.matches()) {
      return List.of(option);
    }
    Optional<IndexedFamily> family = IndexedFamily.forPrefix(m.group(1));
    if (family.isEmpty()) {
      return List.of(option);
    }
    return cap(family.get().expand(m.group(1).toUpperCase(Locale.ROOT)));
  }

  private List<String> cap(List<String> options) {
    return options.size() > maxEnumOptions ? options.subList(0, maxEnumOptions) : options;
  }

  private static String preview(List<String> options) {
    String shown = String.join(", ", options.subList(0, Math.min(PREVIEW_OPTIONS, options.size())));
    return "Options: " + shown + (options.size() > PREVIEW_OPTIONS ? "..." : "");
  }

  private static String capitalize(String s) {
    return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
