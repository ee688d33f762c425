package com.gentoro.lexgraph.reference;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A citation-shaped phrase and the reference type it signals. {@link #PRIORITY_ORDER} is the full
 * table, most specific first; a position claimed by an earlier pattern is never reused by a later
 * one.
 */
public final class ReferencePattern {

  /**
   * Section number with optional letter suffix, hyphenated part and subdivisions: 162, 401k,
   * 1400Z-2, 1(a)(2).
   */
  static final String SECTION_NUMBER =
      "\\d+[A-Za-z]{0,2}(?:[-\u2013]\\d+[A-Za-z]?)?(?:\\([A-Za-z0-9]+\\))*";

  /** One or more numbers joined by commas and a final "and" or "or". */
  private static final String NUMBER_LIST =
      SECTION_NUMBER + "(?:\\s*,\\s*" + SECTION_NUMBER + ")*,?\\s+(?:and|or)\\s+" + SECTION_NUMBER;

  private static final Pattern NUMBER = Pattern.compile(SECTION_NUMBER);

  public static final List<ReferencePattern> PRIORITY_ORDER =
      List.of(
          new ReferencePattern(
              "defined-in",
              ReferenceType.DEFINITION,
              "\\bas\\s+defined\\s+in\\s+section\\s+(" + SECTION_NUMBER + ")",
              false),
          new ReferencePattern(
              "except-as-provided",
              ReferenceType.EXCEPTION,
              "\\bexcept\\s+as\\s+(?:otherwise\\s+)?provided\\s+(?:in|by|under)\\s+section\\s+("
                  + SECTION_NUMBER
                  + ")",
              false),
          new ReferencePattern(
              "exception-under",
              ReferenceType.EXCEPTION,
              "\\bexceptions?\\s+(?:provided\\s+)?(?:in|under)\\s+section\\s+("
                  + SECTION_NUMBER
                  + ")",
              false),
          new ReferencePattern(
              "subject-to",
              ReferenceType.SUBJECT_TO,
              "\\bsubject\\s+to\\s+(?:the\\s+(?:provisions|limitations|requirements)\\s+of\\s+)?"
                  + "section\\s+("
                  + SECTION_NUMBER
                  + ")",
              false),
          new ReferencePattern(
              "section-list",
              ReferenceType.GENERAL,
              "\\bsections\\s+(" + NUMBER_LIST + ")",
              true),
          new ReferencePattern(
              "section", ReferenceType.GENERAL, "\\bsection\\s+(" + SECTION_NUMBER + ")", false),
          new ReferencePattern(
              "sec-abbreviation",
              ReferenceType.GENERAL,
              "\\bsec\\.\\s*(" + SECTION_NUMBER + ")",
              false),
          new ReferencePattern(
              "section-sign-list", ReferenceType.GENERAL, "§§\\s*(" + NUMBER_LIST + ")", true),
          new ReferencePattern(
              "section-sign", ReferenceType.GENERAL, "§§?\\s*(" + SECTION_NUMBER + ")", false));

  private final String name;
  private final ReferenceType type;
  private final Pattern pattern;
  private final boolean list;

  private ReferencePattern(String name, ReferenceType type, String regex, boolean list) {
    this.name = name;
    this.type = type;
    this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    this.list = list;
  }

  public String getName() {
    return name;
  }

  public ReferenceType getType() {
    return type;
  }

  public Pattern getPattern() {
    return pattern;
  }

  /**
   * Section numbers captured by one match, with their offsets in the scanned text. A list pattern
   * yields one target per number it names.
   */
  List<Target> targets(Matcher matcher) {
    List<Target> out = new ArrayList<>();
    if (!list) {
      out.add(new Target(normalize(matcher.group(1)), matcher.start(1)));
      return out;
    }
    Matcher numbers = NUMBER.matcher(matcher.group(1));
    while (numbers.find()) {
      out.add(new Target(normalize(numbers.group()), matcher.start(1) + numbers.start()));
    }
    return out;
  }

  /** En dashes in hyphenated numbers are printed variants of the hyphen. */
  private static String normalize(String number) {
    return number.replace('\u2013', '-');
  }

  record Target(String number, int position) {}

  @Override
  public String toString() {
    return name + "->" + type.key();
  }
}
