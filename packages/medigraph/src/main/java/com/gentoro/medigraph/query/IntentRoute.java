package com.gentoro.medigraph.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * One entry of the router's priority table: how to recognize an intent, how to pull its parameter
 * out of the question, and which query to run for it.
 */
public final class IntentRoute {
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[?.!]+$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final Intent intent;
  private final List<String> triggers;
  private final List<String> leadingTriggers;
  private final List<Pattern> triggerPatterns;
  private final List<Pattern> leadingPatterns;
  private final List<Pattern> removals;
  private final String defaultTerm;
  private final Function<String, String> queryBuilder;
  private final List<String> columns;
  private final int limit;
  private final String successMessage;
  private final String notFoundMessage;

  private IntentRoute(Builder b) {
    this.intent = Objects.requireNonNull(b.intent, "intent");
    this.triggers = List.copyOf(b.triggers);
    this.leadingTriggers = List.copyOf(b.leadingTriggers);
    this.defaultTerm = b.defaultTerm;
    this.queryBuilder = Objects.requireNonNull(b.queryBuilder, "queryBuilder");
    this.columns = List.copyOf(b.columns);
    this.limit = b.limit;
    this.successMessage = Objects.requireNonNull(b.successMessage, "successMessage");
    this.notFoundMessage = Objects.requireNonNull(b.notFoundMessage, "notFoundMessage");
    if (triggers.isEmpty() && leadingTriggers.isEmpty()) {
      throw new IllegalArgumentException("Route " + intent + " has no trigger phrase");
    }

    // Triggers match as whole words, the same rule removal uses
    List<Pattern> triggerPatterns = new ArrayList<>();
    for (String trigger : triggers) triggerPatterns.add(wholeWords("", trigger));
    this.triggerPatterns = List.copyOf(triggerPatterns);
    List<Pattern> leadingPatterns = new ArrayList<>();
    for (String prefix : leadingTriggers) leadingPatterns.add(wholeWords("^", prefix));
    this.leadingPatterns = List.copyOf(leadingPatterns);

    // Longest phrases first, so "medications for patient" goes before "medications for"
    List<String> phrases = new ArrayList<>(triggers);
    phrases.addAll(b.fillers);
    phrases.sort((a, c) -> Integer.compare(c.length(), a.length()));
    List<Pattern> patterns = new ArrayList<>();
    for (String phrase : phrases) patterns.add(wholeWords("", phrase));
    this.removals = List.copyOf(patterns);
  }

  private static Pattern wholeWords(String anchor, String phrase) {
    return Pattern.compile(
        anchor + "\\b" + Pattern.quote(phrase) + "\\b",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  public static Builder builder(Intent intent) {
    return new Builder(intent);
  }

  public Intent intent() {
    return intent;
  }

  /**
   * Whether this route claims an already normalized (trimmed, lower-cased) question. Triggers must
   * appear as whole words: "medications for patientP001" does not contain "medications for
   * patient".
   */
  public boolean matches(String normalizedQuestion) {
    for (Pattern trigger : triggerPatterns) {
      if (trigger.matcher(normalizedQuestion).find()) return true;
    }
    for (Pattern prefix : leadingPatterns) {
      if (prefix.matcher(normalizedQuestion).find()) return true;
    }
    return false;
  }

  /**
   * Strip trigger phrases and filler words from the trimmed question, keeping the remainder's
   * original case. Falls back to the default term when nothing is left.
   */
  public String extractParameter(String question) {
    String remainder = question.trim();
    for (Pattern removal : removals) {
      remainder = removal.matcher(remainder).replaceAll(" ");
    }
    remainder = WHITESPACE.matcher(remainder).replaceAll(" ").trim();
    remainder = TRAILING_PUNCTUATION.matcher(remainder).replaceAll("").trim();
    if (remainder.isEmpty() && defaultTerm != null) {
      return defaultTerm;
    }
    return remainder;
  }

  public String buildQuery(String parameter) {
    return queryBuilder.apply(parameter);
  }

  public List<String> columns() {
    return columns;
  }

  public int limit() {
    return limit;
  }

  public String successMessage(String parameter) {
    return format(successMessage, parameter);
  }

  public String notFoundMessage(String parameter) {
    return format(notFoundMessage, parameter);
  }

  private static String format(String template, String parameter) {
    return template.replace("{}", parameter);
  }

  @Override
  public String toString() {
    return "IntentRoute[" + intent + " " + triggers + "]";
  }

  public static final class Builder {
    private final Intent intent;
    private final List<String> triggers = new ArrayList<>();
    private final List<String> leadingTriggers = new ArrayList<>();
    private final List<String> fillers = new ArrayList<>();
    private String defaultTerm;
    private Function<String, String> queryBuilder;
    private final List<String> columns = new ArrayList<>();
    private int limit = 50;
    private String successMessage;
    private String notFoundMessage;

    private Builder(Intent intent) {
      this.intent = intent;
    }

    /** Phrase that selects this route when found anywhere in the question. */
    public Builder trigger(String... phrases) {
      for (String phrase : phrases) triggers.add(phrase.toLowerCase(Locale.ROOT));
      return this;
    }

    /** Phrase that selects this route only when the question starts with it. */
    public Builder leadingTrigger(String... phrases) {
      for (String phrase : phrases) leadingTriggers.add(phrase.toLowerCase(Locale.ROOT));
      return this;
    }

    /** Words removed from the question, in addition to the triggers, when extracting. */
    public Builder filler(String... words) {
      fillers.addAll(List.of(words));
      return this;
    }

    public Builder defaultTerm(String term) {
      this.defaultTerm = term;
      return this;
    }

    /** Cypher for a parameter; it must read the parameter as {@code $term} and cap with {@code $limit}. */
    public Builder query(Function<String, String> builder) {
      this.queryBuilder = builder;
      return this;
    }

    public Builder columns(String... names) {
      columns.addAll(List.of(names));
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    /** Message templates; {@code {}} is replaced with the resolved parameter. */
    public Builder messages(String success, String notFound) {
      this.successMessage = success;
      this.notFoundMessage = notFound;
      return this;
    }

    public IntentRoute build() {
      return new IntentRoute(this);
    }
  }
}
