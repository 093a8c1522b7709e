package com.gentoro.medigraph.guideline;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of the guideline catalogue: the guideline texts, the keyword dictionaries used to
 * find mentioned conditions and medications, and explicit recommendation rules.
 */
public class GuidelineCatalog {

  @JsonProperty("guidelines")
  public List<Guideline> guidelines = new ArrayList<>();

  /** Canonical condition term to the phrases that signal it in guideline text. */
  @JsonProperty("condition_keywords")
  public Map<String, List<String>> conditionKeywords = new LinkedHashMap<>();

  @JsonProperty("medication_keywords")
  public Map<String, List<String>> medicationKeywords = new LinkedHashMap<>();

  @JsonProperty("rules")
  public List<LinkRule> rules = new ArrayList<>();

  public static class Guideline {
    @JsonProperty("id")
    public String id;

    @JsonProperty("title")
    public String title;

    @JsonProperty("source")
    public String source;

    @JsonProperty("text")
    public String text;
  }

  /**
   * Applies when every phrase in {@code requires} occurs in a guideline's text. A {@code
   * RECOMMENDS} rule links the guideline to the medication (with a reason) and to the condition
   * it targets; a {@code CONTRAINDICATED_FOR} rule links it to the condition only.
   */
  public static class LinkRule {
    @JsonProperty("kind")
    public RuleKind kind;

    @JsonProperty("requires")
    public List<String> requires = new ArrayList<>();

    @JsonProperty("condition")
    public String condition;

    @JsonProperty("medication")
    public String medication;

    @JsonProperty("reason")
    public String reason;
  }

  public enum RuleKind {
    RECOMMENDS,
    CONTRAINDICATED_FOR
  }
}
