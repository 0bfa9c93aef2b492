package com.flamingo.ai.dealflow.service.table;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonical financing participant roles.
 *
 * <p>Matching is ordered from most to least specific, so {@code Joint Lead Arranger} resolves to
 * {@code joint_lead_arranger} rather than {@code arranger}.
 */
public final class ParticipantRoles {

  public static final String JOINT_BOOKRUNNER = "joint_bookrunner";
  public static final String BOOKRUNNER = "bookrunner";
  public static final String CO_MANAGER = "co_manager";
  public static final String LEAD_UNDERWRITER = "lead_underwriter";
  public static final String UNDERWRITER = "underwriter";
  public static final String JOINT_LEAD_ARRANGER = "joint_lead_arranger";
  public static final String LEAD_ARRANGER = "lead_arranger";
  public static final String ARRANGER = "arranger";
  public static final String ADMINISTRATIVE_AGENT = "administrative_agent";
  public static final String SYNDICATION_AGENT = "syndication_agent";
  public static final String AGENT = "agent";
  public static final String FINANCIAL_ADVISOR = "financial_advisor";
  public static final String OTHER = "other";

  private static final Map<Pattern, String> RULES = new LinkedHashMap<>();

  static {
    rule("joint\\s+(?:lead\\s+)?book[-\\s]?runn(?:er|ing\\s+managers?)s?", JOINT_BOOKRUNNER);
    rule("book[-\\s]?runn(?:er|ing\\s+managers?)s?", BOOKRUNNER);
    rule("co[-\\s]?managers?", CO_MANAGER);
    rule("joint\\s+lead\\s+arrangers?", JOINT_LEAD_ARRANGER);
    rule("(?:mandated\\s+)?lead\\s+arrangers?", LEAD_ARRANGER);
    rule("arrangers?", ARRANGER);
    rule("administrative\\s+agents?", ADMINISTRATIVE_AGENT);
    rule("syndication\\s+agents?", SYNDICATION_AGENT);
    rule("(?:documentation|collateral|paying)\\s+agents?", AGENT);
    wholeTextRule("agents?", AGENT);
    rule("lead\\s+(?:underwriters?|managers?)|representatives?", LEAD_UNDERWRITER);
    rule("underwriters?|initial\\s+purchasers?", UNDERWRITER);
    wholeTextRule("managers?", UNDERWRITER);
    rule("financial\\s+advis[eo]rs?", FINANCIAL_ADVISOR);
  }

  private ParticipantRoles() {}

  private static void rule(String regex, String role) {
    RULES.put(Pattern.compile("\\b(?:" + regex + ")\\b", Pattern.CASE_INSENSITIVE), role);
  }

  /** Generic words such as {@code Agent} only name a role when they are the whole text. */
  private static void wholeTextRule(String regex, String role) {
    RULES.put(
        Pattern.compile(
            "^\\s*(?:the\\s+)?(?:" + regex + ")\\s*[.:;,]?\\s*$", Pattern.CASE_INSENSITIVE),
        role);
  }

  /** Canonical role for free-form role text, {@link #OTHER} when nothing matches. */
  public static String normalize(String roleText) {
    if (roleText == null || roleText.isBlank()) {
      return OTHER;
    }
    for (Map.Entry<Pattern, String> entry : RULES.entrySet()) {
      if (entry.getKey().matcher(roleText).find()) {
        return entry.getValue();
      }
    }
    return OTHER;
  }

  /** True when the text names a financing role. */
  public static boolean isRole(String text) {
    return !OTHER.equals(normalize(text));
  }
}
