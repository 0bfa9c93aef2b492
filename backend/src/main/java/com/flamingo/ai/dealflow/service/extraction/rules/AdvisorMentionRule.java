package com.flamingo.ai.dealflow.service.extraction.rules;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.service.extraction.ExtractionContext;
import com.flamingo.ai.dealflow.service.extraction.ExtractionRule;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import com.flamingo.ai.dealflow.service.extraction.RuleMatch;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Emits {@code ADVISOR_MENTION} facts for sentences such as {@code Goldman Sachs & Co. LLC is
 * acting as exclusive financial advisor to Beta}.
 */
@Component
@RequiredArgsConstructor
public class AdvisorMentionRule implements ExtractionRule {

  public static final String NAME = "advisor-mention";

  private static final String NAME_TOKEN = "[A-Z][\\w&'.-]*";

  private static final Pattern ADVISOR =
      Pattern.compile(
          "(?<advisor>"
              + NAME_TOKEN
              + "(?:(?:\\s+|,\\s+(?=(?:LLC|Inc|L\\.P|Ltd|plc)\\b))(?:"
              + NAME_TOKEN
              + "|&))*)"
              + "\\s+(?:is|are|was|were|has\\s+been)?\\s*(?:acting|acted|serving|served)\\s+as\\s+"
              + "(?:(?:exclusive|lead|sole|co-lead|joint|a|the|its)\\s+)*financial\\s+advisors?"
              + "(?:\\s+to\\s+(?:the\\s+)?(?<party>"
              + NAME_TOKEN
              + "(?:\\s+"
              + NAME_TOKEN
              + "){0,5}))?");

  private final DealflowConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<RuleMatch> apply(ExtractionContext context) {
    String text = context.fullText();
    List<RuleMatch> matches = new ArrayList<>();
    Matcher matcher = ADVISOR.matcher(text);
    while (matcher.find()) {
      String advisor = matcher.group("advisor").trim();
      String normalized = PartyNameNormalizer.normalize(advisor);
      if (normalized.isEmpty()) {
        continue;
      }
      Map<String, String> payload = new HashMap<>();
      payload.put(PayloadKeys.ADVISOR_NAME_RAW, advisor);
      payload.put(PayloadKeys.ADVISOR_NAME_NORMALIZED, normalized);
      String party = matcher.group("party");
      if (party != null) {
        payload.put(PayloadKeys.ADVISED_PARTY_RAW, PartyNameNormalizer.display(party));
      }
      matches.add(
          new RuleMatch(
              FactKind.ADVISOR_MENTION,
              payload,
              matcher.start("advisor"),
              matcher.end(),
              config.getExtraction().getAdvisorConfidence(),
              NAME));
    }
    return matches;
  }
}
