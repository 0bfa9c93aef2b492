package com.flamingo.ai.dealflow.service.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.dealflow.domain.enums.MarketTag;
import com.flamingo.ai.dealflow.exception.ReferenceDataException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

/**
 * Reads and validates the attribution rate table. Any missing section, unknown market tag or
 * negative rate is a {@link ReferenceDataException}.
 */
@Slf4j
@RequiredArgsConstructor
public class RateTableLoader {

  static final String ADVISORY_FEE_BPS = "advisory_fee_bps";
  static final String UNDERWRITING_FEE_BPS = "underwriting_fee_bps";
  static final String ROLE_SPLITS = "role_splits";
  static final String THRESHOLDS = "thresholds";

  private final ObjectMapper objectMapper;

  public RateTable load(Resource resource) {
    String location = resource.getDescription();
    if (!resource.exists()) {
      throw new ReferenceDataException(location, "Rate table not found");
    }
    JsonNode root;
    try (InputStream in = resource.getInputStream()) {
      root = objectMapper.readTree(in);
    } catch (IOException e) {
      throw new ReferenceDataException(location, "Rate table is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new ReferenceDataException(location, "Rate table must be a JSON object");
    }
    for (String section :
        List.of(ADVISORY_FEE_BPS, UNDERWRITING_FEE_BPS, ROLE_SPLITS, THRESHOLDS)) {
      if (!root.has(section)) {
        throw new ReferenceDataException(location, "Rate table is missing '" + section + "'");
      }
    }

    RateTable table =
        new RateTable(
            readBrackets(location, root.get(ADVISORY_FEE_BPS)),
            readUnderwriting(location, root.get(UNDERWRITING_FEE_BPS)),
            readRoleSplits(location, root.get(ROLE_SPLITS)),
            readNumbers(location, THRESHOLDS, root.get(THRESHOLDS)));
    log.info(
        "Loaded rate table from {}: {} advisory brackets, {} role-split families",
        location,
        table.advisoryBrackets().size(),
        table.roleSplits().size());
    return table;
  }

  private List<RateTable.AdvisoryBracket> readBrackets(String location, JsonNode node) {
    if (!node.isArray() || node.isEmpty()) {
      throw new ReferenceDataException(
          location, "'" + ADVISORY_FEE_BPS + "' must be a non-empty array");
    }
    List<RateTable.AdvisoryBracket> brackets = new ArrayList<>();
    boolean hasFloor = false;
    for (JsonNode bracket : node) {
      BigDecimal min =
          number(location, ADVISORY_FEE_BPS + ".min_deal_value", bracket.get("min_deal_value"));
      BigDecimal bps = number(location, ADVISORY_FEE_BPS + ".bps", bracket.get("bps"));
      hasFloor |= min.signum() == 0;
      brackets.add(new RateTable.AdvisoryBracket(min, bps));
    }
    if (!hasFloor) {
      throw new ReferenceDataException(
          location, "'" + ADVISORY_FEE_BPS + "' needs a bracket starting at min_deal_value 0");
    }
    return brackets;
  }

  private Map<MarketTag, BigDecimal> readUnderwriting(String location, JsonNode node) {
    Map<String, BigDecimal> raw = readNumbers(location, UNDERWRITING_FEE_BPS, node);
    Map<MarketTag, BigDecimal> rates = new EnumMap<>(MarketTag.class);
    for (Map.Entry<String, BigDecimal> entry : raw.entrySet()) {
      try {
        rates.put(MarketTag.valueOf(entry.getKey()), entry.getValue());
      } catch (IllegalArgumentException e) {
        throw new ReferenceDataException(
            location, "Unknown market tag '" + entry.getKey() + "' in " + UNDERWRITING_FEE_BPS, e);
      }
    }
    if (!rates.containsKey(MarketTag.UNKNOWN)) {
      throw new ReferenceDataException(
          location, "'" + UNDERWRITING_FEE_BPS + "' needs an UNKNOWN fallback rate");
    }
    return rates;
  }

  private Map<String, Map<String, BigDecimal>> readRoleSplits(String location, JsonNode node) {
    if (!node.isObject()) {
      throw new ReferenceDataException(location, "'" + ROLE_SPLITS + "' must be an object");
    }
    Map<String, Map<String, BigDecimal>> splits = new HashMap<>();
    Iterator<Map.Entry<String, JsonNode>> families = node.fields();
    while (families.hasNext()) {
      Map.Entry<String, JsonNode> family = families.next();
      String path = ROLE_SPLITS + "." + family.getKey();
      Map<String, BigDecimal> weights = readNumbers(location, path, family.getValue());
      if (!weights.containsKey(RateTable.OTHER_ROLE)) {
        throw new ReferenceDataException(location, "'" + path + "' needs an 'other' weight");
      }
      splits.put(family.getKey(), weights);
    }
    for (String required : List.of(RateTable.UNKNOWN_FAMILY, RateTable.ADVISORY_FAMILY)) {
      if (!splits.containsKey(required)) {
        throw new ReferenceDataException(
            location, "'" + ROLE_SPLITS + "' needs a '" + required + "' table");
      }
    }
    return splits;
  }

  private Map<String, BigDecimal> readNumbers(String location, String path, JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new ReferenceDataException(location, "'" + path + "' must be an object");
    }
    Map<String, BigDecimal> values = new HashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      values.put(field.getKey(), number(location, path + "." + field.getKey(), field.getValue()));
    }
    return values;
  }

  private static BigDecimal number(String location, String path, JsonNode node) {
    if (node == null || !node.isNumber()) {
      throw new ReferenceDataException(location, "'" + path + "' must be a number");
    }
    BigDecimal value = node.decimalValue();
    if (value.signum() < 0) {
      throw new ReferenceDataException(location, "'" + path + "' must not be negative");
    }
    return value;
  }
}
