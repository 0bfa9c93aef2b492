package com.flamingo.ai.dealflow.service.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.dealflow.exception.ReferenceDataException;
import com.flamingo.ai.dealflow.service.extraction.PartyNameNormalizer;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

/**
 * Reads and validates the sponsor seed list.
 *
 * <p>Expected shape: {@code {"sponsors": [{"name": "KKR", "aliases": ["kkr", "kohlberg kravis
 * roberts"]}]}}. An alias may belong to one sponsor only.
 */
@Slf4j
@RequiredArgsConstructor
public class SponsorSeedListLoader {

  private final ObjectMapper objectMapper;

  public SponsorSeedList load(Resource resource) {
    String location = resource.getDescription();
    if (!resource.exists()) {
      throw new ReferenceDataException(location, "Sponsor seed list not found");
    }
    JsonNode root;
    try (InputStream in = resource.getInputStream()) {
      root = objectMapper.readTree(in);
    } catch (IOException e) {
      throw new ReferenceDataException(location, "Sponsor seed list is not valid JSON", e);
    }
    if (root == null || !root.path("sponsors").isArray() || root.path("sponsors").isEmpty()) {
      throw new ReferenceDataException(location, "Sponsor seed list has no 'sponsors' entries");
    }

    List<SponsorSeedList.Sponsor> sponsors = new ArrayList<>();
    Map<String, String> owners = new HashMap<>();
    for (JsonNode node : root.path("sponsors")) {
      String name = node.path("name").asText("").trim();
      if (name.isEmpty()) {
        throw new ReferenceDataException(location, "Sponsor entry without a name");
      }
      JsonNode aliasNodes = node.path("aliases");
      if (!aliasNodes.isArray() || aliasNodes.isEmpty()) {
        throw new ReferenceDataException(location, "Sponsor '" + name + "' has no aliases");
      }
      List<String> aliases = new ArrayList<>();
      for (JsonNode aliasNode : aliasNodes) {
        String alias = aliasNode.asText("").trim().toLowerCase(Locale.ROOT);
        String key = PartyNameNormalizer.normalize(alias);
        if (key.isEmpty()) {
          throw new ReferenceDataException(location, "Sponsor '" + name + "' has a blank alias");
        }
        String owner = owners.putIfAbsent(key, name);
        if (owner != null && !owner.equals(name)) {
          throw new ReferenceDataException(
              location,
              "Alias '" + alias + "' is claimed by both '" + owner + "' and '" + name + "'");
        }
        aliases.add(alias);
      }
      sponsors.add(new SponsorSeedList.Sponsor(name, aliases));
    }
    log.info(
        "Loaded {} sponsors with {} aliases from {}", sponsors.size(), owners.size(), location);
    return new SponsorSeedList(sponsors);
  }
}
