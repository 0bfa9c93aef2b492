package com.flamingo.ai.dealflow.service.extraction;

import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/** Fixed mapping from defined-term labels to transaction roles. */
public final class RoleLabels {

  private static final Map<String, PartyRole> LABELS =
      Map.ofEntries(
          Map.entry("company", PartyRole.TARGET),
          Map.entry("target", PartyRole.TARGET),
          Map.entry("seller", PartyRole.TARGET),
          Map.entry("parent", PartyRole.ACQUIRER),
          Map.entry("buyer", PartyRole.ACQUIRER),
          Map.entry("purchaser", PartyRole.ACQUIRER),
          Map.entry("acquirer", PartyRole.ACQUIRER),
          Map.entry("acquiror", PartyRole.ACQUIRER),
          Map.entry("holdco", PartyRole.ACQUIRER),
          Map.entry("merger sub", PartyRole.ACQUISITION_VEHICLE),
          Map.entry("merger subsidiary", PartyRole.ACQUISITION_VEHICLE),
          Map.entry("acquisition sub", PartyRole.ACQUISITION_VEHICLE),
          Map.entry("acquisition subsidiary", PartyRole.ACQUISITION_VEHICLE),
          Map.entry("newco", PartyRole.ACQUISITION_VEHICLE));

  private static final Pattern VEHICLE_NAME =
      Pattern.compile("^(?:merger|acquisition)\\s+sub(?:sidiary)?\\b", Pattern.CASE_INSENSITIVE);

  private static final Pattern SPACES = Pattern.compile("\\s+");

  private RoleLabels() {}

  /** Role for a label such as {@code Company} or {@code Merger Sub}; empty when unrecognized. */
  public static Optional<PartyRole> roleFor(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String key = SPACES.matcher(label.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    return Optional.ofNullable(LABELS.get(key));
  }

  /** True for party names that are themselves merger-subsidiary placeholders. */
  public static boolean isVehicleName(String name) {
    return name != null && VEHICLE_NAME.matcher(name.trim()).find();
  }
}
