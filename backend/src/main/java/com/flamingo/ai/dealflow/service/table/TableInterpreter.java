package com.flamingo.ai.dealflow.service.table;

import com.flamingo.ai.dealflow.config.DealflowConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads financing participants out of a {@link TableGrid}.
 *
 * <p>A column is a role column when the share of its data cells naming a financing role reaches
 * the configured threshold. The name column is the other column with the highest share of
 * bank-like names, falling back to the nearest non-numeric column. Tables without a role column
 * can still be read when a header names the column ({@code Underwriter}, {@code Lender}, ...).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TableInterpreter {

  private static final Pattern HEADER_VOCABULARY =
      Pattern.compile(
          "\\b(?:name|lenders?|underwriters?|roles?|institutions?|amounts?|commitments?|banks?"
              + "|arrangers?|bookrunners?|initial\\s+purchasers?|titles?|capacity)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern ROLE_NAMING_HEADER =
      Pattern.compile(
          "^\\s*(?:the\\s+)?(?:underwriters?|lenders?|arrangers?|bookrunners?"
              + "|initial\\s+purchasers?|agents?)\\s*$",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern KNOWN_BANK =
      Pattern.compile(
          "\\b(?:goldman|morgan\\s+stanley|j\\.?\\s?p\\.?\\s?morgan|jpmorgan|bofa|merrill"
              + "|bank\\s+of\\s+america|citi(?:group|bank)?|barclays|wells\\s+fargo|deutsche"
              + "|credit\\s+suisse|ubs|rbc|bnp|hsbc|mizuho|mufg|smbc|sumitomo|jefferies"
              + "|td\\s+securities|evercore|lazard|centerview|moelis|pjt|guggenheim|nomura"
              + "|santander|soci[eé]t[eé]\\s+g[eé]n[eé]rale|natixis|scotia|truist|pnc|citizens"
              + "|keybanc|macquarie|ing|credit\\s+agricole|bmo|cibc|us\\s+bancorp|regions"
              + "|fifth\\s+third|capital\\s+one|houlihan|perella|rothschild|ares"
              + "|blackstone\\s+credit|kkr\\s+capital\\s+markets)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern INSTITUTION_SUFFIX =
      Pattern.compile(
          "(?:\\b(?:bank|securities|capital\\s+markets|llc|inc|plc|incorporated|limited|ag|funding"
              + "|n\\.a|s\\.a|l\\.p|lp|ltd|partners|corporation)\\b\\.?|&\\s*co\\.?)",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern NUMERIC =
      Pattern.compile(
          "^[\\s$%(),.\\-\\d]*\\d[\\s$%(),.\\-\\d]*(?:million|billion|mm|m|bn)?\\s*$",
          Pattern.CASE_INSENSITIVE);

  private final DealflowConfig config;

  /**
   * A participant row read from a table.
   *
   * @param row grid row
   * @param nameColumn column holding the institution name
   * @param roleColumn column holding the role, or -1 when the role came from the header
   * @param institution institution name as written
   * @param role role text as written
   * @param fromHeader whether the role was supplied by a column header
   */
  public record ParticipantRow(
      int row,
      int nameColumn,
      int roleColumn,
      String institution,
      String role,
      boolean fromHeader) {}

  /**
   * Result of interpreting a table.
   *
   * @param rows participant rows, empty when the table is not a participant table
   * @param relevant whether the table mentions financing roles at all
   */
  public record Interpretation(List<ParticipantRow> rows, boolean relevant) {

    /** A relevant table that yielded nothing. */
    public boolean failed() {
      return relevant && rows.isEmpty();
    }
  }

  public Interpretation interpret(TableGrid grid) {
    boolean relevant = mentionsRoles(grid);
    if (grid.rowCount() == 0 || grid.columnCount() < 2) {
      return new Interpretation(List.of(), relevant);
    }
    int header = findHeaderRow(grid);
    int firstData = header + 1;
    if (firstData >= grid.rowCount()) {
      return new Interpretation(List.of(), relevant);
    }

    Optional<Integer> roleColumn = findRoleColumn(grid, firstData);
    if (roleColumn.isPresent()) {
      int nameColumn = findNameColumn(grid, firstData, roleColumn.get());
      if (nameColumn < 0) {
        log.debug("Table {} has a role column but no name column", grid.index());
        return new Interpretation(List.of(), true);
      }
      List<ParticipantRow> rows = new ArrayList<>();
      for (int r = firstData; r < grid.rowCount(); r++) {
        String role = grid.cell(r, roleColumn.get());
        String name = grid.cell(r, nameColumn);
        if (ParticipantRoles.isRole(role) && isNameLike(name)) {
          rows.add(new ParticipantRow(r, nameColumn, roleColumn.get(), name, role, false));
        }
      }
      return new Interpretation(rows, true);
    }

    if (header >= 0) {
      for (int c = 0; c < grid.columnCount(); c++) {
        String heading = grid.cell(header, c);
        if (ROLE_NAMING_HEADER.matcher(heading).matches()) {
          List<ParticipantRow> rows = new ArrayList<>();
          for (int r = firstData; r < grid.rowCount(); r++) {
            String name = grid.cell(r, c);
            if (isNameLike(name) && !isTotalRow(name)) {
              rows.add(new ParticipantRow(r, c, -1, name, heading.trim(), true));
            }
          }
          return new Interpretation(rows, true);
        }
      }
    }
    return new Interpretation(List.of(), relevant);
  }

  /** Index of the header row among the first rows, or -1. */
  int findHeaderRow(TableGrid grid) {
    int scan = Math.min(config.getTable().getHeaderScanRows(), grid.rowCount());
    for (int r = 0; r < scan; r++) {
      if (grid.isHeaderRow(r)) {
        return r;
      }
    }
    List<String> first = grid.row(0);
    boolean shortCells = first.stream().allMatch(s -> s.length() <= 40);
    boolean vocabulary = first.stream().anyMatch(s -> HEADER_VOCABULARY.matcher(s).find());
    boolean names = first.stream().anyMatch(TableInterpreter::isBankLike);
    return shortCells && vocabulary && !names ? 0 : -1;
  }

  private Optional<Integer> findRoleColumn(TableGrid grid, int firstData) {
    double threshold = config.getTable().getRoleColumnThreshold();
    int best = -1;
    double bestDensity = 0;
    for (int c = 0; c < grid.columnCount(); c++) {
      int filled = 0;
      int roles = 0;
      for (int r = firstData; r < grid.rowCount(); r++) {
        String value = grid.cell(r, c);
        if (value.isBlank()) {
          continue;
        }
        filled++;
        if (ParticipantRoles.isRole(value)) {
          roles++;
        }
      }
      double density = filled == 0 ? 0 : (double) roles / filled;
      if (density >= threshold && density > bestDensity) {
        best = c;
        bestDensity = density;
      }
    }
    return best < 0 ? Optional.empty() : Optional.of(best);
  }

  private int findNameColumn(TableGrid grid, int firstData, int roleColumn) {
    double threshold = config.getTable().getNameColumnThreshold();
    int best = -1;
    double bestDensity = 0;
    int bestDistance = Integer.MAX_VALUE;
    int nearestText = -1;
    int nearestTextDistance = Integer.MAX_VALUE;
    for (int c = 0; c < grid.columnCount(); c++) {
      if (c == roleColumn) {
        continue;
      }
      int distance = Math.abs(c - roleColumn);
      int filled = 0;
      int banks = 0;
      int numeric = 0;
      for (int r = firstData; r < grid.rowCount(); r++) {
        String value = grid.cell(r, c);
        if (value.isBlank() || value.equals(grid.cell(r, roleColumn))) {
          continue;
        }
        filled++;
        if (isBankLike(value)) {
          banks++;
        }
        if (NUMERIC.matcher(value).matches()) {
          numeric++;
        }
      }
      if (filled == 0) {
        continue;
      }
      double density = (double) banks / filled;
      if (density >= threshold
          && (density > bestDensity || (density == bestDensity && distance < bestDistance))) {
        best = c;
        bestDensity = density;
        bestDistance = distance;
      }
      if (numeric * 2 < filled && distance < nearestTextDistance) {
        nearestText = c;
        nearestTextDistance = distance;
      }
    }
    return best >= 0 ? best : nearestText;
  }

  static boolean isBankLike(String value) {
    return KNOWN_BANK.matcher(value).find() || INSTITUTION_SUFFIX.matcher(value).find();
  }

  private static boolean isNameLike(String value) {
    return value != null
        && !value.isBlank()
        && !NUMERIC.matcher(value).matches()
        && !ParticipantRoles.isRole(value)
        && Character.isLetterOrDigit(value.trim().charAt(0));
  }

  private static boolean isTotalRow(String value) {
    return value.trim().toLowerCase(Locale.ROOT).startsWith("total");
  }

  private static boolean mentionsRoles(TableGrid grid) {
    for (int r = 0; r < grid.rowCount(); r++) {
      for (String value : grid.row(r)) {
        if (ParticipantRoles.isRole(value)) {
          return true;
        }
      }
    }
    return false;
  }
}
