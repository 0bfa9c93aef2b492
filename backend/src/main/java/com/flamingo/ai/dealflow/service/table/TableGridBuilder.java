package com.flamingo.ai.dealflow.service.table;

import com.flamingo.ai.dealflow.service.normalize.TextNormalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/** Builds {@link TableGrid}s from the {@code table} elements of a markup document. */
@Component
@RequiredArgsConstructor
public class TableGridBuilder {

  /** Upper bound on a single span; larger values are treated as malformed and clamped. */
  static final int MAX_SPAN = 50;

  private final TextNormalizer textNormalizer;

  /** Grids for every table of the markup that has at least one cell, nested tables included. */
  public List<TableGrid> build(String markup) {
    if (markup == null || markup.isBlank()) {
      return List.of();
    }
    Document document = Jsoup.parse(markup);
    List<TableGrid> grids = new ArrayList<>();
    int index = 0;
    for (Element table : document.select("table")) {
      TableGrid grid = build(table, index++);
      if (grid.rowCount() > 0 && grid.columnCount() > 0) {
        grids.add(grid);
      }
    }
    return grids;
  }

  TableGrid build(Element table, int index) {
    // rows belonging to this table only, not to nested tables
    List<Element> rows =
        table.select("tr").stream().filter(tr -> tr.closest("table") == table).toList();
    Map<Long, Cell> placed = new HashMap<>();
    int width = 0;
    for (int r = 0; r < rows.size(); r++) {
      int c = 0;
      for (Element td : rows.get(r).children()) {
        if (!td.normalName().equals("td") && !td.normalName().equals("th")) {
          continue;
        }
        while (placed.containsKey(key(r, c))) {
          c++;
        }
        int rowSpan = span(td.attr("rowspan"));
        int colSpan = span(td.attr("colspan"));
        Cell cell = new Cell(cellText(td), td.normalName().equals("th"));
        for (int dr = 0; dr < rowSpan && r + dr < rows.size(); dr++) {
          for (int dc = 0; dc < colSpan; dc++) {
            placed.putIfAbsent(key(r + dr, c + dc), cell);
          }
        }
        c += colSpan;
        width = Math.max(width, c);
      }
    }

    List<List<String>> cells = new ArrayList<>();
    List<List<Boolean>> headers = new ArrayList<>();
    for (int r = 0; r < rows.size(); r++) {
      List<String> rowCells = new ArrayList<>(width);
      List<Boolean> rowHeaders = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        Cell cell = placed.get(key(r, c));
        rowCells.add(cell == null ? "" : cell.text());
        rowHeaders.add(cell != null && cell.header());
      }
      cells.add(rowCells);
      headers.add(rowHeaders);
    }
    return new TableGrid(index, cells, headers);
  }

  private String cellText(Element cell) {
    return textNormalizer.normalizePlainText(cell.text()).text().replace('\n', ' ');
  }

  private static int span(String value) {
    if (value == null || value.isBlank()) {
      return 1;
    }
    try {
      int span = Integer.parseInt(value.trim());
      return Math.max(1, Math.min(span, MAX_SPAN));
    } catch (NumberFormatException e) {
      return 1;
    }
  }

  private static long key(int row, int column) {
    return ((long) row << 32) | column;
  }

  private record Cell(String text, boolean header) {}
}
