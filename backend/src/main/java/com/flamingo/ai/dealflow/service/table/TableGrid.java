package com.flamingo.ai.dealflow.service.table;

import java.util.List;

/**
 * Rectangular cell grid of one table. Spanned cells repeat their value into every covered
 * position and ragged rows are padded with empty cells.
 *
 * @param index position of the table within its document
 * @param cells row-major cell text
 * @param headerCells whether a cell came from a header ({@code th}) element
 */
public record TableGrid(int index, List<List<String>> cells, List<List<Boolean>> headerCells) {

  public TableGrid {
    cells = cells.stream().map(List::copyOf).toList();
    headerCells = headerCells.stream().map(List::copyOf).toList();
  }

  public int rowCount() {
    return cells.size();
  }

  public int columnCount() {
    return cells.isEmpty() ? 0 : cells.get(0).size();
  }

  public String cell(int row, int column) {
    return cells.get(row).get(column);
  }

  public List<String> row(int row) {
    return cells.get(row);
  }

  /** True when every non-empty cell of the row came from a header element. */
  public boolean isHeaderRow(int row) {
    boolean any = false;
    for (int c = 0; c < columnCount(); c++) {
      if (cell(row, c).isEmpty()) {
        continue;
      }
      if (!headerCells.get(row).get(c)) {
        return false;
      }
      any = true;
    }
    return any;
  }

  /** Row cells joined with {@code " | "}, skipping empty cells. */
  public String rowText(int row) {
    return String.join(" | ", row(row).stream().filter(s -> !s.isEmpty()).toList());
  }
}
