package com.gentoro.lexgraph.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a table into text, one {@code | a | b |} line per row.
 *
 * <p>Cells are trimmed, inner whitespace is collapsed and pipes are escaped. Rows without any cell
 * are dropped; a row of blank cells is kept in place. Every line is padded with empty cells up to
 * the widest row. There is no header separator line. Never fails: an empty table yields an empty
 * string.
 */
public class TableNormalizer {

  public String normalize(List<? extends List<String>> rows) {
    if (rows == null || rows.isEmpty()) {
      return "";
    }
    List<List<String>> kept = new ArrayList<>();
    int width = 0;
    for (List<String> row : rows) {
      if (row == null || row.isEmpty()) continue;
      List<String> cells = new ArrayList<>(row.size());
      for (String cell : row) {
        cells.add(cleanCell(cell));
      }
      kept.add(cells);
      width = Math.max(width, cells.size());
    }

    StringBuilder out = new StringBuilder();
    for (List<String> cells : kept) {
      while (cells.size() < width) cells.add("");
      if (out.length() > 0) out.append('\n');
      out.append("| ").append(String.join(" | ", cells)).append(" |");
    }
    return out.toString();
  }

  static String cleanCell(String cell) {
    if (cell == null) return "";
    return cell.replace('\u00a0', ' ').trim().replaceAll("\\s+", " ").replace("|", "\\|");
  }
}
