package com.gentoro.lexgraph.parser;

import java.util.ArrayList;
import java.util.List;

/** Collects the direct text of one unit as whitespace-normalized paragraphs. */
final class TextAccumulator {
  private final List<String> paragraphs = new ArrayList<>();
  private final StringBuilder current = new StringBuilder();

  void append(String raw) {
    if (raw != null) current.append(raw);
  }

  /** Ends the running paragraph, if any. */
  void breakParagraph() {
    String collapsed = current.toString().replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
    current.setLength(0);
    if (!collapsed.isEmpty()) paragraphs.add(collapsed);
  }

  /** Adds a preformatted block (a flattened table) as its own paragraph, line breaks kept. */
  void appendBlock(String block) {
    breakParagraph();
    if (block != null && !block.isEmpty()) paragraphs.add(block);
  }

  String result() {
    breakParagraph();
    return String.join("\n", paragraphs);
  }
}
