package com.flamingo.ai.dealflow.service.normalize;

import java.util.Arrays;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.Range;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

/**
 * Converts filing markup into canonical visual text.
 *
 * <p>Rules, in order:
 *
 * <ol>
 *   <li>Inline presentational tags are unwrapped; script, style and head content is dropped.
 *   <li>Every block-level boundary becomes a double newline.
 *   <li>Closing a table cell appends {@code " | "} unless the cell already ends in punctuation or a
 *       newline, so adjacent cells never fuse into one token.
 *   <li>Typographic quotes and dashes become ASCII, exotic spaces become a plain space, zero-width
 *       characters are removed.
 *   <li>Space runs collapse to one space, spaces around newlines are trimmed, three or more
 *       newlines collapse to two, and the ends are trimmed.
 * </ol>
 *
 * <p>Input without any tag is treated as plain text, so normalizing already-normalized text
 * through either entry point returns it unchanged. The component is stateless and safe to share
 * across document threads.
 */
@Component
@Slf4j
public class TextNormalizer {

  private static final Set<String> BLOCK_TAGS =
      Set.of(
          "address", "article", "aside", "blockquote", "br", "center", "dd", "div", "dl", "dt",
          "figcaption", "figure", "footer", "h1", "h2", "h3", "h4", "h5", "h6", "header", "hr",
          "li", "main", "nav", "ol", "p", "pre", "section", "table", "tbody", "tfoot", "thead",
          "tr", "ul", "caption");

  private static final Set<String> SKIPPED_TAGS =
      Set.of("script", "style", "noscript", "head", "meta", "link", "title", "template");

  private static final Set<String> CELL_TAGS = Set.of("td", "th");

  private static final String CELL_SEPARATOR = " | ";

  /** Characters that already terminate a cell visually. */
  private static final String CELL_TERMINATORS = ".!?;:|\n";

  /** Start of an element, end tag, comment, doctype or processing instruction. */
  private static final Pattern MARKUP_TAG = Pattern.compile("<[A-Za-z/!?]");

  /**
   * Normalizes HTML or XHTML filing markup.
   *
   * @param markup raw markup
   * @return normalized text with offsets into {@code markup}
   */
  public NormalizedText normalize(String markup) {
    if (markup == null || markup.isBlank()) {
      return new NormalizedText("", new int[0]);
    }
    if (!MARKUP_TAG.matcher(markup).find()) {
      return normalizePlainText(markup);
    }
    Parser parser = Parser.htmlParser().setTrackPosition(true);
    Document document = Jsoup.parse(markup, "", parser);

    OffsetBuffer buffer = new OffsetBuffer(markup.length());
    NodeTraversor.filter(new VisualTextFilter(buffer), document);

    NormalizedText result = collapse(buffer);
    log.debug(
        "Normalized {} markup chars into {} text chars", markup.length(), result.text().length());
    return result;
  }

  /**
   * Applies character mapping and whitespace collapsing to text that carries no markup, such as
   * PDF text output or previously normalized text.
   */
  public NormalizedText normalizePlainText(String text) {
    if (text == null || text.isEmpty()) {
      return new NormalizedText("", new int[0]);
    }
    OffsetBuffer buffer = new OffsetBuffer(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\r') {
        if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
          continue;
        }
        c = '\n';
      }
      buffer.appendMapped(c, i);
    }
    return collapse(buffer);
  }

  /** Walks the DOM emitting visual text, block boundaries and cell separators. */
  private static final class VisualTextFilter implements NodeFilter {

    private final OffsetBuffer buffer;
    private int preDepth;

    VisualTextFilter(OffsetBuffer buffer) {
      this.buffer = buffer;
    }

    @Override
    public FilterResult head(Node node, int depth) {
      if (node instanceof TextNode textNode) {
        appendText(textNode);
        return FilterResult.CONTINUE;
      }
      if (node instanceof Element element) {
        String tag = element.normalName();
        if (SKIPPED_TAGS.contains(tag)) {
          return FilterResult.SKIP_ENTIRELY;
        }
        if ("pre".equals(tag)) {
          preDepth++;
        }
        if (BLOCK_TAGS.contains(tag)) {
          buffer.appendBoundary(startOf(element));
        }
      }
      return FilterResult.CONTINUE;
    }

    @Override
    public FilterResult tail(Node node, int depth) {
      if (node instanceof Element element) {
        String tag = element.normalName();
        if (CELL_TAGS.contains(tag) && !buffer.endsWithAny(CELL_TERMINATORS)) {
          buffer.appendLiteral(CELL_SEPARATOR, endOf(element));
        }
        if (BLOCK_TAGS.contains(tag)) {
          buffer.appendBoundary(endOf(element));
        }
        if ("pre".equals(tag)) {
          preDepth--;
        }
      }
      return FilterResult.CONTINUE;
    }

    private void appendText(TextNode textNode) {
      String text = textNode.getWholeText();
      int start = startOf(textNode);
      int end = textNode.sourceRange().isTracked() ? textNode.sourceRange().endPos() : start;
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        if (preDepth == 0 && (c == '\n' || c == '\r' || c == '\t' || c == '\f')) {
          c = ' ';
        } else if (c == '\r') {
          continue;
        }
        int source =
            start < 0
                ? buffer.lastSourceOffset()
                : Math.min(start + i, Math.max(start, end - 1));
        buffer.appendMapped(c, source);
      }
    }

    private int startOf(Node node) {
      Range range = node.sourceRange();
      return range.isTracked() ? range.startPos() : buffer.lastSourceOffset();
    }

    private int endOf(Element element) {
      Range range = element.endSourceRange();
      if (range.isTracked()) {
        return range.startPos();
      }
      return buffer.lastSourceOffset();
    }
  }

  /** Second pass: whitespace collapsing with offset bookkeeping. */
  private static NormalizedText collapse(OffsetBuffer in) {
    StringBuilder out = new StringBuilder(in.length());
    int[] offsets = new int[in.length()];
    int size = 0;
    boolean pendingSpace = false;
    int pendingSpaceSource = 0;
    int pendingNewlines = 0;
    int pendingNewlineSource = 0;

    for (int i = 0; i < in.length(); i++) {
      char c = in.charAt(i);
      int source = in.sourceAt(i);
      if (c == '\n') {
        if (pendingNewlines == 0) {
          pendingNewlineSource = source;
        }
        pendingNewlines++;
        pendingSpace = false;
        continue;
      }
      if (c == ' ') {
        if (pendingNewlines == 0 && !pendingSpace) {
          pendingSpace = true;
          pendingSpaceSource = source;
        }
        continue;
      }
      if (size > 0) {
        if (pendingNewlines > 0) {
          int count = Math.min(pendingNewlines, 2);
          for (int n = 0; n < count; n++) {
            out.append('\n');
            offsets[size++] = pendingNewlineSource;
          }
        } else if (pendingSpace) {
          out.append(' ');
          offsets[size++] = pendingSpaceSource;
        }
      }
      pendingSpace = false;
      pendingNewlines = 0;
      out.append(c);
      offsets[size++] = source;
    }
    return new NormalizedText(out.toString(), Arrays.copyOf(offsets, size));
  }

  /** Maps a single character to its canonical form; returns 0 for characters to drop. */
  static char canonical(char c) {
    switch (c) {
      case '“', '”', '„', '‟', '″' -> {
        return '"';
      }
      case '‘', '’', '‚', '‛', '′' -> {
        return '\'';
      }
      case '‐', '‑', '‒', '–', '—', '―', '−' -> {
        return '-';
      }
      case '​', '‌', '‍', '⁠', '﻿', '­' -> {
        return 0;
      }
      case '\t', '\f', '\u000b' -> {
        return ' ';
      }
      default -> {
        if (c != '\n' && (Character.isSpaceChar(c) || Character.isWhitespace(c))) {
          return ' ';
        }
        return c;
      }
    }
  }

  /** Growable character buffer that remembers the source offset of every character. */
  private static final class OffsetBuffer {

    private final StringBuilder chars;
    private int[] sources;

    OffsetBuffer(int capacity) {
      this.chars = new StringBuilder(Math.max(16, capacity));
      this.sources = new int[Math.max(16, capacity)];
    }

    void appendMapped(char raw, int source) {
      if (raw == '…') {
        appendLiteral("...", source);
        return;
      }
      char c = canonical(raw);
      if (c != 0) {
        append(c, source);
      }
    }

    void appendLiteral(String literal, int source) {
      for (int i = 0; i < literal.length(); i++) {
        append(literal.charAt(i), source);
      }
    }

    void appendBoundary(int source) {
      appendLiteral("\n\n", source);
    }

    boolean endsWithAny(String terminators) {
      for (int i = chars.length() - 1; i >= 0; i--) {
        char c = chars.charAt(i);
        if (c == ' ') {
          continue;
        }
        return terminators.indexOf(c) >= 0;
      }
      return true;
    }

    int lastSourceOffset() {
      return chars.length() == 0 ? 0 : sources[chars.length() - 1];
    }

    int length() {
      return chars.length();
    }

    char charAt(int index) {
      return chars.charAt(index);
    }

    int sourceAt(int index) {
      return sources[index];
    }

    private void append(char c, int source) {
      if (chars.length() == sources.length) {
        sources = Arrays.copyOf(sources, sources.length * 2);
      }
      sources[chars.length()] = source;
      chars.append(c);
    }
  }
}
