package com.hrintake.telegram.render;

import java.util.ArrayList;
import java.util.List;

/** Splits long reports into messages of at most {@code maxLength} characters, on line breaks. */
public final class MessageChunker {

  private static final int MAX_ENTITY_LENGTH = 10;

  private MessageChunker() {}

  public static List<String> split(String text, int maxLength) {
    List<String> chunks = new ArrayList<>();
    StringBuilder buf = new StringBuilder();
    for (String line : (text == null ? "" : text).split("\n", -1)) {
      for (String piece : hardWrap(line, maxLength)) {
        if (buf.length() > 0 && buf.length() + 1 + piece.length() > maxLength) {
          chunks.add(buf.toString());
          buf.setLength(0);
        }
        if (buf.length() > 0) {
          buf.append('\n');
        }
        buf.append(piece);
      }
    }
    if (buf.length() > 0 || chunks.isEmpty()) {
      chunks.add(buf.toString());
    }
    return chunks;
  }

  // a single line longer than the limit is cut into pieces of at most the limit,
  // never inside a surrogate pair, an HTML tag or an entity
  private static List<String> hardWrap(String line, int maxLength) {
    if (line.length() <= maxLength) {
      return List.of(line);
    }
    List<String> pieces = new ArrayList<>();
    int start = 0;
    while (start < line.length()) {
      int end = cutPoint(line, start, Math.min(line.length(), start + maxLength));
      pieces.add(line.substring(start, end));
      start = end;
    }
    return pieces;
  }

  private static int cutPoint(String line, int start, int end) {
    if (end >= line.length()) {
      return line.length();
    }
    int cut = end;
    int tagOpen = line.lastIndexOf('<', cut - 1);
    if (tagOpen >= start && line.lastIndexOf('>', cut - 1) < tagOpen) {
      cut = tagOpen;
    }
    int amp = line.lastIndexOf('&', cut - 1);
    if (amp >= start && line.lastIndexOf(';', cut - 1) < amp && cut - amp <= MAX_ENTITY_LENGTH) {
      cut = amp;
    }
    if (cut <= start) {
      // the tag alone is longer than the limit
      cut = end;
    }
    if (Character.isLowSurrogate(line.charAt(cut))
        && Character.isHighSurrogate(line.charAt(cut - 1))) {
      cut--;
    }
    return cut > start ? cut : end + 1;
  }
}
