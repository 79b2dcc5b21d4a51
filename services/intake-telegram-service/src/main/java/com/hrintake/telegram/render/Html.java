package com.hrintake.telegram.render;

/** Helpers for Telegram's HTML parse mode. */
public final class Html {

  public static final String EMPTY = "—";

  private Html() {}

  public static String escape(String s) {
    if (s == null) return "";
    String out = s;
    out = out.replace("&", "&amp;");
    out = out.replace("<", "&lt;");
    out = out.replace(">", "&gt;");
    return out;
  }

  /** Escaped value, or a dash when there is nothing to show. */
  public static String valueOrDash(String s) {
    return s == null || s.isBlank() ? EMPTY : escape(s);
  }

  public static String bold(String s) {
    return "<b>" + s + "</b>";
  }
}
