package com.hrintake.telegram.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Custom reply keyboard shown under the input field. Always resized to fit. */
public record ReplyKeyboard(List<List<Button>> rows, boolean oneTime) implements ReplyMarkup {

  public record Button(String text, boolean requestContact) {
    public static Button of(String text) {
      return new Button(text, false);
    }
  }

  public static ReplyKeyboard of(List<List<Button>> rows) {
    return new ReplyKeyboard(rows, false);
  }

  @Override
  public Map<String, Object> toPayload() {
    var outRows = new ArrayList<List<Map<String, Object>>>();
    for (var row : rows) {
      var outRow = new ArrayList<Map<String, Object>>();
      for (var btn : row) {
        var b = new HashMap<String, Object>();
        b.put("text", btn.text());
        if (btn.requestContact()) {
          b.put("request_contact", true);
        }
        outRow.add(b);
      }
      outRows.add(outRow);
    }
    Map<String, Object> out = new HashMap<>();
    out.put("keyboard", outRows);
    out.put("resize_keyboard", true);
    if (oneTime) {
      out.put("one_time_keyboard", true);
    }
    return out;
  }
}
