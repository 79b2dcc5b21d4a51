package com.hrintake.telegram.admin;

import com.hrintake.telegram.store.StoredApplication;
import java.util.List;

/**
 * One page of the newest applications.
 *
 * <p>{@code hasMore} is true whenever the page is full. Following it past the last record lands
 * back on the last page, this time without "next".
 */
public record RecentPage(List<StoredApplication> items, int offset, int limit, boolean hasMore) {

  public int pageNumber() {
    return offset / limit + 1;
  }

  public boolean hasPrevious() {
    return offset > 0;
  }

  public int previousOffset() {
    return Math.max(0, offset - limit);
  }

  public int nextOffset() {
    return offset + limit;
  }
}
