package blockstore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Problems found by {@link BlockStore#verifyIndex()}, grouped by block id in the order they were found.
 */
public final class BlockErrors {
  private final LinkedHashMap<String, List<String>> ids = new LinkedHashMap<>();

  public boolean isEmpty() {
    return ids.isEmpty();
  }

  public void badId(String id, String message) {
    ids.computeIfAbsent(id, k -> new ArrayList<>()).add(message);
  }

  public List<String> ids() {
    return new ArrayList<>(ids.keySet());
  }

  public List<String> errorsFor(String id) {
    return ids.getOrDefault(id, List.of());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, List<String>> e : ids.entrySet()) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(e.getKey()).append(" (").append(String.join(", ", e.getValue())).append(')');
    }
    return sb.toString();
  }
}
