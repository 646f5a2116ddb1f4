package io.intellixity.datastore.request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Null-tolerant defensive copies (record values may legitimately be null, which rules out List.copyOf). */
final class Copies {
  private Copies() {}

  static List<String> strings(List<String> in) {
    return (in == null) ? null : List.copyOf(in);
  }

  static Map<String, Object> map(Map<String, Object> in) {
    return (in == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(in));
  }

  static List<Map<String, Object>> records(List<Map<String, Object>> in) {
    if (in == null) return null;
    List<Map<String, Object>> out = new ArrayList<>(in.size());
    for (Map<String, Object> r : in) out.add(map(r));
    return Collections.unmodifiableList(out);
  }
}
