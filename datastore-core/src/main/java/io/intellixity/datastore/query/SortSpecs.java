package io.intellixity.datastore.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses sort expressions such as {@code "name, created desc"}.\n
 *
 * Each comma-separated part is a field name optionally followed by {@code asc} or {@code desc}.
 * Field names may be double-quoted to include spaces.\n
 */
public final class SortSpecs {
  private SortSpecs() {}

  public static List<SortField> parse(String spec) {
    if (spec == null || spec.isBlank()) return List.of();
    List<SortField> out = new ArrayList<>();
    for (String part : spec.split(",")) {
      String p = part.trim();
      if (p.isEmpty()) continue;
      out.add(parsePart(p));
    }
    return List.copyOf(out);
  }

  public static List<SortField> parse(List<String> parts) {
    if (parts == null || parts.isEmpty()) return List.of();
    List<SortField> out = new ArrayList<>();
    for (String p : parts) out.addAll(parse(p));
    return List.copyOf(out);
  }

  private static SortField parsePart(String part) {
    String field;
    String rest;
    if (part.startsWith("\"")) {
      int end = part.indexOf('"', 1);
      if (end < 0) throw new IllegalArgumentException("Unterminated quoted field in sort: " + part);
      field = part.substring(1, end);
      rest = part.substring(end + 1).trim();
    } else {
      int sp = part.indexOf(' ');
      field = (sp < 0) ? part : part.substring(0, sp);
      rest = (sp < 0) ? "" : part.substring(sp + 1).trim();
    }
    if (field.isBlank()) throw new IllegalArgumentException("Blank field in sort: " + part);

    SortField.Direction dir = switch (rest.toLowerCase(Locale.ROOT)) {
      case "", "asc" -> SortField.Direction.ASC;
      case "desc" -> SortField.Direction.DESC;
      default -> throw new IllegalArgumentException("Invalid sort order '" + rest + "' for field '" + field + "'");
    };
    return new SortField(field, dir);
  }
}
