package com.flamingo.ai.lifedigest.elasticsearch;

import co.elastic.clients.elasticsearch._types.mapping.Property;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Difference between the mapping an index service declares and the one the live index has.
 *
 * <p>Missing fields can be added in place. A field whose type changed cannot: Elasticsearch does
 * not convert existing fields, so the index has to be dropped and rebuilt.
 */
record MappingDiff(Map<String, Property> missing, List<String> conflicts) {

  static MappingDiff between(Map<String, Property> declared, Map<String, Property> live) {
    Map<String, Property> missing = new LinkedHashMap<>();
    List<String> conflicts = new ArrayList<>();
    for (Map.Entry<String, Property> field : new TreeMap<>(declared).entrySet()) {
      Property current = live.get(field.getKey());
      if (current == null) {
        missing.put(field.getKey(), field.getValue());
      } else if (current._kind() != field.getValue()._kind()) {
        conflicts.add(
            String.format(
                "%s: declared %s, found %s",
                field.getKey(), field.getValue()._kind(), current._kind()));
      }
    }
    return new MappingDiff(missing, conflicts);
  }

  boolean isUpToDate() {
    return missing.isEmpty() && conflicts.isEmpty();
  }
}
