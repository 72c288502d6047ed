package com.flamingo.ai.lifedigest.service.digest;

import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered set of digesters. Registration order is execution order, and a digester may only depend
 * on outputs of digesters registered before it.
 */
@Slf4j
public class DigesterRegistry {

  private final List<Digester> digesters;

  public DigesterRegistry(List<Digester> digesters) {
    this.digesters = List.copyOf(digesters);
    validate();
    log.info(
        "Registered {} digesters: {}",
        this.digesters.size(),
        this.digesters.stream().map(Digester::getName).toList());
  }

  private void validate() {
    Set<String> names = new HashSet<>();
    Set<String> outputsSoFar = new HashSet<>();
    for (Digester digester : digesters) {
      if (!names.add(digester.getName())) {
        throw new IllegalStateException("Duplicate digester name: " + digester.getName());
      }
      for (String dependency : digester.getDependencies()) {
        if (!outputsSoFar.contains(dependency)) {
          throw new IllegalStateException(
              "Digester '"
                  + digester.getName()
                  + "' depends on '"
                  + dependency
                  + "', which no earlier digester produces");
        }
      }
      for (String output : digester.getOutputNames()) {
        if (!outputsSoFar.add(output)) {
          throw new IllegalStateException("Digest '" + output + "' has more than one producer");
        }
      }
    }
  }

  public List<Digester> getAll() {
    return digesters;
  }

  public Optional<Digester> find(String name) {
    return digesters.stream().filter(d -> d.getName().equals(name)).findFirst();
  }

  /** Digesters that apply to the file, in execution order. */
  public List<Digester> getApplicable(FileRecord file) {
    List<Digester> applicable = new ArrayList<>();
    for (Digester digester : digesters) {
      if (digester.canDigest(file)) {
        applicable.add(digester);
      }
    }
    return applicable;
  }

  /** Output names of every digester that declares a dependency on {@code outputName}. */
  public Set<String> findDownstream(String outputName) {
    Set<String> downstream = new LinkedHashSet<>();
    for (Digester digester : digesters) {
      if (digester.getDependencies().contains(outputName)) {
        downstream.addAll(digester.getOutputNames());
      }
    }
    return downstream;
  }
}
