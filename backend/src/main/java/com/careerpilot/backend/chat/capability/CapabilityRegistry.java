package com.careerpilot.backend.chat.capability;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Capabilities available to the supervisor during one turn. */
public final class CapabilityRegistry {

  private final Map<CapabilityName, Capability> capabilities;

  public CapabilityRegistry(Collection<? extends Capability> capabilities) {
    Map<CapabilityName, Capability> byName = new EnumMap<>(CapabilityName.class);
    for (Capability capability : capabilities) {
      Capability previous = byName.putIfAbsent(capability.name(), capability);
      if (previous != null) {
        throw new IllegalArgumentException(
            "Duplicate capability registered: " + capability.name().code());
      }
    }
    this.capabilities = Collections.unmodifiableMap(byName);
  }

  public Optional<Capability> find(CapabilityName name) {
    return Optional.ofNullable(capabilities.get(name));
  }

  public Optional<Capability> find(String code) {
    return CapabilityName.fromCode(code).flatMap(this::find);
  }

  public Set<CapabilityName> names() {
    return capabilities.keySet();
  }
}
