// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// The set of named definitions a shape may refer to. Construction validates that every
/// [Shape.NamedNode] reachable from a definition resolves to a definition in the same registry.
public record Registry(Map<String, TypeDef> definitions) {

  public static final Registry EMPTY = new Registry(Map.of());

  public Registry {
    Objects.requireNonNull(definitions, "definitions must not be null");
    definitions.forEach((name, def) -> {
      Objects.requireNonNull(def, "Definition for " + name + " must not be null");
      if (!name.equals(def.name())) {
        throw new IllegalArgumentException("Registry key " + name + " does not match definition name " + def.name());
      }
    });
    definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    final var unresolved = unresolved(definitions, definitions.values().stream().flatMap(TypeDef::referencedNames));
    if (!unresolved.isEmpty()) {
      throw new IllegalArgumentException("Unresolved type names: " + String.join(", ", unresolved));
    }
  }

  public static Registry of(TypeDef... definitions) {
    final var byName = new LinkedHashMap<String, TypeDef>();
    for (TypeDef def : definitions) {
      if (byName.put(def.name(), def) != null) {
        throw new IllegalArgumentException("Duplicate definition for type name: " + def.name());
      }
    }
    return new Registry(byName);
  }

  public TypeDef get(String name) {
    final var def = definitions.get(name);
    if (def == null) {
      throw new IllegalArgumentException("No definition for type name: " + name +
          ". Known names: " + String.join(", ", definitions.keySet()));
    }
    return def;
  }

  public boolean contains(String name) {
    return definitions.containsKey(name);
  }

  /// Check that the root shape only refers to names this registry defines
  void validateRoot(Shape root) {
    final var unresolved = unresolved(definitions, root.referencedNames());
    if (!unresolved.isEmpty()) {
      throw new IllegalArgumentException("Shape " + root.toTreeString() + " refers to unresolved type names: " +
          String.join(", ", unresolved));
    }
  }

  private static SortedSet<String> unresolved(Map<String, TypeDef> definitions, Stream<String> names) {
    return names.filter(n -> !definitions.containsKey(n)).collect(Collectors.toCollection(TreeSet::new));
  }

  @Override
  public String toString() {
    return definitions.values().stream().map(TypeDef::toTreeString).collect(Collectors.joining("; ", "Registry[", "]"));
  }
}
