// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Binds an enum definition to a sealed interface whose permitted subclasses are records. The tag
/// of each variant is the position of its record in the `permits` clause.
final class SealedBinding implements Binding.EnumBinding {
  final Class<?> sealedInterface;
  final List<RecordBinding> variants;
  final Map<Class<?>, Integer> tags;

  SealedBinding(Class<?> sealedInterface, List<RecordBinding> variants) {
    this.sealedInterface = Objects.requireNonNull(sealedInterface);
    this.variants = List.copyOf(variants);
    final var byClass = new HashMap<Class<?>, Integer>();
    for (int i = 0; i < this.variants.size(); i++) {
      byClass.put(this.variants.get(i).userType, i);
    }
    this.tags = Map.copyOf(byClass);
  }

  @Override
  public int tag(Object value) {
    Objects.requireNonNull(value, "value must not be null");
    final Integer tag = tags.get(value.getClass());
    if (tag == null) {
      throw new IllegalArgumentException("Expected a permitted subclass of " + sealedInterface + " but got " + value.getClass());
    }
    return tag;
  }

  @Override
  public Object[] fields(Object value) {
    return variants.get(tag(value)).fields(value);
  }

  @Override
  public Object construct(int tag, Object[] fields) {
    return variants.get(tag).construct(fields);
  }

  @Override
  public String toString() {
    return "SealedBinding{sealedInterface=" + sealedInterface + ", variants=" + variants.size() + "}";
  }
}
