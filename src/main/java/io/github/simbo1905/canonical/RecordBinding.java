// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Objects;

import static io.github.simbo1905.canonical.Pickler.LOGGER;

/// Binds a struct definition to a Java record using method handles for the canonical constructor
/// and the component accessors. A record with no components is bound to a single shared instance.
final class RecordBinding implements Binding.StructBinding {
  final Class<?> userType;
  final MethodHandle recordConstructor;
  final MethodHandle[] componentAccessors;
  final Object singleton;

  RecordBinding(Class<?> userType) {
    this.userType = Objects.requireNonNull(userType);
    if (!userType.isRecord()) {
      throw new IllegalArgumentException("User type must be a record: " + userType);
    }
    final RecordComponent[] components = userType.getRecordComponents();

    // Create method handles
    try {
      final Class<?>[] parameterTypes = Arrays.stream(components)
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      final Constructor<?> constructor = userType.getDeclaredConstructor(parameterTypes);
      this.recordConstructor = MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (NoSuchMethodException | IllegalAccessException e) {
      throw new IllegalArgumentException("Failed to create constructor handle for " + userType, e);
    }

    componentAccessors = Arrays.stream(components)
        .map(component -> {
          try {
            return MethodHandles.lookup().unreflect(component.getAccessor());
          } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Failed to create accessor for " + component.getName(), e);
          }
        })
        .toArray(MethodHandle[]::new);

    singleton = components.length == 0 ? invokeConstructor(new Object[0]) : null;
    LOGGER.fine(() -> "RecordBinding construction complete for " + userType.getSimpleName() +
        " with " + componentAccessors.length + " components");
  }

  @Override
  public Object[] fields(Object value) {
    Objects.requireNonNull(value, "record must not be null");
    if (!userType.isAssignableFrom(value.getClass())) {
      throw new IllegalArgumentException("Expected " + userType + " but got " + value.getClass());
    }
    final Object[] fields = new Object[componentAccessors.length];
    for (int i = 0; i < componentAccessors.length; i++) {
      try {
        fields[i] = componentAccessors[i].invoke(value);
      } catch (RuntimeException | Error e) {
        throw e;
      } catch (Throwable e) {
        throw new IllegalStateException("Failed to read component " + i + " of " + userType.getSimpleName(), e);
      }
      if (fields[i] == null) {
        throw new IllegalArgumentException("Component " + userType.getRecordComponents()[i].getName() +
            " of " + userType.getSimpleName() + " is null");
      }
    }
    return fields;
  }

  @Override
  public Object construct(Object[] fields) {
    return singleton != null ? singleton : invokeConstructor(fields);
  }

  private Object invokeConstructor(Object[] fields) {
    try {
      return recordConstructor.invokeWithArguments(fields);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to construct " + userType.getSimpleName(), e);
    }
  }

  @Override
  public String toString() {
    return "RecordBinding{userType=" + userType + "}";
  }
}
