// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.util.*;

import static io.github.simbo1905.canonical.Pickler.LOGGER;

/// Derives shapes from Java types. Records become structs, enums become enums of unit variants and
/// sealed interfaces whose permitted subclasses are records become enums with one variant per record.
/// Every user type is registered under its binary class name.
///
/// @param root the shape of the root class
/// @param registry a definition for every user type reachable from the root
/// @param bindings a binding for every definition in the registry
record RecordShapes(Shape root, Registry registry, Map<String, Binding> bindings) {

  /// Walk the root class and everything reachable from its record components
  static RecordShapes analyze(Class<?> rootClass) {
    Objects.requireNonNull(rootClass, "Class must not be null");
    if (!isUserType(rootClass)) {
      throw new IllegalArgumentException("Class must be a record, enum, or sealed interface: " + rootClass);
    }
    final Deque<Class<?>> worklist = new ArrayDeque<>();
    final Set<Class<?>> discovered = new HashSet<>();
    final Map<String, TypeDef> definitions = new LinkedHashMap<>();
    final Map<String, Binding> bindings = new HashMap<>();

    final Shape root = userTypeShape(rootClass, worklist, discovered);
    while (!worklist.isEmpty()) {
      final Class<?> current = worklist.removeFirst();
      LOGGER.finer(() -> "Analyzing user type " + current.getName());
      if (current.isEnum()) {
        analyzeEnum(current, definitions, bindings);
      } else if (current.isRecord()) {
        final RecordBinding binding = new RecordBinding(current);
        definitions.put(current.getName(), new TypeDef.StructDef(current.getName(),
            componentFields(current, worklist, discovered)));
        bindings.put(current.getName(), binding);
      } else {
        analyzeSealed(current, worklist, discovered, definitions, bindings);
      }
    }
    final Registry registry = new Registry(definitions);
    LOGGER.fine(() -> "Shapes for " + rootClass.getName() + ": root=" + root.toTreeString() + " " + registry);
    return new RecordShapes(root, registry, Map.copyOf(bindings));
  }

  static boolean isUserType(Class<?> clazz) {
    return clazz.isRecord() || clazz.isEnum() || (clazz.isInterface() && clazz.isSealed());
  }

  private static void analyzeEnum(Class<?> enumClass, Map<String, TypeDef> definitions, Map<String, Binding> bindings) {
    final TypeDef.VariantDef[] variants = Arrays.stream(enumClass.getEnumConstants())
        .map(constant -> TypeDef.VariantDef.unit(((Enum<?>) constant).name()))
        .toArray(TypeDef.VariantDef[]::new);
    definitions.put(enumClass.getName(), TypeDef.EnumDef.of(enumClass.getName(), variants));
    bindings.put(enumClass.getName(), new EnumConstantBinding(enumClass));
  }

  /// The tag of each variant is the position of its record in the permits clause
  private static void analyzeSealed(Class<?> sealedInterface, Deque<Class<?>> worklist, Set<Class<?>> discovered,
                                    Map<String, TypeDef> definitions, Map<String, Binding> bindings) {
    final Class<?>[] permitted = sealedInterface.getPermittedSubclasses();
    final List<RecordBinding> recordBindings = new ArrayList<>(permitted.length);
    final TypeDef.VariantDef[] variants = new TypeDef.VariantDef[permitted.length];
    for (int i = 0; i < permitted.length; i++) {
      final Class<?> subclass = permitted[i];
      if (!subclass.isRecord()) {
        throw new IllegalArgumentException("Permitted subclass " + subclass.getName() + " of " +
            sealedInterface.getName() + " must be a record");
      }
      recordBindings.add(new RecordBinding(subclass));
      variants[i] = new TypeDef.VariantDef(subclass.getSimpleName(), componentFields(subclass, worklist, discovered));
    }
    definitions.put(sealedInterface.getName(), TypeDef.EnumDef.of(sealedInterface.getName(), variants));
    bindings.put(sealedInterface.getName(), new SealedBinding(sealedInterface, recordBindings));
  }

  private static List<TypeDef.Field> componentFields(Class<?> recordClass, Deque<Class<?>> worklist, Set<Class<?>> discovered) {
    final List<TypeDef.Field> fields = new ArrayList<>();
    for (RecordComponent component : recordClass.getRecordComponents()) {
      final Shape shape;
      try {
        shape = analyzeType(component.getGenericType(), worklist, discovered);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unsupported component " + component.getName() + " of " +
            recordClass.getName() + ": " + e.getMessage(), e);
      }
      LOGGER.finer(() -> "Component " + component.getName() + " of " + recordClass.getSimpleName() +
          " has shape " + shape.toTreeString());
      fields.add(new TypeDef.Field(component.getName(), shape));
    }
    return fields;
  }

  /// Map a component's generic type onto a shape, queueing any user types found along the way
  static @NotNull Shape analyzeType(Type type, Deque<Class<?>> worklist, Set<Class<?>> discovered) {
    if (type instanceof Class<?> clazz) {
      return classShape(clazz, worklist, discovered);
    }
    if (type instanceof ParameterizedType paramType && paramType.getRawType() instanceof Class<?> rawClass) {
      final Type[] typeArgs = paramType.getActualTypeArguments();
      if (rawClass == List.class) {
        return Shape.seq(analyzeType(typeArgs[0], worklist, discovered));
      } else if (rawClass == Optional.class) {
        return Shape.option(analyzeType(typeArgs[0], worklist, discovered));
      } else if (rawClass == Set.class) {
        return Shape.set(analyzeType(typeArgs[0], worklist, discovered));
      } else if (rawClass == Map.class) {
        return Shape.map(analyzeType(typeArgs[0], worklist, discovered), analyzeType(typeArgs[1], worklist, discovered));
      }
      throw new IllegalArgumentException("Unsupported container type: " + paramType.getTypeName() +
          " (use List, Optional, Set or Map)");
    }
    throw new IllegalArgumentException("Unsupported type: " + type.getTypeName());
  }

  private static Shape classShape(Class<?> clazz, Deque<Class<?>> worklist, Set<Class<?>> discovered) {
    if (clazz == boolean.class || clazz == Boolean.class) {
      return Shape.BOOL;
    } else if (clazz == byte.class || clazz == Byte.class) {
      return Shape.I8;
    } else if (clazz == short.class || clazz == Short.class) {
      return Shape.I16;
    } else if (clazz == int.class || clazz == Integer.class) {
      return Shape.I32;
    } else if (clazz == long.class || clazz == Long.class) {
      return Shape.I64;
    } else if (clazz == float.class || clazz == Float.class) {
      return Shape.F32;
    } else if (clazz == double.class || clazz == Double.class) {
      return Shape.F64;
    } else if (clazz == BigInteger.class) {
      return Shape.I128;
    } else if (clazz == String.class) {
      return Shape.STRING;
    } else if (clazz == Bytes.class) {
      return Shape.BYTES;
    } else if (clazz == Unit.class) {
      return Shape.UNIT;
    } else if (clazz == char.class || clazz == Character.class) {
      throw new IllegalArgumentException("char is a UTF-16 code unit not a Unicode scalar value; " +
          "use an explicit CHAR shape with an int code point");
    } else if (clazz == List.class || clazz == Optional.class || clazz == Set.class || clazz == Map.class) {
      throw new IllegalArgumentException("Raw container type " + clazz.getSimpleName() + " needs type arguments");
    } else if (isUserType(clazz)) {
      return userTypeShape(clazz, worklist, discovered);
    }
    throw new IllegalArgumentException("Unsupported type: " + clazz.getName());
  }

  private static Shape userTypeShape(Class<?> clazz, Deque<Class<?>> worklist, Set<Class<?>> discovered) {
    if (discovered.add(clazz)) {
      worklist.addLast(clazz);
    }
    return Shape.named(clazz.getName());
  }
}
