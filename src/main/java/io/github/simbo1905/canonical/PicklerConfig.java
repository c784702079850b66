// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

/// Decoding limits. Set via system properties `canonical.pickler.maxDepth` and
/// `canonical.pickler.maxLength`, or construct one directly and pass it to the factory methods.
///
/// - `maxDepth` bounds how many struct or enum definitions may be nested inside one another while
///   decoding. Recursive shapes are otherwise unbounded and adversarial input could exhaust the stack.
///   Encoding and sizing apply the same bound so that a picklable value is always unpicklable.
/// - `maxLength` bounds every length prefix (strings, bytes, sequences, maps, sets).
///
/// @param maxDepth  maximum nesting of named definitions, default 500
/// @param maxLength maximum collection or blob length, default 2^31 - 1
public record PicklerConfig(int maxDepth, int maxLength) {

  public static final int DEFAULT_MAX_DEPTH = 500;
  public static final int DEFAULT_MAX_LENGTH = Integer.MAX_VALUE;

  public static final String MAX_DEPTH_PROPERTY = "canonical.pickler.maxDepth";
  public static final String MAX_LENGTH_PROPERTY = "canonical.pickler.maxLength";

  public static final PicklerConfig DEFAULT = new PicklerConfig(DEFAULT_MAX_DEPTH, DEFAULT_MAX_LENGTH);

  public PicklerConfig {
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
    }
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
    }
  }

  /// Read the limits from system properties falling back to the defaults
  public static PicklerConfig current() {
    return new PicklerConfig(
        intProperty(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH),
        intProperty(MAX_LENGTH_PROPERTY, DEFAULT_MAX_LENGTH));
  }

  public PicklerConfig withMaxDepth(int maxDepth) {
    return new PicklerConfig(maxDepth, maxLength);
  }

  public PicklerConfig withMaxLength(int maxLength) {
    return new PicklerConfig(maxDepth, maxLength);
  }

  private static int intProperty(String name, int defaultValue) {
    final String value = System.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + name + ": '" + value + "'. Must be a positive int.", e);
    }
  }
}
