// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

/// The single value of the anonymous zero-field product. Encodes to zero bytes.
public enum Unit {
  UNIT
}
