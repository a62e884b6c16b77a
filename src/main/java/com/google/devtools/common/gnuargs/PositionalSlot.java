// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.devtools.common.gnuargs;

import com.google.auto.value.AutoValue;
import com.google.devtools.common.gnuargs.ArgumentParser.ConstructionException;

/**
 * One named operand slot of a utility, e.g. {@code SOURCE} or {@code DEST} for {@code cp}.
 *
 * <p>A greedy slot captures every argument from its first operand onwards verbatim, options and
 * {@code --} included, and ends option scanning. It is how command-wrapping utilities such as
 * {@code timeout DURATION COMMAND [ARG]...} keep the wrapped command's flags to themselves.
 */
@AutoValue
public abstract class PositionalSlot {

  public static PositionalSlot of(String name, PositionalArity arity) {
    return create(name, arity, false);
  }

  public static PositionalSlot greedy(String name, PositionalArity arity) {
    return create(name, arity, true);
  }

  private static PositionalSlot create(String name, PositionalArity arity, boolean greedy) {
    if (name.isEmpty()) {
      throw new ConstructionException("Positional slots must be named");
    }
    return new AutoValue_PositionalSlot(name, arity, greedy);
  }

  /** The identity reported in events and in missing-operand errors. */
  public abstract String getName();

  public abstract PositionalArity getArity();

  public abstract boolean isGreedy();
}
