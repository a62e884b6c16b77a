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

/** How many operands a positional slot takes. */
@AutoValue
public abstract class PositionalArity {

  /** The {@link #getMax} of a slot that accepts any number of operands. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  public static PositionalArity exactly(int n) {
    return range(n, n);
  }

  public static PositionalArity optional() {
    return range(0, 1);
  }

  public static PositionalArity atLeast(int n) {
    return range(n, UNBOUNDED);
  }

  public static PositionalArity range(int min, int max) {
    if (min < 0 || max < min || max == 0) {
      throw new ConstructionException(
          String.format("Invalid positional arity [%d, %d]", min, max));
    }
    return new AutoValue_PositionalArity(min, max);
  }

  public abstract int getMin();

  public abstract int getMax();

  public boolean isBounded() {
    return getMax() != UNBOUNDED;
  }

  public boolean isFixed() {
    return getMin() == getMax();
  }

  @Override
  public final String toString() {
    if (isFixed()) {
      return "exactly(" + getMin() + ")";
    }
    return isBounded()
        ? "range(" + getMin() + ", " + getMax() + ")"
        : "atLeast(" + getMin() + ")";
  }
}
