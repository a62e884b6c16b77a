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

/** Whether a spelling of an option takes a value, and whether that value may be left out. */
public enum ValueArity {
  /** The spelling is a flag; supplying a value with {@code =} is an error. */
  NONE,
  /** The spelling always takes a value, inline or from the following argument. */
  REQUIRED,
  /**
   * The spelling takes a value only when attached to it: {@code --color=never} or {@code -pDIR}.
   * A following argument is never consumed.
   */
  OPTIONAL;

  public boolean takesValue() {
    return this != NONE;
  }
}
