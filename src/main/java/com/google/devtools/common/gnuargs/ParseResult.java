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
import com.google.common.collect.ImmutableList;

/** A folded settings record together with the events it was folded from. */
@AutoValue
public abstract class ParseResult<S> {

  static <S> ParseResult<S> create(S settings, ParsedArguments arguments) {
    return new AutoValue_ParseResult<>(settings, arguments);
  }

  public abstract S getSettings();

  public abstract ParsedArguments getArguments();

  /**
   * Whether the parse stopped at a help option. The settings then hold only the options given
   * before it.
   */
  public boolean isHelpRequested() {
    return getArguments().isHelpRequested();
  }

  public boolean isVersionRequested() {
    return getArguments().isVersionRequested();
  }

  /** Shorthand for {@code getArguments().getTrailingArguments()}. */
  public ImmutableList<String> getTrailingArguments() {
    return getArguments().getTrailingArguments();
  }
}
