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
import javax.annotation.Nullable;

/**
 * One lexical unit of the command line. What {@link #getText} holds depends on the kind:
 *
 * <ul>
 *   <li>{@link Kind#SHORT_CLUSTER}: the option characters after the leading {@code -};
 *   <li>{@link Kind#LONG_OPTION}: the name between {@code --} and the first {@code =};
 *   <li>{@link Kind#FREE_VALUE}: the argument itself;
 *   <li>{@link Kind#TERMINATOR}: {@code --};
 *   <li>{@link Kind#DEPRECATED_NUMERIC}: the digit run.
 * </ul>
 */
@AutoValue
public abstract class Token {

  /** The lexical categories of an argument. */
  public enum Kind {
    SHORT_CLUSTER,
    LONG_OPTION,
    FREE_VALUE,
    TERMINATOR,
    DEPRECATED_NUMERIC,
  }

  static Token shortCluster(String arg) {
    return new AutoValue_Token(Kind.SHORT_CLUSTER, arg, arg.substring(1), null, "", null);
  }

  static Token longOption(String arg, String name, @Nullable String inlineValue) {
    return new AutoValue_Token(Kind.LONG_OPTION, arg, name, inlineValue, "", null);
  }

  static Token freeValue(String arg) {
    return new AutoValue_Token(Kind.FREE_VALUE, arg, arg, null, "", null);
  }

  static Token terminator() {
    return new AutoValue_Token(Kind.TERMINATOR, "--", "--", null, "", null);
  }

  static Token deprecatedNumeric(
      String arg, String digits, String suffix, NumericShorthand shorthand) {
    return new AutoValue_Token(Kind.DEPRECATED_NUMERIC, arg, digits, null, suffix, shorthand);
  }

  public abstract Kind getKind();

  /** The argument exactly as it appeared on the command line. */
  public abstract String getArg();

  public abstract String getText();

  /** The text after {@code =} of a long option, or null when there was no {@code =}. */
  @Nullable
  public abstract String getInlineValue();

  /** The letters after the digits of a deprecated numeric form; empty otherwise. */
  public abstract String getSuffix();

  /** The binding that recognized a deprecated numeric form. */
  @Nullable
  public abstract NumericShorthand getShorthand();
}
