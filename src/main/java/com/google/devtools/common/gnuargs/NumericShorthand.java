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
 * Binds a deprecated numeric shorthand, such as {@code head -20} or {@code tail +5}, to an option
 * of the utility. A matching argument is rewritten into an event of the bound option whose value
 * is produced by the binding's {@link ValueTransform}.
 *
 * <p>Bindings are opt-in per utility and per sign, so that ordinary negative numbers stay operands
 * everywhere else.
 */
@AutoValue
public abstract class NumericShorthand {

  /** The leading character of the shorthand. */
  public enum Sign {
    PLUS('+'),
    MINUS('-');

    private final char symbol;

    Sign(char symbol) {
      this.symbol = symbol;
    }

    public char getSymbol() {
      return symbol;
    }
  }

  /** Produces the bound option's raw value from the pieces of the shorthand. */
  @FunctionalInterface
  public interface ValueTransform {
    String apply(Sign sign, String digits, String suffix);
  }

  /** Binds {@code -N} to the option with the given identity, passing N through. */
  public static Builder minus(String optionId) {
    return builder(Sign.MINUS, optionId);
  }

  /** Binds {@code +N} to the option with the given identity, passing N through. */
  public static Builder plus(String optionId) {
    return builder(Sign.PLUS, optionId);
  }

  private static Builder builder(Sign sign, String optionId) {
    return new AutoValue_NumericShorthand.Builder()
        .sign(sign)
        .optionId(optionId)
        .suffixLetters("")
        .firstArgumentOnly(false)
        .transform((s, digits, suffix) -> digits + suffix);
  }

  public abstract Sign getSign();

  /** The identity of the option the shorthand stands for. */
  public abstract String getOptionId();

  /** Letters that may follow the digits, e.g. {@code "bcflqv"} for {@code tail -100cf}. */
  public abstract String getSuffixLetters();

  /** Whether the shorthand is only recognized as the first argument, as GNU's obsolete usage. */
  public abstract boolean isFirstArgumentOnly();

  public abstract ValueTransform getTransform();

  /** Builder for {@link NumericShorthand}. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder sign(Sign sign);

    abstract Builder optionId(String optionId);

    public abstract Builder suffixLetters(String suffixLetters);

    public abstract Builder firstArgumentOnly(boolean firstArgumentOnly);

    public abstract Builder transform(ValueTransform transform);

    public abstract NumericShorthand build();
  }

  /**
   * Returns the token for {@code arg} if it is this shorthand, or null. The digit run must be
   * non-empty and every remaining character must be one of the suffix letters.
   */
  @Nullable
  Token match(String arg) {
    if (arg.length() < 2 || arg.charAt(0) != getSign().getSymbol()) {
      return null;
    }
    int end = 1;
    while (end < arg.length() && isAsciiDigit(arg.charAt(end))) {
      end++;
    }
    if (end == 1) {
      return null;
    }
    String suffix = arg.substring(end);
    for (int i = 0; i < suffix.length(); i++) {
      if (getSuffixLetters().indexOf(suffix.charAt(i)) < 0) {
        return null;
      }
    }
    return Token.deprecatedNumeric(arg, arg.substring(1, end), suffix, this);
  }

  /** Applies the transform to a token this binding recognized. */
  String valueOf(Token token) {
    return getTransform().apply(getSign(), token.getText(), token.getSuffix());
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
