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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.common.gnuargs.ArgumentSpec.NumericPrecedence;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import javax.annotation.Nullable;

/**
 * Splits the raw argument list into {@link Token}s, one argument at a time. The sequence is
 * single-pass; to read it again, create a new tokenizer.
 *
 * <p>Besides iteration, the tokenizer lets its consumer take the next argument verbatim (the value
 * of a required-value option), end option recognition (POSIX mode), and drain everything left (a
 * greedy positional slot).
 */
final class Tokenizer implements Iterator<Token> {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ImmutableList<String> args;
  private final ArgumentSpec spec;
  private int position = 0;
  private boolean optionsEnded = false;

  Tokenizer(List<String> args, ArgumentSpec spec) {
    this.args = ImmutableList.copyOf(args);
    this.spec = spec;
  }

  @Override
  public boolean hasNext() {
    return position < args.size();
  }

  @Override
  public Token next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    int index = position++;
    return classify(args.get(index), index);
  }

  /** Takes the next argument as-is, whatever it looks like, or returns null at the end. */
  @Nullable
  String nextRaw() {
    return hasNext() ? args.get(position++) : null;
  }

  /** Every later argument becomes a {@link Token.Kind#FREE_VALUE}. */
  void endOptions() {
    optionsEnded = true;
  }

  /** Takes all remaining arguments verbatim. */
  ImmutableList<String> drainRaw() {
    ImmutableList<String> rest = args.subList(position, args.size());
    position = args.size();
    return rest;
  }

  private Token classify(String arg, int index) {
    if (optionsEnded) {
      return Token.freeValue(arg);
    }
    if (arg.equals("--")) {
      optionsEnded = true;
      return Token.terminator();
    }
    if (arg.startsWith("--")) {
      int equalsAt = arg.indexOf('=');
      return equalsAt == -1
          ? Token.longOption(arg, arg.substring(2), null)
          : Token.longOption(arg, arg.substring(2, equalsAt), arg.substring(equalsAt + 1));
    }
    if (arg.length() < 2) {
      // Includes "-", which conventionally names standard input.
      return Token.freeValue(arg);
    }
    char lead = arg.charAt(0);
    if (lead != '-' && lead != '+') {
      return Token.freeValue(arg);
    }
    Token shorthand = matchShorthand(arg, index);
    if (lead == '+') {
      return shorthand != null ? shorthand : Token.freeValue(arg);
    }
    if (shorthand != null
        && (spec.getNumericPrecedence() == NumericPrecedence.SHORTHAND_FIRST
            || !isDeclaredCluster(arg))) {
      return shorthand;
    }
    boolean declaredShort = spec.declaresShort(arg.charAt(1));
    if (isAsciiDigit(arg.charAt(1)) && !declaredShort) {
      // A negative number, not an option cluster.
      return Token.freeValue(arg);
    }
    return Token.shortCluster(arg);
  }

  @Nullable
  private Token matchShorthand(String arg, int index) {
    for (NumericShorthand shorthand : spec.getShorthands()) {
      if (shorthand.isFirstArgumentOnly() && index != 0) {
        continue;
      }
      Token token = shorthand.match(arg);
      if (token != null) {
        logger.atFine().log(
            "'%s' matches the numeric shorthand of option '%s'", arg, shorthand.getOptionId());
        return token;
      }
    }
    return null;
  }

  /**
   * Whether {@code arg} reads as a cluster of declared short options: every character up to the
   * first value-taking one is declared, and that one takes the rest as its value.
   */
  private boolean isDeclaredCluster(String arg) {
    for (int i = 1; i < arg.length(); i++) {
      ArgumentSpec.Binding binding = spec.getShortBinding(arg.charAt(i));
      if (binding == null) {
        return false;
      }
      if (binding.spelling.getArity().takesValue()) {
        return true;
      }
    }
    return true;
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
