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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import javax.annotation.Nullable;

/**
 * An exception that's thrown when the {@link ArgumentParser} fails. Every failure is fatal to the
 * parse that raised it; the exception carries enough structure for a caller to render its own
 * diagnostic and choose an exit code.
 *
 * @see ArgumentParser#parse(java.util.List)
 */
public class OptionsParsingException extends Exception {

  /** The kinds of failure a parse can end with. */
  public enum ErrorKind {
    /** An option name or short character that the utility does not declare. */
    UNKNOWN_OPTION,
    /** A long option prefix that matches two or more distinct long spellings. */
    AMBIGUOUS_OPTION,
    /** An enumerated value prefix that matches two or more distinct members. */
    AMBIGUOUS_VALUE,
    /** A required-value option at the end of the input. */
    MISSING_REQUIRED_VALUE,
    /** A value attached with {@code =} to an option that takes none. */
    UNEXPECTED_VALUE,
    /** A value that fails enumerated-value resolution or type conversion. */
    INVALID_VALUE,
    /** Fewer operands than the positional slots require. */
    MISSING_OPERAND,
    /** More operands than the positional slots accept. */
    EXCESS_OPERAND,
  }

  private final ErrorKind kind;
  @Nullable private final String invalidArgument;
  private final ImmutableList<String> candidates;

  public OptionsParsingException(ErrorKind kind, String message, @Nullable String argument) {
    this(kind, message, argument, ImmutableList.of(), null);
  }

  public OptionsParsingException(
      ErrorKind kind, String message, @Nullable String argument, Throwable throwable) {
    this(kind, message, argument, ImmutableList.of(), throwable);
  }

  private OptionsParsingException(
      ErrorKind kind,
      String message,
      @Nullable String argument,
      Collection<String> candidates,
      @Nullable Throwable throwable) {
    super(message, throwable);
    this.kind = Preconditions.checkNotNull(kind);
    this.invalidArgument = argument;
    this.candidates = ImmutableList.sortedCopyOf(candidates);
  }

  /** Creates an {@link ErrorKind#AMBIGUOUS_OPTION} failure listing the competing long spellings. */
  static OptionsParsingException ambiguousOption(String arg, Collection<String> candidates) {
    ImmutableList<String> sorted = ImmutableList.sortedCopyOf(candidates);
    return new OptionsParsingException(
        ErrorKind.AMBIGUOUS_OPTION,
        String.format(
            "option '%s' is ambiguous; possibilities: '--%s'",
            arg, Joiner.on("' '--").join(sorted)),
        arg,
        sorted,
        null);
  }

  /** Creates an {@link ErrorKind#AMBIGUOUS_VALUE} failure listing the competing values. */
  static OptionsParsingException ambiguousValue(
      String option, String value, Collection<String> candidates) {
    ImmutableList<String> sorted = ImmutableList.sortedCopyOf(candidates);
    return new OptionsParsingException(
        ErrorKind.AMBIGUOUS_VALUE,
        String.format(
            "ambiguous argument '%s' for '%s'; valid arguments are: '%s'",
            value, option, Joiner.on("', '").join(sorted)),
        value,
        sorted,
        null);
  }

  /** Returns a copy of this failure whose message is prefixed with {@code context}. */
  OptionsParsingException withContext(String context) {
    return new OptionsParsingException(
        kind, context + ": " + getMessage(), invalidArgument, candidates, this);
  }

  public ErrorKind getKind() {
    return kind;
  }

  /**
   * Gets the raw text of the invalid argument or {@code null} if the exception can not determine
   * the exact invalid argument.
   */
  @Nullable
  public String getInvalidArgument() {
    return invalidArgument;
  }

  /** The competing names for the two ambiguity kinds, sorted; empty otherwise. */
  public ImmutableList<String> getCandidates() {
    return candidates;
  }
}
