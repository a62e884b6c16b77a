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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * A parser for GNU-style command lines. The parser is configured with an {@link ArgumentSpec}
 * describing one utility and may be used for any number of parses; each parse owns its own token
 * stream and events.
 *
 * <p>Parsing runs in three stages. The {@link Tokenizer} classifies each argument, the {@link
 * OptionMatcher} turns option tokens into events and buffers free values, and the {@link
 * PositionalAllocator} assigns the buffered values to the positional slots. The first failure ends
 * the parse. A help or version option ends it too, successfully, before operands are assigned; see
 * {@link ArgumentSpec.Builder#addHelpOption}.
 *
 * <p>Here's an example:
 *
 * <pre>
 * ArgumentParser parser =
 *     ArgumentParser.builder()
 *         .spec(
 *             ArgumentSpec.builder()
 *                 .addOption(
 *                     OptionSpec.builder("lines")
 *                         .spelling("-n NUM")
 *                         .spelling("--lines=NUM")
 *                         .build())
 *                 .addPositional(PositionalSlot.of("FILE", PositionalArity.atLeast(0)))
 *                 .build())
 *         .build();
 * ParseResult&lt;TailSettings&gt; result =
 *     parser.parse(args, TailSettings::new, TailSettings::apply);
 * </pre>
 *
 * <p>Options and operands may be interleaved unless POSIX mode is on, in which case the first
 * operand ends option recognition.
 */
public final class ArgumentParser {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Environment variable that switches GNU getopt to POSIX mode. */
  public static final String POSIXLY_CORRECT = "POSIXLY_CORRECT";

  /**
   * Thrown when an argument description is inconsistent, e.g. two options claim the same spelling.
   * This is a bug in the utility's declaration rather than in a user's command line, so it is
   * unchecked; the builders that throw it say so in their documentation.
   */
  public static class ConstructionException extends RuntimeException {
    public ConstructionException(String message) {
      super(message);
    }
  }

  private final ArgumentSpec spec;
  private final boolean stopAtFirstOperand;

  private ArgumentParser(ArgumentSpec spec, boolean stopAtFirstOperand) {
    this.spec = spec;
    this.stopAtFirstOperand = stopAtFirstOperand;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A builder of {@link ArgumentParser}s. */
  public static final class Builder {
    private ArgumentSpec spec;
    private boolean stopAtFirstOperand = false;
    private ImmutableMap<String, String> environment = ImmutableMap.of();

    private Builder() {}

    /** Sets the utility's argument description. Required. */
    @CanIgnoreReturnValue
    public Builder spec(ArgumentSpec spec) {
      this.spec = Preconditions.checkNotNull(spec);
      return this;
    }

    /**
     * Whether the first operand ends option recognition, so that everything after it is an
     * operand. Defaults to false, which lets options follow operands.
     */
    @CanIgnoreReturnValue
    public Builder stopAtFirstOperand(boolean stopAtFirstOperand) {
      this.stopAtFirstOperand = stopAtFirstOperand;
      return this;
    }

    /**
     * Sets the process environment the parser consults. Only {@link #POSIXLY_CORRECT} is read; its
     * presence, with any value, turns on {@link #stopAtFirstOperand}.
     */
    @CanIgnoreReturnValue
    public Builder environment(Map<String, String> environment) {
      this.environment = ImmutableMap.copyOf(environment);
      return this;
    }

    public ArgumentParser build() {
      if (spec == null) {
        throw new ConstructionException("No argument spec given");
      }
      boolean posix = stopAtFirstOperand || environment.containsKey(POSIXLY_CORRECT);
      return new ArgumentParser(spec, posix);
    }
  }

  public ArgumentSpec getSpec() {
    return spec;
  }

  public boolean stopsAtFirstOperand() {
    return stopAtFirstOperand;
  }

  /**
   * Parses {@code args}, the command line without the program name.
   *
   * @throws OptionsParsingException on the first argument that cannot be matched or assigned
   */
  public ParsedArguments parse(List<String> args) throws OptionsParsingException {
    Preconditions.checkNotNull(args);
    OptionMatcher.Matched matched = new OptionMatcher(spec, stopAtFirstOperand).match(args);
    if (matched.request != null) {
      // Operands are neither checked nor reported once help or version is asked for.
      return new ParsedArguments(matched.optionEvents, ImmutableList.of(), matched.request);
    }
    ImmutableList<ArgEvent> operandEvents =
        PositionalAllocator.allocate(spec.getPositionals(), matched.operands);
    ParsedArguments parsed =
        new ParsedArguments(mergeInInputOrder(matched, operandEvents), matched.trailing);
    logger.atFiner().log(
        "Parsed %d argument(s) into %d option event(s) and %d operand(s)",
        args.size(), matched.optionEvents.size(), operandEvents.size());
    return parsed;
  }

  /**
   * Parses {@code args} and folds the events into a fresh settings record from {@code
   * initialSettings}. On failure no settings are returned.
   *
   * @throws OptionsParsingException if parsing fails or {@code reducer} rejects an event
   */
  public <S> ParseResult<S> parse(
      List<String> args, Supplier<S> initialSettings, SettingsReducer<S> reducer)
      throws OptionsParsingException {
    ParsedArguments parsed = parse(args);
    S settings = SettingsReducer.fold(initialSettings.get(), parsed.getEvents(), reducer);
    return ParseResult.create(settings, parsed);
  }

  /** Places every operand event after the option events that preceded its argument. */
  private static ImmutableList<ArgEvent> mergeInInputOrder(
      OptionMatcher.Matched matched, ImmutableList<ArgEvent> operandEvents) {
    ImmutableList.Builder<ArgEvent> events = ImmutableList.builder();
    int option = 0;
    for (int operand = 0; operand < operandEvents.size(); operand++) {
      while (option < matched.optionEvents.size()
          && matched.operandsBefore.get(option) <= operand) {
        events.add(matched.optionEvents.get(option++));
      }
      events.add(operandEvents.get(operand));
    }
    events.addAll(matched.optionEvents.subList(option, matched.optionEvents.size()));
    return events.build();
  }
}
