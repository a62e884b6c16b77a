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
import com.google.devtools.common.gnuargs.ArgumentSpec.Binding;
import com.google.devtools.common.gnuargs.OptionsParsingException.ErrorKind;
import com.google.devtools.common.gnuargs.ParsedArguments.Request;
import com.google.devtools.common.gnuargs.PrefixResolver.Resolution;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Walks the token stream of one parse and turns every option occurrence into an {@link ArgEvent}.
 * Free values are buffered in order for the {@link PositionalAllocator}; once the buffer reaches
 * the start of a greedy slot, everything left is captured verbatim. A help or version option ends
 * matching at once; the arguments after it are never looked at.
 *
 * <p>Each matcher is used for a single parse.
 */
final class OptionMatcher {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** What one pass over the arguments produced, before operands are assigned to slots. */
  static final class Matched {
    /** Option events in command-line order. */
    final ImmutableList<ArgEvent> optionEvents;

    /** For each option event, how many free values preceded it. */
    final ImmutableList<Integer> operandsBefore;

    /** Free values in command-line order, greedy capture included. */
    final ImmutableList<String> operands;

    /** The arguments captured by the greedy slot; empty if it never started. */
    final ImmutableList<String> trailing;

    /** The help or version request that stopped matching, if any. */
    @Nullable final Request request;

    private Matched(
        List<ArgEvent> optionEvents,
        List<Integer> operandsBefore,
        List<String> operands,
        List<String> trailing,
        @Nullable Request request) {
      this.optionEvents = ImmutableList.copyOf(optionEvents);
      this.operandsBefore = ImmutableList.copyOf(operandsBefore);
      this.operands = ImmutableList.copyOf(operands);
      this.trailing = ImmutableList.copyOf(trailing);
      this.request = request;
    }
  }

  private final ArgumentSpec spec;
  private final boolean stopAtFirstOperand;

  private final List<ArgEvent> optionEvents = new ArrayList<>();
  private final List<Integer> operandsBefore = new ArrayList<>();
  private final List<String> operands = new ArrayList<>();
  private final List<String> trailing = new ArrayList<>();
  @Nullable private Request request;

  OptionMatcher(ArgumentSpec spec, boolean stopAtFirstOperand) {
    this.spec = spec;
    this.stopAtFirstOperand = stopAtFirstOperand;
  }

  /**
   * Matches every argument.
   *
   * @throws OptionsParsingException on the first argument that cannot be matched
   */
  Matched match(List<String> args) throws OptionsParsingException {
    Tokenizer tokenizer = new Tokenizer(args, spec);
    int greedyStart = PositionalAllocator.greedyStart(spec.getPositionals());
    while (tokenizer.hasNext() && request == null) {
      Token token = tokenizer.next();
      switch (token.getKind()) {
        case TERMINATOR:
          // The tokenizer has already switched to free values.
          break;
        case FREE_VALUE:
          if (operands.size() == greedyStart) {
            trailing.add(token.getArg());
            trailing.addAll(tokenizer.drainRaw());
            operands.addAll(trailing);
            logger.atFine().log(
                "Greedy slot captured %d argument(s) starting at '%s'",
                trailing.size(), token.getArg());
            break;
          }
          operands.add(token.getArg());
          if (stopAtFirstOperand) {
            tokenizer.endOptions();
          }
          break;
        case SHORT_CLUSTER:
          matchShortCluster(token, tokenizer);
          break;
        case LONG_OPTION:
          matchLongOption(token, tokenizer);
          break;
        case DEPRECATED_NUMERIC:
          matchShorthand(token);
          break;
      }
    }
    return new Matched(optionEvents, operandsBefore, operands, trailing, request);
  }

  private void matchShortCluster(Token token, Tokenizer tokenizer)
      throws OptionsParsingException {
    String chars = token.getText();
    for (int i = 0; i < chars.length(); i++) {
      char c = chars.charAt(i);
      Binding binding = spec.getShortBinding(c);
      if (binding == null) {
        throw new OptionsParsingException(
            ErrorKind.UNKNOWN_OPTION, "invalid option -- '" + c + "'", "-" + c);
      }
      OptionSpelling spelling = binding.spelling;
      String form = spelling.getCommandLineForm();
      if (!spelling.getArity().takesValue()) {
        emit(binding, spelling.getImplicitValue(), form);
        if (request != null) {
          return;
        }
        continue;
      }
      // A value-taking short option consumes the rest of the cluster, verbatim.
      String rest = chars.substring(i + 1);
      if (!rest.isEmpty()) {
        emit(binding, resolveValue(binding, form, rest), form + rest);
        return;
      }
      if (spelling.getArity() == ValueArity.REQUIRED) {
        String next = tokenizer.nextRaw();
        if (next == null) {
          throw new OptionsParsingException(
              ErrorKind.MISSING_REQUIRED_VALUE,
              "option requires an argument -- '" + c + "'",
              form);
        }
        emit(binding, resolveValue(binding, form, next), form + " " + next);
        return;
      }
      emit(binding, spelling.getImplicitValue(), form);
      return;
    }
  }

  private void matchLongOption(Token token, Tokenizer tokenizer) throws OptionsParsingException {
    String name = token.getText();
    if (name.isEmpty()) {
      // "--=value": the empty string would otherwise prefix every long name.
      throw unrecognized(token);
    }
    Resolution<Binding> resolution = PrefixResolver.resolve(name, spec.getLongBindings());
    switch (resolution.getKind()) {
      case NO_MATCH:
        throw unrecognized(token);
      case AMBIGUOUS:
        throw OptionsParsingException.ambiguousOption("--" + name, resolution.getCandidates());
      case EXACT:
      case UNIQUE_PREFIX:
        break;
    }
    Binding binding = resolution.getValue();
    String form = "--" + resolution.getName();
    @Nullable String inline = token.getInlineValue();
    switch (binding.spelling.getArity()) {
      case NONE:
        if (inline != null) {
          throw new OptionsParsingException(
              ErrorKind.UNEXPECTED_VALUE,
              "option '" + form + "' doesn't allow an argument",
              token.getArg());
        }
        emit(binding, binding.spelling.getImplicitValue(), token.getArg());
        break;
      case REQUIRED:
        if (inline != null) {
          emit(binding, resolveValue(binding, form, inline), token.getArg());
          break;
        }
        String next = tokenizer.nextRaw();
        if (next == null) {
          throw new OptionsParsingException(
              ErrorKind.MISSING_REQUIRED_VALUE,
              "option '" + form + "' requires an argument",
              token.getArg());
        }
        emit(binding, resolveValue(binding, form, next), token.getArg() + " " + next);
        break;
      case OPTIONAL:
        // Only an attached value counts; the next argument is never taken.
        emit(
            binding,
            inline != null
                ? resolveValue(binding, form, inline)
                : binding.spelling.getImplicitValue(),
            token.getArg());
        break;
    }
  }

  private static OptionsParsingException unrecognized(Token token) {
    return new OptionsParsingException(
        ErrorKind.UNKNOWN_OPTION,
        "unrecognized option '" + token.getArg() + "'",
        "--" + token.getText());
  }

  private void matchShorthand(Token token) {
    NumericShorthand shorthand = token.getShorthand();
    OptionSpec option = spec.getOption(shorthand.getOptionId());
    record(ArgEvent.option(option, null, shorthand.valueOf(token), token.getArg()));
  }

  private static String resolveValue(Binding binding, String form, String raw)
      throws OptionsParsingException {
    ValueSet values = binding.option.getValues();
    return values == null ? raw : values.resolve(form, raw);
  }

  private void emit(Binding binding, @Nullable String value, String commandLineForm) {
    record(ArgEvent.option(binding.option, binding.spelling, value, commandLineForm));
  }

  private void record(ArgEvent event) {
    request = spec.getRequest(event.getId());
    if (request != null) {
      logger.atFine().log("%s requested by %s", request, event.getCommandLineForm());
      return;
    }
    logger.atFine().log("Matched option '%s' from %s", event.getId(), event.getCommandLineForm());
    optionEvents.add(event);
    operandsBefore.add(operands.size());
  }
}
