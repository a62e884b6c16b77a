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
import javax.annotation.Nullable;

/**
 * The events of one successful parse, in the order their arguments appeared, plus the verbatim
 * arguments captured by a greedy positional slot.
 *
 * <p>A parse that met a help or version option stops there and carries a {@link Request} instead
 * of operands: it holds the option events before the request and nothing else.
 */
public final class ParsedArguments {

  /** What a utility is asked to do instead of its normal work. */
  public enum Request {
    HELP,
    VERSION,
  }

  private final ImmutableList<ArgEvent> events;
  private final ImmutableList<String> trailing;
  @Nullable private final Request request;

  ParsedArguments(ImmutableList<ArgEvent> events, ImmutableList<String> trailing) {
    this(events, trailing, null);
  }

  ParsedArguments(
      ImmutableList<ArgEvent> events, ImmutableList<String> trailing, @Nullable Request request) {
    this.events = events;
    this.trailing = trailing;
    this.request = request;
  }

  public ImmutableList<ArgEvent> getEvents() {
    return events;
  }

  /** The option events only. */
  public ImmutableList<ArgEvent> getOptionEvents() {
    return events.stream().filter(ArgEvent::isOption).collect(ImmutableList.toImmutableList());
  }

  /** The operands assigned to the named positional slot, in order. */
  public ImmutableList<String> getOperands(String slotName) {
    return events.stream()
        .filter(e -> !e.isOption() && e.is(slotName))
        .map(ArgEvent::getValue)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * The arguments a greedy slot captured, from its first operand to the end of the input, with no
   * option interpretation. Empty if the utility has no greedy slot or it was never reached.
   */
  public ImmutableList<String> getTrailingArguments() {
    return trailing;
  }

  /** The help or version request that ended the parse, or null for a normal invocation. */
  @Nullable
  public Request getRequest() {
    return request;
  }

  public boolean isHelpRequested() {
    return request == Request.HELP;
  }

  public boolean isVersionRequested() {
    return request == Request.VERSION;
  }

  @Override
  public String toString() {
    return "ParsedArguments{events="
        + events
        + ", trailing="
        + trailing
        + (request != null ? ", request=" + request : "")
        + "}";
  }
}
