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
import com.google.common.collect.Iterables;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.common.gnuargs.OptionsParsingException.ErrorKind;
import java.util.List;

/**
 * Assigns the free values of a parse to the declared positional slots, left to right.
 *
 * <p>Each slot claims {@code min(max, remaining - minimumsAfter)} operands: as many as it may while
 * leaving enough for the minimums of the slots after it. That lets a trailing fixed slot take the
 * last operand, as in {@code cp SOURCE... DEST}. A slot whose claim falls below its own minimum is
 * the one reported missing, so {@code cp dest} names SOURCE.
 */
final class PositionalAllocator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Value of {@link #greedyStart} when the slots declare no greedy slot. */
  static final int NO_GREEDY_SLOT = -1;

  private PositionalAllocator() {}

  /**
   * Returns how many free values precede the first operand of the greedy slot, or {@link
   * #NO_GREEDY_SLOT}. The slots before a greedy slot all take a fixed number of operands.
   */
  static int greedyStart(List<PositionalSlot> slots) {
    if (slots.isEmpty() || !Iterables.getLast(slots).isGreedy()) {
      return NO_GREEDY_SLOT;
    }
    int start = 0;
    for (PositionalSlot slot : slots.subList(0, slots.size() - 1)) {
      start += slot.getArity().getMax();
    }
    return start;
  }

  /**
   * Returns one {@link ArgEvent.Kind#OPERAND} event per operand, in operand order.
   *
   * @throws OptionsParsingException of kind {@link ErrorKind#MISSING_OPERAND} naming the first slot
   *     whose minimum cannot be met, or {@link ErrorKind#EXCESS_OPERAND} naming the first operand
   *     no slot accepts
   */
  static ImmutableList<ArgEvent> allocate(List<PositionalSlot> slots, List<String> operands)
      throws OptionsParsingException {
    long[] minimumsAfter = new long[slots.size() + 1];
    for (int i = slots.size() - 1; i >= 0; i--) {
      minimumsAfter[i] = minimumsAfter[i + 1] + slots.get(i).getArity().getMin();
    }
    ImmutableList.Builder<ArgEvent> events = ImmutableList.builder();
    int next = 0;
    for (int i = 0; i < slots.size(); i++) {
      PositionalSlot slot = slots.get(i);
      PositionalArity arity = slot.getArity();
      long available = (long) operands.size() - next - minimumsAfter[i + 1];
      int claim = (int) Math.max(0, Math.min(arity.getMax(), available));
      if (claim < arity.getMin()) {
        throw missingOperand(slot, operands);
      }
      for (String operand : operands.subList(next, next + claim)) {
        events.add(ArgEvent.operand(slot, operand));
      }
      logger.atFine().log("Assigned %d operand(s) to %s", claim, slot.getName());
      next += claim;
    }
    if (next < operands.size()) {
      String extra = operands.get(next);
      throw new OptionsParsingException(
          ErrorKind.EXCESS_OPERAND, "extra operand '" + extra + "'", extra);
    }
    return events.build();
  }

  private static OptionsParsingException missingOperand(
      PositionalSlot slot, List<String> operands) {
    String message =
        operands.isEmpty()
            ? "missing operand"
            : "missing operand after '" + Iterables.getLast(operands) + "'";
    return new OptionsParsingException(ErrorKind.MISSING_OPERAND, message, slot.getName());
  }
}
