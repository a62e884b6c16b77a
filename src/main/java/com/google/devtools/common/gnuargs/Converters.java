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

import com.google.devtools.common.gnuargs.OptionsParsingException.ErrorKind;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Some convenient converters for the values coreutils-style options take. */
public final class Converters {

  private Converters() {}

  /** Standard converter for Strings. */
  public static class StringConverter implements Converter<String> {
    @Override
    public String convert(String input) {
      return input;
    }

    @Override
    public String getTypeDescription() {
      return "a string";
    }
  }

  /** Standard converter for integers. Decimal only; a leading sign is accepted. */
  public static class IntegerConverter implements Converter<Integer> {
    @Override
    public Integer convert(String input) throws OptionsParsingException {
      try {
        return Integer.parseInt(input);
      } catch (NumberFormatException e) {
        throw invalid("'" + input + "' is not an int", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "an integer";
    }
  }

  /** Standard converter for longs. Decimal only; a leading sign is accepted. */
  public static class LongConverter implements Converter<Long> {
    @Override
    public Long convert(String input) throws OptionsParsingException {
      try {
        return Long.parseLong(input);
      } catch (NumberFormatException e) {
        throw invalid("'" + input + "' is not a long", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a long integer";
    }
  }

  /** Converter for counts such as a number of lines or a width, bounded inclusively. */
  public static class RangeConverter implements Converter<Long> {
    private final long minValue;
    private final long maxValue;

    public RangeConverter(long minValue, long maxValue) {
      this.minValue = minValue;
      this.maxValue = maxValue;
    }

    @Override
    public Long convert(String input) throws OptionsParsingException {
      long value;
      try {
        value = Long.parseLong(input);
      } catch (NumberFormatException e) {
        throw invalid("'" + input + "' is not " + getTypeDescription(), input, e);
      }
      if (value < minValue || value > maxValue) {
        throw invalid("'" + input + "' should be " + getTypeDescription(), input, null);
      }
      return value;
    }

    @Override
    public String getTypeDescription() {
      if (minValue == 0 && maxValue == Long.MAX_VALUE) {
        return "a non-negative integer";
      }
      if (maxValue == Long.MAX_VALUE) {
        return "an integer >= " + minValue;
      }
      return "an integer in " + minValue + "-" + maxValue + " range";
    }
  }

  /** Converter for non-negative counts. */
  public static class NonNegativeLongConverter extends RangeConverter {
    public NonNegativeLongConverter() {
      super(0, Long.MAX_VALUE);
    }
  }

  /**
   * Converter for durations as {@code timeout} and {@code sleep} write them: a non-negative
   * decimal number with an optional unit suffix of {@code s}, {@code m}, {@code h} or {@code d}.
   * Seconds are the default unit.
   */
  public static class DurationConverter implements Converter<Duration> {
    private static final Pattern DURATION_REGEX =
        Pattern.compile("^([0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)([smhd]?)$");

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    @Override
    public Duration convert(String input) throws OptionsParsingException {
      Matcher m = DURATION_REGEX.matcher(input);
      if (!m.matches()) {
        throw invalid("invalid time interval '" + input + "'", input, null);
      }
      BigDecimal seconds = new BigDecimal(m.group(1));
      switch (m.group(2)) {
        case "m":
          seconds = seconds.multiply(BigDecimal.valueOf(60));
          break;
        case "h":
          seconds = seconds.multiply(BigDecimal.valueOf(60 * 60));
          break;
        case "d":
          seconds = seconds.multiply(BigDecimal.valueOf(24 * 60 * 60));
          break;
        default:
          break;
      }
      BigDecimal nanos =
          seconds.multiply(BigDecimal.valueOf(NANOS_PER_SECOND)).setScale(0, RoundingMode.CEILING);
      // Intervals too long to represent are clamped, as GNU timeout does.
      if (nanos.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
        return Duration.ofNanos(Long.MAX_VALUE);
      }
      return Duration.ofNanos(nanos.longValueExact());
    }

    @Override
    public String getTypeDescription() {
      return "a duration";
    }
  }

  /**
   * Join a list of words as in English. Examples: "nothing" "one" "one or two" "one, two or
   * three". The toString method of each element is used.
   */
  static String joinEnglishList(Iterable<?> choices) {
    StringBuilder buf = new StringBuilder();
    for (Iterator<?> ii = choices.iterator(); ii.hasNext(); ) {
      Object choice = ii.next();
      if (buf.length() > 0) {
        buf.append(ii.hasNext() ? ", " : " or ");
      }
      buf.append(choice);
    }
    return buf.length() == 0 ? "nothing" : buf.toString();
  }

  private static OptionsParsingException invalid(
      String message, String input, Throwable cause) {
    return cause == null
        ? new OptionsParsingException(ErrorKind.INVALID_VALUE, message, input)
        : new OptionsParsingException(ErrorKind.INVALID_VALUE, message, input, cause);
  }
}
