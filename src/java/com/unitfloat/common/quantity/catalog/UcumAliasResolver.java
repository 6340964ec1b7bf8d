// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.unitfloat.common.quantity.catalog;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.apache.commons.lang.StringUtils;

/**
 * Resolves UCUM unit codes.  Tokens are matched on their exact code after folding the two ways of
 * writing micro: the Greek small letter mu and the micro sign are treated alike, and the ASCII
 * {@code u} prefix UCUM uses is tried as well.
 */
public class UcumAliasResolver implements AliasResolver {

  static final char GREEK_MU = '\u03BC';
  static final char MICRO_SIGN = '\u00B5';

  private static final Pattern PARENTHESIZED = Pattern.compile("\\(([^)]+)\\)\\s*$");
  private static final Pattern AFTER_SLASH = Pattern.compile("/\\s*(\\S+)\\s*$");
  private static final Pattern TRAILING_TOKEN =
      Pattern.compile("([A-Za-z\\[\\]%.^\\-0-9" + MICRO_SIGN + GREEK_MU + "]+)\\s*$");
  private static final Pattern ASCII_MICRO_PREFIX = Pattern.compile("u(?=[A-Za-z])");
  private static final Pattern DENOMINATOR_TERM = Pattern.compile("^([a-zA-Z]+)(\\d*)$");

  /**
   * Looks for the unit token in a label: a trailing parenthesized token, else a token after a
   * trailing slash, else the last unit-like word.
   */
  @Override
  @Nullable
  public String tokenFromLabel(@Nullable String label) {
    String trimmed = StringUtils.trimToNull(label);
    if (trimmed == null) {
      return null;
    }
    for (Pattern pattern : ImmutableList.of(PARENTHESIZED, AFTER_SLASH, TRAILING_TOKEN)) {
      Matcher matcher = pattern.matcher(trimmed);
      if (matcher.find()) {
        return matcher.group(1).trim();
      }
    }
    return null;
  }

  @Override
  @Nullable
  public String resolve(@Nullable String token, Map<String, String> identifiersByCode) {
    Preconditions.checkNotNull(identifiersByCode);
    for (String candidate : candidates(token)) {
      String identifier = identifiersByCode.get(candidate);
      if (identifier != null) {
        return identifier;
      }
    }
    return null;
  }

  /**
   * Trims a token and writes micro as the micro sign.
   *
   * @return the normalized token, empty if {@code token} is {@code null}.
   */
  public static String normalizeToken(@Nullable String token) {
    if (token == null) {
      return "";
    }
    return token.trim().replace(GREEK_MU, MICRO_SIGN);
  }

  /**
   * Lists the spellings of a token to try, in order: the ASCII micro spelling, the normalized
   * token and the spelling with ASCII micro prefixes turned into micro signs.
   */
  public static List<String> candidates(@Nullable String token) {
    String normalized = normalizeToken(token);
    if (normalized.isEmpty()) {
      return ImmutableList.of();
    }
    List<String> candidates = Lists.newArrayList();
    String asciiMicro = normalized.replace(MICRO_SIGN, 'u');
    addIfAbsent(candidates, asciiMicro);
    addIfAbsent(candidates, normalized);
    addIfAbsent(candidates, ASCII_MICRO_PREFIX.matcher(asciiMicro).replaceAll(
        String.valueOf(MICRO_SIGN)));
    return ImmutableList.copyOf(candidates);
  }

  private static void addIfAbsent(List<String> candidates, String candidate) {
    if (!candidate.isEmpty() && !candidates.contains(candidate)) {
      candidates.add(candidate);
    }
  }

  /**
   * Rewrites informal unit notation into UCUM: spaces and {@code *} become {@code .} and every
   * term after a {@code /} gets a negated exponent, so {@code kg m/s2} becomes
   * {@code kg.m.s-2}.
   */
  public static String toUcumNotation(String text) {
    String result = Preconditions.checkNotNull(text).replaceAll("[\\s*]", ".");
    if (result.indexOf('/') < 0) {
      return result;
    }
    String[] parts = result.split("/", -1);
    StringBuilder ucum = new StringBuilder(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      Matcher term = DENOMINATOR_TERM.matcher(parts[i]);
      ucum.append('.');
      if (term.matches()) {
        ucum.append(term.group(1)).append('-').append(exponent(term.group(2)));
      } else {
        ucum.append(parts[i]).append("-1");
      }
    }
    return ucum.toString();
  }

  private static String exponent(String digits) {
    if (digits.isEmpty()) {
      return "1";
    }
    String significant = StringUtils.stripStart(digits, "0");
    return significant.isEmpty() ? "0" : significant;
  }
}
