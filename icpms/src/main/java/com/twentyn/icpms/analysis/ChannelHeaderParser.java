/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.icpms.analysis;

import com.twentyn.icpms.model.ChannelDescriptor;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses the instrument's channel column headers.  Two forms are recognized:
 * <pre>
 *   "63  Cu  [ He ]"         -> Cu63_He
 *   "75 -> 91  As  [ O2 ]"   -> As75to91_O2
 * </pre>
 * Anything else is skipped with a warning.
 */
public class ChannelHeaderParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ChannelHeaderParser.class);

  private static final String SHIFT_DELIMITER = "->";
  private static final String GAS_OPEN = "[";
  private static final String GAS_CLOSE = "]";

  // Nominal isotope masses never exceed three digits.
  private static final Pattern MASS_PATTERN = Pattern.compile("^\\d{1,3}$");
  private static final Pattern ELEMENT_PATTERN = Pattern.compile("^[A-Z][a-z]{0,2}$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public static class Result {
    private List<ChannelDescriptor> channels;
    private List<String> skippedHeaders;

    public Result(List<ChannelDescriptor> channels, List<String> skippedHeaders) {
      this.channels = Collections.unmodifiableList(channels);
      this.skippedHeaders = Collections.unmodifiableList(skippedHeaders);
    }

    public List<ChannelDescriptor> getChannels() {
      return channels;
    }

    public List<String> getSkippedHeaders() {
      return skippedHeaders;
    }
  }

  /**
   * Parses every header, in order.  Headers that match neither form are reported in the result rather than failing
   * the run.
   * @param headers the non-metadata column headers of the instrument export.
   * @throws IllegalStateException if two distinct headers produce the same channel id.
   */
  public Result parseHeaders(List<String> headers) {
    List<ChannelDescriptor> channels = new ArrayList<>(headers.size());
    List<String> skipped = new ArrayList<>();
    Map<String, String> channelIdToHeader = new HashMap<>();

    for (String header : headers) {
      ChannelDescriptor descriptor = parseHeader(header);
      if (descriptor == null) {
        LOGGER.warn("Skipping column '%s': does not match the expected channel header format", header);
        skipped.add(header);
        continue;
      }

      String previous = channelIdToHeader.put(descriptor.getChannelId(), header);
      if (previous != null) {
        String msg = String.format("Headers '%s' and '%s' both map to channel id %s",
            previous, header, descriptor.getChannelId());
        LOGGER.error(msg);
        throw new IllegalStateException(msg);
      }
      channels.add(descriptor);
    }

    LOGGER.info("Parsed %d channel headers, skipped %d", channels.size(), skipped.size());
    return new Result(channels, skipped);
  }

  /**
   * Parses a single header.
   * @return the channel descriptor, or null if the header matches neither the plain nor the mass-shift form.
   */
  public ChannelDescriptor parseHeader(String header) {
    if (StringUtils.isBlank(header)) {
      return null;
    }

    List<String> tokens = tokenize(header);

    /* Layout, with every delimiter as its own token:
     *   plain:      MASS ELEMENT [ GAS... ]
     *   mass shift: MASS -> MASS ELEMENT [ GAS... ] */
    int openIdx = tokens.indexOf(GAS_OPEN);
    if (openIdx < 0 || !GAS_CLOSE.equals(tokens.get(tokens.size() - 1)) ||
        tokens.subList(openIdx + 1, tokens.size() - 1).contains(GAS_OPEN) ||
        tokens.subList(openIdx + 1, tokens.size() - 1).contains(GAS_CLOSE)) {
      return null;
    }

    List<String> gasTokens = tokens.subList(openIdx + 1, tokens.size() - 1);
    if (gasTokens.isEmpty()) {
      return null;
    }
    String gasMode = StringUtils.join(gasTokens, " ");

    List<String> prefix = tokens.subList(0, openIdx);
    if (prefix.size() == 2) {
      return makePlainChannel(header, prefix.get(0), prefix.get(1), gasMode);
    }
    if (prefix.size() == 4 && SHIFT_DELIMITER.equals(prefix.get(1))) {
      return makeMassShiftChannel(header, prefix.get(0), prefix.get(2), prefix.get(3), gasMode);
    }
    return null;
  }

  private ChannelDescriptor makePlainChannel(String header, String mass, String element, String gasMode) {
    if (!MASS_PATTERN.matcher(mass).matches() || !ELEMENT_PATTERN.matcher(element).matches()) {
      return null;
    }
    Integer massValue = Integer.valueOf(mass);
    String channelId = String.format("%s%d_%s", element, massValue, channelGasToken(gasMode));
    return new ChannelDescriptor(header, channelId, element, massValue, massValue, gasMode, false);
  }

  private ChannelDescriptor makeMassShiftChannel(String header, String nominalMass, String analyzedMass,
                                                 String element, String gasMode) {
    if (!MASS_PATTERN.matcher(nominalMass).matches() || !MASS_PATTERN.matcher(analyzedMass).matches() ||
        !ELEMENT_PATTERN.matcher(element).matches()) {
      return null;
    }
    Integer nominal = Integer.valueOf(nominalMass);
    Integer analyzed = Integer.valueOf(analyzedMass);
    String channelId = String.format("%s%dto%d_%s", element, nominal, analyzed, channelGasToken(gasMode));
    return new ChannelDescriptor(header, channelId, element, nominal, analyzed, gasMode, true);
  }

  // Multi-word gas modes ("No Gas") are joined so channel ids never contain whitespace.
  private String channelGasToken(String gasMode) {
    return StringUtils.deleteWhitespace(gasMode);
  }

  static List<String> tokenize(String header) {
    String spaced = header
        .replace(SHIFT_DELIMITER, " " + SHIFT_DELIMITER + " ")
        .replace(GAS_OPEN, " " + GAS_OPEN + " ")
        .replace(GAS_CLOSE, " " + GAS_CLOSE + " ")
        .trim();
    if (spaced.isEmpty()) {
      return Collections.emptyList();
    }
    List<String> tokens = new ArrayList<>();
    Collections.addAll(tokens, WHITESPACE.split(spaced));
    return tokens;
  }
}
