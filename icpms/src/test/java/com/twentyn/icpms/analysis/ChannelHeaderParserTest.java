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
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ChannelHeaderParserTest {

  private ChannelHeaderParser parser;

  @Before
  public void setUp() {
    parser = new ChannelHeaderParser();
  }

  @Test
  public void testParsePlainMassHeader() {
    ChannelDescriptor descriptor = parser.parseHeader("63  Cu  [ He ]");
    assertEquals("63  Cu  [ He ]", descriptor.getOriginalHeader());
    assertEquals("Cu63_He", descriptor.getChannelId());
    assertEquals("Cu", descriptor.getElement());
    assertEquals(Integer.valueOf(63), descriptor.getNominalMass());
    assertEquals(Integer.valueOf(63), descriptor.getAnalyzedMass());
    assertEquals("He", descriptor.getGasMode());
    assertFalse(descriptor.isMassShift());
  }

  @Test
  public void testParseMassShiftHeader() {
    ChannelDescriptor descriptor = parser.parseHeader("75 -> 91  As  [ O2 ]");
    assertEquals("As75to91_O2", descriptor.getChannelId());
    assertEquals("As", descriptor.getElement());
    assertEquals(Integer.valueOf(75), descriptor.getNominalMass());
    assertEquals(Integer.valueOf(91), descriptor.getAnalyzedMass());
    assertEquals("O2", descriptor.getGasMode());
    assertTrue(descriptor.isMassShift());
  }

  @Test
  public void testParseTightlySpacedHeaders() {
    assertEquals("Cu63_He", parser.parseHeader("63 Cu [He]").getChannelId());
    assertEquals("As75to91_O2", parser.parseHeader("75->91 As [O2]").getChannelId());
  }

  @Test
  public void testMultiWordGasMode() {
    ChannelDescriptor descriptor = parser.parseHeader("7  Li  [ No Gas ]");
    assertEquals("No Gas", descriptor.getGasMode());
    assertEquals("Li7_NoGas", descriptor.getChannelId());
  }

  @Test
  public void testUnparsableHeadersReturnNull() {
    List<String> testCases = Arrays.asList(
        "", "   ", "Comment", "63 Cu", "Cu 63 [ He ]", "63 Cu [ He", "63 Cu [ ]", "63 -> Cu [ He ]",
        "75 -> 91 -> 93 As [ O2 ]", "63 Cu He [ He ]", "Unnamed: 7",
        "99999999999  Cu  [ He ]", "75 -> 99999999999  As  [ O2 ]", "1234  Cu  [ He ]"
    );
    for (String testCase : testCases) {
      assertNull(String.format("Header '%s' does not parse", testCase), parser.parseHeader(testCase));
    }
  }

  @Test
  public void testParseHeadersSkipsUnparsableColumns() {
    ChannelHeaderParser.Result result = parser.parseHeaders(
        Arrays.asList("75  As  [ He ]", "Comment", "75 -> 91  As  [ O2 ]", "63  Cu  [ He ]"));

    assertEquals(3, result.getChannels().size());
    assertEquals("As75_He", result.getChannels().get(0).getChannelId());
    assertEquals("As75to91_O2", result.getChannels().get(1).getChannelId());
    assertEquals("Cu63_He", result.getChannels().get(2).getChannelId());
    assertEquals(Collections.singletonList("Comment"), result.getSkippedHeaders());
  }

  @Test
  public void testOversizedMassIsSkippedNotFatal() {
    ChannelHeaderParser.Result result = parser.parseHeaders(Arrays.asList("63  Cu  [ He ]", "99999999999  Cu  [ He ]"));

    assertEquals(1, result.getChannels().size());
    assertEquals("Cu63_He", result.getChannels().get(0).getChannelId());
    assertEquals(Collections.singletonList("99999999999  Cu  [ He ]"), result.getSkippedHeaders());
  }

  @Test
  public void testChannelIdIsDeterministic() {
    assertEquals(parser.parseHeader("75 -> 91  As  [ O2 ]"), parser.parseHeader("75 -> 91  As  [ O2 ]"));
  }

  @Test(expected = IllegalStateException.class)
  public void testCollidingChannelIdsAreRejected() {
    parser.parseHeaders(Arrays.asList("63  Cu  [ He ]", "63 Cu [He]"));
  }
}
