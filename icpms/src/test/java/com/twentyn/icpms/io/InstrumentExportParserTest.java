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

package com.twentyn.icpms.io;

import com.twentyn.icpms.model.WideSampleTable;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class InstrumentExportParserTest {

  private InstrumentExportParser parser;

  @Before
  public void setUp() {
    parser = new InstrumentExportParser();
  }

  @Test
  public void testParseExportFile() throws Exception {
    WideSampleTable table = parser.parse(new File(getClass().getResource("/sort.csv").toURI()));

    assertEquals("Acq. Date-Time", table.getAcqTimeHeader());
    assertEquals("Sample Name", table.getSampleHeader());
    assertEquals(Arrays.asList("75  As  [ He ]", "75 -> 91  As  [ O2 ]", "63  Cu  [ He ]", "Comment"),
        table.getChannelHeaders());
    assertEquals("Unit label row is left for the reshaper", 7, table.getRows().size());

    WideSampleTable.Row icv = table.getRows().get(3);
    assertEquals("ICV 1", icv.getSampleName());
    assertEquals("2025-03-01 09:10", icv.getAcqTime());
    assertEquals("99", icv.getCell("75 -> 91  As  [ O2 ]"));
  }

  @Test
  public void testLabelRowAboveHeaderIsSkipped() throws Exception {
    List<List<String>> rows = new ArrayList<>();
    rows.add(Arrays.asList("Batch 12", "", "", "", ""));
    rows.add(Arrays.asList("Time", "Sample", "63  Cu  [ He ]", "", "7  Li  [ No Gas ]"));
    rows.add(Arrays.asList("t0", "Blank 1", "0.5", "x", "0.1"));
    rows.add(Arrays.asList("", "", "", "", ""));
    rows.add(Arrays.asList("t1", "Sample A", "12"));

    WideSampleTable table = parser.parseRows(rows);

    assertEquals("Columns with a blank header are dropped",
        Arrays.asList("63  Cu  [ He ]", "7  Li  [ No Gas ]"), table.getChannelHeaders());
    assertEquals("Blank rows are skipped", 2, table.getRows().size());
    assertEquals("", table.getRows().get(1).getCell("7  Li  [ No Gas ]"));
  }

  @Test
  public void testFindHeaderRow() {
    List<List<String>> shifted = Arrays.asList(
        Arrays.asList("", "", "", "As", "Cu"),
        Arrays.asList("Time", "Sample", "x", "y", "z"));
    assertEquals(1, InstrumentExportParser.findHeaderRow(shifted));

    List<List<String>> narrow = Arrays.asList(
        Arrays.asList("Time", "Sample"),
        Arrays.asList("t0", "A"));
    assertEquals(0, InstrumentExportParser.findHeaderRow(narrow));

    assertEquals(0, InstrumentExportParser.findHeaderRow(
        Collections.singletonList(Arrays.asList("", "", "", "", ""))));
  }

  @Test(expected = InputSchemaException.class)
  public void testEmptyExportIsRejected() throws Exception {
    parser.parseRows(new ArrayList<>());
  }
}
