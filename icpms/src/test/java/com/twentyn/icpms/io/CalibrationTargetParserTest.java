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

import com.twentyn.icpms.model.CalibrationTarget;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class CalibrationTargetParserTest {

  private static TableParser table(String csv) throws Exception {
    TableParser tableParser = new TableParser();
    tableParser.parse(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)), TableParser.CSV_FORMAT);
    return tableParser;
  }

  @Test
  public void testParseFixture() throws Exception {
    List<CalibrationTarget> targets =
        new CalibrationTargetParser().parse(new File(getClass().getResource("/icv.csv").toURI()));
    assertEquals(2, targets.size());
    assertEquals("As", targets.get(0).getElement());
    assertEquals(100.0, targets.get(0).getCalibrationTarget(), 0.0);
    assertNull(targets.get(0).getReferenceTarget());
    assertEquals(50.0, targets.get(1).getCalibrationTarget(), 0.0);
  }

  @Test
  public void testAlternateColumnNames() throws Exception {
    List<CalibrationTarget> targets = new CalibrationTargetParser().parseTable(table(
        "Element,Calibration_Target,SRM_Target\nPb, 10 ,12.5\nCd,n/a,\n,1,1\n"));
    assertEquals(2, targets.size());
    assertEquals("Pb", targets.get(0).getElement());
    assertEquals(10.0, targets.get(0).getCalibrationTarget(), 0.0);
    assertEquals(12.5, targets.get(0).getReferenceTarget(), 0.0);
    assertNull("Unusable targets are kept as undefined", targets.get(1).getCalibrationTarget());
    assertNull(targets.get(1).getReferenceTarget());
  }

  @Test
  public void testMissingTargetColumnIsFatal() throws Exception {
    try {
      new CalibrationTargetParser().parseTable(table("element,ref_target\nAs,40\n"));
      fail("Expected an InputSchemaException");
    } catch (InputSchemaException e) {
      assertEquals(Collections.singletonList("icv_target"), e.getMissingColumns());
    }
  }
}
