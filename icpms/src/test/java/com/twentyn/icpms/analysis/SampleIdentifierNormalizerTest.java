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

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class SampleIdentifierNormalizerTest {

  @Test
  public void testNormalize() {
    assertEquals("SAMPLE_A", SampleIdentifierNormalizer.normalize("  Sample A "));
    assertEquals("SRM_DOLT-5_1", SampleIdentifierNormalizer.normalize("srm_dolt-5_1"));
    assertEquals("BLANK__2", SampleIdentifierNormalizer.normalize("blank  2"));
  }

  @Test
  public void testMissingInputBecomesEmpty() {
    assertEquals("", SampleIdentifierNormalizer.normalize(null));
    assertEquals("", SampleIdentifierNormalizer.normalize(""));
    assertEquals("", SampleIdentifierNormalizer.normalize("   "));
  }

  @Test
  public void testNormalizeIsIdempotent() {
    List<String> testCases = Arrays.asList(
        "Sample A", " icv 1", "SRM_NIST_2710_1", "blank\t3", "x y  z ", "ÄÖ 7", "", "ALREADY_NORMAL"
    );
    for (String testCase : testCases) {
      String once = SampleIdentifierNormalizer.normalize(testCase);
      assertEquals(String.format("Normalizing '%s' twice matches normalizing once", testCase),
          once, SampleIdentifierNormalizer.normalize(once));
    }
  }
}
