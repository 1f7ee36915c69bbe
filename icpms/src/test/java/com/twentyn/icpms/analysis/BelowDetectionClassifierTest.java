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

import com.twentyn.icpms.model.BelowDetectionRecord;
import com.twentyn.icpms.model.BlankStatistic;
import com.twentyn.icpms.model.BlankStatisticsTable;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.twentyn.icpms.analysis.MeasurementFixtures.AS_HE;
import static com.twentyn.icpms.analysis.MeasurementFixtures.AS_O2;
import static com.twentyn.icpms.analysis.MeasurementFixtures.CU_HE;
import static com.twentyn.icpms.analysis.MeasurementFixtures.measurement;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BelowDetectionClassifierTest {

  private static BlankStatistic elementBlank(String element, Double mean, Double detectionLimit) {
    return new BlankStatistic(BlankStatistic.Scope.ELEMENT, element, mean, null, detectionLimit, 2);
  }

  @Test
  public void testStrictComparison() {
    BlankStatistic blank = elementBlank("As", 1.0, 3.0);
    assertFalse("Exactly at the limit is not below it", BelowDetectionClassifier.isBelowDetection(4.0, blank));
    assertTrue(BelowDetectionClassifier.isBelowDetection(4.0 - 1e-9, blank));
    assertFalse(BelowDetectionClassifier.isBelowDetection(null, blank));
  }

  @Test
  public void testUndefinedDetectionLimitNeverFlags() {
    assertFalse(BelowDetectionClassifier.isBelowDetection(0.0, elementBlank("As", 1.0, null)));
    assertFalse(BelowDetectionClassifier.isBelowDetection(0.0, elementBlank("As", null, 1.0)));
    assertFalse(BelowDetectionClassifier.isBelowDetection(0.0, null));
  }

  @Test
  public void testClassifyUsesElementStatistics() {
    Map<String, BlankStatistic> byElement = new HashMap<>();
    byElement.put("As", elementBlank("As", 1.5, 3.0));
    BlankStatisticsTable table = new BlankStatisticsTable(new HashMap<>(), byElement);

    List<BelowDetectionRecord> records = new BelowDetectionClassifier().classify(Arrays.asList(
        measurement("SAMPLE_A", AS_HE, 2.0),
        measurement("SAMPLE_A", AS_O2, 12.0),
        measurement("SAMPLE_A", CU_HE, 0.0)), table);

    assertEquals(1, records.size());
    BelowDetectionRecord record = records.get(0);
    assertEquals("SAMPLE_A", record.getSampleId());
    assertEquals("As75_He", record.getChannelId());
    assertEquals(1.5, record.getBlankMean(), 0.0);
    assertEquals(3.0, record.getDetectionLimit(), 0.0);
  }
}
