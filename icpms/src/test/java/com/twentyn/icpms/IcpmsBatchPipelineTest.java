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

package com.twentyn.icpms;

import com.twentyn.icpms.model.BatchSummary;
import com.twentyn.icpms.model.BelowDetectionRecord;
import com.twentyn.icpms.model.BlankStatistic;
import com.twentyn.icpms.model.ChannelSelection;
import com.twentyn.icpms.model.ConcentrationPivotTable;
import com.twentyn.icpms.model.CorrectedMeasurement;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class IcpmsBatchPipelineTest {

  private static final double DELTA = 1e-6;

  private BatchResult result;

  private File resource(String name) throws Exception {
    return new File(getClass().getResource(name).toURI());
  }

  private BatchResult process(boolean scaleToPpm) throws Exception {
    return new IcpmsBatchProcessor(new QcConfiguration()).process(resource("/sort.csv"), resource("/digest.csv"),
        resource("/icv.csv"), resource("/reference_long.csv"), null, scaleToPpm);
  }

  @Before
  public void setUp() throws Exception {
    result = process(false);
  }

  private Map<String, Double> correctedFor(String sampleId) {
    Map<String, Double> channelToValue = new HashMap<>();
    for (CorrectedMeasurement m : result.getCorrection().getMeasurements()) {
      if (m.getSampleId().equals(sampleId)) {
        channelToValue.put(m.getChannelId(), m.getCorrectedValue());
      }
    }
    return channelToValue;
  }

  @Test
  public void testHeadersAndReshaping() {
    assertEquals(3, result.getChannels().size());
    assertEquals(Collections.singletonList("Comment"), result.getSkippedHeaders());
    assertEquals("Six samples times three channels, unit row dropped", 18, result.getMeasurements().size());
  }

  @Test
  public void testBlankStatistics() {
    assertEquals(2.0, result.getBlankStatistics().forChannel("As75_He").getMean(), DELTA);
    assertEquals(1.0, result.getBlankStatistics().forChannel("As75to91_O2").getMean(), DELTA);
    assertEquals(3.0, result.getBlankStatistics().forChannel("Cu63_He").getMean(), DELTA);

    BlankStatistic as = result.getBlankStatistics().forElement("As");
    assertEquals(1.5, as.getMean(), DELTA);
    assertEquals(3.0 * Math.sqrt(3.5 / 3.0), as.getDetectionLimit(), DELTA);
  }

  @Test
  public void testCorrectedValues() {
    Map<String, Double> a = correctedFor("SAMPLE_A");
    assertEquals(20.0, a.get("As75_He"), DELTA);
    assertEquals(20.0, a.get("As75to91_O2"), DELTA);
    assertEquals(20.0, a.get("Cu63_He"), DELTA);

    Map<String, Double> b = correctedFor("SAMPLE_B");
    assertEquals(0.1, b.get("As75_He"), DELTA);
    assertNull(b.get("As75to91_O2"));
    assertEquals("Negative values are clamped", 0.0, b.get("Cu63_He"), 0.0);

    assertEquals(Collections.singletonList("SAMPLE_B"), result.getCorrection().getUnmatchedSamples());
  }

  @Test
  public void testScaleToPpm() throws Exception {
    result = process(true);
    assertEquals(0.02, correctedFor("SAMPLE_A").get("As75to91_O2"), DELTA);
  }

  @Test
  public void testChannelSelection() {
    List<ChannelSelection> selections = result.getSelections();
    assertEquals(2, selections.size());

    ChannelSelection as = selections.get(0);
    assertEquals("As", as.getElement());
    assertEquals("As75to91_O2", as.getSelectedChannelId());
    assertEquals(98.0, as.getCalibrationRecovery(), DELTA);
    assertEquals(101.0, as.getReferenceRecovery(), DELTA);
    assertEquals(ChannelSelection.Outcome.PASSED_BOTH_BANDS, as.getOutcome());

    ChannelSelection cu = selections.get(1);
    assertEquals("Cu63_He", cu.getSelectedChannelId());
    assertEquals(100.0, cu.getCalibrationRecovery(), DELTA);
    assertEquals(100.0, cu.getReferenceRecovery(), DELTA);
  }

  @Test
  public void testBelowDetection() {
    List<BelowDetectionRecord> records = result.getBelowDetection();
    assertEquals(8, records.size());
    int blanks = 0;
    for (BelowDetectionRecord record : records) {
      assertFalse(record.getSampleId().equals("SAMPLE_A"));
      if (record.getSampleId().startsWith("BLANK")) {
        blanks++;
      }
    }
    assertEquals(6, blanks);
  }

  @Test
  public void testPivotAndSummary() {
    ConcentrationPivotTable pivot = result.getPivot();
    assertEquals(2, pivot.getRows().size());
    ConcentrationPivotTable.Row b = pivot.getRows().get(1);
    assertEquals("SAMPLE_B", b.getSampleId());
    assertTrue(b.isUnmatched());
    assertNull(b.getValue("As"));
    assertEquals(Collections.singleton("Cu"), b.getBelowDetectionElements());

    BatchSummary summary = result.getSummary();
    assertEquals(Integer.valueOf(2), summary.getTotalSamples());
    assertEquals(Integer.valueOf(1), summary.getTotalCalibrationVerification());
    assertEquals(Integer.valueOf(1), summary.getTotalReference());
    assertEquals(Integer.valueOf(2), summary.getTotalBlanks());
    assertEquals(100.0, summary.getCalibrationPassRate(), DELTA);
    assertEquals(100.0, summary.getReferencePassRate(), DELTA);
    assertEquals(Integer.valueOf(2), summary.getElementsAnalyzed());
  }
}
