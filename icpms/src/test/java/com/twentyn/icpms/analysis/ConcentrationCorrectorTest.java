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

import com.twentyn.icpms.QcConfiguration;
import com.twentyn.icpms.model.BlankStatistic;
import com.twentyn.icpms.model.BlankStatisticsTable;
import com.twentyn.icpms.model.CorrectedMeasurement;
import com.twentyn.icpms.model.CorrectionResult;
import com.twentyn.icpms.model.DilutionFactor;
import com.twentyn.icpms.model.SampleMeasurement;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.twentyn.icpms.analysis.MeasurementFixtures.AS_HE;
import static com.twentyn.icpms.analysis.MeasurementFixtures.CU_HE;
import static com.twentyn.icpms.analysis.MeasurementFixtures.measurement;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ConcentrationCorrectorTest {

  private static final double DELTA = 1e-9;

  private ConcentrationCorrector corrector;
  private BlankStatisticsTable blanks;

  @Before
  public void setUp() {
    corrector = new ConcentrationCorrector(new SampleClassifier(new QcConfiguration()), 1.0, 1000.0);

    Map<String, BlankStatistic> byChannel = new HashMap<>();
    byChannel.put("As75_He", new BlankStatistic(BlankStatistic.Scope.CHANNEL, "As75_He", 5.0, 1.0, 3.0, 2));
    blanks = new BlankStatisticsTable(byChannel, new HashMap<>());
  }

  @Test
  public void testBlankSubtractionAndDilution() {
    CorrectionResult result = corrector.correct(
        Collections.singletonList(measurement("SAMPLE_A", AS_HE, 105.0)),
        Collections.singletonList(new DilutionFactor("SAMPLE_A", 2.0)),
        blanks, false);

    CorrectedMeasurement m = result.getMeasurements().get(0);
    assertEquals("Corrected value is (raw - blank) * df", 200.0, m.getCorrectedValue(), DELTA);
    assertEquals(2.0, m.getDilutionFactorUsed(), DELTA);
    assertEquals(5.0, m.getBlankMeanUsed(), DELTA);
    assertTrue(result.getUnmatchedSamples().isEmpty());
  }

  @Test
  public void testScaleToPpm() {
    CorrectionResult result = corrector.correct(
        Collections.singletonList(measurement("SAMPLE_A", AS_HE, 105.0)),
        Collections.singletonList(new DilutionFactor("SAMPLE_A", 2.0)),
        blanks, true);
    assertEquals(0.2, result.getMeasurements().get(0).getCorrectedValue(), DELTA);
  }

  @Test
  public void testNegativeValuesAreClampedToZero() {
    CorrectionResult result = corrector.correct(
        Arrays.asList(measurement("SAMPLE_A", AS_HE, 1.0), measurement("SAMPLE_A", AS_HE, -3.0)),
        Collections.singletonList(new DilutionFactor("SAMPLE_A", 10.0)),
        blanks, false);
    for (CorrectedMeasurement m : result.getMeasurements()) {
      assertEquals(0.0, m.getCorrectedValue(), 0.0);
    }
  }

  @Test
  public void testMissingRawStaysMissing() {
    CorrectionResult result = corrector.correct(
        Collections.singletonList(measurement("SAMPLE_A", AS_HE, null)),
        Collections.singletonList(new DilutionFactor("SAMPLE_A", 2.0)),
        blanks, false);
    assertNull(result.getMeasurements().get(0).getCorrectedValue());
  }

  @Test
  public void testDefaultsForMissingDilutionFactorAndBlank() {
    List<SampleMeasurement> measurements = Arrays.asList(
        measurement("SAMPLE_B", CU_HE, 7.0),
        measurement("SAMPLE_B", AS_HE, 8.0),
        measurement("ICV_1", CU_HE, 50.0),
        measurement("BLANK_1", CU_HE, 0.1));

    CorrectionResult result = corrector.correct(measurements, Collections.<DilutionFactor>emptyList(), blanks, false);

    CorrectedMeasurement cu = result.getMeasurements().get(0);
    assertEquals("No blank mean for the channel means nothing is subtracted", 7.0, cu.getCorrectedValue(), DELTA);
    assertEquals(0.0, cu.getBlankMeanUsed(), 0.0);
    assertEquals(1.0, cu.getDilutionFactorUsed(), 0.0);
    assertEquals(3.0, result.getMeasurements().get(1).getCorrectedValue(), DELTA);

    assertEquals("Only ordinary samples are reported as unmatched, once each",
        Collections.singletonList("SAMPLE_B"), result.getUnmatchedSamples());
  }

  @Test
  public void testFirstDilutionFactorWins() {
    CorrectionResult result = corrector.correct(
        Collections.singletonList(measurement("SAMPLE_A", CU_HE, 1.0)),
        Arrays.asList(new DilutionFactor("SAMPLE_A", 4.0), new DilutionFactor("SAMPLE_A", 8.0)),
        blanks, false);
    assertEquals(4.0, result.getMeasurements().get(0).getDilutionFactorUsed(), 0.0);
  }
}
