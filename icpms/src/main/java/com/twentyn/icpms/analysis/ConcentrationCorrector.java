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

import com.twentyn.icpms.model.BlankStatistic;
import com.twentyn.icpms.model.BlankStatisticsTable;
import com.twentyn.icpms.model.CorrectedMeasurement;
import com.twentyn.icpms.model.CorrectionResult;
import com.twentyn.icpms.model.DilutionFactor;
import com.twentyn.icpms.model.SampleMeasurement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies blank subtraction and dilution correction:
 * <pre>
 *   corrected = max(0, (raw - channel blank mean) * df [/ ppm divisor])
 * </pre>
 * Join defaults: a sample with no dilution factor uses the default factor; a channel with no blank mean uses 0.
 * Ordinary (non-QC) samples that fall back to the default factor are reported as unmatched.
 */
public class ConcentrationCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConcentrationCorrector.class);

  private static final Double DEFAULT_BLANK_MEAN = 0.0;

  private SampleClassifier classifier;
  private Double defaultDilutionFactor;
  private Double ppmDivisor;

  public ConcentrationCorrector(SampleClassifier classifier, Double defaultDilutionFactor, Double ppmDivisor) {
    this.classifier = classifier;
    this.defaultDilutionFactor = defaultDilutionFactor;
    this.ppmDivisor = ppmDivisor;
  }

  /**
   * @param measurements the long measurement table.
   * @param dilutionFactors per-sample dilution factors; sample ids must already be normalized.
   * @param blankStatistics channel-level blank means are read from here.
   * @param scaleToPpm divide by the ppm divisor after correction.
   */
  public CorrectionResult correct(List<SampleMeasurement> measurements, List<DilutionFactor> dilutionFactors,
                                  BlankStatisticsTable blankStatistics, boolean scaleToPpm) {
    Map<String, Double> sampleToFactor = new HashMap<>(dilutionFactors.size());
    for (DilutionFactor factor : dilutionFactors) {
      sampleToFactor.putIfAbsent(factor.getSampleId(), factor.getFactor());
    }

    List<CorrectedMeasurement> corrected = new ArrayList<>(measurements.size());
    Set<String> unmatched = new LinkedHashSet<>();
    for (SampleMeasurement m : measurements) {
      Double df = sampleToFactor.get(m.getSampleId());
      if (df == null) {
        df = defaultDilutionFactor;
        if (!classifier.classify(m.getSampleId()).isQualityControl()) {
          unmatched.add(m.getSampleId());
        }
      }

      BlankStatistic blank = blankStatistics.forChannel(m.getChannelId());
      Double blankMean = blank != null && blank.getMean() != null ? blank.getMean() : DEFAULT_BLANK_MEAN;

      corrected.add(new CorrectedMeasurement(m, df, blankMean, computeCorrected(
          m.getRawConcentration(), blankMean, df, scaleToPpm)));
    }

    if (!unmatched.isEmpty()) {
      LOGGER.warn("%d sample(s) not found in the dilution table, using df=%.1f: %s",
          unmatched.size(), defaultDilutionFactor, String.join(", ", unmatched));
    }
    LOGGER.info("Corrected %d measurements (%s output)", corrected.size(), scaleToPpm ? "ppm" : "ppb");
    return new CorrectionResult(corrected, new ArrayList<>(unmatched));
  }

  Double computeCorrected(Double raw, Double blankMean, Double dilutionFactor, boolean scaleToPpm) {
    if (raw == null) {
      return null;
    }
    double value = (raw - blankMean) * dilutionFactor;
    if (scaleToPpm) {
      value = value / ppmDivisor;
    }
    return value < 0.0 ? 0.0 : value;
  }
}
