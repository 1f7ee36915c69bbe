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
import com.twentyn.icpms.model.SampleMeasurement;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Computes blank mean, sample standard deviation and detection limit (multiplier x SD) per channel and per element.
 * Only measurements whose sample id carries the blank marker contribute, and missing values are ignored.
 */
public class BlankStatisticsCalculator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BlankStatisticsCalculator.class);

  private SampleClassifier classifier;
  private Double detectionLimitMultiplier;

  public BlankStatisticsCalculator(SampleClassifier classifier, Double detectionLimitMultiplier) {
    this.classifier = classifier;
    this.detectionLimitMultiplier = detectionLimitMultiplier;
  }

  public BlankStatisticsTable compute(Iterable<SampleMeasurement> measurements) {
    Map<String, DescriptiveStatistics> channelStats = new TreeMap<>();
    Map<String, DescriptiveStatistics> elementStats = new TreeMap<>();

    int blankRows = 0;
    for (SampleMeasurement m : measurements) {
      if (!classifier.isBlank(m.getSampleId())) {
        continue;
      }
      blankRows++;
      // Register the key even for missing values so the channel still shows up with a zero count.
      DescriptiveStatistics channel = channelStats.computeIfAbsent(m.getChannelId(), k -> new DescriptiveStatistics());
      DescriptiveStatistics element = elementStats.computeIfAbsent(m.getElement(), k -> new DescriptiveStatistics());
      if (m.hasRawConcentration()) {
        channel.addValue(m.getRawConcentration());
        element.addValue(m.getRawConcentration());
      }
    }

    BlankStatisticsTable table = new BlankStatisticsTable(
        summarize(channelStats, k -> makeStatistic(BlankStatistic.Scope.CHANNEL, k, channelStats.get(k))),
        summarize(elementStats, k -> makeStatistic(BlankStatistic.Scope.ELEMENT, k, elementStats.get(k)))
    );
    LOGGER.info("Computed blank statistics from %d blank measurements: %d channels, %d elements",
        blankRows, channelStats.size(), elementStats.size());
    return table;
  }

  private Map<String, BlankStatistic> summarize(Map<String, DescriptiveStatistics> stats,
                                                Function<String, BlankStatistic> maker) {
    Map<String, BlankStatistic> results = new TreeMap<>();
    for (String key : stats.keySet()) {
      results.put(key, maker.apply(key));
    }
    return results;
  }

  BlankStatistic makeStatistic(BlankStatistic.Scope scope, String key, DescriptiveStatistics stats) {
    int n = (int) stats.getN();
    Double mean = n > 0 ? stats.getMean() : null;
    // DescriptiveStatistics reports 0 for a single value; an SD from fewer than two blanks is undefined instead.
    Double sd = n > 1 ? stats.getStandardDeviation() : null;
    Double detectionLimit = sd != null ? detectionLimitMultiplier * sd : null;
    if (sd == null) {
      LOGGER.warn("Only %d blank observation(s) for %s %s: no detection limit", n, scope.name().toLowerCase(), key);
    }
    return new BlankStatistic(scope, key, mean, sd, detectionLimit, n);
  }
}
