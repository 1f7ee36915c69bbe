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
import com.twentyn.icpms.model.ChannelSelection;
import com.twentyn.icpms.model.ConcentrationPivotTable;
import com.twentyn.icpms.model.CorrectedMeasurement;
import com.twentyn.icpms.model.CorrectionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Pivots the long corrected table into one row per ordinary sample and one column per element.  Each element column
 * is filled from the channel chosen by QC selection, or from the lexicographically first channel of that element
 * when no channel could be selected.
 */
public class ConcentrationPivot {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConcentrationPivot.class);

  private SampleClassifier classifier;

  public ConcentrationPivot(SampleClassifier classifier) {
    this.classifier = classifier;
  }

  public ConcentrationPivotTable pivot(CorrectionResult correction, List<ChannelSelection> selections,
                                       BlankStatisticsTable blankStatistics) {
    List<CorrectedMeasurement> samples = new ArrayList<>();
    for (CorrectedMeasurement m : correction.getMeasurements()) {
      if (classifier.isOrdinarySample(m.getSampleId())) {
        samples.add(m);
      }
    }

    Map<String, String> elementChannels = chooseElementChannels(samples, selections);
    List<String> elements = new ArrayList<>(elementChannels.keySet());

    Map<String, Map<String, Double>> sampleToValues = new LinkedHashMap<>();
    for (CorrectedMeasurement m : samples) {
      Map<String, Double> values = sampleToValues.computeIfAbsent(m.getSampleId(), k -> new TreeMap<>());
      if (m.getChannelId().equals(elementChannels.get(m.getElement())) && !values.containsKey(m.getElement())) {
        // A re-run sample keeps its first acquisition.
        values.put(m.getElement(), m.getCorrectedValue());
      }
    }

    Set<String> unmatched = new HashSet<>(correction.getUnmatchedSamples());
    List<ConcentrationPivotTable.Row> rows = new ArrayList<>(sampleToValues.size());
    for (Map.Entry<String, Map<String, Double>> entry : sampleToValues.entrySet()) {
      Set<String> belowDetection = new TreeSet<>();
      for (Map.Entry<String, Double> value : entry.getValue().entrySet()) {
        BlankStatistic blank = blankStatistics.forElement(value.getKey());
        if (value.getValue() != null && blank != null && blank.getDetectionLimit() != null &&
            value.getValue() < blank.getDetectionLimit()) {
          belowDetection.add(value.getKey());
        }
      }
      rows.add(new ConcentrationPivotTable.Row(
          entry.getKey(), entry.getValue(), unmatched.contains(entry.getKey()), belowDetection));
    }

    LOGGER.info("Pivoted %d samples x %d elements", rows.size(), elements.size());
    return new ConcentrationPivotTable(elements, elementChannels, rows);
  }

  private Map<String, String> chooseElementChannels(List<CorrectedMeasurement> samples,
                                                    List<ChannelSelection> selections) {
    Map<String, String> selected = new HashMap<>();
    for (ChannelSelection selection : selections) {
      if (selection.hasSelection()) {
        selected.put(selection.getElement(), selection.getSelectedChannelId());
      }
    }

    Map<String, TreeSet<String>> elementToChannels = new TreeMap<>();
    for (CorrectedMeasurement m : samples) {
      elementToChannels.computeIfAbsent(m.getElement(), k -> new TreeSet<>()).add(m.getChannelId());
    }

    Map<String, String> elementChannels = new TreeMap<>();
    for (Map.Entry<String, TreeSet<String>> entry : elementToChannels.entrySet()) {
      String channel = selected.get(entry.getKey());
      if (channel == null || !entry.getValue().contains(channel)) {
        channel = entry.getValue().first();
      }
      elementChannels.put(entry.getKey(), channel);
    }
    return elementChannels;
  }
}
