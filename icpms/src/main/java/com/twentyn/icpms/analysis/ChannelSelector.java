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
import com.twentyn.icpms.model.ChannelSelection;
import com.twentyn.icpms.model.RecoveryRecord;
import com.twentyn.icpms.model.RecoveryResult;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Picks one authoritative channel per element from its QC recoveries.
 *
 * A channel passes calibration when its ICV recovery is within [calibrationLow, calibrationHigh] and passes
 * reference when its reference recovery is within [referenceLow, referenceHigh], both inclusive.  The first channel
 * (by channel id) passing both is selected; failing that, the channel whose reference recovery is closest to 100%
 * (ties again broken by channel id).  Replicate QC rows of one channel are averaged over their defined recoveries.
 */
public class ChannelSelector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ChannelSelector.class);

  private static final Double PERFECT_RECOVERY = 100.0;

  private Double calibrationLow;
  private Double calibrationHigh;
  private Double referenceLow;
  private Double referenceHigh;

  public ChannelSelector(Double calibrationLow, Double calibrationHigh, Double referenceLow, Double referenceHigh) {
    this.calibrationLow = calibrationLow;
    this.calibrationHigh = calibrationHigh;
    this.referenceLow = referenceLow;
    this.referenceHigh = referenceHigh;
  }

  // QC evidence for one channel: the outer join of its calibration and reference recoveries.
  static class ChannelRecoveries {
    private String channelId;
    private SummaryStatistics calibration = new SummaryStatistics();
    private SummaryStatistics reference = new SummaryStatistics();

    ChannelRecoveries(String channelId) {
      this.channelId = channelId;
    }

    void add(RecoveryRecord record) {
      if (record.getRecoveryPercent() == null) {
        return;
      }
      if (record.getKind() == RecoveryRecord.Kind.CALIBRATION_VERIFICATION) {
        calibration.addValue(record.getRecoveryPercent());
      } else {
        reference.addValue(record.getRecoveryPercent());
      }
    }

    String getChannelId() {
      return channelId;
    }

    Double getCalibrationRecovery() {
      return calibration.getN() > 0 ? calibration.getMean() : null;
    }

    Double getReferenceRecovery() {
      return reference.getN() > 0 ? reference.getMean() : null;
    }
  }

  public List<ChannelSelection> select(List<ChannelDescriptor> channels, RecoveryResult recoveries) {
    // Elements in the order their first channel appears in the export.
    Set<String> elements = new LinkedHashSet<>();
    for (ChannelDescriptor channel : channels) {
      elements.add(channel.getElement());
    }

    Map<String, Map<String, ChannelRecoveries>> elementToChannels = new LinkedHashMap<>();
    List<RecoveryRecord> allRecords = new ArrayList<>(recoveries.getCalibrationRecoveries());
    allRecords.addAll(recoveries.getReferenceRecoveries());
    for (RecoveryRecord record : allRecords) {
      elementToChannels
          .computeIfAbsent(record.getElement(), k -> new TreeMap<>())
          .computeIfAbsent(record.getChannelId(), ChannelRecoveries::new)
          .add(record);
    }

    List<ChannelSelection> selections = new ArrayList<>(elements.size());
    for (String element : elements) {
      Map<String, ChannelRecoveries> candidates = elementToChannels.get(element);
      ChannelSelection selection = candidates == null ?
          ChannelSelection.unselected(element, ChannelSelection.Outcome.NO_QC_DATA) :
          selectForElement(element, new ArrayList<>(candidates.values()));
      LOGGER.debug("Element %s: %s (%s)", element, selection.getSelectedChannelId(), selection.getOutcome());
      selections.add(selection);
    }

    long selected = selections.stream().filter(ChannelSelection::hasSelection).count();
    LOGGER.info("Selected channels for %d of %d elements", selected, selections.size());
    return selections;
  }

  /**
   * @param candidates the element's channels, sorted by channel id.
   */
  ChannelSelection selectForElement(String element, List<ChannelRecoveries> candidates) {
    for (ChannelRecoveries candidate : candidates) {
      if (passesCalibration(candidate.getCalibrationRecovery()) && passesReference(candidate.getReferenceRecovery())) {
        return makeSelection(element, candidate, ChannelSelection.Outcome.PASSED_BOTH_BANDS);
      }
    }

    ChannelRecoveries closest = candidates.stream()
        .filter(c -> c.getReferenceRecovery() != null)
        .min(Comparator.<ChannelRecoveries>comparingDouble(c -> Math.abs(c.getReferenceRecovery() - PERFECT_RECOVERY))
            .thenComparing(ChannelRecoveries::getChannelId))
        .orElse(null);
    if (closest == null) {
      LOGGER.warn("No channel of element %s has a reference recovery; no channel selected", element);
      return ChannelSelection.unselected(element, ChannelSelection.Outcome.NO_REFERENCE_RECOVERY);
    }
    return makeSelection(element, closest, ChannelSelection.Outcome.CLOSEST_REFERENCE_RECOVERY);
  }

  private ChannelSelection makeSelection(String element, ChannelRecoveries chosen, ChannelSelection.Outcome outcome) {
    Double calibration = chosen.getCalibrationRecovery();
    Double reference = chosen.getReferenceRecovery();
    return new ChannelSelection(element, chosen.getChannelId(), calibration, passesCalibration(calibration),
        reference, passesReference(reference), outcome);
  }

  public boolean passesCalibration(Double recovery) {
    return recovery != null && recovery >= calibrationLow && recovery <= calibrationHigh;
  }

  public boolean passesReference(Double recovery) {
    return recovery != null && recovery >= referenceLow && recovery <= referenceHigh;
  }
}
