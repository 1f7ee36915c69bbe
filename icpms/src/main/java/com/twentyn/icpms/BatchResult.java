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
import com.twentyn.icpms.model.BlankStatisticsTable;
import com.twentyn.icpms.model.ChannelDescriptor;
import com.twentyn.icpms.model.ChannelSelection;
import com.twentyn.icpms.model.ConcentrationPivotTable;
import com.twentyn.icpms.model.CorrectionResult;
import com.twentyn.icpms.model.RecoveryResult;
import com.twentyn.icpms.model.SampleMeasurement;

import java.util.Collections;
import java.util.List;

/**
 * Every table produced by one run of {@link IcpmsBatchPipeline}, ready for a report writer.
 */
public class BatchResult {
  private List<ChannelDescriptor> channels;
  private List<String> skippedHeaders;
  private List<SampleMeasurement> measurements;
  private BlankStatisticsTable blankStatistics;
  private CorrectionResult correction;
  private RecoveryResult recoveries;
  private List<ChannelSelection> selections;
  private List<BelowDetectionRecord> belowDetection;
  private ConcentrationPivotTable pivot;
  private BatchSummary summary;

  public BatchResult(List<ChannelDescriptor> channels, List<String> skippedHeaders,
                     List<SampleMeasurement> measurements, BlankStatisticsTable blankStatistics,
                     CorrectionResult correction, RecoveryResult recoveries, List<ChannelSelection> selections,
                     List<BelowDetectionRecord> belowDetection, ConcentrationPivotTable pivot, BatchSummary summary) {
    this.channels = Collections.unmodifiableList(channels);
    this.skippedHeaders = Collections.unmodifiableList(skippedHeaders);
    this.measurements = Collections.unmodifiableList(measurements);
    this.blankStatistics = blankStatistics;
    this.correction = correction;
    this.recoveries = recoveries;
    this.selections = Collections.unmodifiableList(selections);
    this.belowDetection = Collections.unmodifiableList(belowDetection);
    this.pivot = pivot;
    this.summary = summary;
  }

  public List<ChannelDescriptor> getChannels() {
    return channels;
  }

  public List<String> getSkippedHeaders() {
    return skippedHeaders;
  }

  public List<SampleMeasurement> getMeasurements() {
    return measurements;
  }

  public BlankStatisticsTable getBlankStatistics() {
    return blankStatistics;
  }

  public CorrectionResult getCorrection() {
    return correction;
  }

  public RecoveryResult getRecoveries() {
    return recoveries;
  }

  public List<ChannelSelection> getSelections() {
    return selections;
  }

  public List<BelowDetectionRecord> getBelowDetection() {
    return belowDetection;
  }

  public ConcentrationPivotTable getPivot() {
    return pivot;
  }

  public BatchSummary getSummary() {
    return summary;
  }
}
