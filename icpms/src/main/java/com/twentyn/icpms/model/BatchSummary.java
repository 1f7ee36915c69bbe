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

package com.twentyn.icpms.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Run-level counts and pass rates, as shown to the operator once a batch completes.
 */
public class BatchSummary {
  @JsonProperty("unmatched_samples")
  private List<String> unmatchedSamples;

  @JsonProperty("skipped_headers")
  private List<String> skippedHeaders;

  @JsonProperty("total_samples")
  private Integer totalSamples;

  @JsonProperty("total_icv")
  private Integer totalCalibrationVerification;

  @JsonProperty("total_ref")
  private Integer totalReference;

  @JsonProperty("total_blanks")
  private Integer totalBlanks;

  @JsonProperty("icv_pass_rate")
  private Double calibrationPassRate;

  @JsonProperty("ref_pass_rate")
  private Double referencePassRate;

  @JsonProperty("elements_analyzed")
  private Integer elementsAnalyzed;

  public BatchSummary(List<String> unmatchedSamples, List<String> skippedHeaders, Integer totalSamples,
                      Integer totalCalibrationVerification, Integer totalReference, Integer totalBlanks,
                      Double calibrationPassRate, Double referencePassRate, Integer elementsAnalyzed) {
    this.unmatchedSamples = unmatchedSamples;
    this.skippedHeaders = skippedHeaders;
    this.totalSamples = totalSamples;
    this.totalCalibrationVerification = totalCalibrationVerification;
    this.totalReference = totalReference;
    this.totalBlanks = totalBlanks;
    this.calibrationPassRate = calibrationPassRate;
    this.referencePassRate = referencePassRate;
    this.elementsAnalyzed = elementsAnalyzed;
  }

  public List<String> getUnmatchedSamples() {
    return unmatchedSamples;
  }

  public List<String> getSkippedHeaders() {
    return skippedHeaders;
  }

  public Integer getTotalSamples() {
    return totalSamples;
  }

  public Integer getTotalCalibrationVerification() {
    return totalCalibrationVerification;
  }

  public Integer getTotalReference() {
    return totalReference;
  }

  public Integer getTotalBlanks() {
    return totalBlanks;
  }

  // Percent of analyzed elements whose selected channel passed the calibration band.
  public Double getCalibrationPassRate() {
    return calibrationPassRate;
  }

  public Double getReferencePassRate() {
    return referencePassRate;
  }

  public Integer getElementsAnalyzed() {
    return elementsAnalyzed;
  }
}
