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

/**
 * The authoritative channel chosen for one element, with the QC evidence behind the choice.
 */
public class ChannelSelection {
  public enum Outcome {
    // At least one channel passed both the calibration and reference bands.
    PASSED_BOTH_BANDS,
    // No channel passed both; the one with reference recovery nearest 100% was taken.
    CLOSEST_REFERENCE_RECOVERY,
    // QC rows exist but none carries a reference recovery, so nothing can be chosen.
    NO_REFERENCE_RECOVERY,
    // The element has no calibration or reference rows at all.
    NO_QC_DATA,
  }

  @JsonProperty("element")
  private String element;

  @JsonProperty("selected_channel_id")
  private String selectedChannelId;

  @JsonProperty("icv_recovery_pct")
  private Double calibrationRecovery;

  @JsonProperty("icv_pass")
  private boolean calibrationPass;

  @JsonProperty("ref_recovery_pct")
  private Double referenceRecovery;

  @JsonProperty("ref_pass")
  private boolean referencePass;

  @JsonProperty("outcome")
  private Outcome outcome;

  public ChannelSelection(String element, String selectedChannelId, Double calibrationRecovery,
                          boolean calibrationPass, Double referenceRecovery, boolean referencePass, Outcome outcome) {
    this.element = element;
    this.selectedChannelId = selectedChannelId;
    this.calibrationRecovery = calibrationRecovery;
    this.calibrationPass = calibrationPass;
    this.referenceRecovery = referenceRecovery;
    this.referencePass = referencePass;
    this.outcome = outcome;
  }

  public static ChannelSelection unselected(String element, Outcome outcome) {
    return new ChannelSelection(element, null, null, false, null, false, outcome);
  }

  public String getElement() {
    return element;
  }

  public String getSelectedChannelId() {
    return selectedChannelId;
  }

  public boolean hasSelection() {
    return selectedChannelId != null;
  }

  public Double getCalibrationRecovery() {
    return calibrationRecovery;
  }

  public boolean isCalibrationPass() {
    return calibrationPass;
  }

  public Double getReferenceRecovery() {
    return referenceRecovery;
  }

  public boolean isReferencePass() {
    return referencePass;
  }

  public Outcome getOutcome() {
    return outcome;
  }
}
