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

/**
 * Percent recovery of one QC measurement against its known target.  Target and recovery are null when no target
 * could be resolved (or the measurement itself was missing); a null recovery never counts as passing.
 */
public class RecoveryRecord {
  public enum Kind {
    CALIBRATION_VERIFICATION,
    REFERENCE_MATERIAL,
  }

  private Kind kind;
  private String sampleId;
  private String channelId;
  private String element;
  private String referenceName;
  private Double correctedValue;
  private Double targetValue;
  private Double recoveryPercent;

  public RecoveryRecord(Kind kind, String sampleId, String channelId, String element, String referenceName,
                        Double correctedValue, Double targetValue, Double recoveryPercent) {
    this.kind = kind;
    this.sampleId = sampleId;
    this.channelId = channelId;
    this.element = element;
    this.referenceName = referenceName;
    this.correctedValue = correctedValue;
    this.targetValue = targetValue;
    this.recoveryPercent = recoveryPercent;
  }

  public Kind getKind() {
    return kind;
  }

  public String getSampleId() {
    return sampleId;
  }

  public String getChannelId() {
    return channelId;
  }

  public String getElement() {
    return element;
  }

  // Only set for reference-material rows whose name could be resolved.
  public String getReferenceName() {
    return referenceName;
  }

  public Double getCorrectedValue() {
    return correctedValue;
  }

  public Double getTargetValue() {
    return targetValue;
  }

  public Double getRecoveryPercent() {
    return recoveryPercent;
  }
}
