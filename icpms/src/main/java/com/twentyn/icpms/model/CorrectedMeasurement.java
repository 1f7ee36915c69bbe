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

public class CorrectedMeasurement {
  private SampleMeasurement measurement;
  private Double dilutionFactorUsed;
  private Double blankMeanUsed;
  // Null only when the raw concentration was missing; never negative otherwise.
  private Double correctedValue;

  public CorrectedMeasurement(SampleMeasurement measurement, Double dilutionFactorUsed, Double blankMeanUsed,
                              Double correctedValue) {
    this.measurement = measurement;
    this.dilutionFactorUsed = dilutionFactorUsed;
    this.blankMeanUsed = blankMeanUsed;
    this.correctedValue = correctedValue;
  }

  public SampleMeasurement getMeasurement() {
    return measurement;
  }

  public String getSampleId() {
    return measurement.getSampleId();
  }

  public String getAcqTime() {
    return measurement.getAcqTime();
  }

  public String getChannelId() {
    return measurement.getChannelId();
  }

  public String getElement() {
    return measurement.getElement();
  }

  public Double getRawConcentration() {
    return measurement.getRawConcentration();
  }

  public Double getDilutionFactorUsed() {
    return dilutionFactorUsed;
  }

  public Double getBlankMeanUsed() {
    return blankMeanUsed;
  }

  public Double getCorrectedValue() {
    return correctedValue;
  }
}
