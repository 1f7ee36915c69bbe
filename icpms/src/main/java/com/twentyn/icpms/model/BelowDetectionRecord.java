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

public class BelowDetectionRecord {
  private String sampleId;
  private String element;
  private String channelId;
  private Double rawConcentration;
  private Double blankMean;
  private Double detectionLimit;

  public BelowDetectionRecord(String sampleId, String element, String channelId, Double rawConcentration,
                              Double blankMean, Double detectionLimit) {
    this.sampleId = sampleId;
    this.element = element;
    this.channelId = channelId;
    this.rawConcentration = rawConcentration;
    this.blankMean = blankMean;
    this.detectionLimit = detectionLimit;
  }

  public String getSampleId() {
    return sampleId;
  }

  public String getElement() {
    return element;
  }

  public String getChannelId() {
    return channelId;
  }

  public Double getRawConcentration() {
    return rawConcentration;
  }

  public Double getBlankMean() {
    return blankMean;
  }

  public Double getDetectionLimit() {
    return detectionLimit;
  }
}
