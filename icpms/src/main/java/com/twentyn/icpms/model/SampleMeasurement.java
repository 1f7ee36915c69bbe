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
 * One sample x channel cell of the instrument export, in long form.  A null raw concentration means the cell was
 * missing or non-numeric.
 */
public class SampleMeasurement {
  private String sampleId;
  private String acqTime;
  private ChannelDescriptor channel;
  private Double rawConcentration;

  public SampleMeasurement(String sampleId, String acqTime, ChannelDescriptor channel, Double rawConcentration) {
    this.sampleId = sampleId;
    this.acqTime = acqTime;
    this.channel = channel;
    this.rawConcentration = rawConcentration;
  }

  public String getSampleId() {
    return sampleId;
  }

  public String getAcqTime() {
    return acqTime;
  }

  public ChannelDescriptor getChannel() {
    return channel;
  }

  public String getChannelId() {
    return channel.getChannelId();
  }

  public String getElement() {
    return channel.getElement();
  }

  public Double getRawConcentration() {
    return rawConcentration;
  }

  public boolean hasRawConcentration() {
    return rawConcentration != null;
  }
}
