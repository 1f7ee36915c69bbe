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
 * Mean, sample standard deviation and detection limit of the blank population for one channel or one element.
 * The standard deviation and detection limit are null when fewer than two blank observations were available; the
 * mean is null when there were none.
 */
public class BlankStatistic {
  public enum Scope {
    CHANNEL,
    ELEMENT,
  }

  private Scope scope;
  private String key;
  private Double mean;
  private Double standardDeviation;
  private Double detectionLimit;
  private Integer sampleCount;

  public BlankStatistic(Scope scope, String key, Double mean, Double standardDeviation, Double detectionLimit,
                        Integer sampleCount) {
    this.scope = scope;
    this.key = key;
    this.mean = mean;
    this.standardDeviation = standardDeviation;
    this.detectionLimit = detectionLimit;
    this.sampleCount = sampleCount;
  }

  public Scope getScope() {
    return scope;
  }

  /**
   * @return the channel id for CHANNEL scope, the element symbol for ELEMENT scope.
   */
  public String getKey() {
    return key;
  }

  public Double getMean() {
    return mean;
  }

  public Double getStandardDeviation() {
    return standardDeviation;
  }

  public Double getDetectionLimit() {
    return detectionLimit;
  }

  public Integer getSampleCount() {
    return sampleCount;
  }
}
