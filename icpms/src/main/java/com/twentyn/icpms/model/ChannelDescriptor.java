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

import java.util.Objects;

/**
 * One acquisition channel of the instrument export: a (mass, element, gas mode) combination, optionally mass-shifted.
 * The channel id is derived from the header alone, so the same header always maps to the same id.
 */
public class ChannelDescriptor {
  @JsonProperty("original_header")
  private String originalHeader;

  @JsonProperty("channel_id")
  private String channelId;

  @JsonProperty("element")
  private String element;

  @JsonProperty("nominal_mass")
  private Integer nominalMass;

  @JsonProperty("analyzed_mass")
  private Integer analyzedMass;

  @JsonProperty("gas_mode")
  private String gasMode;

  @JsonProperty("is_mass_shift")
  private Boolean massShift;

  public ChannelDescriptor(String originalHeader, String channelId, String element, Integer nominalMass,
                           Integer analyzedMass, String gasMode, Boolean massShift) {
    this.originalHeader = originalHeader;
    this.channelId = channelId;
    this.element = element;
    this.nominalMass = nominalMass;
    this.analyzedMass = analyzedMass;
    this.gasMode = gasMode;
    this.massShift = massShift;
  }

  public String getOriginalHeader() {
    return originalHeader;
  }

  public String getChannelId() {
    return channelId;
  }

  public String getElement() {
    return element;
  }

  public Integer getNominalMass() {
    return nominalMass;
  }

  public Integer getAnalyzedMass() {
    return analyzedMass;
  }

  public String getGasMode() {
    return gasMode;
  }

  public Boolean isMassShift() {
    return massShift;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ChannelDescriptor that = (ChannelDescriptor) o;
    return Objects.equals(originalHeader, that.originalHeader) &&
        Objects.equals(channelId, that.channelId) &&
        Objects.equals(element, that.element) &&
        Objects.equals(nominalMass, that.nominalMass) &&
        Objects.equals(analyzedMass, that.analyzedMass) &&
        Objects.equals(gasMode, that.gasMode) &&
        Objects.equals(massShift, that.massShift);
  }

  @Override
  public int hashCode() {
    return Objects.hash(originalHeader, channelId, element, nominalMass, analyzedMass, gasMode, massShift);
  }

  @Override
  public String toString() {
    return String.format("%s (%s)", channelId, originalHeader);
  }
}
