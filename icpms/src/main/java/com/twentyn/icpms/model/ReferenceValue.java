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
 * Certified concentration of one element in one reference material, in the working unit (ug/kg).  The reference
 * name is null for element-only tables that apply to every reference sample.
 */
public class ReferenceValue {
  private String referenceName;
  private String element;
  private Double targetValue;

  public ReferenceValue(String referenceName, String element, Double targetValue) {
    this.referenceName = referenceName;
    this.element = element;
    this.targetValue = targetValue;
  }

  public String getReferenceName() {
    return referenceName;
  }

  public String getElement() {
    return element;
  }

  public Double getTargetValue() {
    return targetValue;
  }
}
