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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Corrected concentrations with one row per ordinary sample and one column per element.
 */
public class ConcentrationPivotTable {
  public static class Row {
    private String sampleId;
    private Map<String, Double> elementValues;
    private boolean unmatched;
    private Set<String> belowDetectionElements;

    public Row(String sampleId, Map<String, Double> elementValues, boolean unmatched,
               Set<String> belowDetectionElements) {
      this.sampleId = sampleId;
      this.elementValues = Collections.unmodifiableMap(elementValues);
      this.unmatched = unmatched;
      this.belowDetectionElements = Collections.unmodifiableSet(belowDetectionElements);
    }

    public String getSampleId() {
      return sampleId;
    }

    public Double getValue(String element) {
      return elementValues.get(element);
    }

    public Map<String, Double> getElementValues() {
      return elementValues;
    }

    // True when the sample had no dilution factor and was corrected with the default.
    public boolean isUnmatched() {
      return unmatched;
    }

    public Set<String> getBelowDetectionElements() {
      return belowDetectionElements;
    }
  }

  private List<String> elements;
  // Element -> channel whose values fill that column.
  private Map<String, String> elementChannels;
  private List<Row> rows;

  public ConcentrationPivotTable(List<String> elements, Map<String, String> elementChannels, List<Row> rows) {
    this.elements = Collections.unmodifiableList(elements);
    this.elementChannels = Collections.unmodifiableMap(elementChannels);
    this.rows = Collections.unmodifiableList(rows);
  }

  public List<String> getElements() {
    return elements;
  }

  public Map<String, String> getElementChannels() {
    return elementChannels;
  }

  public List<Row> getRows() {
    return rows;
  }
}
