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

package com.twentyn.icpms.analysis;

import com.twentyn.icpms.model.ChannelDescriptor;
import com.twentyn.icpms.model.SampleMeasurement;
import com.twentyn.icpms.model.WideSampleTable;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the wide instrument table into one {@link SampleMeasurement} per sample x parsed channel.  Columns whose
 * headers did not parse are dropped; cells that are not numbers become missing values.
 */
public class Reshaper {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Reshaper.class);

  private String unitLabelSentinel;

  public Reshaper(String unitLabelSentinel) {
    this.unitLabelSentinel = unitLabelSentinel;
  }

  public List<SampleMeasurement> reshape(WideSampleTable table, List<ChannelDescriptor> channels) {
    List<WideSampleTable.Row> rows = table.getRows();
    if (isUnitLabelRow(table)) {
      LOGGER.info("Dropping unit label row found directly under the header");
      rows = rows.subList(1, rows.size());
    }

    List<SampleMeasurement> measurements = new ArrayList<>(rows.size() * channels.size());
    int missing = 0;
    for (WideSampleTable.Row row : rows) {
      String sampleId = SampleIdentifierNormalizer.normalize(row.getSampleName());
      for (ChannelDescriptor channel : channels) {
        Double value = parseConcentration(row.getCell(channel.getOriginalHeader()));
        if (value == null) {
          missing++;
        }
        measurements.add(new SampleMeasurement(sampleId, row.getAcqTime(), channel, value));
      }
    }

    LOGGER.info("Reshaped %d rows x %d channels into %d measurements (%d missing values)",
        rows.size(), channels.size(), measurements.size(), missing);
    return measurements;
  }

  /**
   * A unit label row is the first data row when every channel cell in it equals the sentinel (e.g. "Conc.").
   */
  boolean isUnitLabelRow(WideSampleTable table) {
    if (table.getRows().isEmpty() || table.getChannelHeaders().isEmpty()) {
      return false;
    }
    WideSampleTable.Row first = table.getRows().get(0);
    for (String header : table.getChannelHeaders()) {
      if (!unitLabelSentinel.equals(StringUtils.trim(first.getCell(header)))) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the numeric value of the cell, or null for blank, non-numeric or non-finite cells.
   */
  static Double parseConcentration(String cell) {
    if (StringUtils.isBlank(cell)) {
      return null;
    }
    try {
      Double value = Double.valueOf(cell.trim());
      return value.isNaN() || value.isInfinite() ? null : value;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
