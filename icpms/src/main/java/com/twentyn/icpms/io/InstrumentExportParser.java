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

package com.twentyn.icpms.io;

import com.twentyn.icpms.model.WideSampleTable;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an instrument export (one row per acquisition, one column per channel) into a {@link WideSampleTable}.
 *
 * Some exports carry a row of element symbols above the real header; that shows up as a first row whose leading
 * cells are mostly blank, in which case the second row is used as the header.
 */
public class InstrumentExportParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(InstrumentExportParser.class);

  private static final int HEADER_PROBE_WIDTH = 5;
  private static final int BLANK_CELLS_FOR_SHIFTED_HEADER = 3;

  public WideSampleTable parse(File exportFile) throws IOException, InputSchemaException {
    TableParser parser = new TableParser();
    parser.parse(exportFile);
    LOGGER.info("Read %d rows from instrument export %s", parser.getRows().size(), exportFile.getName());
    return parseRows(parser.getRows());
  }

  public WideSampleTable parseRows(List<List<String>> rows) throws InputSchemaException {
    if (rows.isEmpty()) {
      throw new InputSchemaException("Instrument export", "file is empty");
    }

    int headerIndex = findHeaderRow(rows);
    List<String> header = new ArrayList<>(rows.get(headerIndex).size());
    for (String h : rows.get(headerIndex)) {
      header.add(StringUtils.trimToEmpty(h));
    }

    MetadataColumnLocator locator = new MetadataColumnLocator();
    locator.locate(header);
    int timeIdx = locator.getAcqTimeIndex();
    int sampleIdx = locator.getSampleIndex();

    List<Integer> channelIndices = new ArrayList<>();
    List<String> channelHeaders = new ArrayList<>();
    for (int i = 0; i < header.size(); i++) {
      if (i == timeIdx || i == sampleIdx || header.get(i).isEmpty()) {
        continue;
      }
      channelIndices.add(i);
      channelHeaders.add(header.get(i));
    }

    List<WideSampleTable.Row> tableRows = new ArrayList<>(rows.size() - headerIndex - 1);
    for (int r = headerIndex + 1; r < rows.size(); r++) {
      List<String> row = rows.get(r);
      if (isBlankRow(row)) {
        continue;
      }
      Map<String, String> cells = new HashMap<>();
      for (int c = 0; c < channelIndices.size(); c++) {
        cells.putIfAbsent(channelHeaders.get(c), cellAt(row, channelIndices.get(c)));
      }
      tableRows.add(new WideSampleTable.Row(cellAt(row, timeIdx), cellAt(row, sampleIdx), cells));
    }

    LOGGER.info("Instrument export has %d data rows and %d candidate channel columns",
        tableRows.size(), channelHeaders.size());
    return new WideSampleTable(header.get(timeIdx), header.get(sampleIdx), channelHeaders, tableRows);
  }

  static int findHeaderRow(List<List<String>> rows) {
    if (rows.size() < 2) {
      return 0;
    }
    List<String> first = rows.get(0);
    int blanks = 0;
    for (int i = 0; i < Math.min(HEADER_PROBE_WIDTH, first.size()); i++) {
      if (StringUtils.isBlank(first.get(i))) {
        blanks++;
      }
    }
    if (blanks >= BLANK_CELLS_FOR_SHIFTED_HEADER) {
      LOGGER.info("First row looks like a label row; using the second row as the header");
      return 1;
    }
    return 0;
  }

  private static boolean isBlankRow(List<String> row) {
    for (String cell : row) {
      if (StringUtils.isNotBlank(cell)) {
        return false;
      }
    }
    return true;
  }

  private static String cellAt(List<String> row, int index) {
    return index < row.size() ? row.get(index) : "";
  }
}
