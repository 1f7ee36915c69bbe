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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes report rows, keyed by column name, as a UTF-8 tab-separated file.  Columns absent from a row are written
 * as empty cells.
 */
public class TSVWriter implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private List<String> header;
  private CSVPrinter printer;
  private int rowCount = 0;

  public TSVWriter(List<String> header) {
    this.header = new ArrayList<>(header);
  }

  public void open(File f) throws IOException {
    printer = new CSVPrinter(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8),
        TSV_FORMAT.withHeader(header.toArray(new String[header.size()])));
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }

  public void append(Map<String, String> row) throws IOException {
    if (printer == null) {
      throw new IllegalStateException("TSVWriter must be opened before rows are appended");
    }
    List<String> values = new ArrayList<>(header.size());
    for (String column : header) {
      String value = row.get(column);
      values.add(value == null ? "" : value);
    }
    printer.printRecord(values);
    rowCount++;
  }

  public void append(List<Map<String, String>> rows) throws IOException {
    for (Map<String, String> row : rows) {
      append(row);
    }
    printer.flush();
  }

  public int getRowCount() {
    return rowCount;
  }
}
