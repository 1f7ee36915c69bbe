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

/**
 * The instrument export as read from disk: one row per acquisition, one raw string cell per channel column.  The
 * acquisition-time and sample columns have already been located; channel headers are still unparsed.
 */
public class WideSampleTable {
  public static class Row {
    private String acqTime;
    private String sampleName;
    private Map<String, String> channelCells;

    public Row(String acqTime, String sampleName, Map<String, String> channelCells) {
      this.acqTime = acqTime;
      this.sampleName = sampleName;
      this.channelCells = Collections.unmodifiableMap(channelCells);
    }

    public String getAcqTime() {
      return acqTime;
    }

    public String getSampleName() {
      return sampleName;
    }

    /**
     * @return the raw cell under the given channel header, or null if the row is short.
     */
    public String getCell(String channelHeader) {
      return channelCells.get(channelHeader);
    }

    public Map<String, String> getChannelCells() {
      return channelCells;
    }
  }

  private String acqTimeHeader;
  private String sampleHeader;
  private List<String> channelHeaders;
  private List<Row> rows;

  public WideSampleTable(String acqTimeHeader, String sampleHeader, List<String> channelHeaders, List<Row> rows) {
    this.acqTimeHeader = acqTimeHeader;
    this.sampleHeader = sampleHeader;
    this.channelHeaders = Collections.unmodifiableList(channelHeaders);
    this.rows = Collections.unmodifiableList(rows);
  }

  public String getAcqTimeHeader() {
    return acqTimeHeader;
  }

  public String getSampleHeader() {
    return sampleHeader;
  }

  public List<String> getChannelHeaders() {
    return channelHeaders;
  }

  public List<Row> getRows() {
    return rows;
  }
}
