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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Finds the acquisition-time and sample-name columns of an instrument export.  Each column is located by an ordered
 * list of heuristics; the first heuristic that returns an index wins, and the last one in each list is positional
 * and always succeeds.
 */
public class MetadataColumnLocator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MetadataColumnLocator.class);

  // Only the leading columns are searched by keyword; channel columns follow them.
  public static final int KEYWORD_SEARCH_WIDTH = 5;

  public interface ColumnHeuristic {
    String getName();

    /**
     * @param header the export's header row.
     * @param excludedIndex a column that must not be chosen (the time column when locating the sample column), or -1.
     * @return the chosen column index, or -1 if this heuristic does not apply.
     */
    int locate(List<String> header, int excludedIndex);
  }

  public static class KeywordHeuristic implements ColumnHeuristic {
    private String name;
    private List<String> keywords;

    public KeywordHeuristic(String name, String... keywords) {
      this.name = name;
      this.keywords = Arrays.asList(keywords);
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public int locate(List<String> header, int excludedIndex) {
      for (int i = 0; i < Math.min(KEYWORD_SEARCH_WIDTH, header.size()); i++) {
        if (i == excludedIndex) {
          continue;
        }
        String lower = header.get(i).toLowerCase();
        for (String keyword : keywords) {
          if (lower.contains(keyword)) {
            return i;
          }
        }
      }
      return -1;
    }
  }

  /**
   * Picks a fixed column, or the alternate one if the preferred column is excluded.
   */
  public static class PositionalHeuristic implements ColumnHeuristic {
    private String name;
    private int preferredIndex;
    private int alternateIndex;

    public PositionalHeuristic(String name, int preferredIndex, int alternateIndex) {
      this.name = name;
      this.preferredIndex = preferredIndex;
      this.alternateIndex = alternateIndex;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public int locate(List<String> header, int excludedIndex) {
      int index = preferredIndex == excludedIndex || preferredIndex >= header.size() ? alternateIndex : preferredIndex;
      return index < header.size() ? index : -1;
    }
  }

  public static final List<ColumnHeuristic> ACQ_TIME_HEURISTICS = Collections.unmodifiableList(Arrays.asList(
      new KeywordHeuristic("date/time keyword", "date", "time", "acq"),
      new PositionalHeuristic("first column", 0, 0)
  ));

  public static final List<ColumnHeuristic> SAMPLE_HEURISTICS = Collections.unmodifiableList(Arrays.asList(
      new KeywordHeuristic("sample/name keyword", "sample", "name"),
      new PositionalHeuristic("second column", 1, 0)
  ));

  private int acqTimeIndex = -1;
  private int sampleIndex = -1;

  public void locate(List<String> header) throws InputSchemaException {
    if (header.isEmpty()) {
      throw new InputSchemaException("Instrument export", "header row is empty");
    }
    acqTimeIndex = applyHeuristics("acquisition time", ACQ_TIME_HEURISTICS, header, -1);
    sampleIndex = applyHeuristics("sample", SAMPLE_HEURISTICS, header, acqTimeIndex);
  }

  static int applyHeuristics(String columnKind, List<ColumnHeuristic> heuristics, List<String> header,
                             int excludedIndex) throws InputSchemaException {
    for (ColumnHeuristic heuristic : heuristics) {
      int index = heuristic.locate(header, excludedIndex);
      if (index >= 0) {
        LOGGER.info("Using column '%s' (index %d) as the %s column, found by %s",
            header.get(index), index, columnKind, heuristic.getName());
        return index;
      }
    }
    throw new InputSchemaException("Instrument export", String.format("could not locate the %s column", columnKind));
  }

  public int getAcqTimeIndex() {
    return acqTimeIndex;
  }

  public int getSampleIndex() {
    return sampleIndex;
  }
}
