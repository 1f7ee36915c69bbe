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

import com.twentyn.icpms.analysis.SampleIdentifierNormalizer;
import com.twentyn.icpms.model.DilutionFactor;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads per-sample dilution/digestion factors from a CSV, TSV or spreadsheet with columns sample_id and df.
 */
public class DilutionFactorParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DilutionFactorParser.class);

  public static final String TABLE_NAME = "Dilution factor table";
  public static final String HEADER_SAMPLE_ID = "sample_id";
  public static final String HEADER_DF = "df";
  public static final List<String> EXPECTED_HEADER_FIELDS = Arrays.asList(HEADER_SAMPLE_ID, HEADER_DF);

  public List<DilutionFactor> parse(File file) throws IOException, InputSchemaException {
    TableParser parser = new TableParser();
    parser.parse(file);
    return parseTable(parser);
  }

  List<DilutionFactor> parseTable(TableParser parser) throws InputSchemaException {
    String sampleColumn = parser.findColumn(HEADER_SAMPLE_ID);
    String dfColumn = parser.findColumn(HEADER_DF);
    List<String> missing = new ArrayList<>();
    if (sampleColumn == null) {
      missing.add(HEADER_SAMPLE_ID);
    }
    if (dfColumn == null) {
      missing.add(HEADER_DF);
    }
    if (!missing.isEmpty()) {
      InputSchemaException e = new InputSchemaException(TABLE_NAME, missing, EXPECTED_HEADER_FIELDS, parser.getHeader());
      LOGGER.error(e.getMessage());
      throw e;
    }

    Map<String, DilutionFactor> factors = new LinkedHashMap<>();
    int line = 1;
    for (Map<String, String> row : parser.getResults()) {
      line++;
      String sampleId = SampleIdentifierNormalizer.normalize(row.get(sampleColumn));
      if (sampleId.isEmpty()) {
        continue;
      }
      Double df = parseFactor(row.get(dfColumn));
      if (df == null) {
        LOGGER.warn("Line %d: unusable dilution factor '%s' for sample %s, skipping", line, row.get(dfColumn), sampleId);
        continue;
      }
      DilutionFactor existing = factors.get(sampleId);
      if (existing != null) {
        if (!existing.getFactor().equals(df)) {
          LOGGER.warn("Line %d: sample %s already has df=%f, ignoring conflicting df=%f",
              line, sampleId, existing.getFactor(), df);
        }
        continue;
      }
      factors.put(sampleId, new DilutionFactor(sampleId, df));
    }

    LOGGER.info("Loaded dilution factors for %d samples", factors.size());
    return new ArrayList<>(factors.values());
  }

  /**
   * @return the factor, or null if the cell is not a positive finite number.
   */
  static Double parseFactor(String cell) {
    if (StringUtils.isBlank(cell)) {
      return null;
    }
    try {
      double value = Double.parseDouble(cell.trim());
      return value > 0.0 && !Double.isInfinite(value) ? value : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
