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
 * Loads an explicit sample_id -> ref_name table, so reference names need not be parsed out of sample ids.
 */
public class ReferenceNameMapParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReferenceNameMapParser.class);

  public static final String TABLE_NAME = "Reference name map";
  public static final String HEADER_SAMPLE_ID = "sample_id";
  public static final String HEADER_REFERENCE_NAME = "ref_name";
  public static final List<String> EXPECTED_HEADER_FIELDS = Arrays.asList(HEADER_SAMPLE_ID, HEADER_REFERENCE_NAME);

  public Map<String, String> parse(File file) throws IOException, InputSchemaException {
    TableParser parser = new TableParser();
    parser.parse(file);
    return parseTable(parser);
  }

  Map<String, String> parseTable(TableParser parser) throws InputSchemaException {
    String sampleColumn = parser.findColumn(HEADER_SAMPLE_ID);
    String nameColumn = parser.findColumn(HEADER_REFERENCE_NAME);
    List<String> missing = new ArrayList<>();
    if (sampleColumn == null) {
      missing.add(HEADER_SAMPLE_ID);
    }
    if (nameColumn == null) {
      missing.add(HEADER_REFERENCE_NAME);
    }
    if (!missing.isEmpty()) {
      InputSchemaException e = new InputSchemaException(TABLE_NAME, missing, EXPECTED_HEADER_FIELDS, parser.getHeader());
      LOGGER.error(e.getMessage());
      throw e;
    }

    Map<String, String> sampleToName = new LinkedHashMap<>();
    for (Map<String, String> row : parser.getResults()) {
      String sampleId = SampleIdentifierNormalizer.normalize(row.get(sampleColumn));
      String name = StringUtils.trimToNull(row.get(nameColumn));
      if (!sampleId.isEmpty() && name != null) {
        sampleToName.putIfAbsent(sampleId, name);
      }
    }
    LOGGER.info("Loaded reference names for %d samples", sampleToName.size());
    return sampleToName;
  }
}
