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

import com.twentyn.icpms.model.ReferenceValue;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Loads certified reference-material values.  Three layouts are accepted:
 * <ul>
 *   <li>long: ref_name, element, target_value (values already in ug/kg);</li>
 *   <li>element-only: element, target_value, applied to every reference sample;</li>
 *   <li>wide: row 1 holds element symbols from the third column on, rows 2 and 3 hold element names and units, and
 *   each following row holds a reference name in the second column and mg/kg values underneath the symbols.</li>
 * </ul>
 * Wide values are multiplied by the unit multiplier (1000 by default) to reach ug/kg.
 */
public class ReferenceValueParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReferenceValueParser.class);

  public static final String TABLE_NAME = "Reference value table";
  public static final String HEADER_REFERENCE_NAME = "ref_name";
  public static final String HEADER_ELEMENT = "element";
  public static final String HEADER_TARGET_VALUE = "target_value";

  private static final int WIDE_FIRST_VALUE_COLUMN = 2;
  private static final int WIDE_NAME_COLUMN = 1;
  private static final int WIDE_FIRST_DATA_ROW = 3;

  private Double wideUnitMultiplier;

  public ReferenceValueParser(Double wideUnitMultiplier) {
    this.wideUnitMultiplier = wideUnitMultiplier;
  }

  public List<ReferenceValue> parse(File file) throws IOException, InputSchemaException {
    TableParser parser = new TableParser();
    parser.parse(file);
    return parseTable(parser);
  }

  List<ReferenceValue> parseTable(TableParser parser) throws InputSchemaException {
    if (parser.findColumn(HEADER_ELEMENT) != null && parser.findColumn(HEADER_TARGET_VALUE) != null) {
      return parseLong(parser);
    }
    return parseWide(parser.getRows());
  }

  List<ReferenceValue> parseLong(TableParser parser) {
    String nameColumn = parser.findColumn(HEADER_REFERENCE_NAME);
    String elementColumn = parser.findColumn(HEADER_ELEMENT);
    String valueColumn = parser.findColumn(HEADER_TARGET_VALUE);

    List<ReferenceValue> values = new ArrayList<>();
    for (Map<String, String> row : parser.getResults()) {
      String element = StringUtils.trimToEmpty(row.get(elementColumn));
      Double value = parseValue(row.get(valueColumn));
      if (element.isEmpty() || value == null) {
        continue;
      }
      String name = nameColumn == null ? null : StringUtils.trimToNull(row.get(nameColumn));
      if (nameColumn != null && name == null) {
        continue;
      }
      values.add(new ReferenceValue(name, element, value));
    }
    LOGGER.info("Loaded %d %s reference values", values.size(), nameColumn == null ? "element-only" : "named");
    return values;
  }

  /**
   * Converts the wide per-element matrix to long (reference name, element, value) form.
   */
  List<ReferenceValue> parseWide(List<List<String>> rows) throws InputSchemaException {
    if (rows.isEmpty()) {
      throw new InputSchemaException(TABLE_NAME, "file is empty");
    }
    List<String> symbolRow = rows.get(0);
    List<String> symbols = new ArrayList<>();
    for (int i = WIDE_FIRST_VALUE_COLUMN; i < symbolRow.size(); i++) {
      symbols.add(StringUtils.trimToEmpty(symbolRow.get(i)));
    }
    if (symbols.stream().allMatch(String::isEmpty)) {
      InputSchemaException e = new InputSchemaException(TABLE_NAME,
          Arrays.asList(HEADER_ELEMENT, HEADER_TARGET_VALUE),
          Arrays.asList(HEADER_REFERENCE_NAME, HEADER_ELEMENT, HEADER_TARGET_VALUE), symbolRow);
      LOGGER.error("Reference value table is neither long nor wide format: %s", e.getMessage());
      throw e;
    }

    List<ReferenceValue> values = new ArrayList<>();
    for (int r = WIDE_FIRST_DATA_ROW; r < rows.size(); r++) {
      List<String> row = rows.get(r);
      String name = row.size() > WIDE_NAME_COLUMN ? StringUtils.trimToNull(row.get(WIDE_NAME_COLUMN)) : null;
      if (name == null) {
        continue;
      }
      for (int i = 0; i < symbols.size(); i++) {
        int column = i + WIDE_FIRST_VALUE_COLUMN;
        String element = symbols.get(i);
        Double value = column < row.size() ? parseValue(row.get(column)) : null;
        if (element.isEmpty() || value == null) {
          continue;
        }
        values.add(new ReferenceValue(name, element, value * wideUnitMultiplier));
      }
    }
    LOGGER.info("Converted wide reference value table to %d long rows (x%.0f unit conversion)",
        values.size(), wideUnitMultiplier);
    return values;
  }

  static Double parseValue(String cell) {
    if (StringUtils.isBlank(cell)) {
      return null;
    }
    try {
      double value = Double.parseDouble(cell.trim());
      return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
