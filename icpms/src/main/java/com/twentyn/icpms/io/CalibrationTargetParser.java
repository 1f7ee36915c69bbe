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

import com.twentyn.icpms.model.CalibrationTarget;
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
 * Loads ICV targets per element.  Required columns: element, icv_target (or calibration_target).  An optional
 * ref_target (or srm_target, reference_target) column supplies element-wide reference targets.
 */
public class CalibrationTargetParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CalibrationTargetParser.class);

  public static final String TABLE_NAME = "Calibration target table";
  public static final String HEADER_ELEMENT = "element";
  public static final String[] HEADER_CALIBRATION_TARGET = new String[]{"icv_target", "calibration_target"};
  public static final String[] HEADER_REFERENCE_TARGET = new String[]{"ref_target", "srm_target", "reference_target"};
  public static final List<String> EXPECTED_HEADER_FIELDS =
      Arrays.asList(HEADER_ELEMENT, HEADER_CALIBRATION_TARGET[0], "[" + HEADER_REFERENCE_TARGET[0] + "]");

  public List<CalibrationTarget> parse(File file) throws IOException, InputSchemaException {
    TableParser parser = new TableParser();
    parser.parse(file);
    return parseTable(parser);
  }

  List<CalibrationTarget> parseTable(TableParser parser) throws InputSchemaException {
    String elementColumn = parser.findColumn(HEADER_ELEMENT);
    String calibrationColumn = parser.findColumn(HEADER_CALIBRATION_TARGET);
    String referenceColumn = parser.findColumn(HEADER_REFERENCE_TARGET);

    List<String> missing = new ArrayList<>();
    if (elementColumn == null) {
      missing.add(HEADER_ELEMENT);
    }
    if (calibrationColumn == null) {
      missing.add(HEADER_CALIBRATION_TARGET[0]);
    }
    if (!missing.isEmpty()) {
      InputSchemaException e = new InputSchemaException(TABLE_NAME, missing, EXPECTED_HEADER_FIELDS, parser.getHeader());
      LOGGER.error(e.getMessage());
      throw e;
    }
    if (referenceColumn == null) {
      LOGGER.info("Calibration target table has no reference target column");
    }

    List<CalibrationTarget> targets = new ArrayList<>();
    for (Map<String, String> row : parser.getResults()) {
      String element = StringUtils.trimToEmpty(row.get(elementColumn));
      if (element.isEmpty()) {
        continue;
      }
      Double calibration = parseTarget(row.get(calibrationColumn));
      if (calibration == null) {
        LOGGER.warn("No usable ICV target for element %s ('%s')", element, row.get(calibrationColumn));
      }
      Double reference = referenceColumn == null ? null : parseTarget(row.get(referenceColumn));
      targets.add(new CalibrationTarget(element, calibration, reference));
    }

    LOGGER.info("Loaded calibration targets for %d elements", targets.size());
    return targets;
  }

  static Double parseTarget(String cell) {
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
