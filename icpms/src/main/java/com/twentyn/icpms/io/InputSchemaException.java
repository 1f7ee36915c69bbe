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

import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Thrown when an input table lacks a column the batch cannot run without.  Always fatal.
 */
public class InputSchemaException extends Exception {
  private String tableName;
  private List<String> missingColumns;

  public InputSchemaException(String tableName, List<String> missingColumns, List<String> expectedSchema,
                              List<String> foundColumns) {
    super(String.format("%s is missing required column(s) %s; expected schema: %s; found columns: %s",
        tableName, StringUtils.join(missingColumns, ", "), StringUtils.join(expectedSchema, ", "),
        StringUtils.join(foundColumns, ", ")));
    this.tableName = tableName;
    this.missingColumns = missingColumns;
  }

  public InputSchemaException(String tableName, String message) {
    super(String.format("%s: %s", tableName, message));
    this.tableName = tableName;
  }

  public String getTableName() {
    return tableName;
  }

  public List<String> getMissingColumns() {
    return missingColumns;
  }
}
