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

import org.apache.commons.lang3.StringUtils;

/**
 * Canonical form for sample names so the instrument export, dilution table and reference map join on the same key.
 */
public class SampleIdentifierNormalizer {
  private static final String SPACE = " ";
  private static final String UNDERSCORE = "_";

  private SampleIdentifierNormalizer() {
  }

  /**
   * Trims, upper-cases and replaces internal spaces with underscores.  Null becomes the empty string.  Idempotent.
   */
  public static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    return StringUtils.replace(raw.trim().toUpperCase(), SPACE, UNDERSCORE);
  }
}
