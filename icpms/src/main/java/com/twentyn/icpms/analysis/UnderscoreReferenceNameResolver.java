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
 * Extracts the reference name by naming convention: {@code <prefix><name>_<replicate>}, where the name is every
 * underscore-separated token between the prefix and the trailing replicate index.
 * <pre>
 *   SRM_DOLT-5_1    -> DOLT-5
 *   SRM_NIST_2710_1 -> NIST_2710
 * </pre>
 */
public class UnderscoreReferenceNameResolver implements ReferenceNameResolver {
  private static final String SEPARATOR = "_";

  private String prefix;

  public UnderscoreReferenceNameResolver(String prefix) {
    this.prefix = prefix;
  }

  @Override
  public String resolve(String sampleId) {
    if (sampleId == null || !sampleId.startsWith(prefix)) {
      return null;
    }
    String[] parts = StringUtils.splitPreserveAllTokens(sampleId.substring(prefix.length()), SEPARATOR);
    // Need at least a name and a replicate index.
    if (parts.length < 2) {
      return null;
    }
    String name = StringUtils.join(parts, SEPARATOR, 0, parts.length - 1);
    return name.isEmpty() ? null : name;
  }
}
