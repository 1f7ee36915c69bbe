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

import java.util.HashMap;
import java.util.Map;

/**
 * Looks reference names up in an explicit sample id -> reference name table, and falls back to another resolver for
 * samples the table does not mention.
 */
public class TableReferenceNameResolver implements ReferenceNameResolver {
  private Map<String, String> sampleToReferenceName;
  private ReferenceNameResolver fallback;

  public TableReferenceNameResolver(Map<String, String> sampleToReferenceName, ReferenceNameResolver fallback) {
    this.sampleToReferenceName = new HashMap<>(sampleToReferenceName);
    this.fallback = fallback;
  }

  @Override
  public String resolve(String sampleId) {
    String name = sampleToReferenceName.get(sampleId);
    if (name != null) {
      return name;
    }
    return fallback != null ? fallback.resolve(sampleId) : null;
  }
}
