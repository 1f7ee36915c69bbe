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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Blank statistics keyed by channel id and, separately, by element.  Lookups for keys with no blank observations
 * return null.
 */
public class BlankStatisticsTable {
  private Map<String, BlankStatistic> byChannel;
  private Map<String, BlankStatistic> byElement;

  public BlankStatisticsTable(Map<String, BlankStatistic> byChannel, Map<String, BlankStatistic> byElement) {
    this.byChannel = Collections.unmodifiableMap(byChannel);
    this.byElement = Collections.unmodifiableMap(byElement);
  }

  public BlankStatistic forChannel(String channelId) {
    return byChannel.get(channelId);
  }

  public BlankStatistic forElement(String element) {
    return byElement.get(element);
  }

  public Map<String, BlankStatistic> getByChannel() {
    return byChannel;
  }

  public Map<String, BlankStatistic> getByElement() {
    return byElement;
  }

  public List<BlankStatistic> all() {
    List<BlankStatistic> all = new ArrayList<>(byChannel.size() + byElement.size());
    all.addAll(byChannel.values());
    all.addAll(byElement.values());
    return all;
  }
}
