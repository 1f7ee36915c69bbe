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

import com.twentyn.icpms.model.BelowDetectionRecord;
import com.twentyn.icpms.model.BlankStatistic;
import com.twentyn.icpms.model.BlankStatisticsTable;
import com.twentyn.icpms.model.SampleMeasurement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags measurements whose blank-subtracted raw value is strictly below the element's detection limit.  Rows with a
 * missing raw value or an undefined detection limit are never flagged.
 */
public class BelowDetectionClassifier {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BelowDetectionClassifier.class);

  public List<BelowDetectionRecord> classify(List<SampleMeasurement> measurements,
                                             BlankStatisticsTable blankStatistics) {
    List<BelowDetectionRecord> results = new ArrayList<>();
    for (SampleMeasurement m : measurements) {
      BlankStatistic elementBlank = blankStatistics.forElement(m.getElement());
      if (isBelowDetection(m.getRawConcentration(), elementBlank)) {
        results.add(new BelowDetectionRecord(m.getSampleId(), m.getElement(), m.getChannelId(),
            m.getRawConcentration(), elementBlank.getMean(), elementBlank.getDetectionLimit()));
      }
    }
    LOGGER.info("%d of %d measurements are below the detection limit", results.size(), measurements.size());
    return results;
  }

  public static boolean isBelowDetection(Double raw, BlankStatistic elementBlank) {
    if (raw == null || elementBlank == null ||
        elementBlank.getMean() == null || elementBlank.getDetectionLimit() == null) {
      return false;
    }
    return (raw - elementBlank.getMean()) < elementBlank.getDetectionLimit();
  }
}
