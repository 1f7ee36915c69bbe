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

import com.twentyn.icpms.QcConfiguration;
import com.twentyn.icpms.model.SampleCategory;

/**
 * Assigns a category to a normalized sample id based on the naming markers in the configuration.  Markers are
 * tested in a fixed order, so e.g. a reference-material sample whose name happens to contain "BLANK" is still a
 * reference sample.
 */
public class SampleClassifier {
  private QcConfiguration configuration;

  public SampleClassifier(QcConfiguration configuration) {
    this.configuration = configuration;
  }

  public SampleCategory classify(String sampleId) {
    if (isReferenceMaterial(sampleId)) {
      return SampleCategory.REFERENCE_MATERIAL;
    }
    if (isCalibrationVerification(sampleId)) {
      return SampleCategory.CALIBRATION_VERIFICATION;
    }
    if (sampleId.contains(configuration.getCalibrationBlankMarker())) {
      return SampleCategory.CALIBRATION_BLANK;
    }
    if (isBlank(sampleId)) {
      return SampleCategory.BLANK;
    }
    if (sampleId.contains(configuration.getDuplicateMarker())) {
      return SampleCategory.DUPLICATE;
    }
    return SampleCategory.SAMPLE;
  }

  // These match their own marker regardless of the priority order used by classify().
  public boolean isBlank(String sampleId) {
    return sampleId.contains(configuration.getBlankMarker());
  }

  public boolean isCalibrationVerification(String sampleId) {
    return sampleId.contains(configuration.getCalibrationVerificationMarker());
  }

  public boolean isReferenceMaterial(String sampleId) {
    return sampleId.startsWith(configuration.getReferenceMaterialPrefix());
  }

  /**
   * Ordinary samples are the rows that end up in the per-sample concentration table: anything that is not a blank,
   * ICV, duplicate or reference material.
   */
  public boolean isOrdinarySample(String sampleId) {
    return !(isBlank(sampleId) || isCalibrationVerification(sampleId) ||
        sampleId.contains(configuration.getDuplicateMarker()) || isReferenceMaterial(sampleId));
  }
}
