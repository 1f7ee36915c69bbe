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

package com.twentyn.icpms;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.icpms.io.FileChecker;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;

/**
 * Sample-naming markers, QC tolerance bands and unit constants for one batch run.  Field initializers are the
 * defaults; a JSON file may override any subset of them.  Sample-naming markers are returned upper-cased, the same
 * case as normalized sample ids.
 */
public class QcConfiguration {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @JsonProperty("blank_marker")
  private String blankMarker = "BLANK";

  @JsonProperty("calibration_verification_marker")
  private String calibrationVerificationMarker = "ICV";

  @JsonProperty("calibration_blank_marker")
  private String calibrationBlankMarker = "ICB";

  @JsonProperty("reference_material_prefix")
  private String referenceMaterialPrefix = "SRM_";

  @JsonProperty("duplicate_marker")
  private String duplicateMarker = "DUP";

  @JsonProperty("unit_label_sentinel")
  private String unitLabelSentinel = "Conc.";

  @JsonProperty("calibration_low")
  private Double calibrationLow = 90.0;

  @JsonProperty("calibration_high")
  private Double calibrationHigh = 110.0;

  @JsonProperty("reference_low")
  private Double referenceLow = 80.0;

  @JsonProperty("reference_high")
  private Double referenceHigh = 120.0;

  @JsonProperty("detection_limit_multiplier")
  private Double detectionLimitMultiplier = 3.0;

  @JsonProperty("default_dilution_factor")
  private Double defaultDilutionFactor = 1.0;

  // mg/kg -> ug/kg for wide reference-value files.
  @JsonProperty("reference_unit_multiplier")
  private Double referenceUnitMultiplier = 1000.0;

  // Output divisor applied when parts-per-million output is requested.
  @JsonProperty("ppm_divisor")
  private Double ppmDivisor = 1000.0;

  public QcConfiguration() {
  }

  public static QcConfiguration readFromFile(File configFile) throws IOException {
    FileChecker.verifyInputFile(configFile);
    return OBJECT_MAPPER.readValue(configFile, QcConfiguration.class);
  }

  public String getBlankMarker() {
    return StringUtils.upperCase(blankMarker);
  }

  public String getCalibrationVerificationMarker() {
    return StringUtils.upperCase(calibrationVerificationMarker);
  }

  public String getCalibrationBlankMarker() {
    return StringUtils.upperCase(calibrationBlankMarker);
  }

  public String getReferenceMaterialPrefix() {
    return StringUtils.upperCase(referenceMaterialPrefix);
  }

  public String getDuplicateMarker() {
    return StringUtils.upperCase(duplicateMarker);
  }

  public String getUnitLabelSentinel() {
    return unitLabelSentinel;
  }

  public Double getCalibrationLow() {
    return calibrationLow;
  }

  public Double getCalibrationHigh() {
    return calibrationHigh;
  }

  public Double getReferenceLow() {
    return referenceLow;
  }

  public Double getReferenceHigh() {
    return referenceHigh;
  }

  public Double getDetectionLimitMultiplier() {
    return detectionLimitMultiplier;
  }

  public Double getDefaultDilutionFactor() {
    return defaultDilutionFactor;
  }

  public Double getReferenceUnitMultiplier() {
    return referenceUnitMultiplier;
  }

  public Double getPpmDivisor() {
    return ppmDivisor;
  }
}
