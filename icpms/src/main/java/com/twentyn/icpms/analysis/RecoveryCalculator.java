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

import com.twentyn.icpms.model.CalibrationTarget;
import com.twentyn.icpms.model.CorrectedMeasurement;
import com.twentyn.icpms.model.RecoveryRecord;
import com.twentyn.icpms.model.RecoveryResult;
import com.twentyn.icpms.model.ReferenceValue;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes percent recovery (corrected / target x 100) for calibration-verification and reference-material rows.
 *
 * Reference targets are resolved in this order:
 * 1) if any reference value is named, the reference name comes from the {@link ReferenceNameResolver} and targets
 *    are joined on (normalized reference name, element) only;
 * 2) otherwise element-only reference values, joined on element;
 * 3) then the reference target column of the calibration table, joined on element.
 * A recovery with no target is left undefined.
 */
public class RecoveryCalculator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RecoveryCalculator.class);

  private SampleClassifier classifier;
  private ReferenceNameResolver referenceNameResolver;

  public RecoveryCalculator(SampleClassifier classifier, ReferenceNameResolver referenceNameResolver) {
    this.classifier = classifier;
    this.referenceNameResolver = referenceNameResolver;
  }

  /**
   * @param referenceValues may be empty when no reference-value table was supplied.
   */
  public RecoveryResult compute(List<CorrectedMeasurement> measurements, List<CalibrationTarget> calibrationTargets,
                                List<ReferenceValue> referenceValues) {
    Map<String, Double> elementToCalibrationTarget = new HashMap<>();
    Map<String, Double> elementToFallbackReferenceTarget = new HashMap<>();
    for (CalibrationTarget target : calibrationTargets) {
      elementToCalibrationTarget.putIfAbsent(target.getElement(), target.getCalibrationTarget());
      if (target.getReferenceTarget() != null) {
        elementToFallbackReferenceTarget.putIfAbsent(target.getElement(), target.getReferenceTarget());
      }
    }

    boolean useNamedReferences = false;
    Map<Pair<String, String>, Double> namedReferenceTargets = new HashMap<>();
    Map<String, Double> elementReferenceTargets = new HashMap<>();
    for (ReferenceValue value : referenceValues) {
      if (value.getReferenceName() != null) {
        useNamedReferences = true;
        namedReferenceTargets.putIfAbsent(referenceKey(value.getReferenceName(), value.getElement()),
            value.getTargetValue());
      } else {
        elementReferenceTargets.putIfAbsent(value.getElement(), value.getTargetValue());
      }
    }

    List<RecoveryRecord> calibration = new ArrayList<>();
    List<RecoveryRecord> reference = new ArrayList<>();
    for (CorrectedMeasurement m : measurements) {
      String sampleId = m.getSampleId();
      if (classifier.isCalibrationVerification(sampleId)) {
        Double target = elementToCalibrationTarget.get(m.getElement());
        calibration.add(makeRecord(RecoveryRecord.Kind.CALIBRATION_VERIFICATION, m, null, target));
      }

      if (classifier.isReferenceMaterial(sampleId)) {
        String referenceName = referenceNameResolver.resolve(sampleId);
        Double target;
        if (useNamedReferences) {
          target = referenceName == null ? null :
              namedReferenceTargets.get(referenceKey(referenceName, m.getElement()));
        } else {
          target = elementReferenceTargets.get(m.getElement());
          if (target == null) {
            target = elementToFallbackReferenceTarget.get(m.getElement());
          }
        }
        reference.add(makeRecord(RecoveryRecord.Kind.REFERENCE_MATERIAL, m, referenceName, target));
      }
    }

    LOGGER.info("Computed %d calibration-verification and %d reference-material recoveries (%s reference targets)",
        calibration.size(), reference.size(), useNamedReferences ? "named" : "element-only");
    logMissingTargets(calibration);
    logMissingTargets(reference);
    return new RecoveryResult(calibration, reference);
  }

  private RecoveryRecord makeRecord(RecoveryRecord.Kind kind, CorrectedMeasurement m, String referenceName,
                                    Double target) {
    return new RecoveryRecord(kind, m.getSampleId(), m.getChannelId(), m.getElement(), referenceName,
        m.getCorrectedValue(), target, recoveryPercent(m.getCorrectedValue(), target));
  }

  // Reference names are matched in the same canonical form as sample ids, so "Dolt-5" and "DOLT-5" are one reference.
  private static Pair<String, String> referenceKey(String referenceName, String element) {
    return Pair.of(SampleIdentifierNormalizer.normalize(referenceName), element);
  }

  static Double recoveryPercent(Double corrected, Double target) {
    if (corrected == null || target == null || target == 0.0) {
      return null;
    }
    return corrected / target * 100.0;
  }

  private void logMissingTargets(List<RecoveryRecord> records) {
    long missing = records.stream().filter(r -> r.getTargetValue() == null).count();
    if (missing > 0) {
      LOGGER.warn("%d %s rows have no target; their recovery is undefined",
          missing, records.get(0).getKind().name().toLowerCase());
    }
  }
}
