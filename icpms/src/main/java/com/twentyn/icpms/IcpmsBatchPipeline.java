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

import com.twentyn.icpms.analysis.BelowDetectionClassifier;
import com.twentyn.icpms.analysis.BlankStatisticsCalculator;
import com.twentyn.icpms.analysis.ChannelHeaderParser;
import com.twentyn.icpms.analysis.ChannelSelector;
import com.twentyn.icpms.analysis.ConcentrationCorrector;
import com.twentyn.icpms.analysis.ConcentrationPivot;
import com.twentyn.icpms.analysis.RecoveryCalculator;
import com.twentyn.icpms.analysis.ReferenceNameResolver;
import com.twentyn.icpms.analysis.Reshaper;
import com.twentyn.icpms.analysis.SampleClassifier;
import com.twentyn.icpms.analysis.UnderscoreReferenceNameResolver;
import com.twentyn.icpms.model.BatchSummary;
import com.twentyn.icpms.model.BelowDetectionRecord;
import com.twentyn.icpms.model.BlankStatisticsTable;
import com.twentyn.icpms.model.CalibrationTarget;
import com.twentyn.icpms.model.ChannelSelection;
import com.twentyn.icpms.model.ConcentrationPivotTable;
import com.twentyn.icpms.model.CorrectedMeasurement;
import com.twentyn.icpms.model.CorrectionResult;
import com.twentyn.icpms.model.DilutionFactor;
import com.twentyn.icpms.model.RecoveryRecord;
import com.twentyn.icpms.model.RecoveryResult;
import com.twentyn.icpms.model.ReferenceValue;
import com.twentyn.icpms.model.SampleMeasurement;
import com.twentyn.icpms.model.WideSampleTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Runs every processing stage, in order, over one instrument batch.  Each stage consumes the previous stage's
 * output and produces new tables; nothing is modified in place.
 */
public class IcpmsBatchPipeline {
  private static final Logger LOGGER = LogManager.getFormatterLogger(IcpmsBatchPipeline.class);

  private QcConfiguration configuration;
  private SampleClassifier classifier;
  private ReferenceNameResolver referenceNameResolver;

  public IcpmsBatchPipeline(QcConfiguration configuration) {
    this(configuration, new UnderscoreReferenceNameResolver(configuration.getReferenceMaterialPrefix()));
  }

  public IcpmsBatchPipeline(QcConfiguration configuration, ReferenceNameResolver referenceNameResolver) {
    this.configuration = configuration;
    this.classifier = new SampleClassifier(configuration);
    this.referenceNameResolver = referenceNameResolver;
  }

  /**
   * @param referenceValues may be empty when no reference-value table was supplied.
   * @param scaleToPpm divide corrected values by the ppm divisor.
   */
  public BatchResult run(WideSampleTable export, List<DilutionFactor> dilutionFactors,
                         List<CalibrationTarget> calibrationTargets, List<ReferenceValue> referenceValues,
                         boolean scaleToPpm) {
    LOGGER.info("Processing batch of %d instrument rows", export.getRows().size());

    ChannelHeaderParser.Result parsedHeaders = new ChannelHeaderParser().parseHeaders(export.getChannelHeaders());

    List<SampleMeasurement> measurements = new Reshaper(configuration.getUnitLabelSentinel())
        .reshape(export, parsedHeaders.getChannels());

    BlankStatisticsTable blankStatistics =
        new BlankStatisticsCalculator(classifier, configuration.getDetectionLimitMultiplier()).compute(measurements);

    CorrectionResult correction =
        new ConcentrationCorrector(classifier, configuration.getDefaultDilutionFactor(), configuration.getPpmDivisor())
            .correct(measurements, dilutionFactors, blankStatistics, scaleToPpm);

    RecoveryResult recoveries = new RecoveryCalculator(classifier, referenceNameResolver)
        .compute(correction.getMeasurements(), calibrationTargets, referenceValues);

    List<ChannelSelection> selections = new ChannelSelector(
        configuration.getCalibrationLow(), configuration.getCalibrationHigh(),
        configuration.getReferenceLow(), configuration.getReferenceHigh()
    ).select(parsedHeaders.getChannels(), recoveries);

    List<BelowDetectionRecord> belowDetection = new BelowDetectionClassifier().classify(measurements, blankStatistics);

    ConcentrationPivotTable pivot = new ConcentrationPivot(classifier).pivot(correction, selections, blankStatistics);

    BatchSummary summary = summarize(parsedHeaders.getSkippedHeaders(), correction, recoveries, selections);
    LOGGER.info("Batch complete: %d samples, %d elements, %d unmatched samples",
        summary.getTotalSamples(), summary.getElementsAnalyzed(), summary.getUnmatchedSamples().size());

    return new BatchResult(parsedHeaders.getChannels(), parsedHeaders.getSkippedHeaders(), measurements,
        blankStatistics, correction, recoveries, selections, belowDetection, pivot, summary);
  }

  BatchSummary summarize(List<String> skippedHeaders, CorrectionResult correction, RecoveryResult recoveries,
                         List<ChannelSelection> selections) {
    List<String> allSamples = correction.getMeasurements().stream()
        .map(CorrectedMeasurement::getSampleId).collect(Collectors.toList());

    int elements = selections.size();
    long calibrationPasses = selections.stream().filter(ChannelSelection::isCalibrationPass).count();
    long referencePasses = selections.stream().filter(ChannelSelection::isReferencePass).count();

    return new BatchSummary(
        correction.getUnmatchedSamples(),
        skippedHeaders,
        countDistinct(allSamples, classifier::isOrdinarySample),
        countDistinct(sampleIds(recoveries.getCalibrationRecoveries()), s -> true),
        countDistinct(sampleIds(recoveries.getReferenceRecoveries()), s -> true),
        countDistinct(allSamples, classifier::isBlank),
        elements > 0 ? calibrationPasses * 100.0 / elements : 0.0,
        elements > 0 ? referencePasses * 100.0 / elements : 0.0,
        elements
    );
  }

  private static List<String> sampleIds(List<RecoveryRecord> records) {
    return records.stream().map(RecoveryRecord::getSampleId).collect(Collectors.toList());
  }

  private static int countDistinct(Collection<String> sampleIds, Predicate<String> filter) {
    Set<String> distinct = new LinkedHashSet<>();
    for (String id : sampleIds) {
      if (filter.test(id)) {
        distinct.add(id);
      }
    }
    return distinct.size();
  }
}
