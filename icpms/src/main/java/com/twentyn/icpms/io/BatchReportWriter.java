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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.icpms.BatchResult;
import com.twentyn.icpms.model.BelowDetectionRecord;
import com.twentyn.icpms.model.BlankStatistic;
import com.twentyn.icpms.model.ChannelSelection;
import com.twentyn.icpms.model.ConcentrationPivotTable;
import com.twentyn.icpms.model.CorrectedMeasurement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the result tables of a batch as TSV files, plus the run summary as JSON, into one output directory.
 */
public class BatchReportWriter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BatchReportWriter.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String CORRECTED_LONG_FILE = "corrected_long.tsv";
  public static final String CORRECTED_WIDE_FILE = "corrected_wide.tsv";
  public static final String QC_SUMMARY_FILE = "qc_summary.tsv";
  public static final String BELOW_DETECTION_FILE = "below_detection.tsv";
  public static final String BLANK_STATISTICS_FILE = "blank_statistics.tsv";
  public static final String UNMATCHED_SAMPLES_FILE = "unmatched_samples.tsv";
  public static final String SUMMARY_FILE = "summary.json";

  public static final String HEADER_SAMPLE_ID = "sample_id";
  public static final String HEADER_ACQ_TIME = "acq_time";
  public static final String HEADER_CHANNEL_ID = "channel_id";
  public static final String HEADER_ELEMENT = "element";
  public static final String HEADER_RAW = "raw_conc";
  public static final String HEADER_DF = "df";
  public static final String HEADER_BLANK_MEAN = "avg_blank";
  public static final String HEADER_CORRECTED = "corrected";
  public static final String HEADER_DETECTION_LIMIT = "mdl";
  public static final String HEADER_UNMATCHED = "unmatched";
  public static final String HEADER_BELOW_DETECTION = "below_detection_elements";

  public static final List<String> CORRECTED_LONG_HEADER = Arrays.asList(HEADER_SAMPLE_ID, HEADER_ACQ_TIME,
      HEADER_CHANNEL_ID, HEADER_ELEMENT, HEADER_RAW, HEADER_DF, HEADER_BLANK_MEAN, HEADER_CORRECTED);
  public static final List<String> QC_SUMMARY_HEADER = Arrays.asList(HEADER_ELEMENT, "selected_channel_id",
      "icv_recovery_pct", "icv_pass", "ref_recovery_pct", "ref_pass", "outcome");
  public static final List<String> BELOW_DETECTION_HEADER = Arrays.asList(HEADER_SAMPLE_ID, HEADER_ELEMENT,
      HEADER_CHANNEL_ID, HEADER_RAW, HEADER_BLANK_MEAN, HEADER_DETECTION_LIMIT);
  public static final List<String> BLANK_STATISTICS_HEADER = Arrays.asList("scope", "key", HEADER_BLANK_MEAN,
      "sd_blank", HEADER_DETECTION_LIMIT, "n_blank");

  private File outputDirectory;

  public BatchReportWriter(File outputDirectory) {
    this.outputDirectory = outputDirectory;
  }

  public void write(BatchResult result) throws IOException {
    FileChecker.verifyOrCreateDirectory(outputDirectory);
    writeCorrectedLong(result.getCorrection().getMeasurements());
    writeCorrectedWide(result.getPivot());
    writeQcSummary(result.getSelections());
    writeBelowDetection(result.getBelowDetection());
    writeBlankStatistics(result.getBlankStatistics().all());
    writeUnmatchedSamples(result.getCorrection().getUnmatchedSamples());

    File summaryFile = new File(outputDirectory, SUMMARY_FILE);
    OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(summaryFile, result.getSummary());
    LOGGER.info("Wrote batch report to %s", outputDirectory.getAbsolutePath());
  }

  void writeCorrectedLong(List<CorrectedMeasurement> measurements) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(measurements.size());
    for (CorrectedMeasurement m : measurements) {
      Map<String, String> row = new HashMap<>();
      row.put(HEADER_SAMPLE_ID, m.getSampleId());
      row.put(HEADER_ACQ_TIME, m.getAcqTime());
      row.put(HEADER_CHANNEL_ID, m.getChannelId());
      row.put(HEADER_ELEMENT, m.getElement());
      row.put(HEADER_RAW, formatNumber(m.getRawConcentration()));
      row.put(HEADER_DF, formatNumber(m.getDilutionFactorUsed()));
      row.put(HEADER_BLANK_MEAN, formatNumber(m.getBlankMeanUsed()));
      row.put(HEADER_CORRECTED, formatNumber(m.getCorrectedValue()));
      rows.add(row);
    }
    writeTable(CORRECTED_LONG_FILE, CORRECTED_LONG_HEADER, rows);
  }

  void writeCorrectedWide(ConcentrationPivotTable pivot) throws IOException {
    List<String> header = new ArrayList<>();
    header.add(HEADER_SAMPLE_ID);
    header.addAll(pivot.getElements());
    header.add(HEADER_UNMATCHED);
    header.add(HEADER_BELOW_DETECTION);

    List<Map<String, String>> rows = new ArrayList<>(pivot.getRows().size());
    for (ConcentrationPivotTable.Row pivotRow : pivot.getRows()) {
      Map<String, String> row = new HashMap<>();
      row.put(HEADER_SAMPLE_ID, pivotRow.getSampleId());
      for (String element : pivot.getElements()) {
        Double value = pivotRow.getValue(element);
        row.put(element, value == null ? "" : String.format(Locale.ROOT, "%.3f", value));
      }
      row.put(HEADER_UNMATCHED, Boolean.toString(pivotRow.isUnmatched()));
      row.put(HEADER_BELOW_DETECTION, String.join(",", pivotRow.getBelowDetectionElements()));
      rows.add(row);
    }
    writeTable(CORRECTED_WIDE_FILE, header, rows);
  }

  void writeQcSummary(List<ChannelSelection> selections) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(selections.size());
    for (ChannelSelection s : selections) {
      Map<String, String> row = new HashMap<>();
      row.put(HEADER_ELEMENT, s.getElement());
      row.put("selected_channel_id", s.getSelectedChannelId() == null ? "" : s.getSelectedChannelId());
      row.put("icv_recovery_pct", formatNumber(s.getCalibrationRecovery()));
      row.put("icv_pass", Boolean.toString(s.isCalibrationPass()));
      row.put("ref_recovery_pct", formatNumber(s.getReferenceRecovery()));
      row.put("ref_pass", Boolean.toString(s.isReferencePass()));
      row.put("outcome", s.getOutcome().name());
      rows.add(row);
    }
    writeTable(QC_SUMMARY_FILE, QC_SUMMARY_HEADER, rows);
  }

  void writeBelowDetection(List<BelowDetectionRecord> records) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(records.size());
    for (BelowDetectionRecord r : records) {
      Map<String, String> row = new HashMap<>();
      row.put(HEADER_SAMPLE_ID, r.getSampleId());
      row.put(HEADER_ELEMENT, r.getElement());
      row.put(HEADER_CHANNEL_ID, r.getChannelId());
      row.put(HEADER_RAW, formatNumber(r.getRawConcentration()));
      row.put(HEADER_BLANK_MEAN, formatNumber(r.getBlankMean()));
      row.put(HEADER_DETECTION_LIMIT, formatNumber(r.getDetectionLimit()));
      rows.add(row);
    }
    writeTable(BELOW_DETECTION_FILE, BELOW_DETECTION_HEADER, rows);
  }

  void writeBlankStatistics(List<BlankStatistic> statistics) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(statistics.size());
    for (BlankStatistic s : statistics) {
      Map<String, String> row = new HashMap<>();
      row.put("scope", s.getScope().name().toLowerCase());
      row.put("key", s.getKey());
      row.put(HEADER_BLANK_MEAN, formatNumber(s.getMean()));
      row.put("sd_blank", formatNumber(s.getStandardDeviation()));
      row.put(HEADER_DETECTION_LIMIT, formatNumber(s.getDetectionLimit()));
      row.put("n_blank", s.getSampleCount().toString());
      rows.add(row);
    }
    writeTable(BLANK_STATISTICS_FILE, BLANK_STATISTICS_HEADER, rows);
  }

  void writeUnmatchedSamples(List<String> unmatched) throws IOException {
    List<Map<String, String>> rows = new ArrayList<>(unmatched.size());
    for (String sampleId : unmatched) {
      Map<String, String> row = new HashMap<>();
      row.put(HEADER_SAMPLE_ID, sampleId);
      rows.add(row);
    }
    writeTable(UNMATCHED_SAMPLES_FILE, Arrays.asList(HEADER_SAMPLE_ID), rows);
  }

  private void writeTable(String fileName, List<String> header, List<Map<String, String>> rows) throws IOException {
    File outputFile = new File(outputDirectory, fileName);
    try (TSVWriter writer = new TSVWriter(header)) {
      writer.open(outputFile);
      writer.append(rows);
      LOGGER.debug("Wrote %d rows to %s", writer.getRowCount(), outputFile.getName());
    }
  }

  // Missing values are written as empty cells rather than "null" or "NaN".
  static String formatNumber(Double value) {
    return value == null ? "" : value.toString();
  }
}
