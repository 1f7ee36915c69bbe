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

import com.twentyn.icpms.analysis.ReferenceNameResolver;
import com.twentyn.icpms.analysis.TableReferenceNameResolver;
import com.twentyn.icpms.analysis.UnderscoreReferenceNameResolver;
import com.twentyn.icpms.io.BatchReportWriter;
import com.twentyn.icpms.io.CalibrationTargetParser;
import com.twentyn.icpms.io.DilutionFactorParser;
import com.twentyn.icpms.io.InputSchemaException;
import com.twentyn.icpms.io.InstrumentExportParser;
import com.twentyn.icpms.io.ReferenceNameMapParser;
import com.twentyn.icpms.io.ReferenceValueParser;
import com.twentyn.icpms.model.CalibrationTarget;
import com.twentyn.icpms.model.DilutionFactor;
import com.twentyn.icpms.model.ReferenceValue;
import com.twentyn.icpms.model.WideSampleTable;
import com.twentyn.icpms.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command-line entry point: loads the instrument export and its companion tables, runs the batch pipeline and writes
 * the report tables.
 */
public class IcpmsBatchProcessor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(IcpmsBatchProcessor.class);

  public static final String OPTION_SORT_FILE = "s";
  public static final String OPTION_DIGEST_FILE = "d";
  public static final String OPTION_ICV_FILE = "i";
  public static final String OPTION_REFERENCE_FILE = "r";
  public static final String OPTION_REFERENCE_MAP_FILE = "m";
  public static final String OPTION_OUTPUT_DIR = "o";
  public static final String OPTION_NO_DIVIDE = "n";
  public static final String OPTION_CONFIG_FILE = "c";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Processes one ICP-MS batch: reshapes the instrument export, subtracts blanks, applies dilution factors, ",
      "computes ICV and reference-material recoveries and selects the best channel per element.  Results are ",
      "written as TSV tables plus a JSON summary."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_SORT_FILE)
        .argName("sort file")
        .desc("The instrument export (CSV) with one row per acquisition and one column per channel")
        .hasArg().required()
        .longOpt("sort")
    );
    add(Option.builder(OPTION_DIGEST_FILE)
        .argName("digest file")
        .desc("A CSV/TSV/XLSX table of dilution factors with columns sample_id, df")
        .hasArg().required()
        .longOpt("digest")
    );
    add(Option.builder(OPTION_ICV_FILE)
        .argName("icv file")
        .desc("A table of calibration targets with columns element, icv_target and optionally ref_target")
        .hasArg().required()
        .longOpt("icv")
    );
    add(Option.builder(OPTION_REFERENCE_FILE)
        .argName("reference file")
        .desc("Optional reference material values, in long (ref_name, element, target_value) or wide form")
        .hasArg()
        .longOpt("reference")
    );
    add(Option.builder(OPTION_REFERENCE_MAP_FILE)
        .argName("reference map file")
        .desc("Optional table mapping reference sample ids to reference names (columns sample_id, ref_name)")
        .hasArg()
        .longOpt("reference-map")
    );
    add(Option.builder(OPTION_OUTPUT_DIR)
        .argName("output directory")
        .desc("The directory where result tables should be written")
        .hasArg().required()
        .longOpt("output-dir")
    );
    add(Option.builder(OPTION_NO_DIVIDE)
        .desc("Do not divide corrected values by 1000 (report in ppb rather than ppm)")
        .longOpt("no-div1000")
    );
    add(Option.builder(OPTION_CONFIG_FILE)
        .argName("config file")
        .desc("Optional JSON file overriding sample markers and QC tolerance bands")
        .hasArg()
        .longOpt("config")
    );
  }};

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(IcpmsBatchProcessor.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    try {
      QcConfiguration configuration = cl.hasOption(OPTION_CONFIG_FILE) ?
          QcConfiguration.readFromFile(new File(cl.getOptionValue(OPTION_CONFIG_FILE))) :
          new QcConfiguration();

      BatchResult result = new IcpmsBatchProcessor(configuration).process(
          new File(cl.getOptionValue(OPTION_SORT_FILE)),
          new File(cl.getOptionValue(OPTION_DIGEST_FILE)),
          new File(cl.getOptionValue(OPTION_ICV_FILE)),
          cl.hasOption(OPTION_REFERENCE_FILE) ? new File(cl.getOptionValue(OPTION_REFERENCE_FILE)) : null,
          cl.hasOption(OPTION_REFERENCE_MAP_FILE) ? new File(cl.getOptionValue(OPTION_REFERENCE_MAP_FILE)) : null,
          !cl.hasOption(OPTION_NO_DIVIDE)
      );
      new BatchReportWriter(new File(cl.getOptionValue(OPTION_OUTPUT_DIR))).write(result);
    } catch (InputSchemaException e) {
      LOGGER.error("Invalid input: %s", e.getMessage());
      System.exit(1);
    } catch (IOException e) {
      LOGGER.error("Unable to read or write batch files: %s", e.getMessage());
      System.exit(1);
    }
    LOGGER.info("Done");
  }

  private QcConfiguration configuration;

  public IcpmsBatchProcessor(QcConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Loads every input table and runs the pipeline.
   * @param referenceFile may be null.
   * @param referenceMapFile may be null.
   */
  public BatchResult process(File sortFile, File digestFile, File icvFile, File referenceFile, File referenceMapFile,
                             boolean scaleToPpm) throws IOException, InputSchemaException {
    WideSampleTable export = new InstrumentExportParser().parse(sortFile);
    List<DilutionFactor> dilutionFactors = new DilutionFactorParser().parse(digestFile);
    List<CalibrationTarget> calibrationTargets = new CalibrationTargetParser().parse(icvFile);

    List<ReferenceValue> referenceValues = Collections.emptyList();
    if (referenceFile != null) {
      referenceValues = new ReferenceValueParser(configuration.getReferenceUnitMultiplier()).parse(referenceFile);
    }

    ReferenceNameResolver resolver = new UnderscoreReferenceNameResolver(configuration.getReferenceMaterialPrefix());
    if (referenceMapFile != null) {
      resolver = new TableReferenceNameResolver(new ReferenceNameMapParser().parse(referenceMapFile), resolver);
    }

    return new IcpmsBatchPipeline(configuration, resolver)
        .run(export, dilutionFactors, calibrationTargets, referenceValues, scaleToPpm);
  }
}
