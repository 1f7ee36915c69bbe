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

package com.twentyn.icpms.utils;

import com.twentyn.icpms.IcpmsBatchProcessor;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.MissingOptionException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CLIUtilTest {

  private CLIUtil cliUtil;

  @Before
  public void setUp() {
    cliUtil = new CLIUtil(IcpmsBatchProcessor.class, IcpmsBatchProcessor.HELP_MESSAGE,
        IcpmsBatchProcessor.OPTION_BUILDERS);
  }

  @Test
  public void testHelpOptionIsRegistered() {
    assertTrue(cliUtil.getOptions().hasOption("h"));
    assertTrue(cliUtil.getOptions().hasLongOption("help"));
  }

  @Test
  public void testParseLongAndShortOptions() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{
        "--sort", "sort.csv", "-d", "digest.xlsx", "--icv", "icv.csv", "-o", "out", "--no-div1000"
    });
    assertEquals("sort.csv", cl.getOptionValue(IcpmsBatchProcessor.OPTION_SORT_FILE));
    assertEquals("digest.xlsx", cl.getOptionValue(IcpmsBatchProcessor.OPTION_DIGEST_FILE));
    assertEquals("out", cl.getOptionValue(IcpmsBatchProcessor.OPTION_OUTPUT_DIR));
    assertTrue(cl.hasOption(IcpmsBatchProcessor.OPTION_NO_DIVIDE));
    assertFalse(cl.hasOption(IcpmsBatchProcessor.OPTION_REFERENCE_FILE));
  }

  @Test(expected = MissingOptionException.class)
  public void testRequiredOptionsAreEnforced() throws Exception {
    cliUtil.parse(new String[]{"--sort", "sort.csv"});
  }
}
