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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FileCheckerTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test(expected = IOException.class)
  public void testDirectoryIsNotAnInputFile() throws Exception {
    FileChecker.verifyInputFile(tempFolder.getRoot());
  }

  @Test
  public void testNestedReportDirectoryIsCreated() throws Exception {
    File nested = new File(tempFolder.getRoot(), "a/b/report");
    FileChecker.verifyOrCreateDirectory(nested);
    assertTrue(nested.isDirectory());
  }

  @Test(expected = IOException.class)
  public void testFileIsNotAReportDirectory() throws Exception {
    FileChecker.verifyOrCreateDirectory(tempFolder.newFile("report"));
  }

  @Test
  public void testTsvWriterFillsMissingColumns() throws Exception {
    File out = tempFolder.newFile("rows.tsv");
    Map<String, String> row = new HashMap<>();
    row.put("b", "2");
    try (TSVWriter writer = new TSVWriter(Arrays.asList("a", "b"))) {
      writer.open(out);
      writer.append(Collections.singletonList(row));
      assertEquals(1, writer.getRowCount());
    }

    TableParser parser = new TableParser();
    parser.parse(out);
    assertEquals(Arrays.asList("a", "b"), parser.getHeader());
    assertEquals("", parser.getResults().get(0).get("a"));
    assertEquals("2", parser.getResults().get(0).get("b"));
  }

  @Test(expected = IllegalStateException.class)
  public void testTsvWriterMustBeOpened() throws Exception {
    new TSVWriter(Collections.singletonList("a")).append(new HashMap<String, String>());
  }
}
