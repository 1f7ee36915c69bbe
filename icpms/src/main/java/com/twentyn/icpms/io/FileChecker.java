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

import java.io.File;
import java.io.IOException;

/**
 * Up-front checks on batch inputs and the report directory, so a bad path fails before any processing starts.
 */
public class FileChecker {

  public static void verifyInputFile(File inputFile) throws IOException {
    if (!inputFile.exists()) {
      throw new IOException(String.format("Batch input %s does not exist", inputFile.getAbsolutePath()));
    }
    if (inputFile.isDirectory()) {
      throw new IOException(String.format("Batch input %s is a directory, expected a table file",
          inputFile.getAbsolutePath()));
    }
    if (!inputFile.canRead()) {
      throw new IOException(String.format("Batch input %s is not readable", inputFile.getAbsolutePath()));
    }
  }

  public static void verifyOrCreateDirectory(File directory) throws IOException {
    if (!directory.exists() && !directory.mkdirs()) {
      throw new IOException(String.format("Unable to create report directory %s", directory.getAbsolutePath()));
    }
    if (!directory.isDirectory()) {
      throw new IOException(String.format("Report path %s is not a directory", directory.getAbsolutePath()));
    }
  }
}
