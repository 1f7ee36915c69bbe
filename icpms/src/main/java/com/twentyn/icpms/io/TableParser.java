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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a table from delimited text or a spreadsheet into rows of strings.  The format is chosen by file extension:
 * .xlsx/.xls are read with POI (first sheet only), .tsv/.txt as tab-separated text, anything else as CSV.
 */
public class TableParser {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);
  public static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.withIgnoreEmptyLines(true);

  private static final String UTF8_BOM = "\uFEFF";

  private List<List<String>> rows = null;
  private List<String> header = null;
  private List<Map<String, String>> results = null;

  public void parse(File file) throws IOException {
    FileChecker.verifyInputFile(file);
    String name = file.getName().toLowerCase();
    if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
      parseRows(readSpreadsheet(file));
    } else {
      CSVFormat format = name.endsWith(".tsv") || name.endsWith(".txt") ? TSV_FORMAT : CSV_FORMAT;
      try (InputStream inStream = new FileInputStream(file)) {
        parse(inStream, format);
      }
    }
  }

  public void parse(InputStream inStream, CSVFormat format) throws IOException {
    List<List<String>> rows = new ArrayList<>();
    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), format)) {
      for (CSVRecord record : parser) {
        List<String> row = new ArrayList<>(record.size());
        for (String value : record) {
          row.add(value);
        }
        rows.add(row);
      }
    }
    parseRows(rows);
  }

  /**
   * Treats the first row as the header and maps every later row onto it.  Short rows are padded with empty strings;
   * for duplicate header names the leftmost column wins.
   */
  void parseRows(List<List<String>> rows) {
    if (!rows.isEmpty() && !rows.get(0).isEmpty()) {
      // Excel-exported CSVs often start with a byte order mark.
      rows.get(0).set(0, StringUtils.removeStart(rows.get(0).get(0), UTF8_BOM));
    }
    this.rows = rows;

    List<String> header = new ArrayList<>();
    if (!rows.isEmpty()) {
      for (String h : rows.get(0)) {
        header.add(StringUtils.trimToEmpty(h));
      }
    }
    this.header = header;

    List<Map<String, String>> results = new ArrayList<>(Math.max(rows.size() - 1, 0));
    for (int i = 1; i < rows.size(); i++) {
      List<String> row = rows.get(i);
      Map<String, String> map = new LinkedHashMap<>();
      for (int j = 0; j < header.size(); j++) {
        map.putIfAbsent(header.get(j), j < row.size() ? row.get(j) : "");
      }
      results.add(map);
    }
    this.results = results;
  }

  private List<List<String>> readSpreadsheet(File file) throws IOException {
    List<List<String>> rows = new ArrayList<>();
    try (Workbook workbook = WorkbookFactory.create(file)) {
      Sheet sheet = workbook.getSheetAt(0);
      DataFormatter formatter = new DataFormatter();
      FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
      for (int rowNum = 0; rowNum <= sheet.getLastRowNum(); rowNum++) {
        Row row = sheet.getRow(rowNum);
        if (row == null || row.getLastCellNum() <= 0) {
          continue;
        }
        List<String> values = new ArrayList<>(row.getLastCellNum());
        for (int cellNum = 0; cellNum < row.getLastCellNum(); cellNum++) {
          Cell cell = row.getCell(cellNum);
          values.add(cell == null ? "" : cellText(cell, formatter, evaluator));
        }
        rows.add(values);
      }
    }
    return rows;
  }

  /**
   * Numeric cells, including formulas with a numeric result, are rendered from their stored value rather than their
   * display format so a cell styled "0.0" does not round the number.  Dates and text go through the formatter.
   */
  static String cellText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
    CellType type = cell.getCellType() == CellType.FORMULA ? evaluator.evaluateFormulaCell(cell) : cell.getCellType();
    if (type == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
      return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
    }
    return formatter.formatCellValue(cell, evaluator);
  }

  /**
   * @return every row of the file, header included, exactly as read.
   */
  public List<List<String>> getRows() {
    return this.rows;
  }

  public List<String> getHeader() {
    return this.header;
  }

  public List<Map<String, String>> getResults() {
    return this.results;
  }

  public Map<String, Integer> getHeaderMap() {
    Map<String, Integer> headerMap = new HashMap<>();
    for (int i = 0; i < header.size(); i++) {
      headerMap.putIfAbsent(header.get(i), i);
    }
    return headerMap;
  }

  /**
   * Finds the first header matching any of the candidate names, ignoring case.
   * @return the header as it appears in the file, or null if none matches.
   */
  public String findColumn(String... candidates) {
    for (String candidate : candidates) {
      for (String h : header) {
        if (h.equalsIgnoreCase(candidate)) {
          return h;
        }
      }
    }
    return null;
  }
}
