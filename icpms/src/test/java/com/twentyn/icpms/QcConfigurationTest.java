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

import org.junit.Test;

import java.io.File;
import java.io.IOException;

import static org.junit.Assert.assertEquals;

public class QcConfigurationTest {

  @Test
  public void testDefaults() {
    QcConfiguration configuration = new QcConfiguration();
    assertEquals("BLANK", configuration.getBlankMarker());
    assertEquals("ICV", configuration.getCalibrationVerificationMarker());
    assertEquals("ICB", configuration.getCalibrationBlankMarker());
    assertEquals("SRM_", configuration.getReferenceMaterialPrefix());
    assertEquals("DUP", configuration.getDuplicateMarker());
    assertEquals("Conc.", configuration.getUnitLabelSentinel());
    assertEquals(90.0, configuration.getCalibrationLow(), 0.0);
    assertEquals(110.0, configuration.getCalibrationHigh(), 0.0);
    assertEquals(80.0, configuration.getReferenceLow(), 0.0);
    assertEquals(120.0, configuration.getReferenceHigh(), 0.0);
    assertEquals(3.0, configuration.getDetectionLimitMultiplier(), 0.0);
    assertEquals(1.0, configuration.getDefaultDilutionFactor(), 0.0);
    assertEquals(1000.0, configuration.getReferenceUnitMultiplier(), 0.0);
    assertEquals(1000.0, configuration.getPpmDivisor(), 0.0);
  }

  @Test
  public void testOverridesKeepOtherDefaults() throws Exception {
    QcConfiguration configuration =
        QcConfiguration.readFromFile(new File(getClass().getResource("/qc_override.json").toURI()));
    assertEquals("BLK", configuration.getBlankMarker());
    assertEquals(95.0, configuration.getCalibrationLow(), 0.0);
    assertEquals(110.0, configuration.getCalibrationHigh(), 0.0);
    assertEquals("ICV", configuration.getCalibrationVerificationMarker());
  }

  @Test(expected = IOException.class)
  public void testMissingFile() throws Exception {
    QcConfiguration.readFromFile(new File("does-not-exist.json"));
  }
}
