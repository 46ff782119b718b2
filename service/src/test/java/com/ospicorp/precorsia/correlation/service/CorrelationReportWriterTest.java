package com.ospicorp.precorsia.correlation.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.precorsia.correlation.model.StudyInfo;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class CorrelationReportWriterTest {

  @Test
  void fileNameFlattensDatasetPath() {
    assertEquals("corr_list_MODIS_006_MOD13Q1.json",
        CorrelationReportWriter.fileName("MODIS/006/MOD13Q1", null));
  }

  @Test
  void fileNameAppendsStudyContext() {
    StudyInfo study = new StudyInfo("BWh", -5.5d, 31.25d, LocalDate.of(2020, 6, 1), 365);
    assertEquals("corr_list_MODIS_006_MOD13Q1_BWh_-5.5_31.25_2020-06-01_365.json",
        CorrelationReportWriter.fileName("MODIS/006/MOD13Q1", study));
  }

  @Test
  void fileNameSkipsBlankClimate() {
    StudyInfo study = new StudyInfo(" ", 1d, 2d, null, 0);
    assertEquals("corr_list_X_1.0_2.0_0.json", CorrelationReportWriter.fileName("X", study));
  }
}
