package com.ospicorp.precorsia.correlation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.precorsia.config.PrecorsiaProperties;
import com.ospicorp.precorsia.correlation.model.CorrelationReport;
import com.ospicorp.precorsia.correlation.model.StudyInfo;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes reports as JSON into the report directory, one file per comparable dataset, study
 * site and period.
 */
@Component
public class CorrelationReportWriter {
  private static final Logger log = LoggerFactory.getLogger(CorrelationReportWriter.class);

  private final ObjectMapper mapper;
  private final Path directory;

  public CorrelationReportWriter(ObjectMapper mapper, PrecorsiaProperties properties) {
    this.mapper = mapper;
    this.directory = properties.report().directory();
  }

  public CorrelationReport write(CorrelationReport report, String comparableDataset) {
    String fileName = fileName(comparableDataset, report.study());
    CorrelationReport named = report.withFileName(fileName);
    Path target = directory.resolve(fileName);
    try {
      Files.createDirectories(directory);
      mapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), named);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write correlation report " + target, e);
    }
    log.info("Wrote correlation report {}", target.toAbsolutePath());
    return named;
  }

  static String fileName(String comparableDataset, StudyInfo study) {
    StringJoiner name = new StringJoiner("_", "corr_list_", ".json");
    name.add(sanitize(comparableDataset));
    if (study != null) {
      if (study.climate() != null && !study.climate().isBlank()) {
        name.add(sanitize(study.climate()));
      }
      name.add(String.valueOf(study.longitude()));
      name.add(String.valueOf(study.latitude()));
      if (study.startDate() != null) {
        name.add(study.startDate().toString());
      }
      name.add(String.valueOf(study.days()));
    }
    return name.toString();
  }

  private static String sanitize(String part) {
    return part.replace('/', '_').replace('\\', '_').replace(' ', '_');
  }
}
