package com.ospicorp.precorsia.correlation.controller;

import com.ospicorp.precorsia.config.CsvHttpMessageConverter;
import com.ospicorp.precorsia.correlation.model.CorrelationPoint;
import com.ospicorp.precorsia.correlation.model.CorrelationReport;
import com.ospicorp.precorsia.correlation.model.CorrelationRequest;
import com.ospicorp.precorsia.correlation.model.PointRow;
import com.ospicorp.precorsia.correlation.service.CorrelationPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/correlations")
@Validated
@Tag(name = "Correlation")
public class CorrelationController {
  private static final String ERROR_DOCS_BASE = "https://docs.precorsia.dev/errors/";

  private final CorrelationPipeline pipeline;

  public CorrelationController(CorrelationPipeline pipeline) {
    this.pipeline = pipeline;
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Run a correlation study",
      description = "Matches both acquisition lists in time, filters and gap-fills the stored "
          + "rasters, reduces each shared bucket to one point per series and searches the lag "
          + "with the highest Pearson correlation.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Correlation report",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = CorrelationReport.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Not enough overlapping data",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> run(@Valid @RequestBody CorrelationRequest request,
      @RequestParam(name = "format", required = false)
          @Parameter(description = "Response format: json (report) or csv (reduced points)") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    CorrelationReport report = pipeline.run(request);
    if (contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
      return ResponseEntity.ok().contentType(contentType).body(rows(report));
    }
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(report);
  }

  static List<PointRow> rows(CorrelationReport report) {
    List<PointRow> rows = new ArrayList<>(report.points().size());
    for (int i = 0; i < report.points().size(); i++) {
      CorrelationPoint point = report.points().get(i);
      rows.add(new PointRow(report.correlationList().get(i).bucket(), point.valueA(),
          point.valueB()));
    }
    return rows;
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.",
          2001, ERROR_DOCS_BASE + 2001);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    for (MediaType mediaType : MediaType.parseMediaTypes(accept)) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.equalsTypeAndSubtype(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
