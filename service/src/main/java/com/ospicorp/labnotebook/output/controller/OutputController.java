package com.ospicorp.labnotebook.output.controller;

import com.ospicorp.labnotebook.output.model.OutputReport;
import com.ospicorp.labnotebook.output.service.OutputReportService;
import com.ospicorp.labnotebook.web.InvalidParameterException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/output")
@Tag(name = "Output")
public class OutputController {
  static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");
  static final int INVALID_FORMAT = 1001;

  private final OutputReportService svc;

  public OutputController(OutputReportService svc) {
    this.svc = svc;
  }

  @GetMapping
  @Operation(summary = "Output report",
      description = "Included result fields per experiment, with summary statistics for quantitative fields.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Report",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = OutputReport.class))),
      @ApiResponse(responseCode = "404", description = "Project not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public OutputReport report(@PathVariable long projectId) {
    return svc.report(projectId);
  }

  @GetMapping("/rows")
  @Operation(summary = "Output rows", description = "The report rows only, as JSON or CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Rows",
          content = {
              @Content(mediaType = "application/json"),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Unsupported format",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "404", description = "Project not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> rows(@PathVariable long projectId,
      @RequestParam(name = "format", required = false)
          @Parameter(description = "json or csv; overrides the Accept header", example = "csv") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    OutputReport report = svc.report(projectId);
    return ResponseEntity.ok()
        .contentType(contentType)
        .body(report.rows());
  }

  static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("format", "Invalid format value. Supported values: json,csv.",
          INVALID_FORMAT);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes;
    try {
      mediaTypes = MediaType.parseMediaTypes(accept);
    } catch (IllegalArgumentException ex) {
      return MediaType.APPLICATION_JSON;
    }
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
