package com.scholary.converthub.api;

import com.scholary.converthub.conversion.ConversionService;
import com.scholary.converthub.converter.ConversionResult;
import com.scholary.converthub.converter.ConverterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for single-file conversions.
 *
 * <p>The async endpoint returns a task id tracked by the progress API; the sync endpoint waits
 * for the converted file's URL.
 */
@RestController
@RequestMapping("/api/convert")
@Tag(name = "Conversion", description = "Convert one file")
public class ConversionController {

  private final ConversionService conversionService;
  private final ConverterRegistry registry;

  public ConversionController(ConversionService conversionService, ConverterRegistry registry) {
    this.conversionService = conversionService;
    this.registry = registry;
  }

  @PostMapping(path = "/{operation}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Start a tracked conversion",
      description = "Returns a task id; poll /api/progress/{taskId} for progress and the result.")
  public ResponseEntity<AsyncJobResponse> submit(
      @PathVariable String operation,
      @RequestParam("file") MultipartFile file,
      @RequestParam Map<String, String> params)
      throws IOException {
    String taskId =
        conversionService.submit(
            filenameOf(file), file.getBytes(), operation, BatchController.toOptions(params));
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new AsyncJobResponse(taskId, "/api/progress/" + taskId));
  }

  @PostMapping(path = "/{operation}/sync", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(summary = "Convert a file and wait for the result")
  public ResponseEntity<ConversionResult> convert(
      @PathVariable String operation,
      @RequestParam("file") MultipartFile file,
      @RequestParam Map<String, String> params)
      throws IOException {
    return ResponseEntity.ok(
        conversionService.convert(
            filenameOf(file), file.getBytes(), operation, BatchController.toOptions(params)));
  }

  @GetMapping("/operations")
  @Operation(summary = "List supported conversion operations")
  public ResponseEntity<List<String>> operations() {
    return ResponseEntity.ok(List.copyOf(registry.operations()));
  }

  private static String filenameOf(MultipartFile file) {
    String filename = file.getOriginalFilename();
    return filename == null || filename.isBlank() ? "upload" : filename;
  }
}
