package com.ospicorp.precorsia.raster;

import com.ospicorp.precorsia.correlation.service.QualityFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lets the acquisition side drop retrieved images into the raster store before a run.
 */
@RestController
@RequestMapping("/v1/rasters")
@Validated
@Tag(name = "Rasters")
public class RasterController {
  private static final Logger log = LoggerFactory.getLogger(RasterController.class);
  private static final String RASTER_ID_REGEX = "^[A-Za-z0-9_.-]{1,128}$";

  private final RasterStore store;

  public RasterController(RasterStore store) {
    this.store = store;
  }

  @PutMapping(value = "/{id}",
      consumes = {MediaType.IMAGE_PNG_VALUE, MediaType.APPLICATION_OCTET_STREAM_VALUE})
  @Operation(summary = "Store a raster", description = "Decodes the image to 8-bit grayscale and stores it under the id.")
  public ResponseEntity<Map<String, Object>> put(@PathVariable @Pattern(regexp = RASTER_ID_REGEX)
      @Parameter(description = "Acquisition id", example = "20190101T000000_T34") String id,
      @RequestBody byte[] body) {
    Raster raster = PngRasterCodec.decode(id, body);
    store.put(id, raster);
    log.info("Stored raster {} ({}x{})", id, raster.width(), raster.height());
    return ResponseEntity.ok(Map.of(
        "id", id,
        "width", raster.width(),
        "height", raster.height(),
        "zero_fraction", QualityFilter.zeroFraction(raster)));
  }

  @GetMapping(value = "/{id}", produces = MediaType.IMAGE_PNG_VALUE)
  @Operation(summary = "Fetch a raster as grayscale PNG")
  public ResponseEntity<byte[]> get(@PathVariable @Pattern(regexp = RASTER_ID_REGEX) String id) {
    return ResponseEntity.ok()
        .contentType(MediaType.IMAGE_PNG)
        .body(PngRasterCodec.encode(store.get(id)));
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete a raster")
  public ResponseEntity<Void> delete(@PathVariable @Pattern(regexp = RASTER_ID_REGEX) String id) {
    return store.delete(id) ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }
}
