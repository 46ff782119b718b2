package com.ospicorp.precorsia.config;

import com.ospicorp.precorsia.correlation.model.enums.CompositeWeighting;
import com.ospicorp.precorsia.correlation.model.enums.GapFillScope;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "precorsia")
public record PrecorsiaProperties(
    @DefaultValue RasterSettings raster,
    @DefaultValue ReportSettings report,
    @DefaultValue Defaults defaults
) {

  public enum StoreType { FILESYSTEM, MEMORY }

  public record RasterSettings(
      @DefaultValue("./buffer") Path directory,
      @DefaultValue("filesystem") StoreType store
  ) {}

  public record ReportSettings(@DefaultValue("./data") Path directory) {}

  public record Defaults(
      @DefaultValue("5") int roundFactor,
      @DefaultValue("0.33") double discardThreshold,
      @DefaultValue("3") int bestCount,
      @DefaultValue("exact") CompositeWeighting compositeWeighting,
      @DefaultValue("series") GapFillScope gapFillScope
  ) {}
}
