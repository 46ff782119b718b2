package com.ospicorp.precorsia.config;

import com.ospicorp.precorsia.raster.FileSystemRasterStore;
import com.ospicorp.precorsia.raster.InMemoryRasterStore;
import com.ospicorp.precorsia.raster.RasterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RasterStoreConfig {
  private static final Logger log = LoggerFactory.getLogger(RasterStoreConfig.class);

  @Bean
  RasterStore rasterStore(PrecorsiaProperties properties) {
    PrecorsiaProperties.RasterSettings raster = properties.raster();
    if (raster.store() == PrecorsiaProperties.StoreType.MEMORY) {
      log.info("Using in-memory raster store; rasters are lost on shutdown");
      return new InMemoryRasterStore();
    }
    return new FileSystemRasterStore(raster.directory());
  }
}
