package com.swathtrace.processor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swathtrace.processor.cast.CastProcessor;
import com.swathtrace.processor.cast.InlineCastCodec;
import com.swathtrace.processor.cast.SvpCastReader;
import com.swathtrace.processor.raytrace.RayTracer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the stateless correction building blocks from the bound {@link ProcessorProperties}. */
@Configuration
public class SvCorrectionConfig {

  @Bean
  public CastProcessor castProcessor(ProcessorProperties properties) {
    return new CastProcessor(properties.cast());
  }

  @Bean
  public RayTracer rayTracer(ProcessorProperties properties) {
    return new RayTracer(properties.rayTrace());
  }

  @Bean
  public SvpCastReader svpCastReader() {
    return new SvpCastReader();
  }

  @Bean
  public InlineCastCodec inlineCastCodec(ObjectMapper objectMapper) {
    return new InlineCastCodec(objectMapper);
  }
}
