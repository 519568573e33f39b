package com.beobachter.paper.service.governance;

import com.beobachter.paper.config.PaperTradingProperties;
import com.beobachter.paper.governance.GovernanceBounds;
import com.beobachter.paper.governance.GovernedParameter;
import com.beobachter.paper.governance.ParameterBound;
import com.beobachter.paper.governance.RiskParameters;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the governance bounds file and resolves the clamped {@link RiskParameters}.
 *
 * <p>The file is a JSON object keyed by parameter ({@code "kelly-fraction"}) with
 * {@code min}, {@code max} and {@code step} values. A missing file means no bounds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GovernanceBoundsLoader {

  private static final TypeReference<LinkedHashMap<String, ParameterBound>> BOUNDS_TYPE = new TypeReference<>() {
  };

  private final @NonNull PaperTradingProperties properties;
  private final @NonNull ResourceLoader resourceLoader;
  private final @NonNull ObjectMapper objectMapper;
  private final @NonNull MeterRegistry meterRegistry;

  public GovernanceBounds load() {
    String location = properties.governance().boundsPath();
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      log.warn("governance bounds not found at {}, parameters are unbounded", location);
      return GovernanceBounds.unbounded();
    }

    Map<String, ParameterBound> raw;
    try (InputStream in = resource.getInputStream()) {
      raw = objectMapper.readValue(in, BOUNDS_TYPE);
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read governance bounds " + location, e);
    }

    Map<GovernedParameter, ParameterBound> bounds = new EnumMap<>(GovernedParameter.class);
    if (raw != null) {
      raw.forEach((key, bound) -> {
        if (bound == null) {
          return;
        }
        bounds.put(GovernedParameter.fromKey(key), bound);
      });
    }
    log.info("governance bounds loaded from {}: {} parameters bounded", location, bounds.size());
    return new GovernanceBounds(bounds);
  }

  /**
   * Loads the bounds and applies them to the configured risk parameters.
   */
  public RiskParameters resolve() {
    return RiskParameters.resolve(properties, load(), this::onClamp);
  }

  void onClamp(GovernedParameter parameter, double requested, double applied) {
    log.warn("governance bound applied to {}: requested={} applied={}", parameter.key(), requested, applied);
    Counter.builder("paper.governance.clamped")
        .description("Configured values clamped into governance bounds")
        .tag("parameter", parameter.key())
        .register(meterRegistry)
        .increment();
  }
}
