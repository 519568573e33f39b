package com.beobachter.paper.service.governance;

import com.beobachter.paper.config.PaperTradingProperties;
import com.beobachter.paper.governance.GovernanceBounds;
import com.beobachter.paper.governance.GovernedParameter;
import com.beobachter.paper.governance.RiskParameters;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GovernanceBoundsLoaderTest {

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  @TempDir
  Path dir;

  @Test
  void loadsBoundsKeyedByParameter() throws IOException {
    Path file = write("""
        {
          "kelly-fraction": { "min": 0.05, "max": 0.50, "step": 0.05 },
          "averaging-max-additions": { "min": 0, "max": 3, "step": 1 }
        }
        """);

    GovernanceBounds bounds = loader(file, null).load();

    assertThat(bounds.asMap()).containsOnlyKeys(
        GovernedParameter.KELLY_FRACTION, GovernedParameter.AVERAGING_MAX_ADDITIONS);
    assertThat(bounds.asMap().get(GovernedParameter.KELLY_FRACTION).max()).isEqualByComparingTo("0.50");
  }

  @Test
  void clampsConfiguredValuesAndCountsEachClamp() throws IOException {
    Path file = write("""
        { "kelly-fraction": { "min": 0.05, "max": 0.50, "step": 0.05 },
          "max-exposure-fraction": { "min": 0.01, "max": 0.25, "step": 0.01 } }
        """);
    PaperTradingProperties.Sizing sizing = new PaperTradingProperties.Sizing(0.9, 0.10, null, null);

    RiskParameters parameters = loader(file, sizing).resolve();

    assertThat(parameters.sizing().kellyFraction()).isEqualTo(0.5);
    assertThat(parameters.sizing().maxExposureFraction()).isEqualTo(0.10);
    assertThat(meterRegistry.get("paper.governance.clamped").tag("parameter", "kelly-fraction")
        .counter().count()).isEqualTo(1.0);
    assertThat(meterRegistry.find("paper.governance.clamped").tag("parameter", "max-exposure-fraction")
        .counter()).isNull();
  }

  @Test
  void missingFileMeansUnbounded() {
    GovernanceBounds bounds = loader(dir.resolve("absent.json"), null).load();

    assertThat(bounds.asMap()).isEmpty();
  }

  @Test
  void unknownParameterFailsTheLoad() throws IOException {
    Path file = write("""
        { "leverage": { "min": 1, "max": 2, "step": 1 } }
        """);

    assertThatThrownBy(() -> loader(file, null).load())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("leverage");
  }

  @Test
  void invertedBoundFailsTheLoad() throws IOException {
    Path file = write("""
        { "min-edge": { "min": 0.20, "max": 0.01, "step": 0.01 } }
        """);

    assertThatThrownBy(() -> loader(file, null).load())
        .isInstanceOf(UncheckedIOException.class);
  }

  private Path write(String json) throws IOException {
    Path file = dir.resolve("bounds.json");
    Files.writeString(file, json);
    return file;
  }

  private GovernanceBoundsLoader loader(Path file, PaperTradingProperties.Sizing sizing) {
    PaperTradingProperties properties = new PaperTradingProperties(null, sizing, null, null, null, null, null, null,
        null, new PaperTradingProperties.Governance(file.toUri().toString()));
    return new GovernanceBoundsLoader(properties, new DefaultResourceLoader(), new ObjectMapper(), meterRegistry);
  }
}
