package com.acme.pipeline.domain;

import static org.assertj.core.api.Assertions.*;

import com.acme.pipeline.core.Jsons;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClassificationResultTest {

  @Test
  @DisplayName("reads the ML service response and ignores extra fields")
  void readsServiceResponse() {
    ClassificationResult result =
        Jsons.fromJson(
            "{\"classification\":\"invoice\",\"confidence\":0.93,\"model\":\"v2\"}",
            ClassificationResult.class);

    assertThat(result.classification()).isEqualTo("invoice");
    assertThat(result.confidence()).isEqualTo(0.93f);
  }

  @Test
  @DisplayName("accepts confidence bounds 0.0 and 1.0")
  void acceptsBounds() {
    assertThat(new ClassificationResult("contract", 0.0f).confidence()).isZero();
    assertThat(new ClassificationResult("contract", 1.0f).confidence()).isEqualTo(1.0f);
  }

  @Test
  @DisplayName("rejects confidence outside [0, 1] and NaN")
  void rejectsOutOfRange() {
    assertThatThrownBy(() -> new ClassificationResult("invoice", 1.01f))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Confidence");
    assertThatThrownBy(() -> new ClassificationResult("invoice", -0.1f))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ClassificationResult("invoice", Float.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("rejects a blank label")
  void rejectsBlankLabel() {
    assertThatThrownBy(() -> new ClassificationResult(" ", 0.5f))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
