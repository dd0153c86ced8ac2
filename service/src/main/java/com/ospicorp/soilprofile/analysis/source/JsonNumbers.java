package com.ospicorp.soilprofile.analysis.source;

import com.fasterxml.jackson.databind.JsonNode;

final class JsonNumbers {
  private JsonNumbers() {
  }

  /**
   * Reads a finite number from a numeric or numeric-text node; anything else is absent.
   */
  static Double read(JsonNode node) {
    if (node == null) {
      return null;
    }
    double value;
    if (node.isNumber()) {
      value = node.doubleValue();
    } else if (node.isTextual()) {
      try {
        value = Double.parseDouble(node.textValue().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    } else {
      return null;
    }
    return Double.isFinite(value) ? value : null;
  }
}
