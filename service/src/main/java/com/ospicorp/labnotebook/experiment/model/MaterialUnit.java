package com.ospicorp.labnotebook.experiment.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MaterialUnit {
  G("g"),
  KG("kg");

  private final String symbol;

  MaterialUnit(String symbol) {
    this.symbol = symbol;
  }

  @JsonValue
  public String symbol() {
    return symbol;
  }

  @JsonCreator
  public static MaterialUnit fromSymbol(String symbol) {
    for (MaterialUnit unit : values()) {
      if (unit.symbol.equals(symbol)) {
        return unit;
      }
    }
    throw new IllegalArgumentException("Unsupported unit " + symbol + ". Supported values: g,kg.");
  }
}
