package com.example.draft.model;

public enum Position {
  QB,
  RB,
  WR,
  TE;

  public static Position fromValue(String position) {
    for (Position value : values()) {
      if (value.name().equalsIgnoreCase(position)) {
        return value;
      }
    }
    throw new IllegalArgumentException("unsupported position: " + position);
  }
}
