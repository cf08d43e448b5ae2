package com.example.draft.model;

public enum TimerUrgency {
  NORMAL,
  WARNING,
  CRITICAL
}
