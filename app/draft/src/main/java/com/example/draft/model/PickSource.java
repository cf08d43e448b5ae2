/*
 * どこで: Draft ドメインモデル
 * 何を: 自動指名で選手を決めた優先ソースを定義する
 * なぜ: queue / custom ranking / ADP のどれが効いたかを記録と集計に残すため
 */
package com.example.draft.model;

public enum PickSource {
  QUEUE("queue"),
  CUSTOM_RANKING("custom_ranking"),
  ADP("adp");

  private final String value;

  PickSource(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static PickSource fromValue(String source) {
    for (PickSource pickSource : values()) {
      if (pickSource.value.equalsIgnoreCase(source)) {
        return pickSource;
      }
    }
    throw new IllegalArgumentException("unsupported pick source: " + source);
  }
}
