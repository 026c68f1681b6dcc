/*
 * どこで: Matchmaking ドメインモデル
 * 何を: 検索時に指定できる相手カテゴリを定義する
 */
package io.linkup.matchmaking.model;

public enum MatchPreference {
  DATING("dating"),
  FRIENDSHIP("friendship");

  private final String value;

  MatchPreference(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: API で受け取った preference 文字列を内部列挙型へ変換する。
   * 動作: null/空文字は未指定として null を返し、未対応値は IllegalArgumentException を送出する。
   */
  public static MatchPreference fromValue(String preference) {
    if (preference == null || preference.isBlank()) {
      return null;
    }
    for (MatchPreference matchPreference : values()) {
      if (matchPreference.value.equalsIgnoreCase(preference.trim())) {
        return matchPreference;
      }
    }
    throw new IllegalArgumentException("unsupported preference: " + preference);
  }

  /** 未指定は誰とでも一致し、双方指定時は同一カテゴリのみ一致する。 */
  public static boolean compatible(MatchPreference first, MatchPreference second) {
    return first == null || second == null || first == second;
  }
}
