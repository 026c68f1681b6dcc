/*
 * どこで: Presence
 * 何を: 1 セッションへイベントを送る輸送路を抽象化する
 * なぜ: ソケットを保持するゲートウェイの実装に依存しないため
 */
package io.linkup.matchmaking.presence;

public interface SessionChannel {

  /** 失敗時は RuntimeException を投げる。呼び出し側で配信失敗として扱う。 */
  void send(String eventName, Object payload);
}
