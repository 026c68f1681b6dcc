package io.linkup.matchmaking.delivery;

/**
 * 役割: ユーザーのライブ接続へイベントを届ける。
 * 動作: fire-and-forget。オフラインや送信失敗はドメインエラーにならない。
 */
public interface MatchEventDelivery {

  void deliver(String userId, String eventName, Object payload);
}
