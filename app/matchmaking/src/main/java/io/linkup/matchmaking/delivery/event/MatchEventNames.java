/*
 * どこで: Matchmaking 配信
 * 何を: クライアントへ送るイベント名を定義する
 */
package io.linkup.matchmaking.delivery.event;

public final class MatchEventNames {

  public static final String FOUND = "match:found";
  public static final String PEER_ACCEPTED = "match:peer_accepted";
  public static final String CONFIRMED = "match:confirmed";
  public static final String REJECTED = "match:rejected";
  public static final String EXPIRED = "match:expired";
  public static final String SEARCHING = "match:searching";

  private MatchEventNames() {}
}
