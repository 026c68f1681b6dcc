package io.linkup.matchmaking.delivery;

import io.linkup.matchmaking.presence.SessionChannel;

/** 接続報告を受けたセッションの輸送路を組み立てる。 */
public interface SessionChannelFactory {

  SessionChannel open(String userId, String sessionId);
}
