package io.linkup.matchmaking.service;

import io.linkup.matchmaking.model.ProposalSnapshot;

/** 成立した proposal の参加者用チャットチャネルを作成し、その id を返す。 */
public interface ChatChannelProvisioner {

  String provision(ProposalSnapshot proposal);
}
