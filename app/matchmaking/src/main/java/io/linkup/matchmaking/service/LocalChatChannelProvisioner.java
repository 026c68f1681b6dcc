/*
 * どこで: Matchmaking サービス層
 * 何を: proposal id からチャットルーム id を決める既定実装
 * なぜ: チャットサービス未接続でも成立通知に渡す id を確定させるため
 */
package io.linkup.matchmaking.service;

import io.linkup.matchmaking.model.ProposalSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalChatChannelProvisioner implements ChatChannelProvisioner {

  private static final Logger logger = LoggerFactory.getLogger(LocalChatChannelProvisioner.class);
  private static final String CHANNEL_PREFIX = "match_";

  @Override
  public String provision(ProposalSnapshot proposal) {
    final String channelId = CHANNEL_PREFIX + proposal.proposalId();
    logger.info(
        "chat channel provisioned proposalId={} channelId={} participants={}",
        proposal.proposalId(),
        channelId,
        proposal.participants());
    return channelId;
  }
}
