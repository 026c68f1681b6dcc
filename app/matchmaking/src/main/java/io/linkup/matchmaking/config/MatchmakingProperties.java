/*
 * どこで: Matchmaking 設定
 * 何を: sweep/proposal/delivery/retention のドメイン設定を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package io.linkup.matchmaking.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "matchmaking")
public record MatchmakingProperties(
    @Positive int batchSize,
    @NotNull Duration sweepInterval,
    @NotNull Duration proposalTtl,
    boolean autoRequeueOnRejection,
    @Positive int matchLimitPerSweep,
    boolean sweepEnabled,
    @NotNull Duration deliveryTimeout,
    @NotNull Duration terminalRetention,
    @NotNull Duration retentionInterval,
    @Positive int lockStripes,
    @NotNull Duration requeueExclusion) {}
