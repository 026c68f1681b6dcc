/*
 * どこで: Matchmaking API
 * 何を: エラー応答の標準フォーマットを定義する
 */
package io.linkup.matchmaking.api;

public record ApiErrorResponse(String code, String message) {}
