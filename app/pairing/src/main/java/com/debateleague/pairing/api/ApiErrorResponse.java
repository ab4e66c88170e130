/*
 * どこで: Pairing API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 例外ハンドリング時のレスポンス形状を統一するため
 */
package com.debateleague.pairing.api;

public record ApiErrorResponse(String code, String message) {}
