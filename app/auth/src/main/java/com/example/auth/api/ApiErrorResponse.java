/*
 * どこで: Auth API 層
 * 何を: API エラー応答の共通 DTO
 * なぜ: 失敗理由を code で機械的に判定できるようにするため
 */
package com.example.auth.api;

public record ApiErrorResponse(String code, String message) {}
