/*
 * どこで: Draft API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 指名拒否コードと例外由来のエラーを同じ形で返すため
 */
package com.example.draft.api;

public record ApiErrorResponse(String code, String message) {}
