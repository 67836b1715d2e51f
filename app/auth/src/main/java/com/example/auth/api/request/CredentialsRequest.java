/*
 * どこで: Auth API リクエスト DTO
 * 何を: POST /auth/register と /auth/login の入力を定義する
 * なぜ: 必須チェックをサービス層へ集約し、両 API で同じ形を受け付けるため
 */
package com.example.auth.api.request;

public record CredentialsRequest(String email, String password) {

  @Override
  public String toString() {
    return "CredentialsRequest[email=" + email + "]";
  }
}
