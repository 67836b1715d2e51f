/*
 * どこで: app/auth/src/main/java/com/example/auth/model/OAuthProviderDefinition.java
 * 何を: プロバイダごとのエンドポイント/スコープ/プロフィール属性名
 * なぜ: プロバイダ追加を分岐追加ではなくテーブル追加で済ませるため
 */
package com.example.auth.model;

public record OAuthProviderDefinition(
    String name,
    String authorizeUrl,
    String tokenUrl,
    String profileUrl,
    String scope,
    String subjectAttribute,
    String emailAttribute,
    String displayNameAttribute) {}
