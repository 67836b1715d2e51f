/*
 * どこで: app/auth/src/main/java/com/example/auth/model/OAuthProfile.java
 * 何を: プロバイダのプロフィール応答から抽出した主要属性
 * なぜ: HTTP 応答形式とアカウント同定処理を分離してテストしやすくするため
 */
package com.example.auth.model;

public record OAuthProfile(String subjectId, String email, String displayName) {}
