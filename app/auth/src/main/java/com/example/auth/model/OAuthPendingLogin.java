/*
 * どこで: app/auth/src/main/java/com/example/auth/model/OAuthPendingLogin.java
 * 何を: ログイン開始時に発行した state と対象プロバイダの組
 * なぜ: callback で CSRF/replay 検証を行うためにセッションへ一度だけ保存するため
 */
package com.example.auth.model;

public record OAuthPendingLogin(String state, String providerName) {}
