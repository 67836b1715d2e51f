package com.example.auth.service;

/** Salted slow hash. The salt travels inside the digest. */
public interface CredentialHasher {

  String hash(String secret);

  boolean verify(String secret, String digest);
}
