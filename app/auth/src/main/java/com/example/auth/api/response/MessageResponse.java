package com.example.auth.api.response;

public record MessageResponse(String message) {}
