package com.example.promptstudio.billing;

public record CheckoutSession(String sessionId, String url) {
}
