package com.enterprise.jobqueue.inspector;

import java.nio.charset.StandardCharsets;

final class PayloadPreview {
    
    static final int MAX_LENGTH = 100;
    
    private PayloadPreview() {
    }
    
    static String of(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return "";
        }
        String text = new String(payload, StandardCharsets.UTF_8);
        if (text.length() <= MAX_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_LENGTH) + "...";
    }
}
