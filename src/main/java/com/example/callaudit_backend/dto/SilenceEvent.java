package com.example.callaudit_backend.dto;

public record SilenceEvent(long startMs, long endMs) {
}
