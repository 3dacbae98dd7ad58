package com.aura.shared;

public record HydrationLog(long id, long timestamp, int amountMl) {
}
