package com.ai.scheduling.dto;

public record ControlState(boolean stopped, int queueEntriesChanged, int windowsChanged, String message) {
}
