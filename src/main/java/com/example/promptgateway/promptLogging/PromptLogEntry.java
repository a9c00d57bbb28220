package com.example.promptgateway.promptLogging;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
class PromptLogEntry {
    private String model;
    private String endpoint;
    private String promptRaw;
    private String response;
    private long timestamp;
}
