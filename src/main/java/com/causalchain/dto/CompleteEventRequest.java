package com.causalchain.dto;

import lombok.Data;

@Data
public class CompleteEventRequest {

    // both optional; a message marks the event as failed
    public String errorType;
    public String errorMessage;
}
