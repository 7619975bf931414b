package com.causalchain.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class AddEventRequest {

    public String type;
    public String description;
    public Map<String, Object> context;
    public String severity;
    public List<String> tags;
    public Object data;
    public String parentEventId; // optional
}
