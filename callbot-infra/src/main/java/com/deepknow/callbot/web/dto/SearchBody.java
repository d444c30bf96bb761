package com.deepknow.callbot.web.dto;

import lombok.Data;

@Data
public class SearchBody {
    private String text;
    private Integer topK;
    private Double minScore;
}
