package com.deepknow.callbot.api.response;

import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class RespondResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String sessionId;
    private String decision;    // answer | handoff
    private String reply;
    private List<String> citations;
}
