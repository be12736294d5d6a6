package com.bit.vote.structure.dto;

import lombok.Data;

@Data
public class CreateProjectReq {
    private String caller;
    private String name;
    private String description;
    private long startTime;//epoch秒
    private long duration;//秒
}
