package com.bit.vote.structure.dto;

import lombok.Data;

@Data
public class StakeDTO {
    private long projectId;
    private String participant;
    private long amount;
    private long lastStakeTime;
    private boolean hasUnstaked;
    private long unstakeable;
}
