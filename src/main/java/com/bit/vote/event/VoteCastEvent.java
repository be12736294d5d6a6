package com.bit.vote.event;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class VoteCastEvent extends VotingEvent {
    private String voter;
    private long amount;

    public VoteCastEvent(long projectId, String voter, long amount, long timestamp) {
        setProjectId(projectId);
        setTimestamp(timestamp);
        this.voter = voter;
        this.amount = amount;
    }
}
