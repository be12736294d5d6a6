package com.bit.vote.event;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class TokensUnstakedEvent extends VotingEvent {
    private String participant;
    private long payout;
    private boolean winner;

    public TokensUnstakedEvent(long projectId, String participant, long payout, boolean winner, long timestamp) {
        setProjectId(projectId);
        setTimestamp(timestamp);
        this.participant = participant;
        this.payout = payout;
        this.winner = winner;
    }
}
