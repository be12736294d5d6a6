package com.bit.vote.event;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ProjectFinalizedEvent extends VotingEvent {
    private String winner;
    private long totalVotes;

    public ProjectFinalizedEvent(long projectId, String winner, long totalVotes, long timestamp) {
        setProjectId(projectId);
        setTimestamp(timestamp);
        this.winner = winner;
        this.totalVotes = totalVotes;
    }
}
