package com.bit.vote.event;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ProjectCreatedEvent extends VotingEvent {
    private String name;
    private long startTime;
    private long endTime;

    public ProjectCreatedEvent(long projectId, String name, long startTime, long endTime, long timestamp) {
        setProjectId(projectId);
        setTimestamp(timestamp);
        this.name = name;
        this.startTime = startTime;
        this.endTime = endTime;
    }
}
