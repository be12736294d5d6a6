package com.bit.vote.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

/**
 * 链下索引使用的事件 每个成功的写操作恰好产生一个
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProjectCreatedEvent.class, name = "ProjectCreated"),
        @JsonSubTypes.Type(value = VoteCastEvent.class, name = "VoteCast"),
        @JsonSubTypes.Type(value = ProjectFinalizedEvent.class, name = "ProjectFinalized"),
        @JsonSubTypes.Type(value = TokensUnstakedEvent.class, name = "TokensUnstaked")
})
public abstract class VotingEvent {
    /**
     * 事件序号 由事件存储分配
     */
    private long sequence;
    private long projectId;
    private long timestamp;//epoch秒
}
