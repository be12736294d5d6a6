package com.bit.vote.event;

import com.bit.vote.database.DbOperation;

import java.util.List;

public interface EventService {

    /**
     * 为事件分配序号并生成写操作 与业务状态放在同一个事务里提交
     * @param event 待持久化事件
     * @return 事件行 + 序号计数器行
     */
    List<DbOperation> stage(VotingEvent event);

    /**
     * 事务提交之后发布给进程内监听者
     */
    void publish(VotingEvent event);

    /**
     * 按序号分页读取事件
     * @param fromSequence 起始序号（含）
     * @param limit 最大条数
     */
    List<VotingEvent> list(long fromSequence, int limit);

    long count();
}
