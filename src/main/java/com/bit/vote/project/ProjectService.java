package com.bit.vote.project;

import com.bit.vote.common.Address;
import com.bit.vote.database.DbOperation;
import com.bit.vote.structure.project.Project;

/**
 * 项目注册表：项目元数据、生命周期标志、投票总额
 */
public interface ProjectService {

    /**
     * 创建项目 仅管理员
     * @param startTime 开始时间（epoch秒）必须晚于当前时间
     * @param duration 投票时长（秒）必须大于0
     * @return 新项目ID
     */
    long createProject(Address caller, String name, String description, long startTime, long duration);

    /**
     * @return 项目副本 修改副本不影响存储
     */
    Project getProject(long id);

    long getTotalProjects();

    /**
     * 生成保存项目的写操作 由调用方放进自己的事务
     */
    DbOperation stageSave(Project project);

    /**
     * 事务提交后清掉缓存
     */
    void evict(long id);
}
