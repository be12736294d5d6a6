package com.bit.vote.structure.project;

/**
 * 项目生命周期状态（由标志位与当前时间推导，不单独存储）
 */
public enum ProjectStatus {
    /** 已创建，投票尚未开始 */
    CREATED,
    /** 投票窗口内 */
    VOTING,
    /** 投票窗口已过，等待管理员结算 */
    ENDED,
    /** 已结算：获胜者已确定，可取回质押 */
    FINALIZED,
    /** 已停用但未结算 */
    DEACTIVATED;

    public static ProjectStatus resolve(Project project, long now) {
        if (project.isFinalized()) {
            return FINALIZED;
        }
        if (!project.isActive()) {
            return DEACTIVATED;
        }
        if (now < project.getStartTime()) {
            return CREATED;
        }
        if (now <= project.getEndTime()) {
            return VOTING;
        }
        return ENDED;
    }
}
