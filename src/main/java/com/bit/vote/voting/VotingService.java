package com.bit.vote.voting;

import com.bit.vote.common.Address;
import com.bit.vote.structure.stake.StakeRecord;

/**
 * 投票引擎：投票、结算、取回质押
 */
public interface VotingService {

    /**
     * 向项目投票（质押）
     * 窗口 [startTime, endTime] 含两端；先从账本扣款，扣款失败不改任何状态
     * @param caller 投票人
     * @param amount 金额 必须大于0
     */
    void vote(Address caller, long projectId, long amount);

    /**
     * 结算项目 仅管理员 只能成功一次
     * 获胜者为质押额严格最大者，并列时取先投票者
     * @return 获胜者
     */
    Address finalizeProject(Address caller, long projectId);

    /**
     * 结算后取回质押 获胜者按倍数返还，其余原额返还
     * @return 实际返还金额
     */
    long unstakeTokens(Address caller, long projectId);

    /**
     * 与 unstakeTokens 实际返还额一致 不可取回时返回0
     */
    long getUnstakeableBalance(long projectId, Address participant);

    StakeRecord getStake(long projectId, Address participant);

    long getTotalStaked(Address participant);
}
