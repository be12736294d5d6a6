package com.bit.vote.staking;

import com.bit.vote.common.Address;
import com.bit.vote.database.DbOperation;
import com.bit.vote.structure.stake.StakeRecord;

import java.util.List;

/**
 * 质押记录存储
 * 质押记录：项目ID+地址 -> 记录
 * 投票人序列：项目ID+序号 -> 地址 只追加 顺序即首次投票顺序
 * 参与者汇总：地址 -> 跨项目质押总额（只做展示，不参与校验）
 */
public interface StakingService {

    /**
     * 没有记录时返回金额为0的空记录
     */
    StakeRecord getStake(long projectId, Address participant);

    long getTotalStaked(Address participant);

    Address getVoter(long projectId, int index);

    /**
     * 按首次投票顺序返回
     */
    List<Address> getVoters(long projectId);

    DbOperation stageStake(long projectId, Address participant, StakeRecord record);

    DbOperation stageVoter(long projectId, int index, Address participant);

    DbOperation stageTotalStaked(Address participant, long totalStaked);
}
