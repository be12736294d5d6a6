package com.bit.vote.staking.impl;

import com.bit.vote.common.Address;
import com.bit.vote.database.DataBase;
import com.bit.vote.database.DbOperation;
import com.bit.vote.database.TableEnum;
import com.bit.vote.staking.StakingService;
import com.bit.vote.structure.stake.StakeRecord;
import com.bit.vote.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class StakingServiceImpl implements StakingService {

    private final DataBase dataBase;

    public StakingServiceImpl(DataBase dataBase) {
        this.dataBase = dataBase;
    }

    @Override
    public StakeRecord getStake(long projectId, Address participant) {
        byte[] bytes = dataBase.get(TableEnum.STAKE, stakeKey(projectId, participant));
        return bytes == null ? StakeRecord.empty() : StakeRecord.deserialize(bytes);
    }

    @Override
    public long getTotalStaked(Address participant) {
        byte[] bytes = dataBase.get(TableEnum.PARTICIPANT, participant.toBytes());
        return bytes == null ? 0 : ByteUtils.bytesToLong(bytes);
    }

    @Override
    public Address getVoter(long projectId, int index) {
        byte[] bytes = dataBase.get(TableEnum.VOTER, ByteUtils.indexKey(projectId, index));
        if (bytes == null) {
            throw new IllegalStateException("投票人序列缺失 project=" + projectId + " index=" + index);
        }
        return Address.fromBytes(bytes);
    }

    @Override
    public List<Address> getVoters(long projectId) {
        List<DataBase.KeyValue> rows = dataBase.rangeQuery(TableEnum.VOTER,
                ByteUtils.longToBytes(projectId), ByteUtils.longToBytes(projectId + 1));
        List<Address> voters = new ArrayList<>(rows.size());
        for (DataBase.KeyValue row : rows) {
            voters.add(Address.fromBytes(row.getValue()));
        }
        log.debug("项目{}投票人数: {}", projectId, voters.size());
        return voters;
    }

    @Override
    public DbOperation stageStake(long projectId, Address participant, StakeRecord record) {
        return DbOperation.put(TableEnum.STAKE, stakeKey(projectId, participant), record.serialize());
    }

    @Override
    public DbOperation stageVoter(long projectId, int index, Address participant) {
        return DbOperation.put(TableEnum.VOTER, ByteUtils.indexKey(projectId, index), participant.toBytes());
    }

    @Override
    public DbOperation stageTotalStaked(Address participant, long totalStaked) {
        return DbOperation.put(TableEnum.PARTICIPANT, participant.toBytes(), ByteUtils.longToBytes(totalStaked));
    }

    private static byte[] stakeKey(long projectId, Address participant) {
        return ByteUtils.compositeKey(projectId, participant.toBytes());
    }
}
