package com.bit.vote.ledger;

import com.bit.vote.common.Address;

/**
 * 同质化代币账本 余额的唯一数据源
 */
public interface TokenService {

    /**
     * 增发 仅管理员 用于给参与者与奖励池注资
     */
    void mint(Address caller, Address to, long amount);

    void transfer(Address from, Address to, long amount);

    /**
     * 覆盖式设置授权额度
     */
    void approve(Address owner, Address spender, long amount);

    void transferFrom(Address spender, Address from, Address to, long amount);

    long balanceOf(Address owner);

    long allowance(Address owner, Address spender);

    long totalSupply();
}
