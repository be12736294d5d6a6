package com.bit.vote.ledger;

import com.bit.vote.common.Address;

/**
 * 投票引擎对代币账本的最小依赖
 * 两个方法都不会部分生效：返回false时余额与授权均未改变
 */
public interface TokenLedger {

    /**
     * 从参与者扣款到金库 需要参与者事先给金库足够的授权额度
     * @param from 参与者
     * @param amount 金额
     * @return 授权或余额不足时返回false
     */
    boolean debit(Address from, long amount);

    /**
     * 从金库转账给参与者
     * @param to 收款人
     * @param amount 金额
     * @return 金库余额不足时返回false
     */
    boolean credit(Address to, long amount);
}
