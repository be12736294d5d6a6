package com.bit.vote.ledger.impl;

import com.bit.vote.common.Address;
import com.bit.vote.database.DataBase;
import com.bit.vote.database.DbOperation;
import com.bit.vote.database.TableEnum;
import com.bit.vote.exception.ErrorType;
import com.bit.vote.exception.VotingException;
import com.bit.vote.ledger.TokenLedger;
import com.bit.vote.ledger.TokenService;
import com.bit.vote.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 默认账本实现 余额与授权存在KV库中 每次变更一个事务提交
 */
@Slf4j
@Service
public class TokenLedgerImpl implements TokenLedger, TokenService {

    static final byte[] TOTAL_SUPPLY_KEY = "total_supply".getBytes(StandardCharsets.UTF_8);

    private final DataBase dataBase;
    private final Address admin;
    private final Address vault;
    private final ReentrantLock lock = new ReentrantLock();

    public TokenLedgerImpl(DataBase dataBase,
                           @Qualifier("adminAddress") Address admin,
                           @Qualifier("vaultAddress") Address vault) {
        this.dataBase = dataBase;
        this.admin = admin;
        this.vault = vault;
    }

    //region TokenLedger

    @Override
    public boolean debit(Address from, long amount) {
        if (amount <= 0) {
            return false;
        }
        lock.lock();
        try {
            boolean ok = move(vault, from, vault, amount);
            if (!ok) {
                log.warn("扣款失败 from={} amount={} 授权={} 余额={}",
                        from, amount, allowance(from, vault), balanceOf(from));
            }
            return ok;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean credit(Address to, long amount) {
        if (amount <= 0) {
            return false;
        }
        lock.lock();
        try {
            boolean ok = move(null, vault, to, amount);
            if (!ok) {
                log.warn("金库余额不足 to={} amount={} 金库余额={}", to, amount, balanceOf(vault));
            }
            return ok;
        } finally {
            lock.unlock();
        }
    }

    //endregion

    //region TokenService

    @Override
    public void mint(Address caller, Address to, long amount) {
        if (!admin.equals(caller)) {
            log.warn("非管理员尝试增发 caller={}", caller);
            throw new VotingException(ErrorType.UNAUTHORIZED, "mint");
        }
        requirePositive(amount);
        lock.lock();
        try {
            long newBalance = addExact(balanceOf(to), amount);
            long newSupply = addExact(totalSupply(), amount);
            List<DbOperation> ops = new ArrayList<>(2);
            ops.add(DbOperation.put(TableEnum.BALANCE, to.toBytes(), ByteUtils.longToBytes(newBalance)));
            ops.add(DbOperation.put(TableEnum.META, TOTAL_SUPPLY_KEY, ByteUtils.longToBytes(newSupply)));
            commit(ops);
            log.info("增发 to={} amount={} 总量={}", to, amount, newSupply);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void transfer(Address from, Address to, long amount) {
        requirePositive(amount);
        lock.lock();
        try {
            if (!move(null, from, to, amount)) {
                throw new VotingException(ErrorType.INSUFFICIENT_BALANCE, "from=" + from + " amount=" + amount);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void approve(Address owner, Address spender, long amount) {
        if (amount < 0) {
            throw new VotingException(ErrorType.INVALID_ARGUMENT, "授权额度不能为负数");
        }
        lock.lock();
        try {
            commit(List.of(DbOperation.put(TableEnum.ALLOWANCE, allowanceKey(owner, spender), ByteUtils.longToBytes(amount))));
            log.info("授权 owner={} spender={} amount={}", owner, spender, amount);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void transferFrom(Address spender, Address from, Address to, long amount) {
        requirePositive(amount);
        lock.lock();
        try {
            if (allowance(from, spender) < amount) {
                throw new VotingException(ErrorType.INSUFFICIENT_ALLOWANCE, "from=" + from + " spender=" + spender);
            }
            if (!move(spender, from, to, amount)) {
                throw new VotingException(ErrorType.INSUFFICIENT_BALANCE, "from=" + from + " amount=" + amount);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long balanceOf(Address owner) {
        byte[] bytes = dataBase.get(TableEnum.BALANCE, owner.toBytes());
        return bytes == null ? 0 : ByteUtils.bytesToLong(bytes);
    }

    @Override
    public long allowance(Address owner, Address spender) {
        byte[] bytes = dataBase.get(TableEnum.ALLOWANCE, allowanceKey(owner, spender));
        return bytes == null ? 0 : ByteUtils.bytesToLong(bytes);
    }

    @Override
    public long totalSupply() {
        byte[] bytes = dataBase.get(TableEnum.META, TOTAL_SUPPLY_KEY);
        return bytes == null ? 0 : ByteUtils.bytesToLong(bytes);
    }

    //endregion

    /**
     * 转账核心 调用方持有锁
     * @param spender 不为null时按授权转账并扣减授权额度
     * @return 余额或授权不足返回false 不写任何数据
     */
    private boolean move(Address spender, Address from, Address to, long amount) {
        long fromBalance = balanceOf(from);
        if (fromBalance < amount) {
            return false;
        }
        List<DbOperation> ops = new ArrayList<>(3);
        if (spender != null) {
            long allowed = allowance(from, spender);
            if (allowed < amount) {
                return false;
            }
            ops.add(DbOperation.put(TableEnum.ALLOWANCE, allowanceKey(from, spender), ByteUtils.longToBytes(allowed - amount)));
        }
        if (from.equals(to)) {
            // 自转账只消耗授权
            commit(ops);
            return true;
        }
        long toBalance = addExact(balanceOf(to), amount);
        ops.add(DbOperation.put(TableEnum.BALANCE, from.toBytes(), ByteUtils.longToBytes(fromBalance - amount)));
        ops.add(DbOperation.put(TableEnum.BALANCE, to.toBytes(), ByteUtils.longToBytes(toBalance)));
        commit(ops);
        log.debug("转账 from={} to={} amount={}", from, to, amount);
        return true;
    }

    private void commit(List<DbOperation> ops) {
        if (ops.isEmpty()) {
            return;
        }
        if (!dataBase.dataTransaction(ops)) {
            throw new IllegalStateException("账本事务提交失败");
        }
    }

    private static byte[] allowanceKey(Address owner, Address spender) {
        return ByteUtils.compositeKey(owner.toBytes(), spender.toBytes());
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new VotingException(ErrorType.INVALID_ARGUMENT, "金额必须大于0");
        }
    }

    private static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new VotingException(ErrorType.AMOUNT_OVERFLOW, a + " + " + b, e);
        }
    }
}
