package com.bit.vote.ledger;

import com.bit.vote.common.Address;
import com.bit.vote.exception.ErrorType;
import com.bit.vote.exception.VotingException;
import com.bit.vote.ledger.impl.TokenLedgerImpl;
import com.bit.vote.support.Engine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenLedgerImplTest {

    private static final Address ALICE = Address.ofSeed("alice");
    private static final Address BOB = Address.ofSeed("bob");

    private TokenLedgerImpl token;

    @BeforeEach
    void setUp() {
        token = new Engine(0).token;
        token.mint(Engine.ADMIN, ALICE, 1_000);
    }

    @Test
    void mintOnlyByAdmin() {
        VotingException e = assertThrows(VotingException.class, () -> token.mint(ALICE, ALICE, 1));
        assertEquals(ErrorType.UNAUTHORIZED, e.getErrorType());
        assertEquals(1_000, token.totalSupply());
        assertEquals(1_000, token.balanceOf(ALICE));
    }

    @Test
    void transferMovesBalance() {
        token.transfer(ALICE, BOB, 300);
        assertEquals(700, token.balanceOf(ALICE));
        assertEquals(300, token.balanceOf(BOB));

        VotingException e = assertThrows(VotingException.class, () -> token.transfer(BOB, ALICE, 301));
        assertEquals(ErrorType.INSUFFICIENT_BALANCE, e.getErrorType());
        assertEquals(300, token.balanceOf(BOB));
    }

    @Test
    void transferFromConsumesAllowance() {
        token.approve(ALICE, BOB, 400);
        token.transferFrom(BOB, ALICE, BOB, 150);
        assertEquals(250, token.allowance(ALICE, BOB));
        assertEquals(150, token.balanceOf(BOB));

        VotingException e = assertThrows(VotingException.class, () -> token.transferFrom(BOB, ALICE, BOB, 251));
        assertEquals(ErrorType.INSUFFICIENT_ALLOWANCE, e.getErrorType());
    }

    @Test
    void debitNeedsVaultAllowance() {
        assertFalse(token.debit(ALICE, 10));
        token.approve(ALICE, Engine.VAULT, 100);
        assertTrue(token.debit(ALICE, 60));
        assertEquals(40, token.allowance(ALICE, Engine.VAULT));
        assertEquals(60, token.balanceOf(Engine.VAULT));
        // 授权够但余额不足时不改动任何数据
        token.approve(ALICE, Engine.VAULT, 5_000);
        assertFalse(token.debit(ALICE, 2_000));
        assertEquals(5_000, token.allowance(ALICE, Engine.VAULT));
        assertEquals(940, token.balanceOf(ALICE));
    }

    @Test
    void creditLimitedByVaultBalance() {
        token.approve(ALICE, Engine.VAULT, 100);
        token.debit(ALICE, 100);
        assertFalse(token.credit(BOB, 101));
        assertTrue(token.credit(BOB, 100));
        assertEquals(100, token.balanceOf(BOB));
        assertEquals(0, token.balanceOf(Engine.VAULT));
        assertFalse(token.credit(BOB, 0));
    }

    @Test
    void invalidAmounts() {
        assertEquals(ErrorType.INVALID_ARGUMENT,
                assertThrows(VotingException.class, () -> token.transfer(ALICE, BOB, 0)).getErrorType());
        assertEquals(ErrorType.INVALID_ARGUMENT,
                assertThrows(VotingException.class, () -> token.approve(ALICE, BOB, -1)).getErrorType());
        assertEquals(ErrorType.AMOUNT_OVERFLOW,
                assertThrows(VotingException.class, () -> token.mint(Engine.ADMIN, ALICE, Long.MAX_VALUE)).getErrorType());
    }
}
