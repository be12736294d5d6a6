package com.bit.vote.support;

import com.bit.vote.common.Address;
import com.bit.vote.config.SystemConfig;
import com.bit.vote.database.DataBase;
import com.bit.vote.database.memory.MemoryDb;
import com.bit.vote.event.EventService;
import com.bit.vote.event.EventServiceImpl;
import com.bit.vote.event.VotingEvent;
import com.bit.vote.ledger.TokenLedger;
import com.bit.vote.ledger.impl.TokenLedgerImpl;
import com.bit.vote.project.ProjectService;
import com.bit.vote.project.impl.ProjectServiceImpl;
import com.bit.vote.staking.StakingService;
import com.bit.vote.staking.impl.StakingServiceImpl;
import com.bit.vote.voting.ReentrancyGuard;
import com.bit.vote.voting.VotingService;
import com.bit.vote.voting.impl.VotingServiceImpl;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 不启动Spring 手工装配一套内存引擎
 */
public class Engine {

    public static final Address ADMIN = Address.ofSeed("admin");
    public static final Address VAULT = Address.ofSeed("vault");

    public final MutableClock clock;
    public final DataBase dataBase = new MemoryDb();
    public final SystemConfig config = new SystemConfig();
    public final ReentrancyGuard guard = new ReentrancyGuard();
    public final List<Object> published = new CopyOnWriteArrayList<>();
    public final EventService eventService;
    public final TokenLedgerImpl token;
    public final ProjectService projectService;
    public final StakingService stakingService;
    public final VotingService votingService;

    public Engine(long now) {
        this(now, 2, tokenLedger -> tokenLedger);
    }

    public Engine(long now, Function<TokenLedger, TokenLedger> ledgerWrapper) {
        this(now, 2, ledgerWrapper);
    }

    /**
     * @param ledgerWrapper 可替换投票引擎使用的账本 用于模拟恶意或失败的账本
     */
    public Engine(long now, long winnerMultiplier, Function<TokenLedger, TokenLedger> ledgerWrapper) {
        clock = new MutableClock(now);
        config.setAdmin(ADMIN.toBase58());
        config.setVault(VAULT.toBase58());
        config.setWinnerMultiplier(winnerMultiplier);
        dataBase.createDatabase(config);
        eventService = new EventServiceImpl(dataBase, new ObjectMapper(), published::add);
        token = new TokenLedgerImpl(dataBase, ADMIN, VAULT);
        projectService = new ProjectServiceImpl(dataBase, eventService, guard, clock, ADMIN, config);
        stakingService = new StakingServiceImpl(dataBase);
        votingService = new VotingServiceImpl(projectService, stakingService, ledgerWrapper.apply(token),
                eventService, dataBase, guard, clock, ADMIN, config);
    }

    /**
     * 增发并授权金库
     */
    public void fund(Address who, long amount) {
        token.mint(ADMIN, who, amount);
        token.approve(who, VAULT, amount);
    }

    public long createProject(long startTime, long duration) {
        return projectService.createProject(ADMIN, "p", "d", startTime, duration);
    }

    public List<VotingEvent> events() {
        return eventService.list(1, 1000);
    }
}
