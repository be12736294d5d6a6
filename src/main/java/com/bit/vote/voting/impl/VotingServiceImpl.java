package com.bit.vote.voting.impl;

import com.bit.vote.common.Address;
import com.bit.vote.config.SystemConfig;
import com.bit.vote.database.DataBase;
import com.bit.vote.database.DbOperation;
import com.bit.vote.event.EventService;
import com.bit.vote.event.ProjectFinalizedEvent;
import com.bit.vote.event.TokensUnstakedEvent;
import com.bit.vote.event.VoteCastEvent;
import com.bit.vote.exception.ErrorType;
import com.bit.vote.exception.VotingException;
import com.bit.vote.ledger.TokenLedger;
import com.bit.vote.project.ProjectService;
import com.bit.vote.staking.StakingService;
import com.bit.vote.structure.project.Project;
import com.bit.vote.structure.stake.StakeRecord;
import com.bit.vote.voting.ReentrancyGuard;
import com.bit.vote.voting.VotingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 职责：
 * 投票：校验窗口 -> 账本扣款 -> 一个事务写入质押记录、投票人序列、项目总额、参与者汇总、事件；
 * 结算：单次遍历投票人序列，质押额严格大于当前最大值才替换获胜者；
 * 取回：先标记已取回并扣减汇总（提交），再调用账本返还；返还失败则恢复记录，成功后才写事件。
 * 所有写操作经 ReentrancyGuard 串行，账本回调重入直接失败。
 */
@Slf4j
@Service
public class VotingServiceImpl implements VotingService {

    private final ProjectService projectService;
    private final StakingService stakingService;
    private final TokenLedger tokenLedger;
    private final EventService eventService;
    private final DataBase dataBase;
    private final ReentrancyGuard guard;
    private final Clock clock;
    private final Address admin;
    private final long winnerMultiplier;

    public VotingServiceImpl(ProjectService projectService,
                             StakingService stakingService,
                             TokenLedger tokenLedger,
                             EventService eventService,
                             DataBase dataBase,
                             ReentrancyGuard guard,
                             Clock clock,
                             @Qualifier("adminAddress") Address admin,
                             SystemConfig config) {
        this.projectService = projectService;
        this.stakingService = stakingService;
        this.tokenLedger = tokenLedger;
        this.eventService = eventService;
        this.dataBase = dataBase;
        this.guard = guard;
        this.clock = clock;
        this.admin = admin;
        this.winnerMultiplier = config.getWinnerMultiplier();
    }

    @Override
    public void vote(Address caller, long projectId, long amount) {
        VoteCastEvent event = guard.call("vote", () -> {
            long now = now();
            Project project = projectService.getProject(projectId);
            if (project.isFinalized()) {
                throw new VotingException(ErrorType.PROJECT_ALREADY_FINALIZED, "id=" + projectId);
            }
            if (!project.isActive()) {
                throw new VotingException(ErrorType.PROJECT_NOT_ACTIVE, "id=" + projectId);
            }
            if (now < project.getStartTime() || now > project.getEndTime()) {
                throw new VotingException(ErrorType.INVALID_VOTING_PERIOD,
                        "now=" + now + " 窗口=[" + project.getStartTime() + ", " + project.getEndTime() + "]");
            }
            if (amount <= 0) {
                throw new VotingException(ErrorType.NO_VOTES_CAST, "amount=" + amount);
            }

            // 先算出全部新状态 溢出在扣款前暴露
            StakeRecord stake = stakingService.getStake(projectId, caller);
            boolean firstStake = stake.getAmount() == 0;
            long newStakeAmount = addExact(stake.getAmount(), amount);
            // 质押额须能按获胜倍数支付 取回与查询时不会再溢出
            payoutOf(newStakeAmount, true);
            long newTotalVotes = addExact(project.getTotalVotes(), amount);
            long newTotalStaked = addExact(stakingService.getTotalStaked(caller), amount);

            if (!tokenLedger.debit(caller, amount)) {
                throw new VotingException(ErrorType.INSUFFICIENT_ALLOWANCE, "caller=" + caller + " amount=" + amount);
            }

            List<DbOperation> ops = new ArrayList<>();
            if (firstStake) {
                ops.add(stakingService.stageVoter(projectId, project.getVoterCount(), caller));
                project.setVoterCount(project.getVoterCount() + 1);
            }
            stake.setAmount(newStakeAmount);
            stake.setLastStakeTime(now);
            stake.setHasUnstaked(false);
            project.setTotalVotes(newTotalVotes);
            ops.add(stakingService.stageStake(projectId, caller, stake));
            ops.add(projectService.stageSave(project));
            ops.add(stakingService.stageTotalStaked(caller, newTotalStaked));
            VoteCastEvent cast = new VoteCastEvent(projectId, caller.toBase58(), amount, now);
            ops.addAll(eventService.stage(cast));
            if (!dataBase.dataTransaction(ops)) {
                // 扣款已发生 退回后再报错
                if (!tokenLedger.credit(caller, amount)) {
                    log.error("投票事务失败且退款失败 caller={} amount={}", caller, amount);
                }
                throw new IllegalStateException("投票事务提交失败 project=" + projectId);
            }
            projectService.evict(projectId);
            log.info("投票成功 project={} voter={} amount={} 累计={} 项目总票数={}",
                    projectId, caller, amount, newStakeAmount, newTotalVotes);
            return cast;
        });
        eventService.publish(event);
    }

    @Override
    public Address finalizeProject(Address caller, long projectId) {
        ProjectFinalizedEvent event = guard.call("finalizeProject", () -> {
            requireAdmin(caller, "finalizeProject");
            long now = now();
            Project project = projectService.getProject(projectId);
            if (project.isFinalized()) {
                throw new VotingException(ErrorType.PROJECT_ALREADY_FINALIZED, "id=" + projectId);
            }
            if (now <= project.getEndTime()) {
                throw new VotingException(ErrorType.INVALID_VOTING_PERIOD,
                        "投票尚未结束 now=" + now + " endTime=" + project.getEndTime());
            }
            if (project.getTotalVotes() == 0) {
                throw new VotingException(ErrorType.NO_VOTES_CAST, "id=" + projectId);
            }

            // 严格大于才替换 并列时保留先投票者
            Address currentWinner = null;
            long maxStake = 0;
            for (int i = 0; i < project.getVoterCount(); i++) {
                Address voter = stakingService.getVoter(projectId, i);
                long amount = stakingService.getStake(projectId, voter).getAmount();
                if (amount > maxStake) {
                    maxStake = amount;
                    currentWinner = voter;
                }
            }

            project.setActive(false);
            project.setFinalized(true);
            project.setWinner(currentWinner);

            ProjectFinalizedEvent finalized = new ProjectFinalizedEvent(projectId,
                    currentWinner == null ? null : currentWinner.toBase58(), project.getTotalVotes(), now);
            List<DbOperation> ops = new ArrayList<>();
            ops.add(projectService.stageSave(project));
            ops.addAll(eventService.stage(finalized));
            if (!dataBase.dataTransaction(ops)) {
                throw new IllegalStateException("结算事务提交失败 project=" + projectId);
            }
            projectService.evict(projectId);
            log.info("项目结算完成 project={} winner={} 质押={} 总票数={}",
                    projectId, currentWinner, maxStake, project.getTotalVotes());
            return finalized;
        });
        eventService.publish(event);
        return event.getWinner() == null ? null : Address.fromBase58(event.getWinner());
    }

    @Override
    public long unstakeTokens(Address caller, long projectId) {
        TokensUnstakedEvent event = guard.call("unstakeTokens", () -> {
            long now = now();
            Project project = projectService.getProject(projectId);
            if (!project.isFinalized()) {
                throw new VotingException(ErrorType.PROJECT_NOT_FINALIZED, "id=" + projectId);
            }
            if (now <= project.getEndTime()) {
                throw new VotingException(ErrorType.INVALID_VOTING_PERIOD,
                        "投票尚未结束 now=" + now + " endTime=" + project.getEndTime());
            }
            StakeRecord stake = stakingService.getStake(projectId, caller);
            if (stake.getAmount() == 0) {
                throw new VotingException(ErrorType.NO_VOTES_CAST, "caller=" + caller);
            }
            if (stake.isHasUnstaked()) {
                throw new VotingException(ErrorType.ALREADY_UNSTAKED, "caller=" + caller);
            }

            boolean isWinner = caller.equals(project.getWinner());
            long payout = payoutOf(stake.getAmount(), isWinner);
            long totalStaked = stakingService.getTotalStaked(caller);

            // 先落库再转账 回调重入时已是已取回状态
            StakeRecord unstaked = StakeRecord.deserialize(stake.serialize());
            unstaked.setHasUnstaked(true);
            List<DbOperation> effects = new ArrayList<>(2);
            effects.add(stakingService.stageStake(projectId, caller, unstaked));
            effects.add(stakingService.stageTotalStaked(caller, totalStaked - stake.getAmount()));
            if (!dataBase.dataTransaction(effects)) {
                throw new IllegalStateException("取回事务提交失败 project=" + projectId);
            }

            boolean paid;
            try {
                paid = tokenLedger.credit(caller, payout);
            } catch (RuntimeException e) {
                restore(projectId, caller, stake, totalStaked);
                throw e;
            }
            if (!paid) {
                restore(projectId, caller, stake, totalStaked);
                throw new VotingException(ErrorType.PAYOUT_FAILED, "caller=" + caller + " payout=" + payout);
            }

            // 返还成功后才写事件 索引方看不到未生效的取回
            TokensUnstakedEvent unstakedEvent = new TokensUnstakedEvent(projectId, caller.toBase58(), payout, isWinner, now);
            if (!dataBase.dataTransaction(eventService.stage(unstakedEvent))) {
                log.error("取回已到账但事件写入失败 project={} caller={} payout={}", projectId, caller, payout);
                throw new IllegalStateException("取回事件提交失败 project=" + projectId);
            }
            log.info("取回质押 project={} participant={} 本金={} 返还={} 获胜者={}",
                    projectId, caller, stake.getAmount(), payout, isWinner);
            return unstakedEvent;
        });
        eventService.publish(event);
        return event.getPayout();
    }

    @Override
    public long getUnstakeableBalance(long projectId, Address participant) {
        Project project = projectService.getProject(projectId);
        if (now() <= project.getEndTime() || !project.isFinalized()) {
            return 0;
        }
        StakeRecord stake = stakingService.getStake(projectId, participant);
        if (stake.isHasUnstaked() || stake.getAmount() == 0) {
            return 0;
        }
        return payoutOf(stake.getAmount(), participant.equals(project.getWinner()));
    }

    @Override
    public StakeRecord getStake(long projectId, Address participant) {
        projectService.getProject(projectId);
        return stakingService.getStake(projectId, participant);
    }

    @Override
    public long getTotalStaked(Address participant) {
        return stakingService.getTotalStaked(participant);
    }

    private long payoutOf(long amount, boolean isWinner) {
        if (!isWinner) {
            return amount;
        }
        try {
            return Math.multiplyExact(amount, winnerMultiplier);
        } catch (ArithmeticException e) {
            throw new VotingException(ErrorType.AMOUNT_OVERFLOW, amount + " x " + winnerMultiplier, e);
        }
    }

    /**
     * 返还失败时把质押记录、汇总写回原值
     */
    private void restore(long projectId, Address caller, StakeRecord original, long totalStaked) {
        List<DbOperation> ops = new ArrayList<>(2);
        ops.add(stakingService.stageStake(projectId, caller, original));
        ops.add(stakingService.stageTotalStaked(caller, totalStaked));
        if (!dataBase.dataTransaction(ops)) {
            log.error("取回回滚失败 project={} caller={}", projectId, caller);
            throw new IllegalStateException("取回回滚失败 project=" + projectId);
        }
        log.warn("返还失败，已恢复质押记录 project={} caller={}", projectId, caller);
    }

    private void requireAdmin(Address caller, String operation) {
        if (!admin.equals(caller)) {
            log.warn("非管理员尝试{} caller={}", operation, caller);
            throw new VotingException(ErrorType.UNAUTHORIZED, operation);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new VotingException(ErrorType.AMOUNT_OVERFLOW, a + " + " + b, e);
        }
    }
}
