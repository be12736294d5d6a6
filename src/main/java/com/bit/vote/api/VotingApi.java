package com.bit.vote.api;

import com.alibaba.csp.sentinel.annotation.SentinelResource;
import com.alibaba.csp.sentinel.slots.block.BlockException;
import com.bit.vote.aop.annotation.PermissionsAnnotation;
import com.bit.vote.common.Address;
import com.bit.vote.result.Result;
import com.bit.vote.sentinel.SentinelInit;
import com.bit.vote.structure.dto.StakeDTO;
import com.bit.vote.structure.stake.StakeRecord;
import com.bit.vote.voting.VotingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/voting")
public class VotingApi {

    @Autowired
    private VotingService votingService;

    // 投票 调用前需先 /token/approve 授权给金库
    @SentinelResource(value = SentinelInit.VOTE_RESOURCE, blockHandler = "voteBlockHandler")
    @PostMapping("/vote")
    public Result<String> vote(@RequestParam("caller") String caller,
                               @RequestParam("projectId") long projectId,
                               @RequestParam("amount") long amount) {
        votingService.vote(Address.fromBase58(caller), projectId, amount);
        return Result.OK("投票成功", caller);
    }

    public Result<String> voteBlockHandler(String caller, long projectId, long amount, BlockException e) {
        log.info("投票接口限流 caller={} project={}", caller, projectId);
        return Result.busy("系统繁忙，请稍后重试（已触发限流）");
    }

    // 结算 仅管理员
    @PermissionsAnnotation
    @PostMapping("/finalize")
    public Result<String> finalizeProject(@RequestParam("caller") String caller,
                                          @RequestParam("projectId") long projectId) {
        Address winner = votingService.finalizeProject(Address.fromBase58(caller), projectId);
        return Result.OK(winner == null ? null : winner.toBase58());
    }

    @SentinelResource(value = SentinelInit.UNSTAKE_RESOURCE, blockHandler = "unstakeBlockHandler")
    @PostMapping("/unstake")
    public Result<Long> unstake(@RequestParam("caller") String caller,
                                @RequestParam("projectId") long projectId) {
        return Result.OK(votingService.unstakeTokens(Address.fromBase58(caller), projectId));
    }

    public Result<Long> unstakeBlockHandler(String caller, long projectId, BlockException e) {
        log.info("取回接口限流 caller={} project={}", caller, projectId);
        return Result.busy("系统繁忙，请稍后重试（已触发限流）");
    }

    @GetMapping("/unstakeable")
    public Result<Long> unstakeable(@RequestParam("projectId") long projectId,
                                    @RequestParam("participant") String participant) {
        return Result.OK(votingService.getUnstakeableBalance(projectId, Address.fromBase58(participant)));
    }

    @GetMapping("/stake")
    public Result<StakeDTO> stake(@RequestParam("projectId") long projectId,
                                  @RequestParam("participant") String participant) {
        Address address = Address.fromBase58(participant);
        StakeRecord record = votingService.getStake(projectId, address);
        StakeDTO dto = new StakeDTO();
        dto.setProjectId(projectId);
        dto.setParticipant(address.toBase58());
        dto.setAmount(record.getAmount());
        dto.setLastStakeTime(record.getLastStakeTime());
        dto.setHasUnstaked(record.isHasUnstaked());
        dto.setUnstakeable(votingService.getUnstakeableBalance(projectId, address));
        return Result.OK(dto);
    }

    @GetMapping("/totalStaked")
    public Result<Long> totalStaked(@RequestParam("participant") String participant) {
        return Result.OK(votingService.getTotalStaked(Address.fromBase58(participant)));
    }
}
