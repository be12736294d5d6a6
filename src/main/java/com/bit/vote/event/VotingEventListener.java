package com.bit.vote.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class VotingEventListener {

    @EventListener
    public void onProjectCreated(ProjectCreatedEvent event) {
        log.info("[事件#{}] 项目创建 id={} name={} 窗口=[{}, {}]",
                event.getSequence(), event.getProjectId(), event.getName(), event.getStartTime(), event.getEndTime());
    }

    @EventListener
    public void onVoteCast(VoteCastEvent event) {
        log.info("[事件#{}] 投票 项目={} 投票人={} 金额={}",
                event.getSequence(), event.getProjectId(), event.getVoter(), event.getAmount());
    }

    @EventListener
    public void onProjectFinalized(ProjectFinalizedEvent event) {
        log.info("[事件#{}] 项目结算 项目={} 获胜者={} 总票数={}",
                event.getSequence(), event.getProjectId(), event.getWinner(), event.getTotalVotes());
    }

    @EventListener
    public void onTokensUnstaked(TokensUnstakedEvent event) {
        log.info("[事件#{}] 取回质押 项目={} 参与者={} 返还={} 获胜者={}",
                event.getSequence(), event.getProjectId(), event.getParticipant(), event.getPayout(), event.isWinner());
    }
}
