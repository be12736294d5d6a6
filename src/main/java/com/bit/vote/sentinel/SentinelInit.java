package com.bit.vote.sentinel;

import com.alibaba.csp.sentinel.init.InitFunc;
import com.alibaba.csp.sentinel.slots.block.RuleConstant;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRule;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRuleManager;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Sentinel 启动时通过 SPI 找到 InitFunc 实现并调用 init()
 * 见 META-INF/services/com.alibaba.csp.sentinel.init.InitFunc
 */
@Slf4j
public class SentinelInit implements InitFunc {

    public static final String VOTE_RESOURCE = "votingApi:vote";
    public static final String UNSTAKE_RESOURCE = "votingApi:unstake";

    @Override
    public void init() throws Exception {
        initFlowRules();
        log.info("initFlowRules");
    }

    // 限流规则：限制写接口的 QPS
    private void initFlowRules() {
        List<FlowRule> rules = new ArrayList<>();

        FlowRule voteRule = new FlowRule();
        voteRule.setResource(VOTE_RESOURCE); // 资源名与 @SentinelResource 的 value 一致
        voteRule.setGrade(RuleConstant.FLOW_GRADE_QPS);
        voteRule.setCount(500);
        rules.add(voteRule);

        FlowRule unstakeRule = new FlowRule();
        unstakeRule.setResource(UNSTAKE_RESOURCE);
        unstakeRule.setGrade(RuleConstant.FLOW_GRADE_QPS);
        unstakeRule.setCount(200);
        rules.add(unstakeRule);

        FlowRuleManager.loadRules(rules);
    }
}
