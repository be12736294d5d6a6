package com.bit.vote.exception;

public enum ErrorType {
    NOT_FOUND(404, "项目不存在"),
    INVALID_SCHEDULE(4001, "投票时间窗口非法（开始时间必须晚于当前时间，时长必须大于0）"),
    PROJECT_NOT_ACTIVE(4002, "项目未激活"),
    PROJECT_ALREADY_FINALIZED(4003, "项目已结算"),
    INVALID_VOTING_PERIOD(4004, "不在允许的时间窗口内"),
    INSUFFICIENT_ALLOWANCE(4005, "授权额度或余额不足，扣款失败"),
    INSUFFICIENT_BALANCE(4006, "余额不足"),
    NO_VOTES_CAST(4007, "没有有效投票"),
    ALREADY_UNSTAKED(4008, "已经取回过质押"),
    PROJECT_NOT_FINALIZED(4009, "项目尚未结算"),
    UNAUTHORIZED(510, "无权限，仅管理员可调用"),
    REENTRANT_CALL(4010, "重入调用被拒绝"),
    PAYOUT_FAILED(4011, "质押返还转账失败"),
    AMOUNT_OVERFLOW(4012, "金额溢出"),
    INVALID_ARGUMENT(400, "参数非法");

    private final int code;
    private final String desc;

    ErrorType(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}
