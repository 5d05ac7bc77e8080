package com.bit.sigmos.blockchain;

/**
 * 区块/知识转移被拒绝的原因，拒绝后不会自动重试
 */
public enum RejectReason {
    /** 区块高度不是当前高度+1 */
    STALE_INDEX,
    /** 父哈希不匹配，或线上哈希与重新计算的不一致 */
    HASH_MISMATCH,
    /** 难度目标不符合调整规则，或哈希未达到有效阈值 */
    DIFFICULTY_NOT_MET,
    /** 知识转移非法或重复 */
    INVALID_TRANSACTION,
    /** 时间戳早于父区块或超前本地时钟过多 */
    NON_MONOTONIC_TIMESTAMP
}
