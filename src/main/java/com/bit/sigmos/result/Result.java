package com.bit.sigmos.result;

import lombok.Data;

import java.io.Serializable;

/**
 * 节点接口统一返回数据格式
 * CLI层 / HTTP层 只消费该结构，退出码与提示文案由调用方决定
 */
@Data
public class Result<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int SC_OK_200 = 200;
    /** 区块或知识转移校验失败，不可自动重试 */
    public static final int SC_REJECTED_400 = 400;
    /** 目标身份、节点不存在 */
    public static final int SC_NOT_FOUND_404 = 404;
    /** 连接失败、超时 */
    public static final int SC_TRANSPORT_503 = 503;
    public static final int SC_INTERNAL_SERVER_ERROR_500 = 500;

    /**
     * 成功标志 true=成功，false=失败
     */
    private boolean success = true;

    /**
     * 返回处理消息
     */
    private String message = "";

    /**
     * 返回代码
     */
    private int code = 0;

    /**
     * 返回数据对象 data
     */
    private T data;

    /**
     * 时间戳
     */
    private long timestamp = System.currentTimeMillis();

    public static <T> Result<T> OK() {
        Result<T> r = new Result<>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        return r;
    }

    public static <T> Result<T> OK(T data) {
        Result<T> r = new Result<>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        r.setData(data);
        return r;
    }

    public static <T> Result<T> OK(String msg, T data) {
        Result<T> r = OK(data);
        r.setMessage(msg);
        return r;
    }

    public static <T> Result<T> error(String msg) {
        return error(SC_INTERNAL_SERVER_ERROR_500, msg);
    }

    public static <T> Result<T> error(int code, String msg) {
        Result<T> r = new Result<>();
        r.setCode(code);
        r.setMessage(msg);
        r.setSuccess(false);
        return r;
    }

    public static <T> Result<T> rejected(String msg) {
        return error(SC_REJECTED_400, msg);
    }

    public static <T> Result<T> notFound(String msg) {
        return error(SC_NOT_FOUND_404, msg);
    }
}
