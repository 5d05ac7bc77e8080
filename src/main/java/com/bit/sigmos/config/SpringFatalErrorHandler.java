package com.bit.sigmos.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
public class SpringFatalErrorHandler implements FatalErrorHandler {

    private static final int EXIT_CODE = 2;

    @Autowired
    private ApplicationContext applicationContext;

    private final AtomicBoolean exiting = new AtomicBoolean(false);

    @Override
    public void handle(String reason, Throwable cause) {
        log.error("致命错误，节点即将退出: {}", reason, cause);
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        // System.exit 不能在关闭钩子等待的线程内调用
        Thread exitThread = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> EXIT_CODE)),
                "fatal-exit");
        exitThread.setDaemon(false);
        exitThread.start();
    }
}
