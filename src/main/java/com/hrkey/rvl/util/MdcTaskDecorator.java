package com.hrkey.rvl.util;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * 호출 스레드의 MDC(ownerId 등)를 작업 스레드로 옮긴다.
 */
public class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        // 제출 시점의 MDC 복사
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                runnable.run();
            } finally {
                MDC.clear();
            }
        };
    }
}
