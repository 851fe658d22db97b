package com.example.laborhours.export.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

@Slf4j
@Aspect
@Component
public class ExecutionTimeAspect {

    @Around("@annotation(logExecutionTime)")
    public Object logDuration(ProceedingJoinPoint joinPoint, LogExecutionTime logExecutionTime) throws Throwable {
        String label = logExecutionTime.value().isEmpty()
                ? joinPoint.getSignature().toShortString()
                : logExecutionTime.value();
        long start = System.nanoTime();
        boolean failed = true;
        try {
            Object result = joinPoint.proceed();
            failed = false;
            return result;
        } finally {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            if (failed) {
                log.info("[{}] failed after {} ms", label, elapsedMs);
            } else {
                log.info("[{}] took {} ms", label, elapsedMs);
            }
        }
    }
}
