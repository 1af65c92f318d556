package com.williamcallahan.codelab.logging;

import com.williamcallahan.codelab.domain.codelab.Codelab;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logging aspect for the stages of the codelab parsing pipeline.
 * Logs each stage with its timing; failures are logged and rethrown.
 */
@Aspect
@Component
public class ParsePipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private static final AtomicLong PARSE_SEQUENCE = new AtomicLong();

    // Request id of the parse running on this thread
    private static final ThreadLocal<String> REQUEST_ID = new ThreadLocal<>();

    /**
     * Log a full parse or fragment parse
     */
    @Around("execution(* com.williamcallahan.codelab.service.codelab.CodelabParser+.parse*(..))")
    public Object logParse(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = "PARSE-" + PARSE_SEQUENCE.incrementAndGet() + "-" + Thread.currentThread().getId();
        REQUEST_ID.set(requestId);
        long startTime = System.currentTimeMillis();
        String operation = joinPoint.getSignature().getName();

        PIPELINE_LOG.info("[{}] {} - Starting", requestId, operation);
        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof String source) {
            PIPELINE_LOG.debug("[{}] Source length: {}", requestId, source.length());
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof Codelab codelab) {
                PIPELINE_LOG.info("[{}] {} - Completed in {}ms ({} steps)",
                    requestId, operation, duration, codelab.getSteps().size());
            } else if (result instanceof List<?> nodes) {
                PIPELINE_LOG.info("[{}] {} - Completed in {}ms ({} nodes)",
                    requestId, operation, duration, nodes.size());
            } else {
                PIPELINE_LOG.info("[{}] {} - Completed in {}ms", requestId, operation, duration);
            }
            return result;
        } catch (RuntimeException e) {
            PIPELINE_LOG.error("[{}] {} - Failed: {}", requestId, operation, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }

    /**
     * Log markdown rendering
     */
    @Around("execution(* com.williamcallahan.codelab.service.markdown.MarkupRenderer+.render(..))")
    public Object logRender(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, "STEP 1: MARKDOWN RENDERING");
    }

    /**
     * Log markup tree construction
     */
    @Around("execution(* com.williamcallahan.codelab.service.markdown.MarkupTreeBuilder+.buildTree(..))")
    public Object logTreeBuild(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, "STEP 2: TREE BUILDING");
    }

    private Object logStage(ProceedingJoinPoint joinPoint, String stage) throws Throwable {
        String requestId = currentRequestId();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.debug("[{}] {} - Starting", requestId, stage);
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.info("[{}] {} - Completed in {}ms", requestId, stage, duration);
            return result;
        } catch (RuntimeException e) {
            PIPELINE_LOG.error("[{}] {} - Failed: {}", requestId, stage, e.getMessage());
            throw e;
        }
    }

    private static String currentRequestId() {
        String requestId = REQUEST_ID.get();
        return requestId == null ? "DIRECT" : requestId;
    }
}
