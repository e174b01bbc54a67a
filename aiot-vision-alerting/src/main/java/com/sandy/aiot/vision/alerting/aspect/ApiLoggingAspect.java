package com.sandy.aiot.vision.alerting.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs each alerting API call: request line, handler arguments, outcome and duration.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_JSON = 2000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.aiot.vision.alerting.controller..*)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";
        String actor = request != null ? request.getHeader("X-User-Id") : null;

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String handler = sig.getDeclaringType().getSimpleName() + "." + sig.getName();
        Map<String, Object> argMap = new LinkedHashMap<>();
        Object[] args = pjp.getArgs();
        String[] names = sig.getParameterNames();
        for (int i = 0; i < args.length; i++) {
            if (args[i] instanceof HttpServletRequest || args[i] instanceof HttpServletResponse) continue;
            argMap.put(names != null && i < names.length ? names[i] : "arg" + i, args[i]);
        }
        log.info("API {} {} handler={} actor={} args={}", method, uri, handler, actor, toJson(argMap));

        try {
            Object result = pjp.proceed();
            long cost = System.currentTimeMillis() - start;
            if (result instanceof ResponseEntity<?> re) {
                log.info("API {} {} -> {} in {}ms", method, uri, re.getStatusCode().value(), cost);
                log.debug("API {} {} body={}", method, uri, toJson(re.getBody()));
            } else {
                log.info("API {} {} -> ok in {}ms", method, uri, cost);
            }
            return result;
        } catch (Throwable t) {
            log.error("API Error: {} {} handler={} durationMs={} errorType={} message={}", method, uri, handler,
                    System.currentTimeMillis() - start, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            return s.length() > MAX_JSON ? s.substring(0, MAX_JSON) + "...(" + (s.length() - MAX_JSON) + " more chars)" : s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
