package com.bit.vote.aop;

import com.bit.vote.common.Address;
import com.bit.vote.result.Result;
import com.bit.vote.structure.dto.CreateProjectReq;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestParam;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;

/**
 * 管理员接口拦截 非管理员直接返回无权限 不进入业务层
 */
@Slf4j
@Aspect
@Component
public class PermissionsAspect {

    static final String CALLER_PARAM = "caller";

    private final Address admin;

    public PermissionsAspect(@Qualifier("adminAddress") Address admin) {
        this.admin = admin;
    }

    /**
     * 设置切入点 在注解的位置切入代码
     */
    @Pointcut("@annotation(com.bit.vote.aop.annotation.PermissionsAnnotation)")
    public void PermissionsPointCut() {}

    @Around(value = "PermissionsPointCut()")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        Method method = ((MethodSignature) pjp.getSignature()).getMethod();
        String caller = findCaller(method, pjp.getArgs());
        if (caller == null || !isAdmin(caller)) {
            log.warn("管理员接口拒绝访问 method={} caller={}", method.getName(), caller);
            return Result.noauth("仅管理员可调用");
        }
        return pjp.proceed();
    }

    private boolean isAdmin(String caller) {
        try {
            return admin.equals(Address.fromBase58(caller));
        } catch (IllegalArgumentException e) {
            log.debug("caller 不是合法地址: {}", caller);
            return false;
        }
    }

    private static String findCaller(Method method, Object[] args) {
        Annotation[][] annotations = method.getParameterAnnotations();
        for (int i = 0; i < args.length; i++) {
            if (args[i] instanceof CreateProjectReq) {
                return ((CreateProjectReq) args[i]).getCaller();
            }
            for (Annotation annotation : annotations[i]) {
                if (annotation instanceof RequestParam
                        && CALLER_PARAM.equals(((RequestParam) annotation).value())) {
                    return (String) args[i];
                }
            }
        }
        return null;
    }
}
