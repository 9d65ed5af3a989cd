package com.agenttrace.core.instrument;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Forwards proxy calls to the target, inside a span for traced methods.
 */
final class TracingInvocationHandler implements InvocationHandler {

    private static final Object[] NO_ARGS = new Object[0];

    private final Object target;
    private final boolean traceAllMethods;
    private final ConcurrentMap<Method, Optional<TracedCall>> calls = new ConcurrentHashMap<>();

    TracingInvocationHandler(Object target, boolean traceAllMethods) {
        this.target = target;
        this.traceAllMethods = traceAllMethods;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        Object[] arguments = args != null ? args : NO_ARGS;
        Optional<TracedCall> call = calls.computeIfAbsent(method, this::tracedCallFor);
        if (call.isEmpty()) {
            return invokeTarget(method, arguments);
        }
        if (isAsync(method)) {
            return call.get().invokeAsync(arguments, () -> (CompletionStage<Object>) invokeTarget(method, arguments));
        }
        return call.get().invoke(arguments, () -> invokeTarget(method, arguments));
    }

    private Optional<TracedCall> tracedCallFor(Method method) {
        Traced traced = method.getAnnotation(Traced.class);
        if (traced == null && !traceAllMethods) {
            return Optional.empty();
        }
        String name = traced != null && !traced.name().isEmpty() ? traced.name() : method.getName();
        TracedCall call = TracedCall.node(name)
            .argNames(buildParamNames(method));
        if (traced != null) {
            call.type(traced.nodeType())
                .captureArgs(traced.captureArgs())
                .captureReturn(traced.captureReturn());
        } else {
            call.captureArgs().captureReturn();
        }
        return Optional.of(call);
    }

    /** Parameter names when compiled with -parameters, otherwise arg0, arg1, ... */
    private static String[] buildParamNames(Method method) {
        Parameter[] params = method.getParameters();
        String[] names = new String[params.length];
        for (int i = 0; i < params.length; i++) {
            names[i] = params[i].isNamePresent() ? params[i].getName() : "arg" + i;
        }
        return names;
    }

    private static boolean isAsync(Method method) {
        Class<?> returnType = method.getReturnType();
        return CompletionStage.class.isAssignableFrom(returnType)
            && returnType.isAssignableFrom(CompletableFuture.class);
    }

    private Object invokeTarget(Method method, Object[] args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }
}
