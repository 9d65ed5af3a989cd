package com.agenttrace.core.instrument;

import com.agenttrace.core.config.TracerConfig;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.description.modifier.Visibility;
import net.bytebuddy.implementation.InvocationHandlerAdapter;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Modifier;
import java.util.Objects;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Generates, with Byte Buddy, an implementation of an interface that forwards every call to a
 * target and records traced methods as child spans of the ambient node.
 *
 * A method is traced when it carries {@link Traced}, or when the interface's name starts with one of
 * the config's {@code autoInstrument} prefixes. Methods declared to return {@code CompletionStage} or
 * {@code CompletableFuture} keep their span open until the returned stage completes.
 *
 * One proxy class is generated per interface; each instance carries its own handler.
 */
public final class TracedProxy {

    static final String HANDLER_FIELD = "agenttrace$handler";

    private static final ClassValue<Class<?>> PROXY_TYPES = new ClassValue<>() {
        @Override
        protected Class<?> computeValue(Class<?> type) {
            return new ByteBuddy()
                .subclass(type)
                .defineField(HANDLER_FIELD, InvocationHandler.class, Visibility.PUBLIC)
                .method(not(isDeclaredBy(Object.class)))
                .intercept(InvocationHandlerAdapter.toField(HANDLER_FIELD))
                .make()
                .load(type.getClassLoader())
                .getLoaded();
        }
    };

    private TracedProxy() {}

    public static <T> T create(Class<T> type, T target) {
        return create(type, target, TracerConfig.defaults());
    }

    /**
     * @throws IllegalArgumentException if {@code type} is not a public interface
     */
    public static <T> T create(Class<T> type, T target, TracerConfig config) {
        Objects.requireNonNull(target, "target");
        if (!type.isInterface() || !Modifier.isPublic(type.getModifiers())) {
            throw new IllegalArgumentException("Only public interfaces can be traced: " + type.getName());
        }
        TracingInvocationHandler handler = new TracingInvocationHandler(
            target, config.isAutoInstrumented(type.getName()));

        Class<?> proxyType = PROXY_TYPES.get(type);
        try {
            Object proxy = proxyType.getDeclaredConstructor().newInstance();
            proxyType.getField(HANDLER_FIELD).set(proxy, handler);
            return type.cast(proxy);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Could not instantiate traced proxy for " + type.getName(), e);
        }
    }
}
