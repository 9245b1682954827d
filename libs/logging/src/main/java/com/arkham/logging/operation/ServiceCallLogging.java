package com.arkham.logging.operation;

import com.arkham.logging.event.WideEventBuilder;
import com.arkham.logging.event.WideEvents;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Collection;
import java.util.Map;

/**
 * Wraps a service behind a dynamic proxy that records every call as a wide event named
 * {@code <Service>.<method>}.
 * <p>
 * The first five arguments are summarized as {@code arg_0} … {@code arg_4} in the input; the
 * result is summarized as {@code result_summary} in the output. Summaries never contain whole
 * payloads: strings are quoted and truncated, collections and maps are reduced to their size.
 * Exceptions thrown by the target are recorded and rethrown unchanged; a failure to invoke the
 * target at all is recorded under its own type before it propagates.
 */
public final class ServiceCallLogging {

    static final int MAX_ARGS = 5;
    static final int MAX_ARG_LENGTH = 100;
    static final int MAX_RESULT_LENGTH = 50;

    private final WideEvents events;

    public ServiceCallLogging(WideEvents events) {
        if (events == null) {
            throw new IllegalArgumentException("events must not be null");
        }
        this.events = events;
    }

    /**
     * Proxies {@code target}, naming events after the target's simple class name.
     */
    public <T> T proxy(Class<T> type, T target) {
        return proxy(type, target, target == null ? null : target.getClass().getSimpleName());
    }

    /**
     * Proxies {@code target} through interface {@code type}.
     *
     * @param type        the interface to expose
     * @param target      the implementation
     * @param serviceName prefix of the event names
     */
    public <T> T proxy(Class<T> type, T target, String serviceName) {
        if (type == null || !type.isInterface()) {
            throw new IllegalArgumentException("type must be an interface");
        }
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        String name = serviceName == null || serviceName.isBlank() ? "UnknownService" : serviceName;
        InvocationHandler handler = (proxy, method, args) -> invoke(name, target, method, args);
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }

    private Object invoke(String serviceName, Object target, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return method.invoke(target, args);
        }
        WideEventBuilder event = events.open(serviceName + "." + method.getName());
        if (args != null) {
            for (int i = 0; i < Math.min(args.length, MAX_ARGS); i++) {
                event.input("arg_" + i, formatValue(args[i]));
            }
        }
        try {
            Object result = method.invoke(target, args);
            event.output("result_summary", summarizeResult(result));
            event.success();
            return result;
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            event.error(cause.getClass().getSimpleName(), cause.getMessage() == null ? "" : cause.getMessage(), cause);
            throw cause;
        } catch (Throwable t) {
            // the call never reached the target, or summarizing its result failed
            event.error(t.getClass().getSimpleName(), t.getMessage() == null ? "" : t.getMessage(), t);
            throw t;
        }
    }

    /**
     * Renders an argument for the input section.
     */
    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            String string = text.toString();
            return string.length() > MAX_ARG_LENGTH
                    ? "\"" + string.substring(0, MAX_ARG_LENGTH) + "...\""
                    : "\"" + string + "\"";
        }
        if (value instanceof Collection<?> collection) {
            return "List[" + collection.size() + "]";
        }
        if (value instanceof Map<?, ?> map) {
            return "Map[" + map.size() + "]";
        }
        if (value instanceof byte[] bytes) {
            return "bytes[" + bytes.length + "]";
        }
        if (value.getClass().isArray()) {
            return "Array[" + Array.getLength(value) + "]";
        }
        String string = String.valueOf(value);
        return string.length() > MAX_ARG_LENGTH ? string.substring(0, MAX_ARG_LENGTH) + "..." : string;
    }

    /**
     * Renders a return value for the output section.
     */
    static String summarizeResult(Object result) {
        if (result == null) {
            return "null";
        }
        if (result instanceof Boolean || result instanceof Number) {
            return result.toString();
        }
        if (result instanceof CharSequence text) {
            String string = text.toString();
            return string.length() > MAX_RESULT_LENGTH
                    ? "\"" + string.substring(0, MAX_RESULT_LENGTH) + "...\""
                    : "\"" + string + "\"";
        }
        if (result instanceof Collection<?> collection) {
            return "List[" + collection.size() + " items]";
        }
        if (result instanceof Map<?, ?> map) {
            return "Map[" + map.size() + " keys]";
        }
        if (result.getClass().isArray()) {
            return "Array[" + Array.getLength(result) + " items]";
        }
        return result.getClass().getSimpleName();
    }
}
