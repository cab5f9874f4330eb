package org.netpreserve.consolescan.cdp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static org.netpreserve.consolescan.util.LogUtils.ellipses;

/**
 * Common machinery for a browser-level client and a tab-level session: turns calls on domain interfaces into
 * commands and dispatches incoming events to listeners.
 * <p>
 * Events and responses are handled on a single thread per connection so listeners see events in the order the
 * browser sent them. Blocking commands must therefore not be sent from a listener.
 */
public abstract class CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPBase.class);
    static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(30);
    private final Map<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<JsonNode>>> listeners = new ConcurrentHashMap<>();
    private final List<Runnable> closeHandlers = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;
    private volatile Thread dispatchThread;
    private volatile boolean closed;

    protected CDPBase() {
        String name = Thread.currentThread().getName() + "-CDP";
        dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            dispatchThread = thread;
            return thread;
        });
    }

    /**
     * Returns an implementation of a domain interface. Methods named {@code onXxx} taking a single
     * {@code Consumer} register an event listener, anything else is sent as the command
     * {@code Domain.method} with the method's parameter names as keys. Methods returning a
     * {@link CompletionStage} don't block, and an {@code Async} suffix on their name is dropped.
     */
    @SuppressWarnings("unchecked")
    public <T> T domain(Class<T> domainInterface) {
        return (T) Proxy.newProxyInstance(domainInterface.getClassLoader(), new Class<?>[]{domainInterface},
                (proxy, method, args) -> {
                    if (method.getDeclaringClass() == Object.class) {
                        return objectMethod(domainInterface, proxy, method, args);
                    }
                    if (method.getName().startsWith("on") && method.getParameterCount() == 1) {
                        var consumerType = (ParameterizedType) method.getGenericParameterTypes()[0];
                        registerListener((Class<?>) consumerType.getActualTypeArguments()[0], args[0]);
                        return null;
                    }
                    var parameters = method.getParameters();
                    var params = new LinkedHashMap<String, Object>();
                    for (int i = 0; i < parameters.length; i++) {
                        if (args[i] != null) params.put(parameters[i].getName(), args[i]);
                    }
                    return sendCommand(domainInterface.getSimpleName() + "." + method.getName(), params,
                            method.getGenericReturnType(), method.getAnnotation(Unwrap.class));
                });
    }

    private static Object objectMethod(Class<?> domainInterface, Object proxy, Method method, Object[] args) {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            default:
                return domainInterface.getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(proxy));
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private void registerListener(Class<?> eventClass, Object consumer) {
        addListener(eventClass, (Consumer) consumer);
    }

    public <T> void addListener(Class<T> eventClass, Consumer<T> callback) {
        listeners.computeIfAbsent(eventName(eventClass), key -> new CopyOnWriteArrayList<>()).add(params -> {
            try {
                callback.accept(RPC.JSON.treeToValue(params, eventClass));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * Registers a callback to run once when the underlying connection goes away.
     */
    public void onClose(Runnable handler) {
        closeHandlers.add(handler);
        if (closed) handler.run();
    }

    public boolean isClosed() {
        return closed;
    }

    static String eventName(Class<?> eventClass) {
        return eventClass.getEnclosingClass().getSimpleName() + "." + lowercaseFirstLetter(eventClass.getSimpleName());
    }

    protected void handleMessage(RPC.ServerMessage message) {
        try {
            dispatcher.execute(() -> {
                if (message instanceof RPC.Event event) {
                    dispatchEvent(event);
                } else if (message instanceof RPC.Response response) {
                    completeCommand(response);
                } else {
                    log.error("Unexpected message from browser: {}", message);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Dropping {} received after close", message);
        }
    }

    private void completeCommand(RPC.Response response) {
        var future = pending.remove(response.id());
        if (future == null) {
            log.debug("Response for unknown or abandoned command {}", response.id());
        } else if (response.error() != null) {
            future.completeExceptionally(new CDPException(response.error().code(), response.error().message()));
        } else {
            future.complete(response.result());
        }
    }

    private void dispatchEvent(RPC.Event event) {
        if (log.isTraceEnabled()) log.trace("{} {}", event.method(), ellipses(String.valueOf(event.params())));
        var handlers = listeners.get(event.method());
        if (handlers == null) return;
        for (var handler : handlers) {
            try {
                handler.accept(event.params());
            } catch (Exception e) {
                log.error("Listener for {} failed", event.method(), e);
            }
        }
    }

    Object sendCommand(String method, Map<String, Object> params, Type returnType, Unwrap unwrap) {
        Type valueType = returnType;
        boolean async = false;
        if (returnType instanceof ParameterizedType parameterizedType
            && CompletionStage.class.isAssignableFrom((Class<?>) parameterizedType.getRawType())) {
            valueType = parameterizedType.getActualTypeArguments()[0];
            async = true;
        }
        if (!async && Thread.currentThread() == dispatchThread) {
            throw new IllegalStateException("Blocking on " + method + " from a listener would deadlock");
        }
        if (method.endsWith("Async")) method = method.substring(0, method.length() - "Async".length());
        if (closed) throw new CDPClosedException();

        long id = nextCommandId();
        var future = new CompletableFuture<JsonNode>();
        pending.put(id, future);
        try {
            sendCommandMessage(id, method, params);
        } catch (IOException e) {
            pending.remove(id);
            throw new UncheckedIOException(e);
        }

        ObjectReader reader = readerFor(valueType, unwrap);
        JavaType javaType = RPC.JSON.constructType(valueType);
        boolean discardResult = valueType == void.class || valueType == Void.class;
        CompletableFuture<Object> result = future.thenApply(json -> {
            if (discardResult) return null;
            try {
                return reader.treeToValue(json, javaType);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        });
        if (async) return result;

        try {
            return result.get(COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CDPException cdpException) {
                cdpException.captureStackTrace();
                throw cdpException;
            } else if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new CDPException(0, method + " failed: " + e.getCause());
        } catch (TimeoutException e) {
            throw new CDPTimeoutException(method + " timed out after " + COMMAND_TIMEOUT.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CDPException(0, method + " interrupted");
        } finally {
            pending.remove(id);
        }
    }

    private static ObjectReader readerFor(Type valueType, Unwrap unwrap) {
        if (unwrap == null) return RPC.JSON.reader();
        String field = unwrap.value().isEmpty()
                ? lowercaseFirstLetter(((Class<?>) valueType).getSimpleName())
                : unwrap.value();
        return RPC.JSON.reader(DeserializationFeature.UNWRAP_ROOT_VALUE).withRootName(field);
    }

    private static String lowercaseFirstLetter(String s) {
        return s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1);
    }

    protected abstract void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException;

    protected abstract long nextCommandId();

    protected void close() {
        markClosed();
        dispatcher.shutdown();
    }

    /**
     * The connection is gone: fail everything still waiting on a response and notify close handlers.
     */
    protected void handleRpcClose() {
        markClosed();
    }

    private void markClosed() {
        if (closed) return;
        closed = true;
        pending.values().forEach(future -> future.completeExceptionally(new CDPClosedException()));
        pending.clear();
        for (var handler : closeHandlers) {
            try {
                handler.run();
            } catch (RuntimeException e) {
                log.warn("Close handler failed", e);
            }
        }
    }
}
