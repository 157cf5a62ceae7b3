package com.dagflow.registry;

import com.dagflow.core.AsyncTaskFunction;
import com.dagflow.core.TaskFunction;
import com.dagflow.core.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to function lookup for tasks that reference their work by name. Registering a
 * name again replaces the previous function.
 */
public class TaskFunctionRegistry implements FunctionResolver {
    private static final Logger logger = LoggerFactory.getLogger(TaskFunctionRegistry.class);

    private final Map<String, TaskHandler> functions;

    public TaskFunctionRegistry() {
        this.functions = new ConcurrentHashMap<>();
    }

    public void registerFunction(String name, TaskFunction function) {
        register(name, function != null ? TaskHandler.blocking(function) : null);
    }

    public void registerAsyncFunction(String name, AsyncTaskFunction function) {
        register(name, function != null ? TaskHandler.async(function) : null);
    }

    private void register(String name, TaskHandler handler) {
        if (name == null || handler == null) {
            throw new IllegalArgumentException("Function name and function cannot be null");
        }
        if (functions.put(name, handler) != null) {
            logger.debug("Replaced task function: {}", name);
        } else {
            logger.debug("Registered task function: {}", name);
        }
    }

    @Override
    public Optional<TaskHandler> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public void unregister(String name) {
        functions.remove(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public void clear() {
        functions.clear();
    }

    public int size() {
        return functions.size();
    }
}
