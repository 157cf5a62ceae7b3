package com.dagflow.registry;

import com.dagflow.core.TaskHandler;

import java.util.Optional;

/**
 * Looks up task functions referenced by name.
 */
public interface FunctionResolver {

    Optional<TaskHandler> lookup(String name);
}
