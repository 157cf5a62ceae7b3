package com.dagflow.core;

/**
 * A plain blocking unit of work.
 *
 * <p>The engine runs blocking functions on a dedicated worker pool so that the
 * dispatching thread can enforce the task deadline. Implementations that loop or wait
 * should poll {@link TaskContext#isCancelled()} and exit early once it flips.</p>
 *
 * <pre>{@code
 * TaskFunction sum = context -> {
 *     int a = (Integer) context.getArg(0);
 *     int b = (Integer) context.getKwarg("b");
 *     return a + b;
 * };
 * }</pre>
 *
 * @see AsyncTaskFunction
 */
@FunctionalInterface
public interface TaskFunction {

    Object apply(TaskContext context) throws Exception;
}
