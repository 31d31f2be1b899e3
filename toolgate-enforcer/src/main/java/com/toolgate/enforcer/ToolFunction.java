package com.toolgate.enforcer;

import java.util.Map;

/**
 * The guarded tool. Receives the call's arguments unchanged.
 */
@FunctionalInterface
public interface ToolFunction {

    Object invoke(Map<String, Object> arguments) throws Exception;
}
