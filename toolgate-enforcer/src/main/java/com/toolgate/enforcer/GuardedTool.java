package com.toolgate.enforcer;

import com.toolgate.enforcer.identity.Identity;
import com.toolgate.enforcer.identity.IdentityResolver;
import com.toolgate.policy.model.ToolCall;

import java.util.Map;
import java.util.UUID;

/**
 * A tool bound to an {@link Enforcer}: every invocation is turned into a
 * {@link ToolCall} for the resolved identity and enforced.
 *
 * @param <C> credential type accepted by the identity resolver
 */
public class GuardedTool<C> {

    private final Enforcer enforcer;
    private final String toolName;
    private final ToolFunction tool;
    private final IdentityResolver<C> identityResolver;

    GuardedTool(Enforcer enforcer, String toolName, ToolFunction tool, IdentityResolver<C> identityResolver) {
        this.enforcer = enforcer;
        this.toolName = toolName;
        this.tool = tool;
        this.identityResolver = identityResolver;
    }

    public String getToolName() {
        return toolName;
    }

    /**
     * Invoke the tool on behalf of the holder of {@code credentials}.
     */
    public Object call(C credentials, Map<String, Object> arguments) {
        Identity identity = identityResolver.resolve(credentials);
        if (identity == null) {
            identity = Identity.ANONYMOUS;
        }
        ToolCall call = ToolCall.builder()
                .toolName(toolName)
                .arguments(arguments)
                .actor(identity.actor())
                .roles(identity.roles())
                .requestId(UUID.randomUUID().toString())
                .build();
        return enforcer.enforce(call, tool);
    }

    public Object call(Map<String, Object> arguments) {
        return call(null, arguments);
    }
}
