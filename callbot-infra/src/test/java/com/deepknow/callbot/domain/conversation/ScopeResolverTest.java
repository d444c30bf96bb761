package com.deepknow.callbot.domain.conversation;

import com.deepknow.callbot.domain.agent.AgentDirectory;
import com.deepknow.callbot.domain.agent.AgentRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeResolverTest {

    private final AgentDirectory directory = () -> List.of(
            agent("a1", "acme", "vs_acme"),
            agent("a2", "globex", null),
            agent("a3", "initech", "vs_initech"));

    @Test
    void explicitScopeWins() {
        ScopeResolver resolver = new ScopeResolver(directory, "vs_default");

        assertThat(resolver.resolve(" vs_explicit ", "a1", "acme")).isEqualTo("vs_explicit");
    }

    @Test
    void fallsThroughAgentTenantAndDefault() {
        ScopeResolver resolver = new ScopeResolver(directory, "vs_default");

        assertThat(resolver.resolve(null, "a1", null)).isEqualTo("vs_acme");
        assertThat(resolver.resolve("", "a2", "initech")).isEqualTo("vs_initech");
        assertThat(resolver.resolve(null, "missing", "globex")).isEqualTo("vs_default");
    }

    @Test
    void nullWhenNothingResolves() {
        ScopeResolver resolver = new ScopeResolver(directory, " ");

        assertThat(resolver.resolve(null, null, null)).isNull();
    }

    private static AgentRecord agent(String id, String tenant, String scope) {
        AgentRecord r = new AgentRecord();
        r.setId(id);
        r.setTenantCode(tenant);
        r.setScopeId(scope);
        return r;
    }
}
