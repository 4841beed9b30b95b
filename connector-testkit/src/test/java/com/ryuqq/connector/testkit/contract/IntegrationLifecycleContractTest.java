package com.ryuqq.connector.testkit.contract;

import com.ryuqq.connector.core.exception.AuthenticationException;
import com.ryuqq.connector.core.model.AuthResult;
import com.ryuqq.connector.core.model.IntegrationCapability;
import com.ryuqq.connector.core.model.SyncCursor;
import com.ryuqq.connector.core.outcome.Ok;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 6: Integration Lifecycle.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Required scopes are checked against enabled capabilities only</li>
 *   <li>Granted scopes are persisted on authentication</li>
 *   <li>Disconnect revokes the vendor token and clears local state</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
class IntegrationLifecycleContractTest extends AbstractContractTest {

    @Test
    void testScopes_OnlyEnabledCapabilitiesCount() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB)
            .withCapability(IntegrationCapability.enabled("issues", "Read issues", List.of("repo:read")))
            .withCapability(IntegrationCapability.enabled("webhooks", "Receive events", List.of("hooks:write")))
            .withCapability(new IntegrationCapability("admin", "Manage organization", false, List.of("admin:org")));

        // When & Then
        assertTrue(adapter.validateRequiredScopes(List.of()));
        assertTrue(adapter.validateRequiredScopes(List.of("repo:read")));
        assertTrue(adapter.validateRequiredScopes(List.of("repo:read", "hooks:write")));
        assertFalse(adapter.validateRequiredScopes(List.of("admin:org")), "Disabled capability grants nothing");
        assertFalse(adapter.validateRequiredScopes(List.of("repo:read", "admin:org")));
    }

    @Test
    void testAuthenticate_GrantedScopesPersisted() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        adapter.credentials().then(Ok.of(AuthResult.success("access-9", "refresh-9", null, List.of("repo:read"))));

        // When
        AuthResult result = adapter.authenticate();

        // Then
        assertTrue(result.success());
        assertEquals(List.of("repo:read"), storedConfig(ALICE, GITHUB).scopes());
        assertEquals("access-9", vault.decrypt(storedConfig(ALICE, GITHUB).encryptedAccessToken(), ALICE));
        assertFalse(result.toString().contains("access-9"), "AuthResult must not print tokens");
    }

    @Test
    void testDisconnect_RevokesAndClearsLocalState() {
        // Given
        ScriptedAdapter adapter = connect(ALICE, GITHUB);
        cursorStore.save(new SyncCursor(GITHUB, ALICE, "issues", T0));

        // When
        boolean revoked = registry.disconnect(ALICE, GITHUB);

        // Then
        assertTrue(revoked);
        assertEquals(List.of("access-1"), adapter.revoke().tokens());
        assertTrue(configStore.find(ALICE, GITHUB).isEmpty());
        assertTrue(cursorStore.findAll(ALICE, GITHUB).isEmpty());
        assertTrue(registry.find(ALICE, GITHUB).isEmpty());
        assertThrows(AuthenticationException.class, adapter::listIssues);
    }

    @Test
    void testDisconnect_OtherUsersUnaffected() {
        // Given
        connect(ALICE, GITHUB);
        ScriptedAdapter bob = connect(BOB, GITHUB);

        // When
        registry.disconnect(ALICE, GITHUB);

        // Then
        assertEquals("[]", bob.listIssues());
        assertEquals(1, registry.size());
    }
}
