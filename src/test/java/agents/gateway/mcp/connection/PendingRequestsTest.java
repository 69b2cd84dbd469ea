package agents.gateway.mcp.connection;

import agents.gateway.mcp.base.MCPGatewayException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class PendingRequestsTest {

    private static PendingRequest request(Object id) {
        return new PendingRequest(id, null, System.currentTimeMillis(), null, null);
    }

    private static MCPGatewayException.Kind kindOf(Runnable action) {
        MCPGatewayException error = Assertions.assertThrows(MCPGatewayException.class, action::run);
        return error.getKind();
    }

    @Test
    @DisplayName("An id already in flight is refused; 42 and \"42\" are different ids")
    void duplicateIdIsRefused() {
        PendingRequests pending = new PendingRequests(10);
        pending.register(request(42));

        Assertions.assertEquals(MCPGatewayException.Kind.DUPLICATE_REQUEST_ID, kindOf(() -> pending.register(request(42L))));
        pending.register(request("42"));

        Assertions.assertEquals(2, pending.size());
        Assertions.assertTrue(pending.contains(42));
        Assertions.assertTrue(pending.contains("42"));
        Assertions.assertFalse(pending.contains("n:42"));
        Assertions.assertEquals("42", pending.removeById("42").getRequestId());
        Assertions.assertEquals(42, pending.removeById(42L).getRequestId());
    }

    @Test
    @DisplayName("Registration beyond the limit is refused")
    void limitIsEnforced() {
        PendingRequests pending = new PendingRequests(2);
        pending.register(request(1));
        pending.register(request(2));

        Assertions.assertEquals(MCPGatewayException.Kind.TOO_MANY_PENDING, kindOf(() -> pending.register(request(3))));

        pending.removeById(1);
        pending.register(request(3));
        Assertions.assertEquals(2, pending.size());
    }

    @Test
    @DisplayName("Removing by entry leaves a newer request with the same id alone")
    void removeByEntryIsExact() {
        PendingRequests pending = new PendingRequests(10);
        PendingRequest first = request(7);
        pending.register(first);
        pending.removeById(7);
        PendingRequest second = request(7);
        pending.register(second);

        Assertions.assertFalse(pending.remove(first));
        Assertions.assertSame(second, pending.get(7));
        Assertions.assertTrue(pending.remove(second));
    }

    @Test
    @DisplayName("Closing resolves everything with CONNECTION_CLOSED and admits nothing new")
    void closeAllResolvesOrphans() {
        PendingRequests pending = new PendingRequests(10);
        PendingRequest a = request("a");
        PendingRequest b = request("b");
        pending.register(a);
        pending.register(b);

        Assertions.assertEquals(2, pending.closeAll("Connection closed by upstream"));

        Assertions.assertTrue(a.future().failed());
        Assertions.assertTrue(b.future().failed());
        MCPGatewayException cause = (MCPGatewayException) a.future().cause();
        Assertions.assertEquals(MCPGatewayException.Kind.CONNECTION_CLOSED, cause.getKind());
        Assertions.assertEquals("Connection closed by upstream", cause.getMessage());
        Assertions.assertEquals(0, pending.size());
        Assertions.assertEquals(MCPGatewayException.Kind.CONNECTION_CLOSED, kindOf(() -> pending.register(request("c"))));
    }
}
