package agents.gateway.mcp.discovery;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * What one catalog sync changed.
 */
public class ToolSyncResult {

    private final String serverId;
    private final List<String> inserted = new ArrayList<>();
    private final List<String> updated = new ArrayList<>();
    private final List<String> unchanged = new ArrayList<>();

    public ToolSyncResult(String serverId) {
        this.serverId = serverId;
    }

    void inserted(String name) {
        inserted.add(name);
    }

    void updated(String name) {
        updated.add(name);
    }

    void unchanged(String name) {
        unchanged.add(name);
    }

    public String getServerId() {
        return serverId;
    }

    public List<String> getInserted() {
        return inserted;
    }

    public List<String> getUpdated() {
        return updated;
    }

    public List<String> getUnchanged() {
        return unchanged;
    }

    public int getToolCount() {
        return inserted.size() + updated.size() + unchanged.size();
    }

    public boolean hasChanges() {
        return !inserted.isEmpty() || !updated.isEmpty();
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("serverId", serverId)
            .put("toolCount", getToolCount())
            .put("inserted", new JsonArray(new ArrayList<>(inserted)))
            .put("updated", new JsonArray(new ArrayList<>(updated)))
            .put("unchanged", new JsonArray(new ArrayList<>(unchanged)));
    }
}
