// file: server/src/main/java/io/shardlite/server/dto/AllocationsResponse.java
package io.shardlite.server.dto;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON response for GET /admin/allocations, served by the node hosting the coordinator.
 */
public class AllocationsResponse {
    public String coordinator;
    public String status;
    public Map<String, List<String>> regions;
    public Set<String> handOffInProgress;
}
