// file: server/src/main/java/io/shardlite/server/dto/RegionStateResponse.java
package io.shardlite.server.dto;

import java.util.Map;
import java.util.Set;

/**
 * JSON response for GET /admin/region.
 *   {
 *     "regionId": "node-a",
 *     "proxy": false,
 *     "shards": { "7": ["user-1", "user-9"] }
 *   }
 */
public class RegionStateResponse {
    public String regionId;
    public boolean proxy;
    public Map<String, Set<String>> shards;
}
