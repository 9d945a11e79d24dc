// file: server/src/main/java/io/shardlite/server/runtime/EntityFactory.java
package io.shardlite.server.runtime;

/** Creates the entity for an id on first use, and again after passivation. */
@FunctionalInterface
public interface EntityFactory {

    Entity create(String entityId, EntityContext context);
}
