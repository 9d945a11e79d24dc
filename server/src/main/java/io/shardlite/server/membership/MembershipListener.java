// file: server/src/main/java/io/shardlite/server/membership/MembershipListener.java
package io.shardlite.server.membership;

/** Subscriber to membership changes. Called on the publisher's thread; must only enqueue. */
@FunctionalInterface
public interface MembershipListener {

    void onEvent(MembershipEvent event);
}
