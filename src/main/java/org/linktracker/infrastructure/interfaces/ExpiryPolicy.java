package org.linktracker.infrastructure.interfaces;

public interface ExpiryPolicy {

    long ttlMs();
    default boolean isExpired(long lastRefreshedAt, long now){
        return lastRefreshedAt == 0L || (now - lastRefreshedAt) > ttlMs();
    }
}
